package io.surfworks.qaeforge.circuit;

/**
 * Turns a bound angle and qubits into an instruction.
 */
@FunctionalInterface
public interface GateConstructor {

    /**
     * @param angle  rotation angle in radians
     * @param qubits qubits the gate acts on, control first
     * @return the instruction
     */
    Instruction create(double angle, int... qubits);
}
