package io.surfworks.qaeforge.circuit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the rotation and controlled-rotation blocks of the encode stage.
 *
 * <p>Each method is a pure function returning a fresh program; nothing is
 * accumulated on the builder itself.
 */
public final class BlockBuilder {

    private final GateRegistry registry;

    public BlockBuilder(GateRegistry registry) {
        this.registry = registry;
    }

    public BlockBuilder() {
        this(GateRegistry.standard());
    }

    /**
     * One single-qubit rotation per qubit: {@code R<axis>(thetas[i]) qubits[i]}.
     *
     * @throws CircuitException with {@code LENGTH_MISMATCH} if the list sizes differ
     */
    public CircuitProgram rotationBlock(Axis axis, List<Integer> qubits, List<Double> thetas) {
        if (thetas.size() != qubits.size()) {
            throw CircuitException.lengthMismatch("Rotation block", qubits.size(), qubits.size(), thetas.size());
        }
        GateConstructor gate = registry.constructor(axis, 1);
        List<Instruction> out = new ArrayList<>(qubits.size());
        for (int i = 0; i < qubits.size(); i++) {
            out.add(gate.create(thetas.get(i), qubits.get(i)));
        }
        return CircuitProgram.of(out);
    }

    /**
     * One controlled rotation from {@code controlQubit} to every other qubit.
     *
     * <p>Targets follow the order of {@code qubits} with the control skipped;
     * the k-th target consumes {@code thetas[k]}.
     *
     * @throws CircuitException with {@code LENGTH_MISMATCH} unless
     *         {@code thetas.size() == qubits.size() - 1}, with {@code LOOKUP}
     *         if the control is not one of the qubits, or with
     *         {@code CONFIGURATION} if a qubit is repeated
     */
    public CircuitProgram controlledRotationBlock(Axis axis, List<Integer> qubits, List<Double> thetas,
                                                  int controlQubit) {
        if (!qubits.contains(controlQubit)) {
            throw CircuitException.controlNotInBlock(controlQubit, qubits);
        }
        Set<Integer> seen = new HashSet<>();
        for (int qubit : qubits) {
            if (!seen.add(qubit)) {
                throw CircuitException.duplicateQubit(qubit, qubits);
            }
        }
        if (thetas.size() != qubits.size() - 1) {
            throw CircuitException.lengthMismatch(
                    "Controlled block on control " + controlQubit, qubits.size(), qubits.size() - 1, thetas.size());
        }
        GateConstructor gate = registry.constructor(axis, 2);
        List<Instruction> out = new ArrayList<>(thetas.size());
        int next = 0;
        for (int qubit : qubits) {
            if (qubit != controlQubit) {
                out.add(gate.create(thetas.get(next++), controlQubit, qubit));
            }
        }
        return CircuitProgram.of(out);
    }
}
