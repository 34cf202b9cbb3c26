package io.surfworks.qaeforge.circuit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One gate application: a gate type, its bound angle and the qubits it acts on.
 *
 * @param gate   the gate type
 * @param params bound angle parameters (exactly one for every rotation type)
 * @param qubits qubit indices, control first for controlled types
 */
public record Instruction(GateType gate, List<Double> params, List<Integer> qubits) {

    public Instruction {
        Objects.requireNonNull(gate, "gate");
        if (params.size() != 1) {
            throw new IllegalArgumentException(gate + " takes exactly 1 parameter, got " + params.size());
        }
        if (qubits.size() != gate.arity()) {
            throw new IllegalArgumentException(
                    gate + " acts on " + gate.arity() + " qubit(s), got " + qubits.size());
        }
        List<Double> canonical = new ArrayList<>(params.size());
        for (Double p : params) {
            // -0.0 would make angle negation a non-involution under equals()
            canonical.add(p == 0.0 ? 0.0 : p);
        }
        params = List.copyOf(canonical);
        qubits = List.copyOf(qubits);
    }

    public static Instruction of(GateType gate, double angle, int... qubits) {
        List<Integer> boxed = new ArrayList<>(qubits.length);
        for (int q : qubits) {
            boxed.add(q);
        }
        return new Instruction(gate, List.of(angle), boxed);
    }

    public double angle() {
        return params.get(0);
    }

    /**
     * Control qubit of a controlled gate.
     *
     * @throws IllegalStateException for single-qubit gates
     */
    public int control() {
        if (!gate.isControlled()) {
            throw new IllegalStateException(gate + " has no control qubit");
        }
        return qubits.get(0);
    }

    public int target() {
        return qubits.get(qubits.size() - 1);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(gate.name()).append('(').append(angle()).append(')');
        for (int q : qubits) {
            sb.append(' ').append(q);
        }
        return sb.toString();
    }
}
