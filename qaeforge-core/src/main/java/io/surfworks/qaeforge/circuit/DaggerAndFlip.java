package io.surfworks.qaeforge.circuit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inverts a rotation program and mirrors it across a qubit ordering.
 *
 * <p>The inverse of a rotation by {@code t} is the same rotation by {@code -t},
 * so daggering a program reverses its instructions and negates every angle.
 * Flipping then relabels each qubit through the position reversal of the
 * ordering: with ordering {@code [1, 2, 3, 4, 5, 6]} qubit 1 becomes 6, 2
 * becomes 5, 3 becomes 4 and so on. Both steps are self-inverse, so applying
 * the transform twice with the same ordering gives back the input.
 *
 * <p>Only valid for rotation-family gates, which is every {@link GateType}.
 */
public final class DaggerAndFlip {

    private DaggerAndFlip() {}

    /**
     * Builds {@code M[ordering[k]] = ordering[len - 1 - k]}.
     *
     * @throws CircuitException with {@code CONFIGURATION} if the ordering has duplicates
     */
    public static Map<Integer, Integer> reversalMapping(List<Integer> ordering) {
        int len = ordering.size();
        Map<Integer, Integer> mapping = new HashMap<>(len * 2);
        for (int k = 0; k < len; k++) {
            if (mapping.put(ordering.get(k), ordering.get(len - 1 - k)) != null) {
                throw CircuitException.configuration(
                        "Qubit ordering " + ordering + " repeats qubit " + ordering.get(k));
            }
        }
        return Map.copyOf(mapping);
    }

    /**
     * Daggers and flips {@code program}.
     *
     * @param program  program of rotation gates
     * @param ordering qubit ordering defining the mirror
     * @return the inverted, mirrored program, with the same gate definitions
     * @throws CircuitException with {@code LOOKUP} if the program uses a qubit
     *         that is not in {@code ordering}
     */
    public static CircuitProgram apply(CircuitProgram program, List<Integer> ordering) {
        Map<Integer, Integer> mapping = reversalMapping(ordering);
        List<Instruction> source = program.instructions();
        List<Instruction> out = new ArrayList<>(source.size());

        for (int i = source.size() - 1; i >= 0; i--) {
            Instruction inst = source.get(i);

            List<Integer> qubits = new ArrayList<>(inst.qubits().size());
            for (int q : inst.qubits()) {
                Integer mapped = mapping.get(q);
                if (mapped == null) {
                    throw CircuitException.unmappedQubit(q, ordering);
                }
                qubits.add(mapped);
            }

            List<Double> negated = new ArrayList<>(inst.params().size());
            for (double p : inst.params()) {
                negated.add(-p);
            }

            out.add(new Instruction(inst.gate(), negated, qubits));
        }
        return new CircuitProgram(program.gateDefinitions(), out);
    }
}
