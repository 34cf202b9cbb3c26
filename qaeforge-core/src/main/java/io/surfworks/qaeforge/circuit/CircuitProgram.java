package io.surfworks.qaeforge.circuit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, ordered gate program.
 *
 * <p>Instruction order is execution order. The gate definitions are the
 * preamble a backend needs before it can interpret the custom controlled
 * gates; they are not instructions and do not count towards {@link #size()}.
 *
 * @param gateDefinitions definitions of custom gates, unique by name
 * @param instructions    instructions in execution order
 */
public record CircuitProgram(List<GateDefinition> gateDefinitions, List<Instruction> instructions) {

    private static final CircuitProgram EMPTY = new CircuitProgram(List.of(), List.of());

    public CircuitProgram {
        gateDefinitions = List.copyOf(gateDefinitions);
        instructions = List.copyOf(instructions);
    }

    public static CircuitProgram empty() {
        return EMPTY;
    }

    public static CircuitProgram of(List<Instruction> instructions) {
        return new CircuitProgram(List.of(), instructions);
    }

    public static CircuitProgram of(Instruction... instructions) {
        return of(List.of(instructions));
    }

    /**
     * Number of instructions.
     */
    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public Instruction get(int index) {
        return instructions.get(index);
    }

    /**
     * Returns this program followed by {@code other}.
     *
     * <p>Gate definitions are merged by name, first occurrence wins.
     */
    public CircuitProgram concat(CircuitProgram other) {
        List<Instruction> joined = new ArrayList<>(instructions.size() + other.instructions.size());
        joined.addAll(instructions);
        joined.addAll(other.instructions);
        return new CircuitProgram(mergeDefinitions(gateDefinitions, other.gateDefinitions), joined);
    }

    /**
     * Concatenates programs in order.
     */
    public static CircuitProgram concat(List<CircuitProgram> programs) {
        CircuitProgram result = EMPTY;
        for (CircuitProgram p : programs) {
            result = result.concat(p);
        }
        return result;
    }

    /**
     * Returns a copy carrying the given gate definitions ahead of the existing ones.
     */
    public CircuitProgram withDefinitions(List<GateDefinition> definitions) {
        return new CircuitProgram(mergeDefinitions(definitions, gateDefinitions), instructions);
    }

    /**
     * Returns the instructions in {@code [from, to)} as a program without definitions.
     */
    public CircuitProgram slice(int from, int to) {
        return of(instructions.subList(from, to));
    }

    private static List<GateDefinition> mergeDefinitions(List<GateDefinition> first, List<GateDefinition> second) {
        if (second.isEmpty()) {
            return first;
        }
        Map<String, GateDefinition> byName = new LinkedHashMap<>();
        for (GateDefinition d : first) {
            byName.putIfAbsent(d.name(), d);
        }
        for (GateDefinition d : second) {
            byName.putIfAbsent(d.name(), d);
        }
        return List.copyOf(byName.values());
    }

    @Override
    public String toString() {
        return String.format("CircuitProgram[definitions=%d, instructions=%d]",
                gateDefinitions.size(), instructions.size());
    }
}
