package io.surfworks.qaeforge.circuit;

import java.util.List;

/**
 * Carves the flat parameter list into the sub-ranges owned by each block.
 *
 * <p>For {@code n} input qubits the list is laid out as
 * <pre>
 *   [ initial rotations: n ][ controlled block 0: n-1 ] ... [ controlled block n-1: n-1 ][ final rotations: n ]
 * </pre>
 * for a total of {@code 2n + n(n-1)} parameters.
 */
public final class ParameterSlicer {

    private ParameterSlicer() {}

    /**
     * Total parameter count for {@code n} input qubits.
     *
     * @throws ArithmeticException if the count does not fit in an {@code int}
     */
    public static int parameterCount(int n) {
        return Math.addExact(Math.multiplyExact(2, n), Math.multiplyExact(n, n - 1));
    }

    public static int initialBlockStart() {
        return 0;
    }

    /**
     * Start of the {@code i}-th controlled block (0-based), which owns {@code n-1} parameters.
     */
    public static int controlledBlockStart(int n, int i) {
        return n + (n - 1) * i;
    }

    public static int finalBlockStart(int n) {
        return n + (n - 1) * n;
    }

    /**
     * Returns {@code thetas[start, start + count)}.
     *
     * @throws CircuitException with {@code OUT_OF_RANGE} if the range does not
     *         fit in the list; a short slice is never returned
     */
    public static List<Double> slice(List<Double> thetas, int start, int count) {
        if (start < 0 || count < 0 || start + count > thetas.size()) {
            throw CircuitException.outOfRange(start, count, thetas.size());
        }
        return List.copyOf(thetas.subList(start, start + count));
    }
}
