package io.surfworks.qaeforge.circuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable configuration of a quantum autoencoder circuit.
 *
 * <p>All invariants are checked on construction, so a config that exists is
 * always buildable. {@code null} axes default to {@code n + 2} copies of X and
 * {@code null} qubits default to {@code 0 .. numQubits - 1}.
 *
 * @param numQubits       total number of qubits, normally {@code 2n - numLatentQubits}
 * @param numLatentQubits latent-space qubits; only used to derive {@code n}
 * @param thetas          rotation angles, {@code 2n + n(n-1)} of them
 * @param axes            rotation axis per block, {@code n + 2} of them
 * @param qubits          qubit labels, at least {@code numQubits}, no duplicates
 * @param controlledZMode what a Z-axis controlled block emits
 */
public record CircuitConfig(
        int numQubits,
        int numLatentQubits,
        List<Double> thetas,
        List<Axis> axes,
        List<Integer> qubits,
        ControlledZMode controlledZMode
) {

    public CircuitConfig {
        if (numQubits < 1) {
            throw CircuitException.configuration("numQubits must be positive, got " + numQubits);
        }
        if (numLatentQubits < 0 || numLatentQubits > numQubits) {
            throw CircuitException.configuration(String.format(
                    "numLatentQubits must be in [0, %d], got %d", numQubits, numLatentQubits));
        }
        int n = inputQubitCount(numQubits, numLatentQubits);
        if (n < 1) {
            throw CircuitException.configuration(String.format(
                    "%d qubits with %d latent leave no input qubits", numQubits, numLatentQubits));
        }

        int parameterCount;
        try {
            parameterCount = ParameterSlicer.parameterCount(n);
        } catch (ArithmeticException e) {
            throw CircuitException.configuration(String.format(
                    "%d input qubits need more parameters than a list can hold", n), e);
        }

        if (thetas == null) {
            throw CircuitException.configuration("thetas are required");
        }
        for (int i = 0; i < thetas.size(); i++) {
            Double t = thetas.get(i);
            if (t == null || !Double.isFinite(t)) {
                throw CircuitException.configuration("theta[" + i + "] is not a finite number: " + t);
            }
        }
        if (thetas.size() != parameterCount) {
            throw CircuitException.wrongLength(
                    "thetas for " + n + " input qubits", parameterCount, thetas.size());
        }

        axes = axes == null ? Collections.nCopies(n + 2, Axis.X) : axes;
        for (Axis axis : axes) {
            if (axis == null) {
                throw CircuitException.configuration("axes must not contain null: " + axes);
            }
        }
        if (axes.size() != n + 2) {
            throw CircuitException.wrongLength("axes for " + n + " input qubits", n + 2, axes.size());
        }

        qubits = qubits == null ? defaultQubits(numQubits) : qubits;
        validateQubits(qubits, numQubits);

        thetas = List.copyOf(thetas);
        axes = List.copyOf(axes);
        qubits = List.copyOf(qubits);
        controlledZMode = controlledZMode == null ? ControlledZMode.CORRECT : controlledZMode;
    }

    /**
     * Config with default axes and qubits.
     */
    public static CircuitConfig of(int numQubits, int numLatentQubits, List<Double> thetas) {
        return new CircuitConfig(numQubits, numLatentQubits, thetas, null, null, ControlledZMode.CORRECT);
    }

    /**
     * Number of input qubits {@code n = (numQubits + numLatentQubits) / 2}.
     */
    public int numInputQubits() {
        return inputQubitCount(numQubits, numLatentQubits);
    }

    /**
     * First {@code n} entries of the qubit ordering.
     */
    public List<Integer> inputQubits() {
        return qubits.subList(0, numInputQubits());
    }

    public CircuitConfig withThetas(List<Double> thetas) {
        return new CircuitConfig(numQubits, numLatentQubits, thetas, axes, qubits, controlledZMode);
    }

    public CircuitConfig withAxes(List<Axis> axes) {
        return new CircuitConfig(numQubits, numLatentQubits, thetas, axes, qubits, controlledZMode);
    }

    public CircuitConfig withQubits(List<Integer> qubits) {
        return new CircuitConfig(numQubits, numLatentQubits, thetas, axes, qubits, controlledZMode);
    }

    public CircuitConfig withControlledZMode(ControlledZMode controlledZMode) {
        return new CircuitConfig(numQubits, numLatentQubits, thetas, axes, qubits, controlledZMode);
    }

    static int inputQubitCount(int numQubits, int numLatentQubits) {
        // integer division: an odd total truncates
        return (numQubits + numLatentQubits) / 2;
    }

    private static List<Integer> defaultQubits(int numQubits) {
        List<Integer> qubits = new ArrayList<>(numQubits);
        for (int i = 0; i < numQubits; i++) {
            qubits.add(i);
        }
        return qubits;
    }

    private static void validateQubits(List<Integer> qubits, int numQubits) {
        if (qubits.size() < numQubits) {
            throw CircuitException.configuration(String.format(
                    "qubits must list at least %d labels, got %d", numQubits, qubits.size()));
        }
        Set<Integer> seen = new HashSet<>();
        for (Integer q : qubits) {
            if (q == null || q < 0) {
                throw CircuitException.configuration("qubit labels must be non-negative, got " + q);
            }
            if (!seen.add(q)) {
                throw CircuitException.configuration("qubits " + qubits + " repeat qubit " + q);
            }
        }
    }

    /**
     * Builder for creating configurations.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int numQubits;
        private int numLatentQubits;
        private List<Double> thetas;
        private List<Axis> axes;
        private List<Integer> qubits;
        private ControlledZMode controlledZMode = ControlledZMode.CORRECT;

        public Builder numQubits(int n) { this.numQubits = n; return this; }
        public Builder numLatentQubits(int n) { this.numLatentQubits = n; return this; }
        public Builder thetas(List<Double> thetas) { this.thetas = thetas; return this; }
        public Builder axes(List<Axis> axes) { this.axes = axes; return this; }
        public Builder qubits(List<Integer> qubits) { this.qubits = qubits; return this; }
        public Builder controlledZMode(ControlledZMode mode) { this.controlledZMode = mode; return this; }

        public Builder thetas(double... thetas) {
            List<Double> list = new ArrayList<>(thetas.length);
            for (double t : thetas) {
                list.add(t);
            }
            this.thetas = list;
            return this;
        }

        public Builder axes(Axis... axes) {
            this.axes = List.of(axes);
            return this;
        }

        public Builder qubits(int... qubits) {
            List<Integer> list = new ArrayList<>(qubits.length);
            for (int q : qubits) {
                list.add(q);
            }
            this.qubits = list;
            return this;
        }

        public CircuitConfig build() {
            return new CircuitConfig(numQubits, numLatentQubits, thetas, axes, qubits, controlledZMode);
        }
    }
}
