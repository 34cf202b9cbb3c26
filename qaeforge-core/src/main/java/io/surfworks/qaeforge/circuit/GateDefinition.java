package io.surfworks.qaeforge.circuit;

import java.util.List;
import java.util.function.DoubleFunction;

/**
 * Matrix definition of a parameterized two-qubit gate.
 *
 * <p>A backend has to see the definition of every custom gate before it can
 * interpret instructions that use it. Each entry of the 4x4 matrix carries its
 * Quil expression (in terms of {@code %theta}) and a numeric evaluator.
 *
 * <p>All three controlled rotations are identity on the control-0 subspace and
 * apply the rotation on the control-1 subspace:
 * <pre>
 *   CRX: [[cos(t/2), -i sin(t/2)], [-i sin(t/2), cos(t/2)]]
 *   CRY: [[cos(t/2), -sin(t/2)],   [sin(t/2),    cos(t/2)]]
 *   CRZ: diag(cos(t/2) - i sin(t/2), cos(t/2) + i sin(t/2))
 * </pre>
 *
 * @param name      gate name as it appears in instructions
 * @param parameter name of the symbolic parameter, without the {@code %} sigil
 * @param rows      four rows of four entries
 */
public record GateDefinition(String name, String parameter, List<List<Entry>> rows) {

    public static final String THETA = "theta";

    /**
     * One matrix entry.
     *
     * @param quil  Quil expression text
     * @param value evaluates the entry for a bound angle
     */
    public record Entry(String quil, DoubleFunction<Complex> value) {}

    public GateDefinition {
        if (rows.size() != 4 || rows.stream().anyMatch(r -> r.size() != 4)) {
            throw new IllegalArgumentException("Gate " + name + " needs a 4x4 matrix");
        }
        rows = rows.stream().map(List::copyOf).toList();
    }

    static GateDefinition crx() {
        return controlled("CRX",
                cos(), minusISin(),
                minusISin(), cos());
    }

    static GateDefinition cry() {
        return controlled("CRY",
                cos(), minusSin(),
                sin(), cos());
    }

    static GateDefinition crz() {
        return controlled("CRZ",
                cosMinusISin(), zero(),
                zero(), cosPlusISin());
    }

    /**
     * Evaluates the matrix for a bound angle.
     */
    public Complex[][] matrix(double theta) {
        Complex[][] m = new Complex[4][4];
        for (int i = 0; i < 4; i++) {
            for (int j = 0; j < 4; j++) {
                m[i][j] = rows.get(i).get(j).value().apply(theta);
            }
        }
        return m;
    }

    /**
     * Renders the Quil {@code DEFGATE} block for this gate.
     */
    public String toQuil() {
        StringBuilder sb = new StringBuilder("DEFGATE ")
                .append(name).append("(%").append(parameter).append("):\n");
        for (List<Entry> row : rows) {
            sb.append("    ");
            for (int j = 0; j < row.size(); j++) {
                if (j > 0) sb.append(", ");
                sb.append(row.get(j).quil());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static GateDefinition controlled(String name, Entry a, Entry b, Entry c, Entry d) {
        return new GateDefinition(name, THETA, List.of(
                List.of(one(), zero(), zero(), zero()),
                List.of(zero(), one(), zero(), zero()),
                List.of(zero(), zero(), a, b),
                List.of(zero(), zero(), c, d)));
    }

    private static Entry zero() {
        return new Entry("0", t -> Complex.ZERO);
    }

    private static Entry one() {
        return new Entry("1", t -> Complex.ONE);
    }

    private static Entry cos() {
        return new Entry("COS(%theta/2)", t -> Complex.real(Math.cos(t / 2)));
    }

    private static Entry sin() {
        return new Entry("SIN(%theta/2)", t -> Complex.real(Math.sin(t / 2)));
    }

    private static Entry minusSin() {
        return new Entry("-SIN(%theta/2)", t -> Complex.real(-Math.sin(t / 2)));
    }

    private static Entry minusISin() {
        return new Entry("-i*SIN(%theta/2)", t -> new Complex(0.0, -Math.sin(t / 2)));
    }

    private static Entry cosMinusISin() {
        return new Entry("COS(%theta/2)-i*SIN(%theta/2)", t -> new Complex(Math.cos(t / 2), -Math.sin(t / 2)));
    }

    private static Entry cosPlusISin() {
        return new Entry("COS(%theta/2)+i*SIN(%theta/2)", t -> new Complex(Math.cos(t / 2), Math.sin(t / 2)));
    }
}
