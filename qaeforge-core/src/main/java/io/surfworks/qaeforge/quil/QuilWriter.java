package io.surfworks.qaeforge.quil;

import io.surfworks.qaeforge.circuit.CircuitProgram;
import io.surfworks.qaeforge.circuit.GateDefinition;
import io.surfworks.qaeforge.circuit.Instruction;

/**
 * Renders a {@link CircuitProgram} as Quil text.
 *
 * <p>The gate-definition preamble comes first, one {@code DEFGATE} block per
 * definition followed by a blank line, then one instruction per line:
 * <pre>
 * DEFGATE CRX(%theta):
 *     1, 0, 0, 0
 *     0, 1, 0, 0
 *     0, 0, COS(%theta/2), -i*SIN(%theta/2)
 *     0, 0, -i*SIN(%theta/2), COS(%theta/2)
 *
 * RX(pi) 0
 * CRX(pi/2) 0 1
 * </pre>
 */
public final class QuilWriter {

    private QuilWriter() {}

    public static String write(CircuitProgram program) {
        StringBuilder sb = new StringBuilder();
        for (GateDefinition def : program.gateDefinitions()) {
            sb.append(def.toQuil()).append('\n');
        }
        for (Instruction inst : program.instructions()) {
            sb.append(instruction(inst)).append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders one instruction, e.g. {@code CRX(-pi/2) 3 2}.
     */
    public static String instruction(Instruction inst) {
        StringBuilder sb = new StringBuilder(inst.gate().name()).append('(');
        for (int i = 0; i < inst.params().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(QuilParameterFormat.format(inst.params().get(i)));
        }
        sb.append(')');
        for (int q : inst.qubits()) {
            sb.append(' ').append(q);
        }
        return sb.toString();
    }
}
