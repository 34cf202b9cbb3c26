package io.surfworks.qaeforge.circuit;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Builds the gate program of a parameterized quantum autoencoder.
 *
 * <p>The encode stage over the {@code n} input qubits is
 * <ol>
 *   <li>a rotation on every input qubit ({@code axes[0]}),</li>
 *   <li>for each input qubit {@code i}, controlled rotations from qubit
 *       {@code i} to every other input qubit ({@code axes[i + 1]}),</li>
 *   <li>a final rotation on every input qubit ({@code axes[n + 1]}).</li>
 * </ol>
 * The decode stage is the encode stage daggered and flipped across the full
 * qubit ordering, so it also lands on the trash qubits that follow the
 * inputs. The result is the gate-definition preamble followed by encode and
 * decode.
 *
 * <p>Example usage:
 * <pre>{@code
 * CircuitProgram program = QaeCircuit.build(4, 0, thetas, null, null);
 * System.out.println(QuilWriter.write(program));
 * }</pre>
 */
public final class QaeCircuit {

    private static final Logger LOG = Logger.getLogger(QaeCircuit.class.getName());

    private final CircuitConfig config;
    private final BlockBuilder blocks;

    public QaeCircuit(CircuitConfig config) {
        this.config = config;
        this.blocks = new BlockBuilder(GateRegistry.forMode(config.controlledZMode()));
    }

    /**
     * Builds a circuit from loose arguments.
     *
     * @param axes   rotation axis per block, or {@code null} for all X
     * @param qubits qubit ordering, or {@code null} for {@code 0 .. numQubits - 1}
     * @throws CircuitException with {@code CONFIGURATION} before anything is
     *         built if the arguments violate an invariant
     */
    public static CircuitProgram build(int numQubits, int numLatentQubits, List<Double> thetas,
                                       List<Axis> axes, List<Integer> qubits) {
        CircuitConfig config = new CircuitConfig(
                numQubits, numLatentQubits, thetas, axes, qubits, ControlledZMode.CORRECT);
        return new QaeCircuit(config).build();
    }

    /**
     * Builds the full program: preamble, encode stage, decode stage.
     */
    public CircuitProgram build() {
        CircuitProgram encode = encode();
        CircuitProgram decode = DaggerAndFlip.apply(encode, config.qubits());
        CircuitProgram program = encode.concat(decode).withDefinitions(GateRegistry.definitions());

        LOG.fine(() -> String.format("Built QAE circuit: n=%d, encode=%d, decode=%d, qubits=%s",
                config.numInputQubits(), encode.size(), decode.size(), config.qubits()));
        return program;
    }

    /**
     * Builds only the encode stage.
     */
    public CircuitProgram encode() {
        int n = config.numInputQubits();
        List<Integer> inputs = config.inputQubits();
        List<Double> thetas = config.thetas();
        List<Axis> axes = config.axes();

        List<CircuitProgram> stages = new ArrayList<>(n + 2);
        stages.add(inBlock("initial rotation block", () -> blocks.rotationBlock(axes.get(0), inputs,
                ParameterSlicer.slice(thetas, ParameterSlicer.initialBlockStart(), n))));

        for (int i = 0; i < n; i++) {
            int block = i;
            stages.add(inBlock("controlled block " + i, () -> blocks.controlledRotationBlock(
                    axes.get(block + 1), inputs,
                    ParameterSlicer.slice(thetas, ParameterSlicer.controlledBlockStart(n, block), n - 1),
                    inputs.get(block))));
        }

        stages.add(inBlock("final rotation block", () -> blocks.rotationBlock(axes.get(n + 1), inputs,
                ParameterSlicer.slice(thetas, ParameterSlicer.finalBlockStart(n), n))));

        return CircuitProgram.concat(stages);
    }

    /**
     * Builds one block, naming it in any failure.
     */
    static CircuitProgram inBlock(String block, Supplier<CircuitProgram> builder) {
        try {
            return builder.get();
        } catch (CircuitException e) {
            throw CircuitException.inBlock(block, e);
        }
    }

    @Override
    public String toString() {
        return String.format("QaeCircuit[qubits=%d, latent=%d, inputs=%d, mode=%s]",
                config.numQubits(), config.numLatentQubits(), config.numInputQubits(), config.controlledZMode());
    }
}
