package io.surfworks.qaeforge.cli;

import io.surfworks.qaeforge.circuit.Axis;
import io.surfworks.qaeforge.circuit.CircuitConfig;
import io.surfworks.qaeforge.circuit.CircuitException;
import io.surfworks.qaeforge.circuit.CircuitProgram;
import io.surfworks.qaeforge.circuit.QaeCircuit;
import io.surfworks.qaeforge.json.CircuitJson;
import io.surfworks.qaeforge.quil.QuilParseException;
import io.surfworks.qaeforge.quil.QuilWriter;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class QaeForgeMain {

    private static final Logger LOG = Logger.getLogger(QaeForgeMain.class.getName());

    private final PrintStream out;
    private final PrintStream err;

    QaeForgeMain(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        configureLogging();
        int status = new QaeForgeMain(System.out, System.err).run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one command and returns the process exit status.
     */
    int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return 0;
        }

        String command = args[0];
        try {
            switch (command) {
                case "--help", "-h" -> printUsage();
                case "--example" -> runExample();
                case "--config" -> runConfig(args);
                case "--build" -> runBuild(args);
                default -> {
                    err.println("Unknown command: " + command);
                    printUsage();
                    return 1;
                }
            }
            return 0;
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (CircuitException e) {
            LOG.log(Level.FINE, "Circuit construction failed", e);
            err.println("Error [" + e.errorCode() + "]: " + e.getMessage());
            return 1;
        } catch (QuilParseException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.warning("I/O failure: " + e);
            err.println("Error reading file: " + e.getMessage());
            return 1;
        }
    }

    private void printUsage() {
        out.println("QaeForge CLI - Quantum Autoencoder Circuit Generator");
        out.println();
        out.println("Usage: qaeforge <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  --example                      Build the 7-qubit demo circuit and print Quil");
        out.println("  --config FILE                  Build from a JSON circuit config");
        out.println("  --build N L --thetas a,b,...   Build from arguments");
        out.println("  --help, -h                     Print this help message");
        out.println();
        out.println("Options:");
        out.println("  --axes X,Y,...                 Rotation axis per block (default: all X)");
        out.println("  --qubits 0,1,...               Qubit ordering (default: 0 .. N-1)");
        out.println("  --format quil|json             Output format (default: quil)");
    }

    private void runExample() {
        List<Double> thetas = new ArrayList<>(20);
        thetas.addAll(Collections.nCopies(4, Math.PI));
        thetas.addAll(Collections.nCopies(12, Math.PI / 2));
        thetas.addAll(Collections.nCopies(4, Math.PI));

        CircuitConfig config = CircuitConfig.builder()
                .numQubits(7)
                .numLatentQubits(1)
                .thetas(thetas)
                .axes(Axis.X, Axis.Y, Axis.X, Axis.Y, Axis.X, Axis.Y)
                .build();
        emit(new QaeCircuit(config).build(), "quil");
    }

    private void runConfig(String[] args) throws IOException {
        if (args.length < 2) {
            throw new UsageException("--config requires a FILE argument");
        }
        Path path = Path.of(args[1]);
        if (!Files.exists(path)) {
            throw new UsageException("File not found: " + path);
        }
        String format = "quil";
        for (int i = 2; i < args.length; i++) {
            if (args[i].equals("--format")) {
                format = value(args, ++i, "--format");
            } else {
                throw new UsageException("Unknown option: " + args[i]);
            }
        }

        CircuitConfig config = CircuitJson.readConfig(path);
        LOG.info("Loaded circuit config from " + path);
        emit(new QaeCircuit(config).build(), format);
    }

    private void runBuild(String[] args) {
        if (args.length < 3) {
            throw new UsageException("--build requires N and L arguments");
        }
        CircuitConfig.Builder builder = CircuitConfig.builder()
                .numQubits(parseInt(args[1], "N"))
                .numLatentQubits(parseInt(args[2], "L"));

        String format = "quil";
        boolean haveThetas = false;
        for (int i = 3; i < args.length; i++) {
            switch (args[i]) {
                case "--thetas" -> {
                    builder.thetas(parseDoubles(value(args, ++i, "--thetas")));
                    haveThetas = true;
                }
                case "--axes" -> builder.axes(parseAxes(value(args, ++i, "--axes")));
                case "--qubits" -> builder.qubits(parseInts(value(args, ++i, "--qubits")));
                case "--format" -> format = value(args, ++i, "--format");
                default -> throw new UsageException("Unknown option: " + args[i]);
            }
        }
        if (!haveThetas) {
            throw new UsageException("--build requires --thetas");
        }

        emit(new QaeCircuit(builder.build()).build(), format);
    }

    private void emit(CircuitProgram program, String format) {
        switch (format.toLowerCase(Locale.ROOT)) {
            case "quil" -> out.print(QuilWriter.write(program));
            case "json" -> out.println(CircuitJson.toJson(program));
            default -> throw new UsageException("Unknown format '" + format + "', expected quil or json");
        }
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new UsageException(option + " requires a value");
        }
        return args[index];
    }

    private static int parseInt(String text, String what) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(what + " must be an integer, got '" + text + "'");
        }
    }

    private static List<Double> parseDoubles(String csv) {
        List<Double> values = new ArrayList<>();
        for (String part : csv.split(",")) {
            try {
                values.add(Double.parseDouble(part.trim()));
            } catch (NumberFormatException e) {
                throw new UsageException("Not a number in --thetas: '" + part + "'");
            }
        }
        return values;
    }

    private static List<Axis> parseAxes(String csv) {
        List<Axis> axes = new ArrayList<>();
        for (String part : csv.split(",")) {
            axes.add(Axis.parse(part));
        }
        return axes;
    }

    private static List<Integer> parseInts(String csv) {
        List<Integer> values = new ArrayList<>();
        for (String part : csv.split(",")) {
            values.add(parseInt(part, "Qubit"));
        }
        return values;
    }

    private static void configureLogging() {
        try (InputStream in = QaeForgeMain.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not load logging.properties: " + e.getMessage());
        }
    }

    /**
     * Bad command line.
     */
    static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
