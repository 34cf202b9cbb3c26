package io.surfworks.qaeforge.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.surfworks.qaeforge.circuit.Axis;
import io.surfworks.qaeforge.circuit.CircuitConfig;
import io.surfworks.qaeforge.circuit.CircuitException;
import io.surfworks.qaeforge.circuit.CircuitProgram;
import io.surfworks.qaeforge.circuit.ControlledZMode;
import io.surfworks.qaeforge.circuit.GateDefinition;
import io.surfworks.qaeforge.circuit.Instruction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON reading of circuit configurations and writing of circuit programs.
 *
 * <p>Config format:
 * <pre>{@code
 * {
 *   "numQubits": 4,
 *   "numLatentQubits": 0,
 *   "thetas": [0.1, 0.2, 0.3, 0.4, 0.5, 0.6],
 *   "axes": ["X", "Y", "X", "Z"],          // optional
 *   "qubits": [0, 1, 2, 3],                // optional
 *   "controlledZMode": "LEGACY_CRX_ALIAS"  // optional
 * }
 * }</pre>
 */
public final class CircuitJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private CircuitJson() {}

    /**
     * Reads a configuration from a JSON file.
     *
     * @throws IOException if the file cannot be read
     * @throws CircuitException with {@code CONFIGURATION} if the content is malformed
     */
    public static CircuitConfig readConfig(Path path) throws IOException {
        return readConfig(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Reads a configuration from JSON text.
     *
     * @throws CircuitException with {@code CONFIGURATION} if the text is not a
     *         valid configuration
     */
    public static CircuitConfig readConfig(String json) {
        JsonObject root;
        try {
            root = GSON.fromJson(json, JsonObject.class);
        } catch (JsonParseException | ClassCastException e) {
            throw CircuitException.configuration("Circuit config is not a JSON object: " + e.getMessage(), e);
        }
        if (root == null) {
            throw CircuitException.configuration("Circuit config is empty");
        }

        try {
            CircuitConfig.Builder builder = CircuitConfig.builder()
                    .numQubits(required(root, "numQubits").getAsInt())
                    .numLatentQubits(required(root, "numLatentQubits").getAsInt());

            List<Double> thetas = new ArrayList<>();
            for (JsonElement e : required(root, "thetas").getAsJsonArray()) {
                thetas.add(e.getAsDouble());
            }
            builder.thetas(thetas);

            if (present(root, "axes")) {
                List<Axis> axes = new ArrayList<>();
                for (JsonElement e : root.getAsJsonArray("axes")) {
                    axes.add(Axis.parse(e.getAsString()));
                }
                builder.axes(axes);
            }
            if (present(root, "qubits")) {
                List<Integer> qubits = new ArrayList<>();
                for (JsonElement e : root.getAsJsonArray("qubits")) {
                    qubits.add(e.getAsInt());
                }
                builder.qubits(qubits);
            }
            if (present(root, "controlledZMode")) {
                builder.controlledZMode(ControlledZMode.valueOf(
                        root.get("controlledZMode").getAsString().toUpperCase(Locale.ROOT)));
            }
            return builder.build();
        } catch (IllegalStateException | UnsupportedOperationException | ClassCastException
                 | IllegalArgumentException e) {
            throw CircuitException.configuration("Malformed circuit config: " + e.getMessage(), e);
        }
    }

    /**
     * Writes a program as pretty-printed JSON.
     */
    public static String toJson(CircuitProgram program) {
        JsonObject root = new JsonObject();

        JsonArray defs = new JsonArray();
        for (GateDefinition def : program.gateDefinitions()) {
            defs.add(def.name());
        }
        root.add("gateDefinitions", defs);

        JsonArray instructions = new JsonArray();
        for (Instruction inst : program.instructions()) {
            JsonObject obj = new JsonObject();
            obj.addProperty("gate", inst.gate().name());
            obj.add("params", GSON.toJsonTree(inst.params()));
            obj.add("qubits", GSON.toJsonTree(inst.qubits()));
            instructions.add(obj);
        }
        root.add("instructions", instructions);

        return GSON.toJson(root);
    }

    private static JsonElement required(JsonObject root, String field) {
        if (!present(root, field)) {
            throw CircuitException.configuration("Circuit config is missing '" + field + "'");
        }
        return root.get(field);
    }

    private static boolean present(JsonObject root, String field) {
        return root.has(field) && !root.get(field).isJsonNull();
    }
}
