package io.surfworks.qaeforge.circuit;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only table from (axis, arity) to gate constructor.
 *
 * <p>Both registries are built once during class initialization and never
 * mutated, so they are shared by all circuit builds on all threads. They
 * differ only in what a Z-axis controlled rotation resolves to, see
 * {@link ControlledZMode}.
 *
 * <pre>{@code
 * GateConstructor crx = GateRegistry.standard().constructor(Axis.X, 2);
 * Instruction inst = crx.create(Math.PI / 2, 0, 1);   // CRX(pi/2) 0 1
 * }</pre>
 */
public final class GateRegistry {

    private static final GateDefinition CRX_DEF = GateDefinition.crx();
    private static final GateDefinition CRY_DEF = GateDefinition.cry();
    private static final GateDefinition CRZ_DEF = GateDefinition.crz();
    private static final List<GateDefinition> DEFINITIONS = List.of(CRX_DEF, CRY_DEF, CRZ_DEF);

    private static final GateRegistry STANDARD = new GateRegistry(ControlledZMode.CORRECT);
    private static final GateRegistry LEGACY = new GateRegistry(ControlledZMode.LEGACY_CRX_ALIAS);

    private final ControlledZMode mode;
    private final Map<Axis, GateType> rotations;
    private final Map<Axis, GateType> controlledRotations;

    private GateRegistry(ControlledZMode mode) {
        this.mode = mode;
        Map<Axis, GateType> single = new EnumMap<>(Axis.class);
        Map<Axis, GateType> controlled = new EnumMap<>(Axis.class);
        for (Axis axis : Axis.values()) {
            single.put(axis, GateType.rotation(axis));
            controlled.put(axis, GateType.controlledRotation(axis));
        }
        if (mode == ControlledZMode.LEGACY_CRX_ALIAS) {
            controlled.put(Axis.Z, GateType.CRX);
        }
        this.rotations = Map.copyOf(single);
        this.controlledRotations = Map.copyOf(controlled);
    }

    /**
     * Registry in which every (axis, arity) resolves to its own gate.
     */
    public static GateRegistry standard() {
        return STANDARD;
    }

    public static GateRegistry forMode(ControlledZMode mode) {
        return switch (mode) {
            case CORRECT -> STANDARD;
            case LEGACY_CRX_ALIAS -> LEGACY;
        };
    }

    public ControlledZMode mode() {
        return mode;
    }

    /**
     * Resolves the gate type used for an axis and arity.
     *
     * @param axis  rotation axis
     * @param arity 1 for a rotation, 2 for a controlled rotation
     * @return the gate type
     * @throws IllegalArgumentException if arity is not 1 or 2
     */
    public GateType gateType(Axis axis, int arity) {
        return switch (arity) {
            case 1 -> rotations.get(axis);
            case 2 -> controlledRotations.get(axis);
            default -> throw new IllegalArgumentException("Gate arity must be 1 or 2, got " + arity);
        };
    }

    /**
     * Returns the constructor for an axis and arity.
     */
    public GateConstructor constructor(Axis axis, int arity) {
        GateType type = gateType(axis, arity);
        return type::instruction;
    }

    /**
     * Resolves a gate by its instruction name.
     *
     * @throws IllegalArgumentException for names outside {@link GateType}
     */
    public static GateType byName(String name) {
        try {
            return GateType.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Gate '" + name + "' not registered. Available: " + List.of(GateType.values()), e);
        }
    }

    /**
     * Definitions of the custom controlled gates, in the order a backend
     * should receive them.
     */
    public static List<GateDefinition> definitions() {
        return DEFINITIONS;
    }

    /**
     * Definition of a controlled gate type.
     *
     * @throws IllegalArgumentException for single-qubit gates, which backends know natively
     */
    public static GateDefinition definition(GateType type) {
        return switch (type) {
            case CRX -> CRX_DEF;
            case CRY -> CRY_DEF;
            case CRZ -> CRZ_DEF;
            default -> throw new IllegalArgumentException(type + " is a native gate without a definition");
        };
    }

    @Override
    public String toString() {
        return String.format("GateRegistry[mode=%s, controlled=%s]", mode, controlledRotations);
    }
}
