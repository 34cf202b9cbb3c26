package io.surfworks.qaeforge.circuit;

import java.util.Locale;

/**
 * Rotation axis of a gate block.
 */
public enum Axis {
    X,
    Y,
    Z;

    /**
     * Parses an axis name, ignoring case and surrounding whitespace.
     *
     * @param text "X", "y", " Z ", ...
     * @return the axis
     * @throws CircuitException with {@code CONFIGURATION} for anything else
     */
    public static Axis parse(String text) {
        if (text == null) {
            throw CircuitException.configuration("Axis must not be null");
        }
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "X" -> X;
            case "Y" -> Y;
            case "Z" -> Z;
            default -> throw CircuitException.configuration("Unknown rotation axis '" + text + "'");
        };
    }
}
