package io.surfworks.qaeforge.circuit;

/**
 * Selects which gate a Z-axis controlled-rotation block emits.
 */
public enum ControlledZMode {
    /** Z-axis controlled blocks emit CRZ. */
    CORRECT,

    /**
     * Z-axis controlled blocks emit CRX, reproducing legacy circuits in which
     * the CRZ constructor was bound to the CRX definition.
     */
    LEGACY_CRX_ALIAS
}
