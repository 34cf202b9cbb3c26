package io.surfworks.qaeforge.circuit;

/**
 * The closed set of rotation gates a QAE circuit is made of.
 *
 * <p>Single-qubit rotations act on one qubit. Controlled rotations act on two,
 * the control listed first. Every type is a rotation family, so its inverse
 * is the same type with the angle negated.
 */
public enum GateType {
    RX(Axis.X, 1),
    RY(Axis.Y, 1),
    RZ(Axis.Z, 1),
    CRX(Axis.X, 2),
    CRY(Axis.Y, 2),
    CRZ(Axis.Z, 2);

    private final Axis axis;
    private final int arity;

    GateType(Axis axis, int arity) {
        this.axis = axis;
        this.arity = arity;
    }

    public Axis axis() {
        return axis;
    }

    /**
     * Number of qubits the gate acts on (1 or 2).
     */
    public int arity() {
        return arity;
    }

    public boolean isControlled() {
        return arity == 2;
    }

    /**
     * Binds an angle and qubits into an instruction of this type.
     *
     * @param angle  rotation angle in radians
     * @param qubits control first for controlled types
     * @return the instruction
     */
    public Instruction instruction(double angle, int... qubits) {
        return Instruction.of(this, angle, qubits);
    }

    static GateType rotation(Axis axis) {
        return switch (axis) {
            case X -> RX;
            case Y -> RY;
            case Z -> RZ;
        };
    }

    static GateType controlledRotation(Axis axis) {
        return switch (axis) {
            case X -> CRX;
            case Y -> CRY;
            case Z -> CRZ;
        };
    }
}
