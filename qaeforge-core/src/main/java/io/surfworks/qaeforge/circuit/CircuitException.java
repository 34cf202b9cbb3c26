package io.surfworks.qaeforge.circuit;

import java.util.List;

/**
 * Exception thrown when a circuit cannot be constructed.
 *
 * <p>Every failure is local and non-retryable: it means the configuration or
 * the arguments handed to a builder are malformed. The {@link ErrorCode}
 * identifies which check failed.
 */
public class CircuitException extends RuntimeException {

    private final ErrorCode errorCode;

    public CircuitException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public CircuitException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Circuit construction error codes.
     */
    public enum ErrorCode {
        /** Configuration violates a size or uniqueness invariant */
        CONFIGURATION,

        /** A parameter slice would read past the end of the parameter list */
        OUT_OF_RANGE,

        /** A qubit has no entry in the mapping it is looked up in */
        LOOKUP,

        /** Qubit and parameter lists of incompatible lengths */
        LENGTH_MISMATCH
    }

    public static CircuitException configuration(String message) {
        return new CircuitException(message, ErrorCode.CONFIGURATION);
    }

    public static CircuitException configuration(String message, Throwable cause) {
        return new CircuitException(message, ErrorCode.CONFIGURATION, cause);
    }

    public static CircuitException wrongLength(String what, int expected, int actual) {
        return configuration(String.format("%s: expected length %d, got %d", what, expected, actual));
    }

    public static CircuitException outOfRange(int start, int count, int available) {
        return new CircuitException(
                String.format("Parameter slice [%d, %d) exceeds %d available parameters",
                        start, start + count, available),
                ErrorCode.OUT_OF_RANGE);
    }

    public static CircuitException unmappedQubit(int qubit, List<Integer> ordering) {
        return new CircuitException(
                String.format("Qubit %d is not part of qubit ordering %s", qubit, ordering),
                ErrorCode.LOOKUP);
    }

    public static CircuitException controlNotInBlock(int control, List<Integer> qubits) {
        return new CircuitException(
                String.format("Control qubit %d is not one of the block qubits %s", control, qubits),
                ErrorCode.LOOKUP);
    }

    public static CircuitException duplicateQubit(int qubit, List<Integer> qubits) {
        return configuration(String.format("Block qubits %s repeat qubit %d", qubits, qubit));
    }

    /**
     * Re-raises {@code cause} with the name of the block being built, keeping its error code.
     */
    public static CircuitException inBlock(String block, CircuitException cause) {
        return new CircuitException(block + ": " + cause.getMessage(), cause.errorCode(), cause);
    }

    public static CircuitException lengthMismatch(String block, int qubits, int expectedThetas, int actualThetas) {
        return new CircuitException(
                String.format("%s over %d qubits needs %d parameters, got %d",
                        block, qubits, expectedThetas, actualThetas),
                ErrorCode.LENGTH_MISMATCH);
    }
}
