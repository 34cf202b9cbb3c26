package io.surfworks.qaeforge.circuit;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitConfigTest {

    private static List<Double> thetas(int count) {
        return new ArrayList<>(Collections.nCopies(count, 0.5));
    }

    private static void assertConfigurationError(Runnable action) {
        CircuitException e = assertThrows(CircuitException.class, action::run);
        assertEquals(CircuitException.ErrorCode.CONFIGURATION, e.errorCode());
    }

    @Nested
    class DefaultsTests {

        @Test
        void defaultAxesAndQubits() {
            CircuitConfig config = CircuitConfig.of(4, 0, thetas(6));

            assertEquals(2, config.numInputQubits());
            assertEquals(List.of(Axis.X, Axis.X, Axis.X, Axis.X), config.axes());
            assertEquals(List.of(0, 1, 2, 3), config.qubits());
            assertEquals(List.of(0, 1), config.inputQubits());
            assertEquals(ControlledZMode.CORRECT, config.controlledZMode());
        }

        @Test
        void nullModeDefaultsToCorrect() {
            CircuitConfig config = new CircuitConfig(2, 0, thetas(2), null, null, null);
            assertEquals(ControlledZMode.CORRECT, config.controlledZMode());
        }

        @ParameterizedTest
        @CsvSource({"7, 1, 4", "4, 0, 2", "5, 0, 2", "3, 1, 2", "1, 1, 1"})
        void inputQubitCountTruncates(int numQubits, int latent, int expected) {
            assertEquals(expected, CircuitConfig.inputQubitCount(numQubits, latent));
        }

        @Test
        void listsAreCopied() {
            List<Double> source = thetas(6);
            CircuitConfig config = CircuitConfig.of(4, 0, source);
            source.set(0, 9.0);

            assertEquals(0.5, config.thetas().get(0));
            assertThrows(UnsupportedOperationException.class, () -> config.thetas().add(1.0));
        }
    }

    @Nested
    class ValidationTests {

        @Test
        void thetasOneShort() {
            assertConfigurationError(() -> CircuitConfig.of(4, 0, thetas(5)));
        }

        @Test
        void thetasOneLong() {
            assertConfigurationError(() -> CircuitConfig.of(4, 0, thetas(7)));
        }

        @Test
        void missingThetas() {
            assertConfigurationError(() -> CircuitConfig.of(4, 0, null));
        }

        @Test
        void nonFiniteTheta() {
            List<Double> values = thetas(6);
            values.set(3, Double.NaN);
            assertConfigurationError(() -> CircuitConfig.of(4, 0, values));
        }

        @Test
        void nullTheta() {
            List<Double> values = thetas(6);
            values.set(3, null);
            assertConfigurationError(() -> CircuitConfig.of(4, 0, values));
        }

        @Test
        void wrongAxesLength() {
            assertConfigurationError(() -> new CircuitConfig(
                    4, 0, thetas(6), List.of(Axis.X, Axis.Y, Axis.Z), null, null));
        }

        @Test
        void nullAxisEntry() {
            List<Axis> axes = Arrays.asList(Axis.X, null, Axis.X, Axis.X);
            assertConfigurationError(() -> new CircuitConfig(4, 0, thetas(6), axes, null, null));
        }

        @Test
        void tooFewQubits() {
            assertConfigurationError(() -> new CircuitConfig(4, 0, thetas(6), null, List.of(0, 1, 2), null));
        }

        @Test
        void duplicateQubits() {
            assertConfigurationError(() -> new CircuitConfig(4, 0, thetas(6), null, List.of(0, 1, 1, 3), null));
        }

        @Test
        void negativeQubit() {
            assertConfigurationError(() -> new CircuitConfig(4, 0, thetas(6), null, List.of(0, 1, -2, 3), null));
        }

        @Test
        void extraQubitsAreAllowed() {
            CircuitConfig config = new CircuitConfig(4, 0, thetas(6), null, List.of(5, 6, 7, 8, 9), null);
            assertEquals(List.of(5, 6), config.inputQubits());
        }

        @ParameterizedTest
        @CsvSource({"0, 0", "-1, 0", "4, -1", "4, 5"})
        void badQubitCounts(int numQubits, int latent) {
            assertConfigurationError(() -> CircuitConfig.of(numQubits, latent, thetas(6)));
        }

        @Test
        void parameterCountBeyondIntRangeIsRejected() {
            // 2n + n(n-1) for n = 65536 wraps to 65536 in int arithmetic
            assertConfigurationError(() -> CircuitConfig.of(131072, 0, Collections.nCopies(65536, 0.5)));
        }

        @Test
        void noInputQubits() {
            // (1 + 0) / 2 == 0
            assertConfigurationError(() -> CircuitConfig.of(1, 0, thetas(0)));
        }
    }

    @Nested
    class BuilderTests {

        @Test
        void builderMatchesConstructor() {
            CircuitConfig built = CircuitConfig.builder()
                    .numQubits(4)
                    .numLatentQubits(0)
                    .thetas(0.5, 0.5, 0.5, 0.5, 0.5, 0.5)
                    .axes(Axis.X, Axis.Y, Axis.Z, Axis.X)
                    .qubits(0, 1, 2, 3)
                    .controlledZMode(ControlledZMode.LEGACY_CRX_ALIAS)
                    .build();

            CircuitConfig expected = new CircuitConfig(4, 0, thetas(6),
                    List.of(Axis.X, Axis.Y, Axis.Z, Axis.X), List.of(0, 1, 2, 3),
                    ControlledZMode.LEGACY_CRX_ALIAS);
            assertEquals(expected, built);
        }

        @Test
        void builderValidates() {
            assertConfigurationError(() -> CircuitConfig.builder().numQubits(4).thetas(1.0).build());
        }

        @Test
        void withMethodsRevalidate() {
            CircuitConfig config = CircuitConfig.of(4, 0, thetas(6));
            assertEquals(ControlledZMode.LEGACY_CRX_ALIAS,
                    config.withControlledZMode(ControlledZMode.LEGACY_CRX_ALIAS).controlledZMode());
            assertEquals(List.of(3, 2, 1, 0), config.withQubits(List.of(3, 2, 1, 0)).qubits());
            assertConfigurationError(() -> config.withThetas(thetas(2)));
            assertConfigurationError(() -> config.withAxes(List.of(Axis.Y)));
        }
    }
}
