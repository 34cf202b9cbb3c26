package io.surfworks.qaeforge.circuit;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DaggerAndFlipTest {

    @Nested
    class MappingTests {

        @Test
        void reversesPositions() {
            assertEquals(Map.of(1, 6, 2, 5, 3, 4, 4, 3, 5, 2, 6, 1),
                    DaggerAndFlip.reversalMapping(List.of(1, 2, 3, 4, 5, 6)));
        }

        @Test
        void oddLengthKeepsMiddleFixed() {
            Map<Integer, Integer> mapping = DaggerAndFlip.reversalMapping(List.of(10, 20, 30));
            assertEquals(20, mapping.get(20));
            assertEquals(30, mapping.get(10));
        }

        @Test
        void mappingIsSelfInverse() {
            Map<Integer, Integer> mapping = DaggerAndFlip.reversalMapping(List.of(7, 0, 3, 9, 2));
            for (Map.Entry<Integer, Integer> e : mapping.entrySet()) {
                assertEquals(e.getKey(), mapping.get(e.getValue()));
            }
        }

        @Test
        void emptyOrdering() {
            assertTrue(DaggerAndFlip.reversalMapping(List.of()).isEmpty());
        }

        @Test
        void duplicateQubitsRejected() {
            CircuitException e = assertThrows(CircuitException.class,
                    () -> DaggerAndFlip.reversalMapping(List.of(0, 1, 0)));
            assertEquals(CircuitException.ErrorCode.CONFIGURATION, e.errorCode());
        }
    }

    @Nested
    class ApplyTests {

        private final CircuitProgram program = CircuitProgram.of(
                Instruction.of(GateType.RX, 0.1, 0),
                Instruction.of(GateType.CRY, 0.2, 0, 1),
                Instruction.of(GateType.RZ, -0.3, 1));

        @Test
        void reversesNegatesAndRemaps() {
            CircuitProgram result = DaggerAndFlip.apply(program, List.of(0, 1, 2, 3));

            assertEquals(List.of(
                    Instruction.of(GateType.RZ, 0.3, 2),
                    Instruction.of(GateType.CRY, -0.2, 3, 2),
                    Instruction.of(GateType.RX, -0.1, 3)), result.instructions());
        }

        @Test
        void preservesCountAndDefinitions() {
            CircuitProgram withDefs = program.withDefinitions(GateRegistry.definitions());
            CircuitProgram result = DaggerAndFlip.apply(withDefs, List.of(0, 1));

            assertEquals(withDefs.size(), result.size());
            assertEquals(withDefs.gateDefinitions(), result.gateDefinitions());
        }

        @Test
        void keepsGateTypes() {
            CircuitProgram result = DaggerAndFlip.apply(program, List.of(0, 1));
            for (int k = 0; k < program.size(); k++) {
                assertEquals(program.get(k).gate(), result.get(program.size() - 1 - k).gate());
            }
        }

        @Test
        void appliedTwiceIsIdentity() {
            List<Integer> ordering = List.of(0, 1, 2, 3, 4);
            CircuitProgram twice = DaggerAndFlip.apply(DaggerAndFlip.apply(program, ordering), ordering);
            assertEquals(program, twice);
        }

        @Test
        void zeroAngleSurvivesTwoNegations() {
            CircuitProgram zero = CircuitProgram.of(Instruction.of(GateType.RY, 0.0, 1));
            List<Integer> ordering = List.of(1, 2);

            CircuitProgram once = DaggerAndFlip.apply(zero, ordering);
            assertEquals(Instruction.of(GateType.RY, 0.0, 2), once.get(0));
            assertEquals(zero, DaggerAndFlip.apply(once, ordering));
        }

        @Test
        void emptyProgram() {
            assertTrue(DaggerAndFlip.apply(CircuitProgram.empty(), List.of(0, 1)).isEmpty());
        }

        @Test
        void unmappedQubitIsLookupError() {
            CircuitException e = assertThrows(CircuitException.class,
                    () -> DaggerAndFlip.apply(program, List.of(0, 2, 3)));
            assertEquals(CircuitException.ErrorCode.LOOKUP, e.errorCode());
        }
    }
}
