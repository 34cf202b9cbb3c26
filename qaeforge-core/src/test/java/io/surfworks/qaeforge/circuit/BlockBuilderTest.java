package io.surfworks.qaeforge.circuit;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockBuilderTest {

    private final BlockBuilder builder = new BlockBuilder();

    @Nested
    class RotationBlockTests {

        @Test
        void oneRotationPerQubit() {
            CircuitProgram block = builder.rotationBlock(Axis.Y, List.of(3, 5, 7), List.of(0.1, 0.2, 0.3));

            assertEquals(List.of(
                    Instruction.of(GateType.RY, 0.1, 3),
                    Instruction.of(GateType.RY, 0.2, 5),
                    Instruction.of(GateType.RY, 0.3, 7)), block.instructions());
            assertTrue(block.gateDefinitions().isEmpty());
        }

        @Test
        void emptyBlock() {
            assertTrue(builder.rotationBlock(Axis.X, List.of(), List.of()).isEmpty());
        }

        @Test
        void lengthMismatch() {
            CircuitException e = assertThrows(CircuitException.class,
                    () -> builder.rotationBlock(Axis.X, List.of(0, 1), List.of(0.1)));
            assertEquals(CircuitException.ErrorCode.LENGTH_MISMATCH, e.errorCode());
        }
    }

    @Nested
    class ControlledRotationBlockTests {

        @Test
        void targetsEveryOtherQubitInOrder() {
            CircuitProgram block = builder.controlledRotationBlock(
                    Axis.X, List.of(0, 1, 2, 3), List.of(0.1, 0.2, 0.3), 2);

            assertEquals(List.of(
                    Instruction.of(GateType.CRX, 0.1, 2, 0),
                    Instruction.of(GateType.CRX, 0.2, 2, 1),
                    Instruction.of(GateType.CRX, 0.3, 2, 3)), block.instructions());
        }

        @Test
        void controlIsAlwaysFirstQubit() {
            CircuitProgram block = builder.controlledRotationBlock(
                    Axis.Y, List.of(4, 6, 8), List.of(1.0, 2.0), 4);
            for (Instruction inst : block.instructions()) {
                assertEquals(GateType.CRY, inst.gate());
                assertEquals(4, inst.control());
            }
            assertEquals(List.of(6, 8), block.instructions().stream().map(Instruction::target).toList());
        }

        @Test
        void zAxisEmitsCrz() {
            CircuitProgram block = builder.controlledRotationBlock(Axis.Z, List.of(0, 1), List.of(0.5), 0);
            assertEquals(GateType.CRZ, block.get(0).gate());
        }

        @Test
        void legacyModeEmitsCrxForZAxis() {
            BlockBuilder legacy = new BlockBuilder(GateRegistry.forMode(ControlledZMode.LEGACY_CRX_ALIAS));
            CircuitProgram block = legacy.controlledRotationBlock(Axis.Z, List.of(0, 1), List.of(0.5), 0);
            assertEquals(Instruction.of(GateType.CRX, 0.5, 0, 1), block.get(0));
        }

        @Test
        void singleQubitBlockIsEmpty() {
            assertTrue(builder.controlledRotationBlock(Axis.X, List.of(9), List.of(), 9).isEmpty());
        }

        @Test
        void wrongAngleCount() {
            CircuitException e = assertThrows(CircuitException.class,
                    () -> builder.controlledRotationBlock(Axis.X, List.of(0, 1, 2), List.of(0.1, 0.2, 0.3), 0));
            assertEquals(CircuitException.ErrorCode.LENGTH_MISMATCH, e.errorCode());
        }

        @Test
        void repeatedQubitIsRejected() {
            CircuitException e = assertThrows(CircuitException.class,
                    () -> builder.controlledRotationBlock(Axis.X, List.of(0, 0, 1), List.of(0.1, 0.2), 0));
            assertEquals(CircuitException.ErrorCode.CONFIGURATION, e.errorCode());
        }

        @Test
        void controlOutsideBlock() {
            CircuitException e = assertThrows(CircuitException.class,
                    () -> builder.controlledRotationBlock(Axis.X, List.of(0, 1, 2), List.of(0.1, 0.2), 5));
            assertEquals(CircuitException.ErrorCode.LOOKUP, e.errorCode());
            assertTrue(e.getMessage().contains("5"));
        }
    }
}
