package com.example.rpaengine.ir;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("IrProgram")
class IrProgramTest {

    @Test
    @DisplayName("placeholder jump is patched, then the program seals")
    void patchAndSeal() {
        IrProgram program = new IrProgram();
        int jump = program.emit(new Instruction.Jump(Instruction.PLACEHOLDER));
        int halt = program.emit(new Instruction.Halt());
        program.patch(jump, i -> ((Instruction.Jump) i).withTarget(halt));
        program.seal();

        assertTrue(program.isSealed());
        assertEquals(new Instruction.Jump(1), program.get(0));
        assertThrows(IllegalStateException.class, () -> program.emit(new Instruction.Halt()));
    }

    @Test
    @DisplayName("sealing with an unpatched or out-of-range target fails")
    void sealRejectsBadTargets() {
        IrProgram unpatched = new IrProgram();
        unpatched.emit(new Instruction.Jump(Instruction.PLACEHOLDER));
        assertThrows(IllegalStateException.class, unpatched::seal);

        IrProgram outOfRange = new IrProgram();
        outOfRange.emit(new Instruction.Jump(7));
        assertThrows(IllegalStateException.class, outOfRange::seal);
    }

    @Test
    @DisplayName("a patch may not replace the instruction kind")
    void patchKeepsKind() {
        IrProgram program = new IrProgram();
        program.emit(new Instruction.Jump(Instruction.PLACEHOLDER));
        assertThrows(IllegalStateException.class, () -> program.patch(0, i -> new Instruction.Halt()));
    }

    @Test
    @DisplayName("absent error target is not a jump target")
    void absentErrorTarget() {
        Instruction.RunPowershell ps = new Instruction.RunPowershell("x", Instruction.NO_TARGET);
        assertTrue(ps.targets().isEmpty());
        assertEquals(java.util.List.of(3), ps.withErrorTarget(3).targets());
    }
}
