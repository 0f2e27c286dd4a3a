package ir;

import ir.instructions.*;

/**
 * One method per instruction kind: a new kind added to {@code ir.instructions} must be
 * handled by every visitor.
 */
public interface InstructionVisitor<T> {
    T visit(PulseInst inst);

    T visit(CaptureInst inst);

    T visit(RawCaptureInst inst);

    T visit(DelayInst inst);

    T visit(FenceInst inst);

    T visit(FrameUpdateInst inst);

    T visit(SwapPhasesInst inst);

    T visit(LabelInst inst);

    T visit(JumpInst inst);

    T visit(JumpWhenInst inst);

    T visit(JumpUnlessInst inst);

    T visit(HaltInst inst);

    T visit(ClassicalInst inst);
}
