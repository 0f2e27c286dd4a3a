package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.FrameIdentifier;
import ir.operand.MemoryReference;

import java.util.Objects;

public class RawCaptureInst extends Instruction {
    private final FrameIdentifier frame;
    private final String duration;
    private final MemoryReference target;
    private final boolean blocking;

    public RawCaptureInst(FrameIdentifier frame, String duration, MemoryReference target, boolean blocking) {
        this.frame = Objects.requireNonNull(frame, "frame");
        this.duration = Objects.requireNonNull(duration, "duration");
        this.target = Objects.requireNonNull(target, "target");
        this.blocking = blocking;
    }

    @Override
    public Opcode opCode() {
        return Opcode.RAW_CAPTURE;
    }

    public FrameIdentifier getFrame() {
        return frame;
    }

    public String getDuration() {
        return duration;
    }

    public MemoryReference getTarget() {
        return target;
    }

    public boolean isBlocking() {
        return blocking;
    }

    @Override
    public String toQuil() {
        return blockingPrefix(blocking) + "RAW-CAPTURE " + frame.toQuil() + " " + duration + " " + target;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
