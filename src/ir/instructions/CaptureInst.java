package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.FrameIdentifier;
import ir.operand.MemoryReference;
import ir.operand.WaveformInvocation;

import java.util.Objects;

/**
 * Readout of a frame into classical memory. A nonblocking capture frees its frame
 * immediately while its result is written later.
 */
public class CaptureInst extends Instruction {
    private final FrameIdentifier frame;
    private final WaveformInvocation waveform;
    private final MemoryReference target;
    private final boolean blocking;

    public CaptureInst(FrameIdentifier frame, WaveformInvocation waveform, MemoryReference target,
            boolean blocking) {
        this.frame = Objects.requireNonNull(frame, "frame");
        this.waveform = Objects.requireNonNull(waveform, "waveform");
        this.target = Objects.requireNonNull(target, "target");
        this.blocking = blocking;
    }

    @Override
    public Opcode opCode() {
        return Opcode.CAPTURE;
    }

    public FrameIdentifier getFrame() {
        return frame;
    }

    public WaveformInvocation getWaveform() {
        return waveform;
    }

    public MemoryReference getTarget() {
        return target;
    }

    public boolean isBlocking() {
        return blocking;
    }

    @Override
    public String toQuil() {
        return blockingPrefix(blocking) + "CAPTURE " + frame.toQuil() + " " + waveform.toQuil() + " " + target;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
