package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.FrameIdentifier;
import ir.operand.WaveformInvocation;

import java.util.Objects;

public class PulseInst extends Instruction {
    private final FrameIdentifier frame;
    private final WaveformInvocation waveform;
    private final boolean blocking;

    public PulseInst(FrameIdentifier frame, WaveformInvocation waveform, boolean blocking) {
        this.frame = Objects.requireNonNull(frame, "frame");
        this.waveform = Objects.requireNonNull(waveform, "waveform");
        this.blocking = blocking;
    }

    @Override
    public Opcode opCode() {
        return Opcode.PULSE;
    }

    public FrameIdentifier getFrame() {
        return frame;
    }

    public WaveformInvocation getWaveform() {
        return waveform;
    }

    public boolean isBlocking() {
        return blocking;
    }

    @Override
    public String toQuil() {
        return blockingPrefix(blocking) + "PULSE " + frame.toQuil() + " " + waveform.toQuil();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
