package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.FrameIdentifier;

import java.util.Objects;

/**
 * SET-FREQUENCY, SHIFT-FREQUENCY, SET-PHASE, SHIFT-PHASE and SET-SCALE: each mutates
 * the state of a single frame.
 */
public class FrameUpdateInst extends Instruction {
    private final Opcode opcode;
    private final FrameIdentifier frame;
    private final String value;

    public FrameUpdateInst(Opcode opcode, FrameIdentifier frame, String value) {
        if (!opcode.isFrameUpdate()) {
            throw new IllegalArgumentException(opcode + " is not a frame update");
        }
        this.opcode = opcode;
        this.frame = Objects.requireNonNull(frame, "frame");
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public Opcode opCode() {
        return opcode;
    }

    public FrameIdentifier getFrame() {
        return frame;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toQuil() {
        return opcode.getMnemonic() + " " + frame.toQuil() + " " + value;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
