package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.FrameIdentifier;

import java.util.Objects;

public class SwapPhasesInst extends Instruction {
    private final FrameIdentifier first;
    private final FrameIdentifier second;

    public SwapPhasesInst(FrameIdentifier first, FrameIdentifier second) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
    }

    @Override
    public Opcode opCode() {
        return Opcode.SWAP_PHASES;
    }

    public FrameIdentifier getFirst() {
        return first;
    }

    public FrameIdentifier getSecond() {
        return second;
    }

    @Override
    public String toQuil() {
        return "SWAP-PHASES " + first.toQuil() + " " + second.toQuil();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
