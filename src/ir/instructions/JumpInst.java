package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.Label;

import java.util.Objects;

public class JumpInst extends Instruction {
    private final Label target;

    public JumpInst(Label target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    public JumpInst(String target) {
        this(Label.named(target));
    }

    @Override
    public Opcode opCode() {
        return Opcode.JUMP;
    }

    public Label getTarget() {
        return target;
    }

    @Override
    public String toQuil() {
        return "JUMP " + target;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
