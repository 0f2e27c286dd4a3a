package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.Label;
import ir.operand.MemoryReference;

public class JumpWhenInst extends ConditionalJumpInst {

    public JumpWhenInst(Label target, MemoryReference condition) {
        super(target, condition);
    }

    public JumpWhenInst(String target, MemoryReference condition) {
        this(Label.named(target), condition);
    }

    @Override
    public Opcode opCode() {
        return Opcode.JUMP_WHEN;
    }

    @Override
    public boolean jumpsWhenSet() {
        return true;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
