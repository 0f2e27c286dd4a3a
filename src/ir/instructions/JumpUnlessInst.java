package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.Label;
import ir.operand.MemoryReference;

public class JumpUnlessInst extends ConditionalJumpInst {

    public JumpUnlessInst(Label target, MemoryReference condition) {
        super(target, condition);
    }

    public JumpUnlessInst(String target, MemoryReference condition) {
        this(Label.named(target), condition);
    }

    @Override
    public Opcode opCode() {
        return Opcode.JUMP_UNLESS;
    }

    @Override
    public boolean jumpsWhenSet() {
        return false;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
