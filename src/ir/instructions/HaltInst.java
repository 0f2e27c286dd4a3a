package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;

public class HaltInst extends Instruction {

    @Override
    public Opcode opCode() {
        return Opcode.HALT;
    }

    @Override
    public String toQuil() {
        return "HALT";
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
