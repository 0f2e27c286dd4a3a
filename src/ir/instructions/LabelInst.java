package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.Label;

import java.util.Objects;

public class LabelInst extends Instruction {
    private final Label label;

    public LabelInst(Label label) {
        this.label = Objects.requireNonNull(label, "label");
    }

    public LabelInst(String name) {
        this(Label.named(name));
    }

    @Override
    public Opcode opCode() {
        return Opcode.LABEL;
    }

    public Label getLabel() {
        return label;
    }

    @Override
    public String toQuil() {
        return "LABEL " + label;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
