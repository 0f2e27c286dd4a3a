package ir.instructions;

import ir.operand.Label;
import ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Jump taken or not depending on a single classical memory cell.
 */
public abstract class ConditionalJumpInst extends Instruction {
    private final Label target;
    private final MemoryReference condition;

    protected ConditionalJumpInst(Label target, MemoryReference condition) {
        this.target = Objects.requireNonNull(target, "target");
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public Label getTarget() {
        return target;
    }

    public MemoryReference getCondition() {
        return condition;
    }

    /**
     * @return true if the jump is taken when the condition is non-zero
     */
    public abstract boolean jumpsWhenSet();

    @Override
    public String toQuil() {
        return opCode().getMnemonic() + " " + target + " " + condition;
    }
}
