package graph;

import exception.ProgramGraphException;
import ir.instructions.ConditionalJumpInst;
import ir.instructions.HaltInst;
import ir.instructions.Instruction;
import ir.instructions.JumpInst;
import ir.operand.Label;
import ir.operand.MemoryReference;

import java.util.Objects;

/**
 * How control leaves a basic block.
 */
public final class BlockTerminator {
    public enum Kind {
        /** no explicit terminator: fall through to the next block */
        CONTINUE,
        JUMP,
        CONDITIONAL,
        HALT
    }

    private static final BlockTerminator CONTINUE = new BlockTerminator(Kind.CONTINUE, null, null, false);
    private static final BlockTerminator HALT = new BlockTerminator(Kind.HALT, null, null, false);

    private final Kind kind;
    private final Label target;
    private final MemoryReference condition;
    private final boolean jumpIfSet;

    private BlockTerminator(Kind kind, Label target, MemoryReference condition, boolean jumpIfSet) {
        this.kind = kind;
        this.target = target;
        this.condition = condition;
        this.jumpIfSet = jumpIfSet;
    }

    public static BlockTerminator fallthrough() {
        return CONTINUE;
    }

    /**
     * @throws ProgramGraphException UNSUPPORTED_TERMINATOR if {@code inst} does not transfer control
     */
    public static BlockTerminator of(Instruction inst) {
        if (inst instanceof JumpInst jump) {
            return new BlockTerminator(Kind.JUMP, jump.getTarget(), null, false);
        }
        if (inst instanceof ConditionalJumpInst branch) {
            return new BlockTerminator(Kind.CONDITIONAL, branch.getTarget(), branch.getCondition(),
                    branch.jumpsWhenSet());
        }
        if (inst instanceof HaltInst) {
            return HALT;
        }
        throw ProgramGraphException.unsupportedTerminator(inst.toQuil());
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the jump target, or null for CONTINUE and HALT
     */
    public Label getTarget() {
        return target;
    }

    /**
     * @return the memory cell tested by a conditional jump, or null
     */
    public MemoryReference getCondition() {
        return condition;
    }

    /**
     * @return for a conditional jump, true if it is taken when the condition is non-zero
     */
    public boolean jumpsIfSet() {
        return jumpIfSet;
    }

    public boolean isConditional() {
        return kind == Kind.CONDITIONAL;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BlockTerminator)) return false;
        BlockTerminator that = (BlockTerminator) obj;
        return kind == that.kind && jumpIfSet == that.jumpIfSet
                && Objects.equals(target, that.target)
                && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, target, condition, jumpIfSet);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case JUMP -> "JUMP " + target;
            case CONDITIONAL -> (jumpIfSet ? "JUMP-WHEN " : "JUMP-UNLESS ") + target + " " + condition;
            case HALT -> "HALT";
            case CONTINUE -> "CONTINUE";
        };
    }
}
