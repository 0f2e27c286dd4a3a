package graph;

import ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Condition under which a control edge is followed. A conditional jump splits the
 * two observable states of its memory cell, zero and non-zero.
 */
public final class BranchPredicate {
    public enum Kind {
        ALWAYS,
        IF_ZERO,
        IF_NONZERO
    }

    public static final BranchPredicate ALWAYS = new BranchPredicate(Kind.ALWAYS, null);

    private final Kind kind;
    private final MemoryReference condition;

    private BranchPredicate(Kind kind, MemoryReference condition) {
        this.kind = kind;
        this.condition = condition;
    }

    public static BranchPredicate ifZero(MemoryReference condition) {
        return new BranchPredicate(Kind.IF_ZERO, Objects.requireNonNull(condition));
    }

    public static BranchPredicate ifNonZero(MemoryReference condition) {
        return new BranchPredicate(Kind.IF_NONZERO, Objects.requireNonNull(condition));
    }

    public Kind getKind() {
        return kind;
    }

    public MemoryReference getCondition() {
        return condition;
    }

    public boolean isAlways() {
        return kind == Kind.ALWAYS;
    }

    /**
     * @return the predicate selecting exactly the states this one rejects
     */
    public BranchPredicate negate() {
        return switch (kind) {
            case IF_ZERO -> ifNonZero(condition);
            case IF_NONZERO -> ifZero(condition);
            case ALWAYS -> throw new IllegalStateException("'always' has no complement");
        };
    }

    /**
     * True if the two predicates test the same cell and select disjoint states that
     * together cover every value.
     */
    public boolean isComplementOf(BranchPredicate other) {
        return kind != Kind.ALWAYS && other.kind != Kind.ALWAYS
                && kind != other.kind && condition.equals(other.condition);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BranchPredicate)) return false;
        BranchPredicate that = (BranchPredicate) obj;
        return kind == that.kind && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, condition);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case IF_ZERO -> "if " + condition + " == 0";
            case IF_NONZERO -> "if " + condition + " != 0";
            case ALWAYS -> "always";
        };
    }
}
