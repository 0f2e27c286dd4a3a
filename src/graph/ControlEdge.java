package graph;

import java.util.Objects;

/**
 * Predicate-labelled edge leaving a block. The target is a block index, or
 * {@link #EXIT} when control leaves the program.
 */
public final class ControlEdge {
    public static final int EXIT = -1;

    private final int source;
    private final BranchPredicate predicate;
    private final int target;

    public ControlEdge(int source, BranchPredicate predicate, int target) {
        if (target < EXIT) {
            throw new IllegalArgumentException("invalid target block " + target);
        }
        this.source = source;
        this.predicate = Objects.requireNonNull(predicate);
        this.target = target;
    }

    public int getSource() {
        return source;
    }

    public BranchPredicate getPredicate() {
        return predicate;
    }

    public int getTarget() {
        return target;
    }

    public boolean isExit() {
        return target == EXIT;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ControlEdge)) return false;
        ControlEdge that = (ControlEdge) obj;
        return source == that.source && target == that.target && predicate.equals(that.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, predicate, target);
    }

    @Override
    public String toString() {
        return source + " -> " + (isExit() ? "exit" : String.valueOf(target)) + " [" + predicate + "]";
    }
}
