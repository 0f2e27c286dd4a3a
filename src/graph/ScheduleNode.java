package graph;

/**
 * Node of a {@link ScheduleGraph}: one of the block's instructions, or one of the
 * two sentinels every block has.
 */
public final class ScheduleNode implements Comparable<ScheduleNode> {
    public enum Kind {
        START,
        INSTRUCTION,
        END
    }

    public static final ScheduleNode START = new ScheduleNode(Kind.START, -1);
    public static final ScheduleNode END = new ScheduleNode(Kind.END, -1);

    private final Kind kind;
    private final int instructionIndex;

    private ScheduleNode(Kind kind, int instructionIndex) {
        this.kind = kind;
        this.instructionIndex = instructionIndex;
    }

    public static ScheduleNode instruction(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("negative instruction index " + index);
        }
        return new ScheduleNode(Kind.INSTRUCTION, index);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isStart() {
        return kind == Kind.START;
    }

    public boolean isEnd() {
        return kind == Kind.END;
    }

    public boolean isInstruction() {
        return kind == Kind.INSTRUCTION;
    }

    /**
     * @return position of the instruction inside its block
     * @throws IllegalStateException for the start and end sentinels
     */
    public int getInstructionIndex() {
        if (!isInstruction()) {
            throw new IllegalStateException(this + " has no instruction");
        }
        return instructionIndex;
    }

    // start < instructions in block order < end
    @Override
    public int compareTo(ScheduleNode other) {
        int c = Integer.compare(kind.ordinal(), other.kind.ordinal());
        return c != 0 ? c : Integer.compare(instructionIndex, other.instructionIndex);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScheduleNode)) return false;
        ScheduleNode that = (ScheduleNode) obj;
        return kind == that.kind && instructionIndex == that.instructionIndex;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + instructionIndex;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case START -> "start";
            case END -> "end";
            default -> "[" + instructionIndex + "]";
        };
    }
}
