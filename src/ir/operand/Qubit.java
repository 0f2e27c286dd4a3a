package ir.operand;

/**
 * Fixed qubit index. Only used to identify frames, never interpreted numerically.
 */
public final class Qubit implements Comparable<Qubit> {
    private final long index;

    private Qubit(long index) {
        this.index = index;
    }

    public static Qubit of(long index) {
        if (index < 0) {
            throw new IllegalArgumentException("negative qubit index " + index);
        }
        return new Qubit(index);
    }

    public long getIndex() {
        return index;
    }

    @Override
    public int compareTo(Qubit other) {
        return Long.compare(index, other.index);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Qubit)) return false;
        return index == ((Qubit) obj).index;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(index);
    }

    @Override
    public String toString() {
        return Long.toString(index);
    }
}
