package ir.operand;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single cell of a classical memory region, e.g. {@code ro[0]}.
 */
public class MemoryReference extends Operand implements Comparable<MemoryReference> {
    private static final Comparator<MemoryReference> ORDER = Comparator
            .comparing(MemoryReference::getName)
            .thenComparingInt(MemoryReference::getIndex);

    private final String name;
    private final int index;

    public MemoryReference(String name, int index) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("memory region name must not be blank");
        }
        if (index < 0) {
            throw new IllegalArgumentException("negative memory index " + index + " for " + name);
        }
        this.name = name;
        this.index = index;
    }

    public static MemoryReference of(String name, int index) {
        return new MemoryReference(name, index);
    }

    public String getName() {
        return name;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean isMemoryReference() {
        return true;
    }

    @Override
    public int compareTo(MemoryReference other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        MemoryReference that = (MemoryReference) obj;
        return index == that.index && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, index);
    }

    @Override
    public String toString() {
        return name + "[" + index + "]";
    }
}
