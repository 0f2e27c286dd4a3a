package ir.operand;

import exception.ProgramGraphException;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A physical control channel, keyed by an ordered qubit list and a name.
 * Instructions naming the same frame contend for the same resource.
 */
public final class FrameIdentifier implements Comparable<FrameIdentifier> {
    private final List<Qubit> qubits;
    private final String name;

    private FrameIdentifier(List<Qubit> qubits, String name) {
        this.qubits = qubits;
        this.name = name;
    }

    /**
     * @throws ProgramGraphException MALFORMED_FRAME_REFERENCE for an empty or repeating
     *                               qubit list, or a blank name
     */
    public static FrameIdentifier of(List<Qubit> qubits, String name) {
        if (qubits == null || qubits.isEmpty()) {
            throw ProgramGraphException.malformedFrame("frame \"" + name + "\" names no qubit");
        }
        if (name == null || name.isBlank()) {
            throw ProgramGraphException.malformedFrame("frame on qubits " + render(qubits) + " has no name");
        }
        if (new HashSet<>(qubits).size() != qubits.size()) {
            throw ProgramGraphException.malformedFrame("frame \"" + name + "\" repeats a qubit: " + render(qubits));
        }
        return new FrameIdentifier(List.copyOf(qubits), name);
    }

    public static FrameIdentifier of(long qubit, String name) {
        return of(List.of(Qubit.of(qubit)), name);
    }

    public List<Qubit> getQubits() {
        return qubits;
    }

    public String getName() {
        return name;
    }

    public boolean usesAnyOf(Collection<Qubit> others) {
        for (Qubit q : qubits) {
            if (others.contains(q)) {
                return true;
            }
        }
        return false;
    }

    /* same qubits regardless of order */
    public boolean hasQubitSet(Set<Qubit> others) {
        return qubits.size() == others.size() && others.containsAll(qubits);
    }

    public String toQuil() {
        return render(qubits) + " \"" + name + "\"";
    }

    private static String render(List<Qubit> qubits) {
        return qubits.stream().map(Qubit::toString).collect(Collectors.joining(" "));
    }

    @Override
    public int compareTo(FrameIdentifier other) {
        int common = Math.min(qubits.size(), other.qubits.size());
        for (int i = 0; i < common; i++) {
            int c = qubits.get(i).compareTo(other.qubits.get(i));
            if (c != 0) {
                return c;
            }
        }
        int c = Integer.compare(qubits.size(), other.qubits.size());
        return c != 0 ? c : name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FrameIdentifier)) return false;
        FrameIdentifier that = (FrameIdentifier) obj;
        return qubits.equals(that.qubits) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qubits, name);
    }

    @Override
    public String toString() {
        return toQuil();
    }
}
