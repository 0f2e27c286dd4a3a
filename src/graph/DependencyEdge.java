package graph;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Directed edge of a schedule graph with every kind of dependency that induced it.
 */
public final class DependencyEdge {
    private final ScheduleNode source;
    private final ScheduleNode target;
    private final Set<DependencyKind> kinds;

    public DependencyEdge(ScheduleNode source, ScheduleNode target, Set<DependencyKind> kinds) {
        if (kinds.isEmpty()) {
            throw new IllegalArgumentException("edge " + source + " -> " + target + " has no dependency kind");
        }
        this.source = Objects.requireNonNull(source);
        this.target = Objects.requireNonNull(target);
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(kinds));
    }

    public ScheduleNode getSource() {
        return source;
    }

    public ScheduleNode getTarget() {
        return target;
    }

    public Set<DependencyKind> getKinds() {
        return kinds;
    }

    public boolean hasKind(DependencyKind kind) {
        return kinds.contains(kind);
    }

    /**
     * Kind labels joined by newlines, e.g. "await capture\nframe".
     */
    public String getLabel() {
        return kinds.stream().map(DependencyKind::getLabel).collect(Collectors.joining("\n"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DependencyEdge)) return false;
        DependencyEdge that = (DependencyEdge) obj;
        return source.equals(that.source) && target.equals(that.target) && kinds.equals(that.kinds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, kinds);
    }

    @Override
    public String toString() {
        return source + " -> " + target + " " + kinds;
    }
}
