package graph;

/**
 * Why one node of a schedule graph must follow another. The declaration order is the
 * order in which kinds are listed in edge labels.
 */
public enum DependencyKind {
    /** reads or overwrites a cell a nonblocking capture has not written yet */
    AWAIT_CAPTURE("await capture"),
    /** overwrites a cell that an earlier instruction still reads */
    AWAIT_READ("await read"),
    /** reads or overwrites a cell after an earlier write */
    AWAIT_WRITE("await write"),
    /** both use the same frame */
    FRAME("frame"),
    /** structural: classical program order, or links to start/end */
    ORDERING("ordering"),
    ;

    private final String label;

    DependencyKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
