package pass.GraphPass;

import graph.DependencyKind;
import graph.ScheduleGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Outstanding accesses to one memory cell within a block: the last write, a
 * nonblocking capture whose value has not landed yet, and the reads issued since.
 */
class MemoryAccessQueue {
    enum AccessType {
        READ,
        WRITE,
        /* nonblocking capture: the cell is written after the frame is released */
        CAPTURE,
    }

    private Integer pendingWrite;
    private Integer pendingCapture;
    private final List<Integer> pendingReads = new ArrayList<>();

    /**
     * Record an access by {@code node}, adding the await edges it must respect.
     */
    void access(int node, AccessType type, ScheduleGraph.Builder graph) {
        if (type == AccessType.READ) {
            awaitOn(pendingWrite, node, DependencyKind.AWAIT_WRITE, graph);
            awaitOn(pendingCapture, node, DependencyKind.AWAIT_CAPTURE, graph);
            pendingReads.add(node);
            return;
        }
        awaitOn(pendingWrite, node, DependencyKind.AWAIT_WRITE, graph);
        awaitOn(pendingCapture, node, DependencyKind.AWAIT_CAPTURE, graph);
        for (int read : pendingReads) {
            awaitOn(read, node, DependencyKind.AWAIT_READ, graph);
        }
        pendingReads.clear();
        if (type == AccessType.CAPTURE) {
            pendingWrite = null;
            pendingCapture = node;
        } else {
            pendingWrite = node;
            pendingCapture = null;
        }
    }

    /**
     * @return the nonblocking capture still owing its value, or null
     */
    Integer getPendingCapture() {
        return pendingCapture;
    }

    private static void awaitOn(Integer from, int to, DependencyKind kind, ScheduleGraph.Builder graph) {
        // ADD ro ro 这类指令先读后写同一单元, 不连自环
        if (from != null && from != to) {
            graph.addEdge(from, to, kind);
        }
    }
}
