package graph;

import exception.ProgramGraphException;
import ir.instructions.Instruction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Dependency DAG of one basic block. Nodes are the block's instructions plus a
 * {@code start} and an {@code end} sentinel; an edge means its target may not begin
 * before its source completes, a missing path means the two may run concurrently.
 *
 * <p>Nodes live in an arena indexed 0 (start), 1..n (instructions), n+1 (end); the
 * adjacency maps reference those indices only. The graph is immutable.
 */
public final class ScheduleGraph {
    private final String blockName;
    private final List<Instruction> instructions;
    private final List<Map<Integer, Set<DependencyKind>>> successors;
    private final List<Set<Integer>> predecessors;
    private final List<ScheduleNode> topologicalOrder;

    private ScheduleGraph(String blockName, List<Instruction> instructions,
            List<Map<Integer, Set<DependencyKind>>> successors, List<Set<Integer>> predecessors,
            List<ScheduleNode> topologicalOrder) {
        this.blockName = blockName;
        this.instructions = instructions;
        this.successors = successors;
        this.predecessors = predecessors;
        this.topologicalOrder = topologicalOrder;
    }

    public String getBlockName() {
        return blockName;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public int getNodeCount() {
        return instructions.size() + 2;
    }

    public ScheduleNode getStart() {
        return ScheduleNode.START;
    }

    public ScheduleNode getEnd() {
        return ScheduleNode.END;
    }

    /**
     * All nodes: start, the instructions in block order, end.
     */
    public List<ScheduleNode> getNodes() {
        List<ScheduleNode> nodes = new ArrayList<>(getNodeCount());
        for (int id = 0; id < getNodeCount(); id++) {
            nodes.add(nodeOf(id));
        }
        return nodes;
    }

    /**
     * @throws IllegalArgumentException for {@code start}, {@code end} or a node outside the block
     */
    public Instruction getInstruction(ScheduleNode node) {
        if (!node.isInstruction()) {
            throw new IllegalArgumentException(node + " of block " + blockName + " is not an instruction");
        }
        return instructions.get(idOf(node) - 1);
    }

    public List<ScheduleNode> getSuccessors(ScheduleNode node) {
        return toNodes(successors.get(idOf(node)).keySet());
    }

    public List<ScheduleNode> getPredecessors(ScheduleNode node) {
        return toNodes(predecessors.get(idOf(node)));
    }

    /**
     * @return the kinds on the edge {@code from -> to}; empty if there is no such edge
     */
    public Set<DependencyKind> getDependencies(ScheduleNode from, ScheduleNode to) {
        Set<DependencyKind> kinds = successors.get(idOf(from)).get(idOf(to));
        return kinds == null ? Collections.emptySet() : kinds;
    }

    public boolean hasEdge(ScheduleNode from, ScheduleNode to) {
        return successors.get(idOf(from)).containsKey(idOf(to));
    }

    /**
     * Every edge, ordered by source then target.
     */
    public List<DependencyEdge> getEdges() {
        List<DependencyEdge> edges = new ArrayList<>();
        for (int from = 0; from < getNodeCount(); from++) {
            for (Map.Entry<Integer, Set<DependencyKind>> e : successors.get(from).entrySet()) {
                edges.add(new DependencyEdge(nodeOf(from), nodeOf(e.getKey()), e.getValue()));
            }
        }
        return edges;
    }

    public int getEdgeCount() {
        int count = 0;
        for (Map<Integer, Set<DependencyKind>> out : successors) {
            count += out.size();
        }
        return count;
    }

    /**
     * Topological order, breaking ties by block position. Always starts with
     * {@code start} and finishes with {@code end}.
     */
    public List<ScheduleNode> topologicalOrder() {
        return topologicalOrder;
    }

    /**
     * Nodes not yet completed whose predecessors are all in {@code completed}: what a
     * scheduler may issue next.
     */
    public List<ScheduleNode> readySet(Collection<ScheduleNode> completed) {
        Set<Integer> done = new HashSet<>();
        for (ScheduleNode node : completed) {
            done.add(idOf(node));
        }
        List<ScheduleNode> ready = new ArrayList<>();
        for (int id = 0; id < getNodeCount(); id++) {
            if (!done.contains(id) && done.containsAll(predecessors.get(id))) {
                ready.add(nodeOf(id));
            }
        }
        return ready;
    }

    /**
     * @return true if a directed path of at least one edge leads from {@code from} to {@code to}
     */
    public boolean hasPath(ScheduleNode from, ScheduleNode to) {
        int target = idOf(to);
        BitSet seen = new BitSet(getNodeCount());
        ArrayDeque<Integer> work = new ArrayDeque<>(successors.get(idOf(from)).keySet());
        while (!work.isEmpty()) {
            int id = work.poll();
            if (id == target) {
                return true;
            }
            if (!seen.get(id)) {
                seen.set(id);
                work.addAll(successors.get(id).keySet());
            }
        }
        return false;
    }

    private int idOf(ScheduleNode node) {
        return switch (node.getKind()) {
            case START -> 0;
            case END -> instructions.size() + 1;
            default -> {
                int index = node.getInstructionIndex();
                if (index >= instructions.size()) {
                    throw new IllegalArgumentException("block " + blockName + " has no instruction " + index);
                }
                yield index + 1;
            }
        };
    }

    private ScheduleNode nodeOf(int id) {
        return nodeOf(id, instructions.size());
    }

    private static ScheduleNode nodeOf(int id, int instructionCount) {
        if (id == 0) {
            return ScheduleNode.START;
        }
        if (id == instructionCount + 1) {
            return ScheduleNode.END;
        }
        return ScheduleNode.instruction(id - 1);
    }

    private List<ScheduleNode> toNodes(Collection<Integer> ids) {
        List<ScheduleNode> nodes = new ArrayList<>(ids.size());
        for (int id : ids) {
            nodes.add(nodeOf(id));
        }
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScheduleGraph)) return false;
        ScheduleGraph that = (ScheduleGraph) obj;
        return blockName.equals(that.blockName)
                && instructions.equals(that.instructions)
                && successors.equals(that.successors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blockName, instructions, successors);
    }

    @Override
    public String toString() {
        return "ScheduleGraph(" + blockName + ", " + getNodeCount() + " nodes, " + getEdgeCount() + " edges)";
    }

    public static Builder builder(String blockName, List<Instruction> instructions) {
        return new Builder(blockName, instructions);
    }

    /**
     * Mutable adjacency under construction. Adding the same edge twice merges its kinds.
     */
    public static final class Builder {
        private final String blockName;
        private final List<Instruction> instructions;
        private final List<TreeMap<Integer, EnumSet<DependencyKind>>> successors = new ArrayList<>();
        private final List<BitSet> predecessors = new ArrayList<>();

        private Builder(String blockName, List<Instruction> instructions) {
            this.blockName = Objects.requireNonNull(blockName);
            this.instructions = List.copyOf(instructions);
            for (int id = 0; id < instructions.size() + 2; id++) {
                successors.add(new TreeMap<>());
                predecessors.add(new BitSet());
            }
        }

        public String getBlockName() {
            return blockName;
        }

        public List<Instruction> getInstructions() {
            return instructions;
        }

        public int startId() {
            return 0;
        }

        public int endId() {
            return instructions.size() + 1;
        }

        public static int idOfInstruction(int index) {
            return index + 1;
        }

        public Builder addEdge(int from, int to, DependencyKind kind) {
            checkId(from);
            checkId(to);
            successors.get(from).computeIfAbsent(to, k -> EnumSet.noneOf(DependencyKind.class)).add(kind);
            predecessors.get(to).set(from);
            return this;
        }

        public boolean hasIncoming(int id) {
            return !predecessors.get(id).isEmpty();
        }

        public boolean hasOutgoing(int id) {
            return !successors.get(id).isEmpty();
        }

        private void checkId(int id) {
            if (id < 0 || id > endId()) {
                throw new IllegalArgumentException("node " + id + " out of range in block " + blockName);
            }
        }

        /**
         * Freeze the graph.
         *
         * @throws ProgramGraphException CYCLIC_DEPENDENCY_DETECTED if the edges contain a cycle
         */
        public ScheduleGraph build() {
            int count = endId() + 1;
            int[] inDegree = new int[count];
            for (int id = 0; id < count; id++) {
                inDegree[id] = predecessors.get(id).cardinality();
            }
            // Kahn 拓扑排序, 同层按块内位置
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int id = 0; id < count; id++) {
                if (inDegree[id] == 0) {
                    ready.add(id);
                }
            }
            List<Integer> order = new ArrayList<>(count);
            while (!ready.isEmpty()) {
                int id = ready.poll();
                order.add(id);
                for (int succ : successors.get(id).keySet()) {
                    if (--inDegree[succ] == 0) {
                        ready.add(succ);
                    }
                }
            }
            if (order.size() != count) {
                throw ProgramGraphException.cyclicDependency(blockName);
            }

            List<Map<Integer, Set<DependencyKind>>> frozenSuccessors = new ArrayList<>(count);
            List<Set<Integer>> frozenPredecessors = new ArrayList<>(count);
            for (int id = 0; id < count; id++) {
                TreeMap<Integer, Set<DependencyKind>> out = new TreeMap<>();
                for (Map.Entry<Integer, EnumSet<DependencyKind>> e : successors.get(id).entrySet()) {
                    out.put(e.getKey(), Collections.unmodifiableSet(EnumSet.copyOf(e.getValue())));
                }
                frozenSuccessors.add(Collections.unmodifiableMap(out));
                Set<Integer> in = new TreeSet<>();
                predecessors.get(id).stream().forEach(in::add);
                frozenPredecessors.add(Collections.unmodifiableSet(in));
            }

            List<ScheduleNode> topo = new ArrayList<>(count);
            for (int id : order) {
                topo.add(nodeOf(id, instructions.size()));
            }
            return new ScheduleGraph(blockName, instructions,
                    Collections.unmodifiableList(frozenSuccessors),
                    Collections.unmodifiableList(frozenPredecessors),
                    Collections.unmodifiableList(topo));
        }
    }
}
