package graph;

import ir.Program;
import pass.PassManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Whole-program graph: the basic blocks in program order, each with its
 * {@link ScheduleGraph} and predicate-labelled outgoing control edges, plus a
 * synthetic entry leading to the first block. Control edges may form cycles.
 *
 * <p>Built once from a complete program and read-only afterwards.
 */
public final class ProgramGraph {
    private final List<BasicBlock> blocks;
    private final List<ScheduleGraph> scheduleGraphs;
    private final List<List<ControlEdge>> outgoing;

    public ProgramGraph(List<BasicBlock> blocks, List<ScheduleGraph> scheduleGraphs,
            List<List<ControlEdge>> outgoing) {
        if (blocks.size() != scheduleGraphs.size() || blocks.size() != outgoing.size()) {
            throw new IllegalArgumentException("blocks, schedule graphs and control edges are not aligned");
        }
        this.blocks = List.copyOf(blocks);
        this.scheduleGraphs = List.copyOf(scheduleGraphs);
        List<List<ControlEdge>> edges = new ArrayList<>(outgoing.size());
        for (List<ControlEdge> out : outgoing) {
            edges.add(List.copyOf(out));
        }
        this.outgoing = Collections.unmodifiableList(edges);
    }

    /**
     * Build the graph of {@code program} with a fresh pass pipeline.
     *
     * @throws exception.ProgramGraphException on the first problem found; nothing is
     *                                         returned in that case
     */
    public static ProgramGraph build(Program program) {
        return new PassManager().build(program);
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public int getBlockCount() {
        return blocks.size();
    }

    public BasicBlock getBlock(int index) {
        return blocks.get(index);
    }

    /**
     * @return the block opened by {@code label}, or null
     */
    public BasicBlock getBlock(String label) {
        for (BasicBlock block : blocks) {
            if (block.getLabel() != null && block.getLabel().getName().equals(label)) {
                return block;
            }
        }
        return null;
    }

    /**
     * @return the block the entry point leads to, or null for an empty program
     */
    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public ScheduleGraph getScheduleGraph(BasicBlock block) {
        return scheduleGraphs.get(checked(block));
    }

    public List<ControlEdge> getOutgoingEdges(BasicBlock block) {
        return outgoing.get(checked(block));
    }

    /**
     * Blocks from which control can leave the program.
     */
    public List<BasicBlock> getExitBlocks() {
        List<BasicBlock> exits = new ArrayList<>();
        for (BasicBlock block : blocks) {
            List<ControlEdge> out = outgoing.get(block.getIndex());
            if (out.isEmpty() || out.stream().anyMatch(ControlEdge::isExit)) {
                exits.add(block);
            }
        }
        return exits;
    }

    private int checked(BasicBlock block) {
        int index = block.getIndex();
        if (index < 0 || index >= blocks.size() || !blocks.get(index).equals(block)) {
            throw new IllegalArgumentException("block " + block.getName() + " is not part of this graph");
        }
        return index;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ProgramGraph)) return false;
        ProgramGraph that = (ProgramGraph) obj;
        return blocks.equals(that.blocks) && scheduleGraphs.equals(that.scheduleGraphs)
                && outgoing.equals(that.outgoing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blocks, scheduleGraphs, outgoing);
    }

    @Override
    public String toString() {
        return "ProgramGraph(" + blocks.size() + " blocks)";
    }
}
