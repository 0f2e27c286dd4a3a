package pass.GraphPass;

import exception.ProgramGraphException;
import graph.BasicBlock;
import graph.BlockTerminator;
import graph.BranchPredicate;
import graph.ControlEdge;
import graph.ProgramGraph;
import pass.BuildContext;
import pass.GraphPassType;
import pass.Pass;
import util.logging.LogManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Connect the blocks by their terminators and assemble the {@link ProgramGraph}.
 */
public class ControlFlowPass implements Pass.GraphPass {
    private static final Logger log = LogManager.getLogger(ControlFlowPass.class);

    @Override
    public GraphPassType getType() {
        return GraphPassType.ControlFlow;
    }

    @Override
    public void run(BuildContext context) {
        List<BasicBlock> blocks = context.getBlocks();
        List<List<ControlEdge>> outgoing = new ArrayList<>(blocks.size());
        for (BasicBlock block : blocks) {
            List<ControlEdge> edges = edgesOf(block, blocks.size(), context.getLabelIndex());
            log.trace("{} -> {}", block.getName(), edges);
            outgoing.add(edges);
        }
        context.setProgramGraph(new ProgramGraph(blocks, context.getScheduleGraphs(), outgoing));
    }

    /**
     * Outgoing edges of one block. A conditional jump yields the taken edge first, then
     * the fallthrough under the complementary predicate.
     */
    public static List<ControlEdge> edgesOf(BasicBlock block, int blockCount, Map<String, Integer> labelIndex) {
        BlockTerminator terminator = block.getTerminator();
        int source = block.getIndex();
        int next = source + 1 < blockCount ? source + 1 : ControlEdge.EXIT;
        List<ControlEdge> edges = new ArrayList<>(2);
        switch (terminator.getKind()) {
            case CONTINUE -> {
                // 最后一个块顺序执行到程序末尾, 隐式退出
                if (next != ControlEdge.EXIT) {
                    edges.add(new ControlEdge(source, BranchPredicate.ALWAYS, next));
                }
            }
            case JUMP -> edges.add(new ControlEdge(source, BranchPredicate.ALWAYS, targetOf(terminator, labelIndex)));
            case CONDITIONAL -> {
                BranchPredicate taken = terminator.jumpsIfSet()
                        ? BranchPredicate.ifNonZero(terminator.getCondition())
                        : BranchPredicate.ifZero(terminator.getCondition());
                edges.add(new ControlEdge(source, taken, targetOf(terminator, labelIndex)));
                edges.add(new ControlEdge(source, taken.negate(), next));
            }
            case HALT -> {
            }
        }
        return edges;
    }

    private static int targetOf(BlockTerminator terminator, Map<String, Integer> labelIndex) {
        Integer target = labelIndex.get(terminator.getTarget().getName());
        if (target == null) {
            throw ProgramGraphException.undefinedLabel(terminator.getTarget().getName());
        }
        return target;
    }
}
