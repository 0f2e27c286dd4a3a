package pass.GraphPass;

import graph.BasicBlock;
import graph.BranchPredicate;
import graph.ControlEdge;
import graph.ProgramGraph;
import graph.ScheduleGraph;
import graph.ScheduleNode;
import pass.BuildContext;
import pass.GraphPassType;
import pass.Pass;

import java.util.List;

/**
 * Re-check a finished program graph:
 * - every schedule graph has start as its only source and end as its only sink
 * - every node lies on a start -> end path
 * - the topological order runs from start to end
 * - control edges leave their own block and reach a block or the exit
 * - a conditional block has two complementary edges, any other block at most one
 */
public class VerifyGraphPass implements Pass.GraphPass {
    @Override
    public GraphPassType getType() {
        return GraphPassType.VerifyGraph;
    }

    @Override
    public void run(BuildContext context) {
        ProgramGraph graph = context.getProgramGraph();
        for (BasicBlock block : graph.getBlocks()) {
            verifySchedule(block, graph.getScheduleGraph(block));
            verifyControl(block, graph.getOutgoingEdges(block), graph.getBlockCount());
        }
    }

    private void verifySchedule(BasicBlock block, ScheduleGraph graph) {
        if (graph.getInstructions().size() != block.getInstructions().size()) {
            fail("Schedule graph does not cover the block", block, graph.getInstructions().size());
        }
        ScheduleNode start = graph.getStart();
        ScheduleNode end = graph.getEnd();
        for (ScheduleNode node : graph.getNodes()) {
            boolean source = graph.getPredecessors(node).isEmpty();
            boolean sink = graph.getSuccessors(node).isEmpty();
            if (source != node.isStart()) {
                fail(source ? "Node without predecessor" : "Start has a predecessor", block, node);
            }
            if (sink != node.isEnd()) {
                fail(sink ? "Node without successor" : "End has a successor", block, node);
            }
            if (node.isInstruction() && (!graph.hasPath(start, node) || !graph.hasPath(node, end))) {
                fail("Node is not on a start -> end path", block, node);
            }
        }
        List<ScheduleNode> order = graph.topologicalOrder();
        if (order.size() != graph.getNodeCount() || !order.get(0).isStart()
                || !order.get(order.size() - 1).isEnd()) {
            fail("Topological order does not run from start to end", block, order);
        }
    }

    private void verifyControl(BasicBlock block, List<ControlEdge> edges, int blockCount) {
        for (ControlEdge edge : edges) {
            if (edge.getSource() != block.getIndex()) {
                fail("Control edge leaves another block", block, edge);
            }
            if (edge.getTarget() >= blockCount) {
                fail("Control edge targets a missing block", block, edge);
            }
        }
        if (block.getTerminator().isConditional()) {
            if (edges.size() != 2) {
                fail("Conditional block needs two control edges", block, edges);
            }
            BranchPredicate first = edges.get(0).getPredicate();
            BranchPredicate second = edges.get(1).getPredicate();
            if (!first.isComplementOf(second)) {
                fail("Branch predicates are not exclusive and exhaustive", block, edges);
            }
        } else if (edges.size() > 1 || edges.stream().anyMatch(e -> !e.getPredicate().isAlways())) {
            fail("Unconditional block needs at most one 'always' edge", block, edges);
        }
    }

    private void fail(String msg, BasicBlock block, Object extra) {
        StringBuilder sb = new StringBuilder();
        sb.append("[GraphVerifier] ").append(msg).append('\n');
        sb.append("  BasicBlock: ").append(block.getName()).append('\n');
        if (extra != null)
            sb.append("  Extra: ").append(extra).append('\n');
        throw new IllegalStateException(sb.toString());
    }
}
