package pass.GraphPass;

import graph.BasicBlock;
import graph.BlockTerminator;
import graph.DependencyKind;
import graph.ScheduleGraph;
import ir.instructions.CaptureInst;
import ir.instructions.ClassicalInst;
import ir.instructions.FenceInst;
import ir.instructions.Instruction;
import ir.instructions.RawCaptureInst;
import ir.operand.FrameIdentifier;
import ir.operand.MemoryReference;
import pass.GraphPass.MemoryAccessQueue.AccessType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resource and data hazards of one block, found in a single pass over its
 * instructions. Only the edges a hazard requires are added: two instructions on
 * disjoint frames with no memory in common stay unordered.
 *
 * <p>A resolver holds the state of one block and is discarded afterwards.
 */
public class FrameDependencyResolver {
    private final FrameResolver frames;
    private final ScheduleGraph.Builder graph;

    /* frame -> 最近一次使用它的节点 */
    private final Map<FrameIdentifier, Integer> lastToucher = new TreeMap<>();
    /* frame -> nodes using it since its last FENCE */
    private final Map<FrameIdentifier, List<Integer>> touchers = new TreeMap<>();
    private final Map<MemoryReference, MemoryAccessQueue> memory = new TreeMap<>();
    private int lastClassical;

    private FrameDependencyResolver(FrameResolver frames, ScheduleGraph.Builder graph) {
        this.frames = frames;
        this.graph = graph;
        this.lastClassical = graph.startId();
    }

    /**
     * Dependency edges of {@code block}, not yet linked to start and end where nothing
     * else orders a node.
     */
    public static ScheduleGraph.Builder resolve(BasicBlock block, FrameResolver frames) {
        FrameDependencyResolver resolver = new FrameDependencyResolver(frames,
                ScheduleGraph.builder(block.getName(), block.getInstructions()));
        List<Instruction> instructions = block.getInstructions();
        for (int i = 0; i < instructions.size(); i++) {
            resolver.add(ScheduleGraph.Builder.idOfInstruction(i), instructions.get(i));
        }
        resolver.finish(block.getTerminator());
        return resolver.graph;
    }

    private void add(int node, Instruction inst) {
        boolean fence = inst instanceof FenceInst;
        for (FrameIdentifier frame : frames.framesOf(inst)) {
            graph.addEdge(lastToucher.getOrDefault(frame, graph.startId()), node, DependencyKind.FRAME);
            lastToucher.put(frame, node);
            List<Integer> users = touchers.computeIfAbsent(frame, f -> new ArrayList<>());
            if (fence) {
                // 栅栏要等该帧上所有之前的指令, 不只是最后一个
                for (int user : users) {
                    graph.addEdge(user, node, DependencyKind.FRAME);
                }
                users.clear();
            }
            users.add(node);
        }

        if (inst instanceof CaptureInst capture) {
            access(capture.getTarget(), node, capture.isBlocking() ? AccessType.WRITE : AccessType.CAPTURE);
        } else if (inst instanceof RawCaptureInst capture) {
            access(capture.getTarget(), node, capture.isBlocking() ? AccessType.WRITE : AccessType.CAPTURE);
        } else if (inst instanceof ClassicalInst classical) {
            for (MemoryReference ref : classical.reads()) {
                access(ref, node, AccessType.READ);
            }
            for (MemoryReference ref : classical.writes()) {
                access(ref, node, AccessType.WRITE);
            }
            graph.addEdge(lastClassical, node, DependencyKind.ORDERING);
            lastClassical = node;
        }
    }

    private void finish(BlockTerminator terminator) {
        int end = graph.endId();
        for (int node : lastToucher.values()) {
            graph.addEdge(node, end, DependencyKind.FRAME);
        }
        graph.addEdge(lastClassical, end, DependencyKind.ORDERING);
        if (terminator.getCondition() != null) {
            access(terminator.getCondition(), end, AccessType.READ);
        }
        // 块结束前所有异步 capture 必须落地
        for (MemoryAccessQueue queue : memory.values()) {
            Integer capture = queue.getPendingCapture();
            if (capture != null) {
                graph.addEdge(capture, end, DependencyKind.AWAIT_CAPTURE);
            }
        }
    }

    private void access(MemoryReference ref, int node, AccessType type) {
        memory.computeIfAbsent(ref, r -> new MemoryAccessQueue()).access(node, type, graph);
    }
}
