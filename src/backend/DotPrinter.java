package backend;

import graph.BasicBlock;
import graph.ControlEdge;
import graph.DependencyEdge;
import graph.ProgramGraph;
import graph.ScheduleGraph;
import graph.ScheduleNode;
import util.logging.LogManager;
import util.logging.Logger;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Graphviz rendering of a {@link ProgramGraph}: one cluster per block holding its
 * schedule graph, control edges between the clusters' end and start nodes. The text
 * depends only on the graph, so equal graphs print identically.
 */
public class DotPrinter {
    private static final Logger logger = LogManager.getLogger(DotPrinter.class);
    private static final String INDENT = "    ";
    // 单例实例
    private static DotPrinter instance;

    private DotPrinter() {
    }

    public static DotPrinter getInstance() {
        if (instance == null) {
            instance = new DotPrinter();
        }
        return instance;
    }

    public String printToString(ProgramGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph {\n");
        sb.append(INDENT).append("entry [label=\"Entry Point\"];\n");
        BasicBlock entry = graph.getEntryBlock();
        if (entry != null) {
            sb.append(INDENT).append("entry -> ").append(nodeId(entry, ScheduleNode.START)).append(";\n");
        }

        boolean hasExit = false;
        for (BasicBlock block : graph.getBlocks()) {
            printCluster(sb, block, graph.getScheduleGraph(block));
            for (ControlEdge edge : graph.getOutgoingEdges(block)) {
                String target = edge.isExit()
                        ? "exit"
                        : nodeId(graph.getBlock(edge.getTarget()), ScheduleNode.START);
                hasExit |= edge.isExit();
                sb.append(INDENT).append(nodeId(block, ScheduleNode.END)).append(" -> ").append(target)
                        .append(" [label=").append(quote(edge.getPredicate().toString())).append("];\n");
            }
        }
        // 只有存在隐式退出边时才画 exit 节点
        if (hasExit) {
            sb.append(INDENT).append("exit [label=\"Exit Point\"];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private void printCluster(StringBuilder sb, BasicBlock block, ScheduleGraph schedule) {
        String inner = INDENT + INDENT;
        sb.append(INDENT).append("subgraph ").append(quote("cluster_" + blockId(block))).append(" {\n");
        sb.append(inner).append("label=").append(quote(block.getName())).append(";\n");
        sb.append(inner).append("node [style=\"filled\"];\n");

        List<DependencyEdge> edges = schedule.getEdges();
        for (ScheduleNode node : schedule.getNodes()) {
            sb.append(inner).append(nodeId(block, node)).append(" [");
            if (node.isInstruction()) {
                String text = "[" + node.getInstructionIndex() + "] " + schedule.getInstruction(node).toQuil();
                sb.append("shape=rectangle, label=").append(quote(text));
            } else {
                sb.append("shape=circle, label=").append(quote(node.toString()));
            }
            sb.append("];\n");
            for (DependencyEdge edge : edges) {
                if (edge.getSource().equals(node)) {
                    sb.append(inner).append(nodeId(block, node)).append(" -> ")
                            .append(nodeId(block, edge.getTarget()))
                            .append(" [label=").append(quote(edge.getLabel())).append("];\n");
                }
            }
        }
        sb.append(INDENT).append("}\n");
    }

    // ids come from the block position: a label may spell another block's synthetic name
    private static String blockId(BasicBlock block) {
        return "b" + block.getIndex();
    }

    private static String nodeId(BasicBlock block, ScheduleNode node) {
        String suffix = node.isInstruction() ? String.valueOf(node.getInstructionIndex()) : node.toString();
        return quote(blockId(block) + "_" + suffix);
    }

    /**
     * DOT string literal; newlines become the {@code \n} escape.
     */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * @throws IOException if the file cannot be opened or the write fails
     */
    public void printToFile(ProgramGraph graph, String filename) throws IOException {
        try (PrintStream out = new PrintStream(new FileOutputStream(filename), false, StandardCharsets.UTF_8)) {
            out.print(printToString(graph));
            if (out.checkError()) {
                throw new IOException("failed to write graph to " + filename);
            }
        }
        logger.info("graph written to {}", filename);
    }
}
