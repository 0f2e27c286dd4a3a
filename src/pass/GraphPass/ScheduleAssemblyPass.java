package pass.GraphPass;

import graph.DependencyKind;
import graph.ScheduleGraph;
import pass.BuildContext;
import pass.GraphPassType;
import pass.Pass;
import util.logging.LogManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Close every block's dependency edges into a single-entry, single-exit DAG: nodes
 * nothing waits on are linked to {@code end}, nodes waiting on nothing hang off
 * {@code start}. Freezing a graph checks it for cycles.
 */
public class ScheduleAssemblyPass implements Pass.GraphPass {
    private static final Logger log = LogManager.getLogger(ScheduleAssemblyPass.class);

    @Override
    public GraphPassType getType() {
        return GraphPassType.ScheduleAssembly;
    }

    @Override
    public void run(BuildContext context) {
        List<ScheduleGraph> graphs = new ArrayList<>();
        for (ScheduleGraph.Builder builder : context.getDependencies()) {
            ScheduleGraph graph = assemble(builder);
            log.debug("block {}: {}", graph.getBlockName(), graph);
            graphs.add(graph);
        }
        context.setScheduleGraphs(graphs);
    }

    public static ScheduleGraph assemble(ScheduleGraph.Builder builder) {
        int start = builder.startId();
        int end = builder.endId();
        for (int id = start + 1; id < end; id++) {
            if (!builder.hasIncoming(id)) {
                builder.addEdge(start, id, DependencyKind.ORDERING);
            }
            if (!builder.hasOutgoing(id)) {
                builder.addEdge(id, end, DependencyKind.ORDERING);
            }
        }
        if (!builder.hasOutgoing(start)) {
            builder.addEdge(start, end, DependencyKind.ORDERING);
        }
        return builder.build();
    }
}
