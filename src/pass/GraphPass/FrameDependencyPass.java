package pass.GraphPass;

import graph.BasicBlock;
import graph.ScheduleGraph;
import pass.BuildContext;
import pass.GraphPassType;
import pass.Pass;
import util.logging.LogManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.List;

public class FrameDependencyPass implements Pass.GraphPass {
    private static final Logger log = LogManager.getLogger(FrameDependencyPass.class);

    @Override
    public GraphPassType getType() {
        return GraphPassType.FrameDependency;
    }

    @Override
    public void run(BuildContext context) {
        FrameResolver frames = new FrameResolver(FrameResolver.knownFrames(context.getProgram()));
        log.debug("known frames: {}", frames.getKnownFrames());

        List<ScheduleGraph.Builder> dependencies = new ArrayList<>();
        for (BasicBlock block : context.getBlocks()) {
            dependencies.add(FrameDependencyResolver.resolve(block, frames));
        }
        context.setDependencies(dependencies);
    }
}
