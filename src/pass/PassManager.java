package pass;

import driver.Config;
import graph.ProgramGraph;
import ir.Program;
import pass.Pass.GraphPass;
import util.logging.LogManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the graph construction pipeline. One manager per build: the pipeline keeps no
 * state between builds, so independent programs may be built concurrently.
 */
public class PassManager {
    private static final Logger log = LogManager.getLogger(PassManager.class);

    private final List<GraphPass> pipeline = new ArrayList<>();

    public PassManager() {
        this(Config.getInstance().isVerify());
    }

    public PassManager(boolean verify) {
        for (GraphPassType type : GraphPassType.values()) {
            // 可选 pass 只在校验开启时加入
            if (!type.isOptional() || verify) {
                addPass(type);
            }
        }
    }

    public List<GraphPass> getPipeline() {
        return Collections.unmodifiableList(pipeline);
    }

    /**
     * Build the program graph of {@code program}. The first failing pass aborts the build.
     */
    public ProgramGraph build(Program program) {
        BuildContext context = new BuildContext(program);
        runPasses(context);
        return context.getProgramGraph();
    }

    public void runPasses(BuildContext context) {
        log.debug("building graph of {} ({} instructions)", context.getProgram().getName(),
                context.getProgram().size());
        for (GraphPass p : pipeline) {
            long begin = System.nanoTime();
            p.run(context);
            log.debug("[Graph] {} done in {} us", p.getType().getName(), (System.nanoTime() - begin) / 1000);
        }
    }

    /**
     * 追加一个 pass
     */
    private void addPass(GraphPassType type) {
        pipeline.add(type.create());
    }
}
