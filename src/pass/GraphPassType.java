package pass;

import java.util.function.Supplier;

import pass.GraphPass.BasicBlockExtractionPass;
import pass.GraphPass.ControlFlowPass;
import pass.GraphPass.FrameDependencyPass;
import pass.GraphPass.ScheduleAssemblyPass;
import pass.GraphPass.VerifyGraphPass;
import pass.Pass.GraphPass;

/**
 * GraphPassFactory: create the GraphPass here
 */
public enum GraphPassType implements PassType<GraphPass> {
    BlockExtraction(BasicBlockExtractionPass::new, false),
    FrameDependency(FrameDependencyPass::new, false),
    ScheduleAssembly(ScheduleAssemblyPass::new, false),
    ControlFlow(ControlFlowPass::new, false),
    VerifyGraph(VerifyGraphPass::new, true),
    ;

    private final Supplier<GraphPass> supplier;
    private final boolean optional;

    GraphPassType(Supplier<GraphPass> constructor, boolean optional) {
        this.supplier = constructor;
        this.optional = optional;
    }

    @Override
    public Supplier<GraphPass> constructor() {
        return supplier;
    }

    @Override
    public boolean isOptional() {
        return optional;
    }
}
