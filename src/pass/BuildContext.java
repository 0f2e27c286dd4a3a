package pass;

import graph.BasicBlock;
import graph.ProgramGraph;
import graph.ScheduleGraph;
import ir.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one graph build produces along the pipeline. Each pass reads what earlier
 * passes stored and adds its own result; a context belongs to a single build.
 */
public class BuildContext {
    private final Program program;

    private List<BasicBlock> blocks;
    private Map<String, Integer> labelIndex;
    private List<ScheduleGraph.Builder> dependencies;
    private List<ScheduleGraph> scheduleGraphs;
    private ProgramGraph programGraph;

    public BuildContext(Program program) {
        this.program = program;
    }

    public Program getProgram() {
        return program;
    }

    public List<BasicBlock> getBlocks() {
        return require(blocks, "basic blocks");
    }

    public void setBlocks(List<BasicBlock> blocks, Map<String, Integer> labelIndex) {
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.labelIndex = Collections.unmodifiableMap(new LinkedHashMap<>(labelIndex));
    }

    /**
     * @return label name to block index
     */
    public Map<String, Integer> getLabelIndex() {
        return require(labelIndex, "label index");
    }

    public List<ScheduleGraph.Builder> getDependencies() {
        return require(dependencies, "block dependencies");
    }

    public void setDependencies(List<ScheduleGraph.Builder> dependencies) {
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
    }

    public List<ScheduleGraph> getScheduleGraphs() {
        return require(scheduleGraphs, "schedule graphs");
    }

    public void setScheduleGraphs(List<ScheduleGraph> scheduleGraphs) {
        this.scheduleGraphs = Collections.unmodifiableList(new ArrayList<>(scheduleGraphs));
    }

    public ProgramGraph getProgramGraph() {
        return require(programGraph, "program graph");
    }

    public boolean hasProgramGraph() {
        return programGraph != null;
    }

    public void setProgramGraph(ProgramGraph programGraph) {
        this.programGraph = programGraph;
    }

    private static <T> T require(T value, String what) {
        if (value == null) {
            throw new IllegalStateException(what + " not computed yet: check the pass order");
        }
        return value;
    }
}
