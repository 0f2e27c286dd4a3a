package graph;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import backend.DotPrinter;
import exception.ProgramGraphException;
import ir.Program;
import ir.instructions.*;
import ir.operand.FrameIdentifier;
import ir.operand.MemoryReference;
import ir.operand.WaveformInvocation;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Test;

public class ProgramGraphTest {

  private static final MemoryReference RO = MemoryReference.of("ro", 0);

  private static WaveformInvocation waveform() {
    return new WaveformInvocation("test", Map.of("duration", "1000000.0"));
  }

  /* measure, then pulse "rf" and measure again for as long as ro[0] reads non-zero */
  static Program measureFeedback() {
    return Program.builder("measure_feedback")
        .add(new LabelInst("measure"))
        .add(new PulseInst(FrameIdentifier.of(0, "ro_tx"), waveform(), false))
        .add(new CaptureInst(FrameIdentifier.of(0, "ro_rx"), waveform(), RO, false))
        .add(new JumpUnlessInst("end", RO))
        .add(new LabelInst("feedback"))
        .add(new PulseInst(FrameIdentifier.of(0, "rf"), waveform(), true))
        .add(new JumpInst("measure"))
        .add(new LabelInst("end"))
        .build();
  }

  @Test
  public void testMeasureFeedbackBlocks() {
    ProgramGraph graph = ProgramGraph.build(measureFeedback());
    assertEquals(3, graph.getBlockCount());
    assertThat(graph.getBlock(0).getName(), is("measure"));
    assertThat(graph.getBlock(1).getName(), is("feedback"));
    assertThat(graph.getBlock(2).getName(), is("end"));
    assertThat(graph.getEntryBlock(), is(graph.getBlock("measure")));
    assertThat(graph.getBlock("nowhere"), is(nullValue()));
    assertThat(graph.getExitBlocks(), is(List.of(graph.getBlock("end"))));
  }

  @Test
  public void testMeasureFeedbackControlEdges() {
    ProgramGraph graph = ProgramGraph.build(measureFeedback());
    BasicBlock measure = graph.getBlock("measure");
    List<ControlEdge> out = graph.getOutgoingEdges(measure);
    assertEquals(2, out.size());
    assertThat(out, hasItem(new ControlEdge(0, BranchPredicate.ifNonZero(RO), 1)));
    assertThat(out, hasItem(new ControlEdge(0, BranchPredicate.ifZero(RO), 2)));

    assertThat(graph.getOutgoingEdges(graph.getBlock("feedback")),
        is(List.of(new ControlEdge(1, BranchPredicate.ALWAYS, 0))));
    assertTrue(graph.getOutgoingEdges(graph.getBlock("end")).isEmpty());
  }

  @Test
  public void testMeasureFeedbackScheduleGraph() {
    ProgramGraph graph = ProgramGraph.build(measureFeedback());
    ScheduleGraph measure = graph.getScheduleGraph(graph.getBlock("measure"));
    ScheduleNode pulse = ScheduleNode.instruction(0);
    ScheduleNode capture = ScheduleNode.instruction(1);

    assertTrue(measure.getDependencies(capture, measure.getEnd()).contains(DependencyKind.AWAIT_CAPTURE));
    assertTrue(measure.getDependencies(capture, measure.getEnd()).contains(DependencyKind.FRAME));
    assertThat(measure.getDependencies(pulse, measure.getEnd()), is(Set.of(DependencyKind.FRAME)));
    // separate frames: the readout pulse and the capture may overlap
    assertFalse(measure.hasPath(pulse, capture));
    assertFalse(measure.hasPath(capture, pulse));
  }

  @Test
  public void testEverySchedulePassesThroughStartAndEnd() {
    ProgramGraph graph = ProgramGraph.build(measureFeedback());
    for (BasicBlock block : graph.getBlocks()) {
      ScheduleGraph schedule = graph.getScheduleGraph(block);
      for (ScheduleNode node : schedule.getNodes()) {
        assertThat(schedule.getPredecessors(node).isEmpty(), is(node.isStart()));
        assertThat(schedule.getSuccessors(node).isEmpty(), is(node.isEnd()));
        if (node.isInstruction()) {
          assertTrue(schedule.hasPath(schedule.getStart(), node));
          assertTrue(schedule.hasPath(node, schedule.getEnd()));
        }
      }
    }
  }

  @Test
  public void testBuildIsDeterministic() {
    ProgramGraph first = ProgramGraph.build(measureFeedback());
    ProgramGraph second = ProgramGraph.build(measureFeedback());
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    DotPrinter printer = DotPrinter.getInstance();
    assertEquals(printer.printToString(first), printer.printToString(second));
  }

  @Test
  public void testUndefinedLabelBuildsNothing() {
    Program program = Program.of(List.of(
        new LabelInst("measure"),
        new JumpInst("missing")));
    ProgramGraphException e = assertThrows(ProgramGraphException.class, () -> ProgramGraph.build(program));
    assertThat(e.getKind(), is(ProgramGraphException.Kind.UNDEFINED_LABEL));
  }

  @Test
  public void testEmptyProgram() {
    ProgramGraph graph = ProgramGraph.build(Program.of(List.of()));
    assertEquals(0, graph.getBlockCount());
    assertThat(graph.getEntryBlock(), is(nullValue()));
  }

  @Test
  public void testForeignBlockIsRejected() {
    ProgramGraph graph = ProgramGraph.build(measureFeedback());
    BasicBlock foreign = new BasicBlock(0, null, List.of(), BlockTerminator.fallthrough());
    assertThrows(IllegalArgumentException.class, () -> graph.getScheduleGraph(foreign));
  }
}
