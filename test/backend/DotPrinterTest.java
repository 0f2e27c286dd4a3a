package backend;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import graph.ProgramGraph;
import ir.Program;
import ir.instructions.JumpWhenInst;
import ir.instructions.LabelInst;
import ir.operand.MemoryReference;
import frontend.QuilFrontend;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Test;

public class DotPrinterTest {

  static String resource(String name) throws IOException {
    try (InputStream in = DotPrinterTest.class.getResourceAsStream("/" + name)) {
      assertNotNull("missing test resource " + name, in);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @Test
  public void testMeasureFeedbackSnapshot() throws Exception {
    Program program = QuilFrontend.parse(resource("measure_feedback.quil"), "measure_feedback.quil");
    String dot = DotPrinter.getInstance().printToString(ProgramGraph.build(program));
    assertEquals(resource("measure_feedback.dot"), dot);
  }

  @Test
  public void testExitNodeOnlyWhenUsed() {
    ProgramGraph loop = ProgramGraph.build(Program.of(List.of(
        new LabelInst("loop"),
        new JumpWhenInst("loop", MemoryReference.of("ro", 0)))));
    String dot = DotPrinter.getInstance().printToString(loop);
    assertThat(dot, containsString("\"b0_end\" -> exit [label=\"if ro[0] == 0\"];"));
    assertThat(dot, containsString("\"b0_end\" -> \"b0_start\" [label=\"if ro[0] != 0\"];"));
    assertThat(dot, containsString("exit [label=\"Exit Point\"];"));

    ProgramGraph halting = ProgramGraph.build(Program.of(List.of(new LabelInst("only"))));
    assertThat(DotPrinter.getInstance().printToString(halting), not(containsString("Exit Point")));
  }

  @Test
  public void testLabelSpellingASyntheticNameKeepsBlocksApart() throws Exception {
    Program program = QuilFrontend.parse(
        "PULSE 0 \"rf\" w\nHALT\nLABEL @block_0\nPULSE 1 \"rf\" w\n", "clash.quil");
    ProgramGraph graph = ProgramGraph.build(program);
    assertEquals("block_0", graph.getBlocks().get(0).getName());
    assertEquals("block_0", graph.getBlocks().get(1).getName());

    String dot = DotPrinter.getInstance().printToString(graph);
    assertThat(dot, containsString("subgraph \"cluster_b0\""));
    assertThat(dot, containsString("subgraph \"cluster_b1\""));
    assertThat(dot, containsString("\"b0_0\" [shape=rectangle, label=\"[0] PULSE 0 \\\"rf\\\" w\"];"));
    assertThat(dot, containsString("\"b1_0\" [shape=rectangle, label=\"[0] PULSE 1 \\\"rf\\\" w\"];"));
    assertEquals(dot.indexOf("subgraph \"cluster_b0\""), dot.lastIndexOf("subgraph \"cluster_b0\""));
  }

  @Test
  public void testUnwritableTargetFails() {
    ProgramGraph graph = ProgramGraph.build(Program.of(List.of(new LabelInst("only"))));
    String directory = System.getProperty("java.io.tmpdir");
    try {
      DotPrinter.getInstance().printToFile(graph, directory);
      fail("a directory is not a writable file");
    } catch (IOException expected) {
      // FileOutputStream refuses directories
    }
  }

  @Test
  public void testEmptyProgramHasOnlyTheEntry() {
    String dot = DotPrinter.getInstance().printToString(ProgramGraph.build(Program.of(List.of())));
    assertEquals("digraph {\n    entry [label=\"Entry Point\"];\n}\n", dot);
  }

  @Test
  public void testQuoteEscapes() {
    assertEquals("\"a\\\"b\\\\c\\nd\"", DotPrinter.quote("a\"b\\c\nd"));
  }
}
