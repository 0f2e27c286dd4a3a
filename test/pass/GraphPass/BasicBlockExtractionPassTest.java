package pass.GraphPass;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.*;

import exception.ProgramGraphException;
import graph.BasicBlock;
import graph.BlockTerminator;
import ir.instructions.*;
import ir.operand.FrameIdentifier;
import ir.operand.MemoryReference;
import ir.operand.WaveformInvocation;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import pass.GraphPass.BasicBlockExtractionPass.Extraction;

public class BasicBlockExtractionPassTest {

  private static final MemoryReference RO = MemoryReference.of("ro", 0);

  private static Instruction pulse(String frame) {
    return new PulseInst(FrameIdentifier.of(0, frame), WaveformInvocation.named("w"), true);
  }

  @Test
  public void testBlockBoundaries() {
    Extraction ex = BasicBlockExtractionPass.extract(List.of(
        pulse("a"),
        new LabelInst("loop"),
        pulse("b"),
        new JumpInst("loop"),
        pulse("c"),
        new HaltInst()));

    List<BasicBlock> blocks = ex.blocks();
    assertEquals(3, blocks.size());

    assertThat(blocks.get(0).getName(), is("block_0"));
    assertThat(blocks.get(0).getLabel(), is(nullValue()));
    assertThat(blocks.get(0).getInstructions(), is(List.of(pulse("a"))));
    assertThat(blocks.get(0).getTerminator(), is(BlockTerminator.fallthrough()));

    assertThat(blocks.get(1).getName(), is("loop"));
    assertThat(blocks.get(1).getInstructions(), is(List.of(pulse("b"))));
    assertThat(blocks.get(1).getTerminator().getKind(), is(BlockTerminator.Kind.JUMP));

    assertThat(blocks.get(2).getName(), is("block_2"));
    assertThat(blocks.get(2).getTerminator().getKind(), is(BlockTerminator.Kind.HALT));

    assertThat(ex.labelIndex(), is(Map.of("loop", 1)));
  }

  @Test
  public void testEmptyLabelledBlocksAreKept() {
    Extraction ex = BasicBlockExtractionPass.extract(List.of(
        new LabelInst("first"),
        new LabelInst("second")));
    assertEquals(2, ex.blocks().size());
    assertTrue(ex.blocks().get(0).isEmpty());
    assertThat(ex.blocks().get(0).getTerminator(), is(BlockTerminator.fallthrough()));
    assertThat(ex.blocks().get(1).getName(), is("second"));
    assertThat(ex.labelIndex().get("second"), is(1));
  }

  @Test
  public void testEveryTerminatorClosesItsBlock() {
    Extraction ex = BasicBlockExtractionPass.extract(List.of(
        new LabelInst("top"),
        new JumpWhenInst("top", RO),
        new JumpUnlessInst("top", RO),
        new JumpInst("top")));
    assertEquals(3, ex.blocks().size());
    BlockTerminator when = ex.blocks().get(0).getTerminator();
    assertTrue(when.isConditional());
    assertTrue(when.jumpsIfSet());
    assertThat(when.getCondition(), is(RO));
    assertFalse(ex.blocks().get(1).getTerminator().jumpsIfSet());
    assertThat(ex.blocks().get(2).getName(), is("block_2"));
  }

  @Test
  public void testForwardJumpIsResolved() {
    Extraction ex = BasicBlockExtractionPass.extract(List.of(
        new JumpInst("later"),
        pulse("a"),
        new LabelInst("later")));
    assertEquals(3, ex.blocks().size());
    assertThat(ex.labelIndex().get("later"), is(2));
  }

  @Test
  public void testEmptyProgramHasNoBlocks() {
    Extraction ex = BasicBlockExtractionPass.extract(List.of());
    assertTrue(ex.blocks().isEmpty());
    assertTrue(ex.labelIndex().isEmpty());
  }

  @Test
  public void testDuplicateLabel() {
    ProgramGraphException e = assertThrows(ProgramGraphException.class,
        () -> BasicBlockExtractionPass.extract(List.of(
            new LabelInst("x"), pulse("a"), new LabelInst("x"))));
    assertThat(e.getKind(), is(ProgramGraphException.Kind.DUPLICATE_LABEL));
  }

  @Test
  public void testUndefinedLabel() {
    ProgramGraphException e = assertThrows(ProgramGraphException.class,
        () -> BasicBlockExtractionPass.extract(List.of(
            new LabelInst("x"), new JumpWhenInst("nowhere", RO))));
    assertThat(e.getKind(), is(ProgramGraphException.Kind.UNDEFINED_LABEL));
    assertThat(e.getMessage(), is("Undefined label: @nowhere"));
    assertFalse(e.isInternal());
  }

  @Test
  public void testNonControlInstructionIsNotATerminator() {
    try {
      BlockTerminator.of(pulse("a"));
      fail("a pulse cannot end a block");
    } catch (ProgramGraphException e) {
      assertThat(e.getKind(), is(ProgramGraphException.Kind.UNSUPPORTED_TERMINATOR));
      assertFalse(e.isInternal());
    }
  }
}
