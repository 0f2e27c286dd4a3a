package frontend;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import exception.ProgramGraphException;
import ir.Opcode;
import ir.Program;
import ir.instructions.*;
import ir.operand.FrameIdentifier;
import ir.operand.Imm;
import ir.operand.MemoryReference;
import ir.operand.Qubit;
import java.util.List;
import org.junit.Test;

public class QuilFrontendTest {

  private static Program parse(String source) throws QuilParseException {
    return QuilFrontend.parse(source, "test.quil");
  }

  @Test
  public void testInstructionKinds() throws Exception {
    Program program = parse(String.join("\n",
        "LABEL @start",
        "NONBLOCKING PULSE 0 \"rf\" flat(duration: 1e-6, iq: 1)",
        "CAPTURE 0 \"ro_rx\" boxcar ro[1]",
        "NONBLOCKING RAW-CAPTURE 0 \"ro_rx\" 2e-6 raw",
        "DELAY 0 1 \"cz\" 1.0",
        "FENCE",
        "SET-PHASE 0 \"rf\" pi",
        "SWAP-PHASES 0 \"rf\" 1 \"rf\"",
        "MOVE out[0] ro[1]",
        "JUMP-WHEN @start ro",
        "HALT"));
    List<Instruction> insts = program.getInstructions();
    assertEquals(11, insts.size());
    assertThat(program.getName(), is("test"));

    PulseInst pulse = (PulseInst) insts.get(1);
    assertFalse(pulse.isBlocking());
    assertThat(pulse.getFrame(), is(FrameIdentifier.of(0, "rf")));
    assertThat(pulse.getWaveform().toQuil(), is("flat(duration: 1.0E-6, iq: 1.0)"));

    CaptureInst capture = (CaptureInst) insts.get(2);
    assertTrue(capture.isBlocking());
    assertThat(capture.getTarget(), is(MemoryReference.of("ro", 1)));

    RawCaptureInst raw = (RawCaptureInst) insts.get(3);
    assertThat(raw.getTarget(), is(MemoryReference.of("raw", 0)));
    assertThat(raw.getDuration(), is("2.0E-6"));

    DelayInst delay = (DelayInst) insts.get(4);
    assertThat(delay.getQubits(), is(List.of(Qubit.of(0), Qubit.of(1))));
    assertThat(delay.getFrameNames(), is(List.of("cz")));

    assertTrue(((FenceInst) insts.get(5)).isFenceAll());
    assertThat(insts.get(6).opCode(), is(Opcode.SET_PHASE));
    assertThat(insts.get(7).toQuil(), is("SWAP-PHASES 0 \"rf\" 1 \"rf\""));
    assertThat(((ClassicalInst) insts.get(8)).reads(), hasItem(MemoryReference.of("ro", 1)));

    JumpWhenInst branch = (JumpWhenInst) insts.get(9);
    assertThat(branch.getTarget().getName(), is("start"));
    assertThat(branch.getCondition(), is(MemoryReference.of("ro", 0)));
    assertThat(insts.get(10), is(instanceOf(HaltInst.class)));
  }

  @Test
  public void testDeclaredFramesAndAttributes() throws Exception {
    Program program = parse(String.join("\n",
        "DEFFRAME 0 \"rf\":",
        "    SAMPLE-RATE: 1000000000.0",
        "    INITIAL-FREQUENCY: 4.5e9",
        "DEFFRAME 0 1 \"cz\"",
        "DELAY 0 1 1e-7"));
    assertThat(program.getDeclaredFrames(), hasItem(FrameIdentifier.of(0, "rf")));
    assertEquals(2, program.getDeclaredFrames().size());
    assertEquals(1, program.size());
  }

  @Test
  public void testExpressionsAreNormalisedNotEvaluated() throws Exception {
    Program program = parse(String.join("\n",
        "SET-PHASE 0 \"rf\" -pi/2",
        "SHIFT-FREQUENCY 0 \"rf\" 2*(1+3)",
        "DELAY 0 \"rf\" 1000000"));
    assertThat(((FrameUpdateInst) program.getInstructions().get(0)).getValue(), is("-pi / 2.0"));
    assertThat(((FrameUpdateInst) program.getInstructions().get(1)).getValue(), is("2.0 * (1.0 + 3.0)"));
    assertThat(((DelayInst) program.getInstructions().get(2)).getDuration(), is("1000000.0"));
  }

  @Test
  public void testSeparatorsAndComments() throws Exception {
    Program program = parse("# header\n\nPULSE 0 \"a\" w; PULSE 1 \"b\" w # trailing\n\n");
    assertEquals(2, program.size());
  }

  @Test
  public void testClassicalOperands() throws Exception {
    Program program = parse("ADD ro[2] -3\nLT flag ro[2] 1.5\nNOT flag");
    ClassicalInst add = (ClassicalInst) program.getInstructions().get(0);
    assertThat(add.getOperands().get(1), is(Imm.of(-3)));
    ClassicalInst lt = (ClassicalInst) program.getInstructions().get(1);
    assertThat(lt.toQuil(), is("LT flag[0] ro[2] 1.5"));
    assertThat(program.getInstructions().get(2).opCode(), is(Opcode.NOT));
  }

  @Test
  public void testSyntaxErrorsReportLine() {
    QuilParseException e = assertThrows(QuilParseException.class,
        () -> parse("HALT\nPULSE 0 \"rf\"\n"));
    assertFalse(e.getErrors().isEmpty());
    assertThat(e.getErrors().get(0).getLineNumber(), is(2));
    assertThat(e.getMessage(), containsString("test.quil"));
  }

  @Test
  public void testUnknownCharacter() {
    QuilParseException e = assertThrows(QuilParseException.class, () -> parse("HALT $"));
    assertThat(e.getErrors().get(0).getLineNumber(), is(1));
  }

  @Test
  public void testInvalidOperandIsAParseError() {
    QuilParseException e = assertThrows(QuilParseException.class,
        () -> parse("HALT\nEXCHANGE ro[0] 1"));
    assertThat(e.getErrors().get(0).getLineNumber(), is(2));
    assertThat(e.getErrors().get(0).getColumn(), is(0));
  }

  @Test
  public void testMalformedFrame() {
    ProgramGraphException e = assertThrows(ProgramGraphException.class,
        () -> parse("PULSE 0 0 \"rf\" w"));
    assertThat(e.getKind(), is(ProgramGraphException.Kind.MALFORMED_FRAME_REFERENCE));
  }
}
