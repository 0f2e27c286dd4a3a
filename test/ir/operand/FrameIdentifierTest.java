package ir.operand;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

import exception.ProgramGraphException;
import java.util.List;
import java.util.Set;
import org.junit.Test;

public class FrameIdentifierTest {

  @Test
  public void testRendersQubitsThenQuotedName() {
    FrameIdentifier frame = FrameIdentifier.of(List.of(Qubit.of(0), Qubit.of(1)), "cz");
    assertThat(frame.toQuil(), is("0 1 \"cz\""));
  }

  @Test
  public void testRejectsEmptyQubitList() {
    ProgramGraphException e = assertThrows(ProgramGraphException.class,
        () -> FrameIdentifier.of(List.of(), "rf"));
    assertThat(e.getKind(), is(ProgramGraphException.Kind.MALFORMED_FRAME_REFERENCE));
  }

  @Test
  public void testRejectsRepeatedQubit() {
    ProgramGraphException e = assertThrows(ProgramGraphException.class,
        () -> FrameIdentifier.of(List.of(Qubit.of(2), Qubit.of(2)), "cz"));
    assertThat(e.getKind(), is(ProgramGraphException.Kind.MALFORMED_FRAME_REFERENCE));
  }

  @Test
  public void testRejectsBlankName() {
    ProgramGraphException e = assertThrows(ProgramGraphException.class,
        () -> FrameIdentifier.of(0, " "));
    assertThat(e.getKind(), is(ProgramGraphException.Kind.MALFORMED_FRAME_REFERENCE));
  }

  @Test
  public void testOrdersByQubitsThenName() {
    FrameIdentifier rf0 = FrameIdentifier.of(0, "rf");
    FrameIdentifier ro0 = FrameIdentifier.of(0, "ro_rx");
    FrameIdentifier rf1 = FrameIdentifier.of(1, "rf");
    FrameIdentifier cz01 = FrameIdentifier.of(List.of(Qubit.of(0), Qubit.of(1)), "cz");
    assertTrue(rf0.compareTo(ro0) < 0);
    assertTrue(ro0.compareTo(cz01) < 0);
    assertTrue(cz01.compareTo(rf1) < 0);
    assertEquals(0, rf0.compareTo(FrameIdentifier.of(0, "rf")));
  }

  @Test
  public void testQubitQueries() {
    FrameIdentifier cz = FrameIdentifier.of(List.of(Qubit.of(1), Qubit.of(0)), "cz");
    assertTrue(cz.usesAnyOf(List.of(Qubit.of(0))));
    assertFalse(cz.usesAnyOf(List.of(Qubit.of(2))));
    assertTrue(cz.hasQubitSet(Set.of(Qubit.of(0), Qubit.of(1))));
    assertFalse(cz.hasQubitSet(Set.of(Qubit.of(0))));
  }

  @Test
  public void testEqualityUsesQubitsAndName() {
    assertEquals(FrameIdentifier.of(3, "rf"), FrameIdentifier.of(3, "rf"));
    assertNotEquals(FrameIdentifier.of(3, "rf"), FrameIdentifier.of(4, "rf"));
    assertNotEquals(FrameIdentifier.of(3, "rf"), FrameIdentifier.of(3, "ro_rx"));
  }
}
