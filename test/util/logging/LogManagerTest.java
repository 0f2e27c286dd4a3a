package util.logging;

import static org.junit.Assert.*;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class LogManagerTest {

  private LogLevel saved;

  @Before
  public void saveRootLevel() {
    LogManager.init();
    saved = LogManager.getRootLevel();
  }

  @After
  public void restoreRootLevel() {
    LogManager.setRootLevel(saved);
    LogManager.disableConsole();
  }

  @Test
  public void testRootLevelIsFollowed() {
    Logger logger = LogManager.getLogger(LogManagerTest.class);
    LogManager.setRootLevel(LogLevel.ERROR);
    assertFalse(logger.isDebugEnabled());
    assertTrue(logger.isEnabled(LogLevel.ERROR));

    LogManager.setRootLevel(LogLevel.TRACE);
    assertTrue(logger.isTraceEnabled());
  }

  @Test
  public void testPinnedLevelIgnoresRoot() {
    Logger pinned = LogManager.getLogger(LogManagerTest.class, LogLevel.DEBUG);
    LogManager.setRootLevel(LogLevel.ERROR);
    assertTrue(pinned.isDebugEnabled());
    assertFalse(pinned.isTraceEnabled());
  }

  @Test
  public void testSameNameGivesSameLogger() {
    assertSame(LogManager.getLogger(LogManagerTest.class), LogManager.getLogger(LogManagerTest.class));
    assertNotSame(LogManager.getLogger(LogManagerTest.class),
        LogManager.getLogger(LogManagerTest.class, LogLevel.INFO));
  }

  @Test
  public void testConsoleToggleDoesNotThrow() {
    LogManager.enableConsole();
    LogManager.setRootLevel(LogLevel.OFF);
    LogManager.getLogger(LogManagerTest.class).error("suppressed {}", 1);
  }
}
