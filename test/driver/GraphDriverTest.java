package driver;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import exception.UsageException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class GraphDriverTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final GraphDriver driver = GraphDriver.getInstance();

  private File copyResource(String name) throws IOException {
    File file = tmp.newFile(name);
    try (InputStream in = getClass().getResourceAsStream("/" + name)) {
      Files.copy(in, file.toPath(), StandardCopyOption.REPLACE_EXISTING);
    }
    return file;
  }

  @Test
  public void testParseArgs() {
    driver.parseArgs(new String[] {"prog.quil", "-o", "prog.dot", "--no-verify"});
    assertThat(driver.getSource(), is("prog.quil"));
    assertThat(driver.getTarget(), is("prog.dot"));
    assertFalse(driver.isVerify());

    driver.parseArgs(new String[] {"other.quil"});
    assertThat(driver.getSource(), is("other.quil"));
    assertThat(driver.getTarget(), is(nullValue()));
    assertThat(driver.isVerify(), is(Config.getInstance().isVerify()));
  }

  @Test
  public void testUsageErrors() {
    assertThrows(UsageException.class, () -> driver.parseArgs(new String[0]));
    assertThrows(UsageException.class, () -> driver.parseArgs(null));
    assertThrows(UsageException.class, () -> driver.parseArgs(new String[] {"prog.txt"}));
    assertThrows(UsageException.class, () -> driver.parseArgs(new String[] {"a.quil", "b.quil"}));
    assertThrows(UsageException.class, () -> driver.parseArgs(new String[] {"-o", "out.dot"}));
    UsageException e = assertThrows(UsageException.class,
        () -> driver.parseArgs(new String[] {"a.quil", "-o"}));
    assertThat(e.getMessage(), containsString("-o"));
  }

  @Test
  public void testRunWritesGraph() throws Exception {
    File input = copyResource("measure_feedback.quil");
    File output = new File(tmp.getRoot(), "measure_feedback.dot");
    driver.parseArgs(new String[] {input.getPath(), "-o", output.getPath()});
    driver.run();

    String expected;
    try (InputStream in = getClass().getResourceAsStream("/measure_feedback.dot")) {
      expected = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    assertEquals(expected, Files.readString(output.toPath()));
  }
}
