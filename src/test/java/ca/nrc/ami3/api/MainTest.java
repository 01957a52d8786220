package ca.nrc.ami3.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.nrc.ami3.testutil.ExposureFixtures;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void missingCommandReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: ami3"));
  }

  @Test
  void unknownCommandReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"calibrate", "in=x"}));
  }

  @Test
  void helpAfterCommandIsForwarded() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"run", "--help"}));
    assertTrue(buffer.toString().contains("--allow-overwrite"));
  }

  @Test
  void dispatchesInspectWithForwardedArguments() throws IOException {
    Path table = ExposureFixtures.writeAssociation(tempDir, "a3001", null, "sci1_calints.json", "science");

    ExitCode code = Main.run(new String[] {"in=" + table, "INSPECT"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Association a3001"));
  }
}
