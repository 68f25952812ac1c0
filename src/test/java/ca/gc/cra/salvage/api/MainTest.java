package ca.gc.cra.salvage.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
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
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: salvage <validate|decide|repair|run>"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String printed = buffer.toString();
    for (String command : new String[] {"validate", "decide", "repair", "run"}) {
      assertTrue(printed.contains(command), command);
    }
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"carve", "in=/tmp"}));
  }

  @Test
  void dispatchesToCommandWithLeadingFlags() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help", "DECIDE"}));
    assertTrue(buffer.toString().contains("salvage decide"));
  }

  @Test
  void helpWordIsACommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }
}
