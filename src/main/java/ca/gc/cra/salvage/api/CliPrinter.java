package ca.gc.cra.salvage.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text, dry-run plans and run summaries.
 *
 * <p>Writes to the stdout file descriptor directly so operator-facing text stays separate from log output.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
