package ca.gc.cra.salvage.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.salvage.fixtures.ImageFixtures;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RepairCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private Path in;
  private Path out;

  @BeforeEach
  void setUp() throws IOException {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    in = tempDir.resolve("evidence");
    write(in.resolve("photorec/f0001.jpg"), ImageFixtures.jpeg());
    write(in.resolve("photorec/f0002.jpg"), ImageFixtures.jpegWithoutFooter());
    write(in.resolve("foremost/00000003.png"), ImageFixtures.pngWithoutFooter());
    out = tempDir.resolve("case");
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void repairsFromRecordedPaths() throws IOException {
    Path validation = out.resolve("validation_report.json");
    assertEquals(ExitCode.SUCCESS, ValidateCli.run(new String[] {"in=" + in, "out=" + out, "decodeCheck=false"}));
    assertEquals(ExitCode.SUCCESS, DecideCli.run(new String[] {"report=" + validation, "out=" + out}));
    byte[] original = Files.readAllBytes(in.resolve("photorec/f0002.jpg"));

    ExitCode code = RepairCli.run(new String[] {
        "report=" + validation, "decision=" + out.resolve("decision_report.json"), "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Successful       : 2"), buffer.toString());
    Path repaired = out.resolve("repaired/photorec_f0002.jpg.footer_append.jpg");
    assertTrue(ImageFixtures.endsWithJpegFooter(Files.readAllBytes(repaired)));
    assertTrue(Files.exists(out.resolve("repaired/foremost_00000003.png.footer_append.png")));
    assertTrue(Files.exists(out.resolve("repair_report.json")));
    assertEquals(original.length, Files.size(in.resolve("photorec/f0002.jpg")));
  }

  @Test
  void requiresDecisionReport() {
    ExitCode code = RepairCli.run(new String[] {"report=" + tempDir.resolve("v.json"), "out=" + out});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: repair"));
  }

  @Test
  void overrideIsNotAcceptedByRepair() throws IOException {
    Path report = Files.writeString(tempDir.resolve("v.json"), "{}");
    Path decision = Files.writeString(tempDir.resolve("d.json"), "{}");

    ExitCode code = RepairCli.run(new String[] {
        "report=" + report, "decision=" + decision, "out=" + out, "override.strategy=skip_repair"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void malformedReportIsAnIoError() throws IOException {
    Path report = Files.writeString(tempDir.resolve("v.json"), "{\"report\":\"validation\"}");
    Path decision = Files.writeString(tempDir.resolve("d.json"), "{}");

    ExitCode code = RepairCli.run(new String[] {"report=" + report, "decision=" + decision, "out=" + out});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void dryRunDescribesRecordedPathSource() throws IOException {
    Path report = Files.writeString(tempDir.resolve("v.json"), "{}");
    Path decision = Files.writeString(tempDir.resolve("d.json"), "{}");

    ExitCode code = RepairCli.run(new String[] {
        "report=" + report, "decision=" + decision, "out=" + out, "headerSearchWindow=4096", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String printed = buffer.toString();
    assertTrue(printed.contains("Evidence         : paths recorded in the validation report"), printed);
    assertTrue(printed.contains("Header window    : 4096 bytes"));
    assertTrue(Files.notExists(out));
  }

  private static void write(Path file, byte[] data) throws IOException {
    Files.createDirectories(file.getParent());
    Files.write(file, data);
  }
}
