package ca.gc.cra.salvage.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.salvage.application.report.ArtifactEntry;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.NotAttemptedEntry;
import ca.gc.cra.salvage.application.report.RepairEntry;
import ca.gc.cra.salvage.application.report.RepairReport;
import ca.gc.cra.salvage.application.report.SkippedEntry;
import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.ClassifierSettings;
import ca.gc.cra.salvage.domain.classify.CorruptionClassifier;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import ca.gc.cra.salvage.domain.decision.DecisionEngine;
import ca.gc.cra.salvage.domain.decision.DecisionThresholds;
import ca.gc.cra.salvage.domain.decision.ManualOverride;
import ca.gc.cra.salvage.domain.decision.Strategy;
import ca.gc.cra.salvage.domain.decision.SuccessRateTable;
import ca.gc.cra.salvage.domain.repair.RepairEngine;
import ca.gc.cra.salvage.domain.repair.RepairOutcome;
import ca.gc.cra.salvage.domain.repair.RepairSettings;
import ca.gc.cra.salvage.domain.validation.ValidationOracle;
import ca.gc.cra.salvage.fixtures.ImageFixtures;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonReportRoundTripTest {
  private static final long GENERATED_AT = 1_700_000_000_123L;

  @TempDir Path tempDir;

  private final ValidationOracle oracle = ValidationOracle.builtIn();
  private final CorruptionClassifier classifier = new CorruptionClassifier(ClassifierSettings.defaults());

  @Test
  void validationReportSurvivesWriteAndRead() throws IOException {
    ClassificationReport report = sampleReport();

    Path written = new JsonReportWriter(tempDir, false).writeValidation(report);
    ClassificationReport read = new JsonReportReader().readValidation(written);

    assertEquals(tempDir.resolve(JsonReportWriter.VALIDATION_REPORT), written);
    assertEquals(report, read);
  }

  @Test
  void validationReportCarriesSummaryAndBreakdowns() throws IOException {
    Path written = new JsonReportWriter(tempDir, false).writeValidation(sampleReport());

    Map<?, ?> root = (Map<?, ?>) new JsonSupport().parse(written);

    assertEquals(1, ((Number) root.get("schemaVersion")).intValue());
    assertEquals("validation", root.get("report"));
    assertEquals("2023-11-14T22:13:20.123Z", root.get("generatedAt"));
    assertEquals(Map.of("missing_footer", 1, "false_positive", 1), root.get("corruptionTypes"));
    assertTrue(((Map<?, ?>) root.get("bySource")).containsKey("photorec"));
    assertEquals(3, ((List<?>) root.get("artifacts")).size());
    Map<?, ?> first = (Map<?, ?>) ((List<?>) root.get("artifacts")).get(0);
    assertEquals(ImageArtifact.of("x", ImageFixtures.jpeg(), "x", "m").sha256(), first.get("sha256"));
  }

  @Test
  void entriesWithoutDigestReadAsEmpty() throws IOException {
    Path report = tempDir.resolve("old.json");
    Files.writeString(report, "{\"report\":\"validation\",\"generatedAt\":\"2024-01-01T00:00:00Z\","
        + "\"artifacts\":[{\"id\":\"p/a.jpg\",\"sourcePath\":\"/e/p/a.jpg\",\"recoveryMethod\":\"p\","
        + "\"format\":\"jpeg\",\"size\":10,\"classification\":\"valid\",\"corruptionType\":\"none\","
        + "\"repairabilityTier\":0,\"confidence\":\"high\",\"checksRun\":[\"size\"],\"failedChecks\":[]}],"
        + "\"skipped\":[]}");

    ClassificationReport read = new JsonReportReader().readValidation(report);

    assertEquals("", read.artifacts().get(0).sha256());
    assertEquals(10, read.artifacts().get(0).size());
  }

  @Test
  void decisionReportSurvivesWriteAndReadWithOverride() throws IOException {
    BatchDecision decision = new DecisionEngine(SuccessRateTable.defaults(), DecisionThresholds.defaults())
        .decide(sampleReport().statistics())
        .withOverride(new ManualOverride(Strategy.SKIP_REPAIR, "court deadline", "lead examiner",
            Instant.ofEpochMilli(GENERATED_AT)));

    Path written = new JsonReportWriter(tempDir, false).writeDecision(decision, GENERATED_AT);
    BatchDecision read = new JsonReportReader().readDecision(written);

    assertEquals(decision, read);
    assertEquals(Strategy.SKIP_REPAIR, read.effectiveStrategy());
  }

  @Test
  void repairReportListsOutcomesAndRates() throws IOException {
    ClassificationReport classification = sampleReport();
    ArtifactEntry damaged = classification.find("photorec/b.jpg").orElseThrow();
    ImageArtifact artifact = ImageArtifact.of(damaged.id(), ImageFixtures.jpegWithoutFooter(), damaged.sourcePath(),
        damaged.recoveryMethod());
    RepairOutcome outcome = new RepairEngine(oracle, classifier, (data, format) -> Optional.empty(),
        RepairSettings.defaults()).repair(artifact, damaged.record());
    RepairReport report = new RepairReport(GENERATED_AT, Strategy.PERFORM_REPAIR,
        List.of(new RepairEntry(outcome, Optional.of("/out/repaired/b.footer_append.jpg"))),
        List.of(new NotAttemptedEntry("foremost/c.jpg", "false_positive", "unrecoverable")),
        classification.statistics());

    Path written = new JsonReportWriter(tempDir, false).writeRepair(report);
    Map<?, ?> root = (Map<?, ?>) new JsonSupport().parse(written);

    assertEquals("repair", root.get("report"));
    assertEquals("perform_repair", root.get("effectiveStrategy"));
    Map<?, ?> summary = (Map<?, ?>) root.get("summary");
    assertEquals(1, ((Number) summary.get("attempted")).intValue());
    assertEquals(1, ((Number) summary.get("successful")).intValue());
    assertEquals(100.0, ((Number) ((Map<?, ?>) summary.get("successRateByType")).get("missing_footer"))
        .doubleValue());
    List<?> notAttempted = (List<?>) root.get("notAttempted");
    assertEquals("unrecoverable", ((Map<?, ?>) notAttempted.get(0)).get("reason"));
  }

  @Test
  void existingReportIsNotReplacedWithoutOverwrite() throws IOException {
    ClassificationReport report = sampleReport();
    new JsonReportWriter(tempDir, false).writeValidation(report);

    assertThrows(FileAlreadyExistsException.class, () -> new JsonReportWriter(tempDir, false).writeValidation(report));
    new JsonReportWriter(tempDir, true).writeValidation(report);
  }

  @Test
  void readerRejectsWrongKindAndMissingFields() throws IOException {
    Path decision = tempDir.resolve("decision.json");
    Files.writeString(decision, "{\"report\":\"decision\",\"generatedAt\":\"2024-01-01T00:00:00Z\"}");
    IOException wrongKind = assertThrows(IOException.class, () -> new JsonReportReader().readValidation(decision));
    assertTrue(wrongKind.getMessage().contains("expected validation"));

    Path partial = tempDir.resolve("partial.json");
    Files.writeString(partial, "{\"report\":\"validation\",\"generatedAt\":\"2024-01-01T00:00:00Z\"}");
    IOException missing = assertThrows(IOException.class, () -> new JsonReportReader().readValidation(partial));
    assertTrue(missing.getMessage().contains("missing field artifacts"));

    Path garbage = tempDir.resolve("garbage.json");
    Files.writeString(garbage, "{not json");
    assertThrows(IOException.class, () -> new JsonReportReader().readValidation(garbage));
  }

  private ClassificationReport sampleReport() {
    return new ClassificationReport(GENERATED_AT, List.of(
        entry("photorec/a.jpg", ImageFixtures.jpeg()),
        entry("photorec/b.jpg", ImageFixtures.jpegWithoutFooter()),
        entry("foremost/c.jpg", ImageFixtures.jpegFalsePositive())),
        List.of(new SkippedEntry("photorec/locked.jpg", "/evidence/photorec/locked.jpg", "unreadable: denied")));
  }

  private ArtifactEntry entry(String id, byte[] data) {
    String method = id.substring(0, id.indexOf('/'));
    ImageArtifact artifact = ImageArtifact.of(id, data, "/evidence/" + id, method);
    CorruptionRecord record = classifier.classify(artifact, oracle.validate(artifact));
    return new ArtifactEntry(
        id, artifact.sourcePath(), method, artifact.format(), artifact.size(), artifact.sha256(), record);
  }
}
