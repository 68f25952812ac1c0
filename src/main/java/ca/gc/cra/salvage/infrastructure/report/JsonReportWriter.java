package ca.gc.cra.salvage.infrastructure.report;

import ca.gc.cra.salvage.application.port.ReportWriterPort;
import ca.gc.cra.salvage.application.report.ArtifactEntry;
import ca.gc.cra.salvage.application.report.Breakdown;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.NotAttemptedEntry;
import ca.gc.cra.salvage.application.report.RepairEntry;
import ca.gc.cra.salvage.application.report.RepairReport;
import ca.gc.cra.salvage.application.report.SkippedEntry;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import ca.gc.cra.salvage.domain.decision.BatchStatistics;
import ca.gc.cra.salvage.domain.decision.ExpectedOutcome;
import ca.gc.cra.salvage.domain.decision.ManualOverride;
import ca.gc.cra.salvage.domain.repair.RepairAttempt;
import ca.gc.cra.salvage.domain.repair.RepairOutcome;
import ca.gc.cra.salvage.domain.validation.ValidationVerdict;
import ca.gc.cra.salvage.infrastructure.persistence.AtomicFiles;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes the three batch reports as pretty-printed JSON with the Jackson streaming generator.
 * <p><strong>Why:</strong> Reports are the hand-off between the {@code validate}, {@code decide} and {@code repair}
 * commands and the record examiners sign off on; field order and artifact order are fixed so reruns diff cleanly.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportWriter implements ReportWriterPort {
  public static final String VALIDATION_REPORT = "validation_report.json";
  public static final String DECISION_REPORT = "decision_report.json";
  public static final String REPAIR_REPORT = "repair_report.json";
  static final int SCHEMA_VERSION = 1;

  private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

  private final JsonFactory jsonFactory = new JsonFactory();
  private final Path directory;
  private final boolean allowOverwrite;

  /**
   * Creates a writer targeting {@code directory}.
   *
   * @param directory report output directory
   * @param allowOverwrite whether existing reports may be replaced
   */
  public JsonReportWriter(Path directory, boolean allowOverwrite) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.allowOverwrite = allowOverwrite;
  }

  @Override
  public Path writeValidation(ClassificationReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    ByteArrayOutputStream out = new ByteArrayOutputStream(8192);
    try (JsonGenerator gen = newGenerator(out)) {
      gen.writeStartObject();
      writeHeader(gen, "validation", report.generatedAtMillis());
      writeSummary(gen, report);
      writeCounts(gen, "corruptionTypes", report.corruptionTypes());
      writeBreakdowns(gen, "byFormat", report.byFormat());
      writeBreakdowns(gen, "bySource", report.bySource());
      gen.writeArrayFieldStart("artifacts");
      for (ArtifactEntry entry : report.artifacts()) {
        writeArtifact(gen, entry);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("skipped");
      for (SkippedEntry skipped : report.skipped()) {
        gen.writeStartObject();
        gen.writeStringField("id", skipped.id());
        gen.writeStringField("sourcePath", skipped.sourcePath());
        gen.writeStringField("reason", skipped.reason());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    return publish(VALIDATION_REPORT, out.toByteArray());
  }

  @Override
  public Path writeDecision(BatchDecision decision, long decidedAtMillis) throws IOException {
    Objects.requireNonNull(decision, "decision");
    ByteArrayOutputStream out = new ByteArrayOutputStream(2048);
    try (JsonGenerator gen = newGenerator(out)) {
      gen.writeStartObject();
      writeHeader(gen, "decision", decidedAtMillis);
      gen.writeStringField("strategy", decision.strategy().reportName());
      gen.writeStringField("effectiveStrategy", decision.effectiveStrategy().reportName());
      gen.writeStringField("confidence", decision.confidence().reportName());
      gen.writeNumberField("rule", decision.rule().number());
      gen.writeStringField("ruleLabel", decision.rule().label());
      gen.writeStringField("reasoning", decision.reasoning());
      gen.writeNumberField("estimate", decision.estimate());
      gen.writeNumberField("repairableCount", decision.repairableCount());
      writeStatistics(gen, "statistics", decision.statistics());
      ExpectedOutcome expected = decision.expectedOutcome();
      gen.writeObjectFieldStart("expectedOutcome");
      gen.writeNumberField("currentValid", expected.currentValid());
      gen.writeNumberField("expectedAdditional", expected.expectedAdditional());
      gen.writeNumberField("finalExpectedCount", expected.finalExpectedCount());
      gen.writeNumberField("finalExpectedPercent", expected.finalExpectedPercent());
      gen.writeNumberField("improvementPercentagePoints", expected.improvementPercentagePoints());
      gen.writeEndObject();
      Optional<ManualOverride> override = decision.manualOverride();
      if (override.isPresent()) {
        ManualOverride manual = override.get();
        gen.writeObjectFieldStart("manualOverride");
        gen.writeStringField("strategy", manual.strategy().reportName());
        gen.writeStringField("justification", manual.justification());
        gen.writeStringField("approver", manual.approver());
        gen.writeStringField("recordedAt", manual.recordedAt().toString());
        gen.writeEndObject();
      }
      gen.writeEndObject();
    }
    return publish(DECISION_REPORT, out.toByteArray());
  }

  @Override
  public Path writeRepair(RepairReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    ByteArrayOutputStream out = new ByteArrayOutputStream(8192);
    try (JsonGenerator gen = newGenerator(out)) {
      gen.writeStartObject();
      writeHeader(gen, "repair", report.generatedAtMillis());
      gen.writeStringField("effectiveStrategy", report.effectiveStrategy().reportName());
      gen.writeObjectFieldStart("summary");
      gen.writeNumberField("attempted", report.attempted());
      gen.writeNumberField("successful", report.successful());
      gen.writeNumberField("failed", report.failed());
      gen.writeObjectFieldStart("successRateByType");
      for (Map.Entry<String, Double> rate : report.successRateByType().entrySet()) {
        gen.writeNumberField(rate.getKey(), rate.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
      writeStatistics(gen, "finalStatistics", report.finalStatistics());
      gen.writeArrayFieldStart("artifacts");
      for (RepairEntry entry : report.entries()) {
        writeRepairEntry(gen, entry);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("notAttempted");
      for (NotAttemptedEntry skipped : report.notAttempted()) {
        gen.writeStartObject();
        gen.writeStringField("id", skipped.id());
        gen.writeStringField("corruptionType", skipped.corruptionType());
        gen.writeStringField("reason", skipped.reason());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    return publish(REPAIR_REPORT, out.toByteArray());
  }

  private JsonGenerator newGenerator(ByteArrayOutputStream out) throws IOException {
    return jsonFactory.createGenerator(out).useDefaultPrettyPrinter();
  }

  private Path publish(String name, byte[] bytes) throws IOException {
    Path target = directory.resolve(name);
    AtomicFiles.write(target, bytes, allowOverwrite);
    log.info("Wrote {} ({} bytes)", target, bytes.length);
    return target;
  }

  private static void writeHeader(JsonGenerator gen, String kind, long atMillis) throws IOException {
    gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
    gen.writeStringField("report", kind);
    gen.writeStringField("generatedAt", Instant.ofEpochMilli(atMillis).toString());
  }

  private static void writeSummary(JsonGenerator gen, ClassificationReport report) throws IOException {
    BatchStatistics stats = report.statistics();
    gen.writeObjectFieldStart("summary");
    gen.writeNumberField("total", stats.total());
    gen.writeNumberField("valid", stats.valid());
    gen.writeNumberField("corrupted", stats.corrupted());
    gen.writeNumberField("unrecoverable", stats.unrecoverable());
    gen.writeNumberField("skipped", report.skipped().size());
    gen.writeNumberField("integrityScore", stats.integrityScore());
    gen.writeEndObject();
  }

  private static void writeStatistics(JsonGenerator gen, String field, BatchStatistics stats) throws IOException {
    gen.writeObjectFieldStart(field);
    gen.writeNumberField("total", stats.total());
    gen.writeNumberField("valid", stats.valid());
    gen.writeNumberField("corrupted", stats.corrupted());
    gen.writeNumberField("unrecoverable", stats.unrecoverable());
    gen.writeNumberField("integrityScore", stats.integrityScore());
    gen.writeObjectFieldStart("corruptedByType");
    for (Map.Entry<CorruptionType, Integer> entry : stats.corruptedByType().entrySet()) {
      gen.writeNumberField(entry.getKey().reportName(), entry.getValue());
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeCounts(JsonGenerator gen, String field, Map<String, Integer> counts) throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      gen.writeNumberField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private static void writeBreakdowns(JsonGenerator gen, String field, Map<String, Breakdown> groups)
      throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, Breakdown> entry : groups.entrySet()) {
      Breakdown breakdown = entry.getValue();
      gen.writeObjectFieldStart(entry.getKey());
      gen.writeNumberField("total", breakdown.total());
      gen.writeNumberField("valid", breakdown.valid());
      gen.writeNumberField("corrupted", breakdown.corrupted());
      gen.writeNumberField("unrecoverable", breakdown.unrecoverable());
      gen.writeNumberField("integrityScore", breakdown.integrityScore());
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private static void writeArtifact(JsonGenerator gen, ArtifactEntry entry) throws IOException {
    CorruptionRecord record = entry.record();
    gen.writeStartObject();
    gen.writeStringField("id", entry.id());
    gen.writeStringField("sourcePath", entry.sourcePath());
    gen.writeStringField("recoveryMethod", entry.recoveryMethod());
    gen.writeStringField("format", entry.format().reportName());
    gen.writeNumberField("size", entry.size());
    gen.writeStringField("sha256", entry.sha256());
    gen.writeStringField("classification", record.classification().reportName());
    gen.writeStringField("corruptionType", record.corruptionType().reportName());
    gen.writeNumberField("repairabilityTier", record.repairabilityTier());
    gen.writeStringField("confidence", record.confidence().reportName());
    writeStrings(gen, "checksRun", record.checksRun());
    writeStrings(gen, "failedChecks", record.failedChecks());
    writeStrings(gen, "unavailableChecks", record.unavailableChecks());
    writeTechnique(gen, "recommendedTechnique", record.recommendedTechnique());
    gen.writeEndObject();
  }

  private static void writeRepairEntry(JsonGenerator gen, RepairEntry entry) throws IOException {
    RepairOutcome outcome = entry.outcome();
    gen.writeStartObject();
    gen.writeStringField("id", entry.id());
    gen.writeStringField("originalCorruptionType", outcome.originalRecord().corruptionType().reportName());
    gen.writeStringField("status", outcome.status().reportName());
    writeTechnique(gen, "techniqueUsed", outcome.technique());
    gen.writeBooleanField("success", outcome.repaired());
    if (outcome.finalRecord().isPresent() && outcome.repaired()) {
      gen.writeStringField("finalClassification", outcome.finalRecord().get().classification().reportName());
    } else {
      gen.writeStringField("finalClassification", outcome.originalRecord().classification().reportName());
    }
    if (entry.outputPath().isPresent()) {
      gen.writeStringField("outputPath", entry.outputPath().get());
    } else {
      gen.writeNullField("outputPath");
    }
    gen.writeStringField("note", outcome.note());
    gen.writeArrayFieldStart("attempts");
    for (RepairAttempt attempt : outcome.attempts()) {
      gen.writeStartObject();
      gen.writeStringField("technique", attempt.technique().reportName());
      gen.writeStringField("inputArtifactId", attempt.inputArtifactId());
      if (attempt.outputArtifact().isPresent()) {
        gen.writeStringField("outputArtifactId", attempt.outputArtifact().get().id());
      } else {
        gen.writeNullField("outputArtifactId");
      }
      gen.writeBooleanField("success", attempt.success());
      gen.writeStringField("note", attempt.note());
      gen.writeArrayFieldStart("verdictsAfter");
      for (ValidationVerdict verdict : attempt.verdictsAfter()) {
        gen.writeStartObject();
        gen.writeStringField("check", verdict.checkName());
        gen.writeBooleanField("passed", verdict.passed());
        if (verdict.diagnostic().isPresent()) {
          gen.writeStringField("diagnostic", verdict.diagnostic().get());
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeTechnique(JsonGenerator gen, String field, Optional<RepairTechnique> technique)
      throws IOException {
    if (technique.isPresent()) {
      gen.writeStringField(field, technique.get().reportName());
    } else {
      gen.writeNullField(field);
    }
  }

  private static void writeStrings(JsonGenerator gen, String field, List<String> values) throws IOException {
    gen.writeArrayFieldStart(field);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }
}
