package ca.gc.cra.salvage.infrastructure.report;

import ca.gc.cra.salvage.application.port.ReportReaderPort;
import ca.gc.cra.salvage.application.report.ArtifactEntry;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.SkippedEntry;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.classify.Classification;
import ca.gc.cra.salvage.domain.classify.Confidence;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import ca.gc.cra.salvage.domain.decision.BatchStatistics;
import ca.gc.cra.salvage.domain.decision.DecisionRule;
import ca.gc.cra.salvage.domain.decision.ExpectedOutcome;
import ca.gc.cra.salvage.domain.decision.ManualOverride;
import ca.gc.cra.salvage.domain.decision.Strategy;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads reports produced by {@link JsonReportWriter} back into report models.
 *
 * <p>Any structural problem (missing field, unknown enum value, inconsistent counts) surfaces as an
 * {@link IOException} naming the file and field, since a damaged report must not steer a repair run.
 *
 * @since 0.1.0
 */
public final class JsonReportReader implements ReportReaderPort {
  private final JsonSupport json = new JsonSupport();

  @Override
  public ClassificationReport readValidation(Path file) throws IOException {
    Map<?, ?> root = document(file, "validation");
    try {
      List<ArtifactEntry> artifacts = new ArrayList<>();
      for (Object item : list(root, "artifacts")) {
        artifacts.add(artifact(object(item, "artifacts[]")));
      }
      List<SkippedEntry> skipped = new ArrayList<>();
      for (Object item : list(root, "skipped")) {
        Map<?, ?> entry = object(item, "skipped[]");
        skipped.add(new SkippedEntry(text(entry, "id"), text(entry, "sourcePath"), text(entry, "reason")));
      }
      return new ClassificationReport(instant(root, "generatedAt"), artifacts, skipped);
    } catch (IllegalArgumentException ex) {
      throw new IOException("invalid validation report " + file + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public BatchDecision readDecision(Path file) throws IOException {
    Map<?, ?> root = document(file, "decision");
    try {
      Map<?, ?> expected = object(root.get("expectedOutcome"), "expectedOutcome");
      ExpectedOutcome outcome = new ExpectedOutcome(
          integer(expected, "currentValid"),
          integer(expected, "expectedAdditional"),
          integer(expected, "finalExpectedCount"),
          number(expected, "finalExpectedPercent"),
          number(expected, "improvementPercentagePoints"));
      BatchDecision decision = new BatchDecision(
          Strategy.fromReportName(text(root, "strategy")),
          Confidence.fromReportName(text(root, "confidence")),
          DecisionRule.fromNumber(integer(root, "rule")),
          number(root, "estimate"),
          integer(root, "repairableCount"),
          statistics(object(root.get("statistics"), "statistics")),
          outcome,
          text(root, "reasoning"),
          Optional.empty());
      Object override = root.get("manualOverride");
      if (override != null) {
        Map<?, ?> manual = object(override, "manualOverride");
        decision = decision.withOverride(new ManualOverride(
            Strategy.fromReportName(text(manual, "strategy")),
            text(manual, "justification"),
            text(manual, "approver"),
            Instant.ofEpochMilli(instant(manual, "recordedAt"))));
      }
      return decision;
    } catch (IllegalArgumentException ex) {
      throw new IOException("invalid decision report " + file + ": " + ex.getMessage(), ex);
    }
  }

  private Map<?, ?> document(Path file, String kind) throws IOException {
    Object parsed;
    try {
      parsed = json.parse(file);
    } catch (IllegalArgumentException ex) {
      throw new IOException(ex.getMessage(), ex);
    }
    if (!(parsed instanceof Map<?, ?> root)) {
      throw new IOException(file + " is not a JSON object");
    }
    Object declared = root.get("report");
    if (declared != null && !kind.equals(declared)) {
      throw new IOException(file + " is a " + declared + " report, expected " + kind);
    }
    return root;
  }

  private static ArtifactEntry artifact(Map<?, ?> entry) {
    String id = text(entry, "id");
    Object technique = entry.get("recommendedTechnique");
    CorruptionType type = CorruptionType.fromReportName(text(entry, "corruptionType"));
    CorruptionRecord record = new CorruptionRecord(
        id,
        Classification.fromReportName(text(entry, "classification")),
        type,
        integer(entry, "repairabilityTier"),
        technique == null ? Optional.empty() : Optional.of(RepairTechnique.fromReportName(technique.toString())),
        Confidence.fromReportName(text(entry, "confidence")),
        strings(entry, "checksRun"),
        strings(entry, "failedChecks"),
        entry.containsKey("unavailableChecks") ? strings(entry, "unavailableChecks") : List.of());
    return new ArtifactEntry(
        id,
        text(entry, "sourcePath"),
        text(entry, "recoveryMethod"),
        ImageFormat.fromReportName(text(entry, "format")),
        (long) number(entry, "size"),
        entry.containsKey("sha256") ? text(entry, "sha256") : "",
        record);
  }

  private static BatchStatistics statistics(Map<?, ?> stats) {
    EnumMap<CorruptionType, Integer> byType = new EnumMap<>(CorruptionType.class);
    Map<?, ?> raw = object(stats.get("corruptedByType"), "corruptedByType");
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getValue() instanceof Number count)) {
        throw new IllegalArgumentException("corruptedByType." + entry.getKey() + " must be a number");
      }
      byType.put(CorruptionType.fromReportName(entry.getKey().toString()), count.intValue());
    }
    return new BatchStatistics(
        integer(stats, "valid"), integer(stats, "corrupted"), integer(stats, "unrecoverable"), byType);
  }

  private static Object field(Map<?, ?> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException("missing field " + key);
    }
    return value;
  }

  private static String text(Map<?, ?> map, String key) {
    return field(map, key).toString();
  }

  private static int integer(Map<?, ?> map, String key) {
    if (!(field(map, key) instanceof Number value)) {
      throw new IllegalArgumentException(key + " must be a number");
    }
    return value.intValue();
  }

  private static double number(Map<?, ?> map, String key) {
    if (!(field(map, key) instanceof Number value)) {
      throw new IllegalArgumentException(key + " must be a number");
    }
    return value.doubleValue();
  }

  private static long instant(Map<?, ?> map, String key) {
    try {
      return Instant.parse(text(map, key)).toEpochMilli();
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(key + " is not an ISO-8601 instant", ex);
    }
  }

  private static Map<?, ?> object(Object value, String name) {
    if (!(value instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(name + " must be an object");
    }
    return map;
  }

  private static List<?> list(Map<?, ?> map, String key) {
    if (!(field(map, key) instanceof List<?> values)) {
      throw new IllegalArgumentException(key + " must be an array");
    }
    return values;
  }

  private static List<String> strings(Map<?, ?> map, String key) {
    List<String> result = new ArrayList<>();
    for (Object value : list(map, key)) {
      result.add(String.valueOf(value));
    }
    return result;
  }
}
