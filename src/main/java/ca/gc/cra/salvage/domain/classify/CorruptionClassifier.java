package ca.gc.cra.salvage.domain.classify;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.container.ContainerParsers;
import ca.gc.cra.salvage.domain.container.ContainerStructure;
import ca.gc.cra.salvage.domain.container.MalformedContainerException;
import ca.gc.cra.salvage.domain.container.Segment;
import ca.gc.cra.salvage.domain.validation.ValidationReport;
import ca.gc.cra.salvage.domain.validation.ValidationVerdict;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Combines container facts and oracle verdicts into a {@link CorruptionRecord}.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>No container at all ({@link MalformedContainerException}) is unrecoverable.</li>
 *   <li>All checks pass: valid. No check passes: unrecoverable.</li>
 *   <li>Otherwise corrupted, typed in this order: no image structure (false positive, forced unrecoverable),
 *       start marker missing at offset zero (invalid header), second start marker inside the container
 *       (fragmented), end marker missing (missing footer or truncated), inconsistent units (corrupt segments),
 *       anything else (corrupt data).</li>
 *   <li>An end marker missing where a check reports image data ending early is truncated, whatever the container
 *       walk suggests.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; deterministic for identical inputs.</p>
 *
 * @since 0.1.0
 */
public final class CorruptionClassifier {
  /**
   * Diagnostic fragments, lower case, that mean the compressed image data itself ran out. A bare "premature end of
   * JPEG file" is not among them: the JPEG reader reports it for a stream that lacks only its end marker.
   */
  static final List<String> DATA_ENDED_EARLY = List.of(
      "premature end of data segment",
      "unexpected end of",
      "eofexception",
      "eof while reading");

  private final ClassifierSettings settings;

  public CorruptionClassifier(ClassifierSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Classifies an artifact from its verdicts.
   *
   * @param artifact artifact the verdicts were produced for
   * @param report oracle verdicts for {@code artifact}
   * @return new corruption record
   */
  public CorruptionRecord classify(ImageArtifact artifact, ValidationReport report) {
    Objects.requireNonNull(artifact, "artifact");
    Objects.requireNonNull(report, "report");
    Confidence confidence = Confidence.HIGH.lowered(report.unavailableChecks().size());

    ContainerStructure structure;
    try {
      structure = ContainerParsers.parse(artifact);
    } catch (MalformedContainerException ex) {
      return record(artifact, report, Classification.UNRECOVERABLE, CorruptionType.FALSE_POSITIVE, confidence);
    }
    if (report.allPassed()) {
      return record(artifact, report, Classification.VALID, CorruptionType.NONE, confidence);
    }
    CorruptionType type = deriveType(structure, report);
    if (!report.anyPassed() || type == CorruptionType.FALSE_POSITIVE) {
      return record(artifact, report, Classification.UNRECOVERABLE, type, confidence);
    }
    return record(artifact, report, Classification.CORRUPTED, type, confidence);
  }

  /**
   * Derives the corruption type from container facts and the failed checks.
   *
   * @param structure parsed container
   * @param report oracle verdicts for the same bytes
   * @return corruption type, never {@link CorruptionType#NONE}
   */
  public CorruptionType deriveType(ContainerStructure structure, ValidationReport report) {
    CorruptionType fromStructure = deriveType(structure);
    if (fromStructure == CorruptionType.MISSING_FOOTER && reportsDataEndedEarly(report)) {
      return CorruptionType.TRUNCATED;
    }
    return fromStructure;
  }

  /**
   * Derives the corruption type from container facts.
   *
   * @param structure parsed container
   * @return corruption type, never {@link CorruptionType#NONE}
   */
  public CorruptionType deriveType(ContainerStructure structure) {
    if (!structure.hasImageContent()) {
      return CorruptionType.FALSE_POSITIVE;
    }
    if (!structure.hasStartMarker()) {
      return CorruptionType.INVALID_HEADER;
    }
    if (structure.foreignStart().isPresent()) {
      return CorruptionType.FRAGMENTED;
    }
    if (!structure.hasEndMarker()) {
      return breaksAtExpectedEnd(structure) ? CorruptionType.MISSING_FOOTER : CorruptionType.TRUNCATED;
    }
    if (!structure.isConsistent()) {
      return CorruptionType.CORRUPT_SEGMENTS;
    }
    return CorruptionType.CORRUPT_DATA;
  }

  /**
   * The stream ends where only the footer is missing: after compressed image data was reached, either inside
   * JPEG scan data, between consistent units, or inside a unit short by no more than the configured tolerance.
   */
  private boolean breaksAtExpectedEnd(ContainerStructure structure) {
    if (!structure.hasScanData()) {
      return false;
    }
    return switch (structure.endState()) {
      case IN_SCAN_DATA -> true;
      case AT_SEGMENT_BOUNDARY -> lastSegmentConsistent(structure);
      case IN_SEGMENT -> structure.shortfall() <= settings.footerToleranceBytes();
      case COMPLETE -> false;
    };
  }

  static boolean reportsDataEndedEarly(ValidationReport report) {
    for (ValidationVerdict verdict : report.verdicts()) {
      if (verdict.passed() || verdict.diagnostic().isEmpty()) {
        continue;
      }
      String diagnostic = verdict.diagnostic().get().toLowerCase(Locale.ROOT);
      for (String sign : DATA_ENDED_EARLY) {
        if (diagnostic.contains(sign)) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean lastSegmentConsistent(ContainerStructure structure) {
    List<Segment> segments = structure.segments();
    return !segments.isEmpty() && segments.get(segments.size() - 1).consistent();
  }

  private static CorruptionRecord record(
      ImageArtifact artifact,
      ValidationReport report,
      Classification classification,
      CorruptionType type,
      Confidence confidence) {
    Optional<RepairTechnique> technique =
        classification == Classification.CORRUPTED ? type.technique() : Optional.empty();
    return new CorruptionRecord(
        artifact.id(),
        classification,
        type,
        type.tier(),
        technique,
        confidence,
        report.checksRun(),
        report.failedChecks(),
        report.unavailableChecks());
  }
}
