package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.CorruptionClassifier;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.container.ContainerParsers;
import ca.gc.cra.salvage.domain.container.ContainerStructure;
import ca.gc.cra.salvage.domain.container.MalformedContainerException;
import ca.gc.cra.salvage.domain.validation.ValidationOracle;
import ca.gc.cra.salvage.domain.validation.ValidationReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies the technique mapped to an artifact's corruption type and verifies the result.
 * <p><strong>Why:</strong> Recovered evidence may only be replaced by output that independently passes the same
 * required checks as any valid artifact.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Dispatch {@link CorruptionType} to a {@link TechniqueHandler}.</li>
 *   <li>Turn every locally valid candidate into a fresh {@link ImageArtifact} and re-run the oracle over it.</li>
 *   <li>Re-classify every candidate; only one that passes the required checks and re-classifies as valid counts
 *       as repaired, so reports never pair a success with a corrupted final classification.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across worker threads when the oracle and pixel
 * recovery are.</p>
 *
 * @since 0.1.0
 */
public final class RepairEngine {
  private static final Logger log = LoggerFactory.getLogger(RepairEngine.class);

  private final ValidationOracle oracle;
  private final CorruptionClassifier classifier;
  private final TechniqueHandler footerAppend;
  private final TechniqueHandler headerReconstruction;
  private final TechniqueHandler segmentStripping;
  private final TechniqueHandler partialDecode;

  /**
   * Creates an engine with the built-in techniques.
   *
   * @param oracle oracle used to verify candidates
   * @param classifier classifier used for the final classification
   * @param pixelRecovery decoder behind partial decode re-encode
   * @param settings repair tunables
   */
  public RepairEngine(
      ValidationOracle oracle,
      CorruptionClassifier classifier,
      PixelRecovery pixelRecovery,
      RepairSettings settings) {
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    Objects.requireNonNull(settings, "settings");
    this.footerAppend = new FooterAppendTechnique();
    this.headerReconstruction = new HeaderReconstructionTechnique(settings.headerSearchWindow());
    this.segmentStripping = new SegmentStrippingTechnique();
    this.partialDecode = new PartialDecodeTechnique(pixelRecovery);
  }

  /**
   * Maps a corruption type to its technique.
   *
   * @param type corruption type
   * @return technique for {@code type}
   * @throws TechniqueNotApplicableException when no technique applies
   */
  public static RepairTechnique techniqueFor(CorruptionType type) throws TechniqueNotApplicableException {
    Optional<RepairTechnique> technique = type.technique();
    if (technique.isEmpty()) {
      throw new TechniqueNotApplicableException(type);
    }
    return technique.get();
  }

  /**
   * Repairs one artifact. The input artifact is never modified.
   *
   * @param artifact artifact to repair
   * @param record classification of {@code artifact}
   * @return outcome with every attempt made
   * @throws IllegalArgumentException when the record is unrecoverable or belongs to another artifact
   */
  public RepairOutcome repair(ImageArtifact artifact, CorruptionRecord record) {
    Objects.requireNonNull(artifact, "artifact");
    Objects.requireNonNull(record, "record");
    if (!artifact.id().equals(record.artifactId())) {
      throw new IllegalArgumentException(
          "record " + record.artifactId() + " does not describe artifact " + artifact.id());
    }
    if (record.isUnrecoverable()) {
      throw new IllegalArgumentException("unrecoverable artifacts are never repaired: " + artifact.id());
    }
    if (record.isValid()) {
      return RepairOutcome.unchanged(artifact, record);
    }

    RepairTechnique technique;
    try {
      technique = techniqueFor(record.corruptionType());
    } catch (TechniqueNotApplicableException ex) {
      log.debug("Not repairing {}: {}", artifact.id(), ex.getMessage());
      return RepairOutcome.notAttempted(record, ex.getMessage());
    }

    ContainerStructure structure;
    try {
      structure = ContainerParsers.parse(artifact);
    } catch (MalformedContainerException ex) {
      return RepairOutcome.notAttempted(record, "container unreadable at offset " + ex.offset());
    }

    List<TechniqueResult> steps = handlerFor(technique).apply(artifact, structure);
    List<RepairAttempt> attempts = new ArrayList<>(steps.size());
    int produced = 0;
    for (TechniqueResult step : steps) {
      Optional<byte[]> bytes = step.candidate();
      if (!step.locallyValid() || bytes.isEmpty()) {
        attempts.add(RepairAttempt.withoutOutput(technique, artifact.id(), step.note()));
        continue;
      }
      produced++;
      ImageArtifact candidate = artifact.derive(outputId(artifact.id(), technique, produced), bytes.get());
      ValidationReport after = oracle.validate(candidate);
      CorruptionRecord finalRecord = classifier.classify(candidate, after);
      boolean success = after.requiredPassed() && finalRecord.isValid();
      String note = success ? step.note() : step.note() + "; " + rejection(after, finalRecord);
      attempts.add(new RepairAttempt(
          technique, artifact.id(), Optional.of(candidate), success, after.verdicts(), note));
      if (success) {
        log.debug("Repaired {} with {} as {}", artifact.id(), technique.reportName(), candidate.id());
        return new RepairOutcome(artifact.id(), record, RepairStatus.REPAIRED, Optional.of(technique), attempts,
            Optional.of(candidate), Optional.of(finalRecord), step.note());
      }
    }
    String note = attempts.isEmpty() ? "no attempt made" : attempts.get(attempts.size() - 1).note();
    log.debug("Repair of {} with {} failed: {}", artifact.id(), technique.reportName(), note);
    return new RepairOutcome(artifact.id(), record, RepairStatus.FAILED, Optional.of(technique), attempts,
        Optional.empty(), Optional.empty(), note);
  }

  private static String rejection(ValidationReport after, CorruptionRecord finalRecord) {
    if (!after.requiredPassed()) {
      return "required checks failed: " + after.failedChecks();
    }
    return "re-classified " + finalRecord.classification().reportName() + "/"
        + finalRecord.corruptionType().reportName() + ", failed checks: " + after.failedChecks();
  }

  private TechniqueHandler handlerFor(RepairTechnique technique) {
    return switch (technique) {
      case FOOTER_APPEND -> footerAppend;
      case HEADER_RECONSTRUCTION -> headerReconstruction;
      case SEGMENT_STRIPPING -> segmentStripping;
      case PARTIAL_DECODE_REENCODE -> partialDecode;
    };
  }

  /** {@code <input id>#<technique>}, with a counter when one technique produced several candidates. */
  static String outputId(String inputId, RepairTechnique technique, int ordinal) {
    String base = inputId + "#" + technique.reportName();
    return ordinal <= 1 ? base : base + "-" + ordinal;
  }
}
