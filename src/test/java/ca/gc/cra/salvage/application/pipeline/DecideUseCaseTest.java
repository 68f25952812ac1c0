package ca.gc.cra.salvage.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.salvage.application.report.ArtifactEntry;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.ClassifierSettings;
import ca.gc.cra.salvage.domain.classify.CorruptionClassifier;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import ca.gc.cra.salvage.domain.decision.DecisionEngine;
import ca.gc.cra.salvage.domain.decision.DecisionRule;
import ca.gc.cra.salvage.domain.decision.DecisionThresholds;
import ca.gc.cra.salvage.domain.decision.ManualOverride;
import ca.gc.cra.salvage.domain.decision.Strategy;
import ca.gc.cra.salvage.domain.decision.SuccessRateTable;
import ca.gc.cra.salvage.domain.validation.ValidationOracle;
import ca.gc.cra.salvage.fixtures.ImageFixtures;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DecideUseCaseTest {
  private static final long NOW = 1_700_000_000_000L;

  private final CapturingReportWriter reports = new CapturingReportWriter();
  private final DecideUseCase useCase = new DecideUseCase(
      new DecisionEngine(SuccessRateTable.defaults(), DecisionThresholds.defaults()), reports, () -> NOW);

  @Test
  void writesAutomaticDecision() throws PipelineException {
    BatchDecision decision = useCase.run(report(), Optional.empty());

    assertEquals(Strategy.PERFORM_REPAIR, decision.strategy());
    assertEquals(DecisionRule.LOW_YIELD, decision.rule());
    assertFalse(decision.overridden());
    assertEquals(decision, reports.decision);
    assertEquals(NOW, reports.decidedAtMillis);
  }

  @Test
  void overrideIsRecordedBesideRecommendation() throws PipelineException {
    BatchDecision decision = useCase.run(report(), Optional.of(
        new DecideUseCase.OverrideRequest(Strategy.SKIP_REPAIR, "originals only for court", "J. Doe")));

    assertEquals(Strategy.PERFORM_REPAIR, decision.strategy());
    assertEquals(Strategy.SKIP_REPAIR, decision.effectiveStrategy());
    ManualOverride manual = decision.manualOverride().orElseThrow();
    assertEquals("J. Doe", manual.approver());
    assertEquals(Instant.ofEpochMilli(NOW), manual.recordedAt());
    assertTrue(reports.decision.overridden());
  }

  @Test
  void overrideNeedsJustificationAndApprover() {
    assertThrows(IllegalArgumentException.class, () -> useCase.run(report(),
        Optional.of(new DecideUseCase.OverrideRequest(Strategy.SKIP_REPAIR, " ", "J. Doe"))));
    assertThrows(IllegalArgumentException.class, () -> useCase.run(report(),
        Optional.of(new DecideUseCase.OverrideRequest(Strategy.SKIP_REPAIR, "reason", null))));
    assertNull(reports.decision);
  }

  @Test
  void reportWriteFailureIsFatal() {
    reports.failWrites = true;

    assertThrows(PipelineException.class, () -> useCase.run(report(), Optional.empty()));
  }

  private static ClassificationReport report() {
    ValidationOracle oracle = ValidationOracle.builtIn();
    CorruptionClassifier classifier = new CorruptionClassifier(ClassifierSettings.defaults());
    ImageArtifact valid = ImageArtifact.of("photorec/a.jpg", ImageFixtures.jpeg(), "/e/a.jpg", "photorec");
    ImageArtifact damaged = ImageArtifact.of("photorec/b.jpg", ImageFixtures.jpegWithoutFooter(), "/e/b.jpg",
        "photorec");
    return new ClassificationReport(0L, List.of(entry(valid, oracle, classifier), entry(damaged, oracle, classifier)),
        List.of());
  }

  private static ArtifactEntry entry(ImageArtifact artifact, ValidationOracle oracle, CorruptionClassifier classifier) {
    return new ArtifactEntry(artifact.id(), artifact.sourcePath(), artifact.recoveryMethod(), artifact.format(),
        artifact.size(), artifact.sha256(), classifier.classify(artifact, oracle.validate(artifact)));
  }
}
