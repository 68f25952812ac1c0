package ca.gc.cra.salvage.domain.decision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.salvage.domain.classify.Confidence;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DecisionEngineTest {
  private final DecisionEngine engine = new DecisionEngine(SuccessRateTable.defaults(), DecisionThresholds.defaults());

  @Test
  void cleanBatchSkipsRepair() {
    BatchDecision decision = engine.decide(new BatchStatistics(120, 0, 3, Map.of()));

    assertEquals(Strategy.SKIP_REPAIR, decision.strategy());
    assertEquals(DecisionRule.NO_CORRUPTION, decision.rule());
    assertEquals(Confidence.HIGH, decision.confidence());
    assertEquals(0.0, decision.estimate());
    assertEquals(0, decision.expectedAdditional());
  }

  @Test
  void onlyUnrepairableTypesSkipRepair() {
    BatchDecision decision = engine.decide(stats(5, Map.of(CorruptionType.FRAGMENTED, 4)));

    assertEquals(Strategy.SKIP_REPAIR, decision.strategy());
    assertEquals(DecisionRule.NO_REPAIRABLE, decision.rule());
    assertEquals(15.0, decision.estimate());
    assertTrue(decision.reasoning().startsWith("Rule 2"));
  }

  @Test
  void lowYieldBatchRepairsRegardlessOfEstimate() {
    DecisionEngine pessimistic = new DecisionEngine(
        SuccessRateTable.defaults().with(CorruptionType.CORRUPT_DATA, 0.0), DecisionThresholds.defaults());

    BatchDecision decision = pessimistic.decide(stats(10, Map.of(CorruptionType.CORRUPT_DATA, 6)));

    assertEquals(Strategy.PERFORM_REPAIR, decision.strategy());
    assertEquals(DecisionRule.LOW_YIELD, decision.rule());
    assertEquals(Confidence.HIGH, decision.confidence());
    assertEquals(0.0, decision.estimate());
    assertEquals(0, decision.expectedAdditional());
  }

  @Test
  void highEstimateRepairsWithConfidenceFromMargin() {
    BatchDecision high = engine.decide(stats(200, Map.of(CorruptionType.MISSING_FOOTER, 10)));
    BatchDecision medium = engine.decide(stats(200, Map.of(CorruptionType.CORRUPT_SEGMENTS, 10)));

    assertEquals(DecisionRule.HIGH_ESTIMATE, high.rule());
    assertEquals(Confidence.HIGH, high.confidence());
    assertEquals(85.0, high.estimate());
    assertEquals(8, high.expectedAdditional());
    assertEquals(DecisionRule.HIGH_ESTIMATE, medium.rule());
    assertEquals(Confidence.MEDIUM, medium.confidence());
  }

  @Test
  void lowEstimateSkipsRepairWithMediumConfidence() {
    Map<CorruptionType, Integer> types = new EnumMap<>(CorruptionType.class);
    types.put(CorruptionType.CORRUPT_DATA, 8);
    types.put(CorruptionType.FRAGMENTED, 2);

    BatchDecision decision = engine.decide(stats(300, types));

    assertEquals(Strategy.SKIP_REPAIR, decision.strategy());
    assertEquals(DecisionRule.LOW_ESTIMATE, decision.rule());
    assertEquals(Confidence.MEDIUM, decision.confidence());
    assertEquals(35.0, decision.estimate());
    assertEquals(8, decision.repairableCount());
    assertEquals(300, decision.expectedOutcome().finalExpectedCount());
  }

  @Test
  void estimateWeightsRatesByCount() {
    Map<CorruptionType, Integer> types = new EnumMap<>(CorruptionType.class);
    types.put(CorruptionType.MISSING_FOOTER, 1);
    types.put(CorruptionType.INVALID_HEADER, 1);
    types.put(CorruptionType.CORRUPT_DATA, 1);

    assertEquals(65.0, engine.estimate(stats(0, types)));
  }

  @Test
  void raisingValidCountNeverTurnsSkipIntoPerform() {
    Map<CorruptionType, Integer> types = Map.of(CorruptionType.CORRUPT_DATA, 5);
    Strategy previous = Strategy.PERFORM_REPAIR;
    for (int valid = 0; valid <= 200; valid += 10) {
      Strategy current = engine.decide(stats(valid, types)).strategy();
      if (previous == Strategy.SKIP_REPAIR) {
        assertEquals(Strategy.SKIP_REPAIR, current, "valid=" + valid);
      }
      previous = current;
    }
    assertEquals(Strategy.SKIP_REPAIR, previous);
  }

  @Test
  void raisingSuccessRatesNeverTurnsPerformIntoSkip() {
    Map<CorruptionType, Integer> types = new EnumMap<>(CorruptionType.class);
    types.put(CorruptionType.MISSING_FOOTER, 3);
    types.put(CorruptionType.CORRUPT_SEGMENTS, 2);
    types.put(CorruptionType.CORRUPT_DATA, 4);
    types.put(CorruptionType.FRAGMENTED, 1);
    BatchStatistics stats = stats(DecisionThresholds.DEFAULT_LOW_YIELD_THRESHOLD, types);

    Strategy previous = null;
    double previousEstimate = -1.0;
    for (int rate = 0; rate <= 100; rate += 5) {
      SuccessRateTable table = SuccessRateTable.defaults();
      for (CorruptionType type : types.keySet()) {
        table = table.with(type, rate);
      }
      BatchDecision decision = new DecisionEngine(table, DecisionThresholds.defaults()).decide(stats);
      assertTrue(decision.estimate() >= previousEstimate, "rate=" + rate);
      if (previous == Strategy.PERFORM_REPAIR) {
        assertEquals(Strategy.PERFORM_REPAIR, decision.strategy(), "rate=" + rate);
      }
      if (rate == 0) {
        assertEquals(Strategy.SKIP_REPAIR, decision.strategy());
      }
      previous = decision.strategy();
      previousEstimate = decision.estimate();
    }
    assertEquals(Strategy.PERFORM_REPAIR, previous);
  }

  @Test
  void raisingOneTypeRateIsMonotoneToo() {
    Map<CorruptionType, Integer> types = Map.of(CorruptionType.CORRUPT_DATA, 6, CorruptionType.MISSING_FOOTER, 1);
    BatchStatistics stats = stats(120, types);

    Strategy previous = null;
    for (int rate = 0; rate <= 100; rate++) {
      SuccessRateTable table = SuccessRateTable.defaults().with(CorruptionType.CORRUPT_DATA, rate);
      Strategy current = new DecisionEngine(table, DecisionThresholds.defaults()).decide(stats).strategy();
      if (previous == Strategy.PERFORM_REPAIR) {
        assertEquals(Strategy.PERFORM_REPAIR, current, "rate=" + rate);
      }
      previous = current;
    }
    assertEquals(Strategy.PERFORM_REPAIR, previous);
  }

  @Test
  void recoveryScenarioProjectsOneAdditionalImage() {
    Map<CorruptionType, Integer> types = Map.of(CorruptionType.MISSING_FOOTER, 2);
    BatchStatistics stats = new BatchStatistics(7, 2, 1, types);

    BatchDecision decision = engine.decide(stats);

    assertEquals(70.0, stats.integrityScore());
    assertEquals(Strategy.PERFORM_REPAIR, decision.strategy());
    assertEquals(DecisionRule.LOW_YIELD, decision.rule());
    assertEquals(85.0, decision.estimate());
    assertEquals(1, decision.expectedAdditional());
    assertEquals(8, decision.expectedOutcome().finalExpectedCount());
    assertEquals(80.0, decision.expectedOutcome().finalExpectedPercent());
    assertEquals(10.0, decision.expectedOutcome().improvementPercentagePoints());
  }

  @Test
  void overrideReplacesEffectiveStrategyOnly() {
    BatchDecision decision = engine.decide(stats(300, Map.of(CorruptionType.CORRUPT_DATA, 4)));
    ManualOverride override = new ManualOverride(
        Strategy.PERFORM_REPAIR, "case file requires every image", "analyst-7", Instant.parse("2024-03-01T10:00:00Z"));

    BatchDecision overridden = decision.withOverride(override);

    assertEquals(Strategy.SKIP_REPAIR, overridden.strategy());
    assertEquals(Strategy.PERFORM_REPAIR, overridden.effectiveStrategy());
    assertTrue(overridden.overridden());
  }

  @Test
  void statisticsRejectMismatchedTypeCounts() {
    assertThrows(IllegalArgumentException.class,
        () -> new BatchStatistics(1, 3, 0, Map.of(CorruptionType.MISSING_FOOTER, 2)));
    assertThrows(IllegalArgumentException.class,
        () -> SuccessRateTable.defaults().with(CorruptionType.TRUNCATED, 120.0));
    assertThrows(IllegalArgumentException.class,
        () -> new ManualOverride(Strategy.SKIP_REPAIR, " ", "analyst", Instant.EPOCH));
  }

  @Test
  void emptyBatchScoresZero() {
    assertEquals(0.0, new BatchStatistics(0, 0, 0, Map.of()).integrityScore());
  }

  @Test
  void rulesResolveByNumber() {
    assertEquals(DecisionRule.LOW_YIELD, DecisionRule.fromNumber(3));
    assertThrows(IllegalArgumentException.class, () -> DecisionRule.fromNumber(6));
  }

  private static BatchStatistics stats(int valid, Map<CorruptionType, Integer> types) {
    int corrupted = types.values().stream().mapToInt(Integer::intValue).sum();
    return new BatchStatistics(valid, corrupted, 0, types);
  }
}
