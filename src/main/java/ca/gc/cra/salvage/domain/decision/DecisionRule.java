package ca.gc.cra.salvage.domain.decision;

/**
 * Decision rules in the fixed priority order they are evaluated; the first match wins.
 */
public enum DecisionRule {
  NO_CORRUPTION(1, "no corrupted artifacts"),
  NO_REPAIRABLE(2, "no repairable artifacts"),
  LOW_YIELD(3, "low valid count"),
  HIGH_ESTIMATE(4, "repair estimate at or above threshold"),
  LOW_ESTIMATE(5, "repair estimate below threshold");

  private final int number;
  private final String label;

  DecisionRule(int number, String label) {
    this.number = number;
    this.label = label;
  }

  public int number() {
    return number;
  }

  public String label() {
    return label;
  }

  public static DecisionRule fromNumber(int number) {
    for (DecisionRule rule : values()) {
      if (rule.number == number) {
        return rule;
      }
    }
    throw new IllegalArgumentException("unknown decision rule: " + number);
  }
}
