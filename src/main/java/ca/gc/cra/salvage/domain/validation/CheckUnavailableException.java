package ca.gc.cra.salvage.domain.validation;

/**
 * Signals that an optional check could not run (missing tool, timeout, decoder not installed). Non-fatal: the
 * check is left out of the verdict list and classification confidence drops.
 *
 * @since 0.1.0
 */
public class CheckUnavailableException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String checkName;

  public CheckUnavailableException(String checkName, String message) {
    super(checkName + " unavailable: " + message);
    this.checkName = checkName;
  }

  public CheckUnavailableException(String checkName, String message, Throwable cause) {
    super(checkName + " unavailable: " + message, cause);
    this.checkName = checkName;
  }

  public String checkName() {
    return checkName;
  }
}
