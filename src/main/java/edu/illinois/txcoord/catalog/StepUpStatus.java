package edu.illinois.txcoord.catalog;

/**
 * Outcome of coordinator recovery after a node became primary.
 */
public final class StepUpStatus {

  private static final StepUpStatus OK = new StepUpStatus(null);

  private final Throwable cause;

  private StepUpStatus(Throwable cause) {
    this.cause = cause;
  }

  public static StepUpStatus ok() {
    return OK;
  }

  public static StepUpStatus failed(Throwable cause) {
    if (cause == null)
      throw new IllegalArgumentException("failed status requires a cause");
    return new StepUpStatus(cause);
  }

  public boolean isOK() {
    return cause == null;
  }

  /**
   * @return the recovery failure, or null if recovery succeeded
   */
  public Throwable getCause() {
    return cause;
  }

  @Override
  public String toString() {
    return isOK() ? "OK" : "Failed: " + cause;
  }
}
