package edu.illinois.txcoord.catalog;

import java.io.IOException;

/**
 * Raised by catalog lookups once coordinator recovery has failed on this
 * node. The catalog keeps rejecting requests until the node changes role
 * again.
 */
public class CoordinatorStepUpFailedException extends IOException {

  private static final long serialVersionUID = -2318840170362519024L;

  private final StepUpStatus status;

  public CoordinatorStepUpFailedException(StepUpStatus status) {
    super("Coordinator recovery failed and coordinateCommit requests are "
        + "not allowed", status.getCause());
    this.status = status;
  }

  public StepUpStatus getStatus() {
    return status;
  }

}
