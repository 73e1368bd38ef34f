package edu.illinois.txcoord.util;

import java.io.InterruptedIOException;

/**
 * Thrown when an operation stops waiting because its context was killed,
 * its deadline passed or its thread was interrupted.
 */
public class OperationInterruptedException extends InterruptedIOException {

  private static final long serialVersionUID = 4127781301863470251L;

  public OperationInterruptedException(String message) {
    super(message);
  }

  public OperationInterruptedException(String message, Throwable cause) {
    super(message);
    initCause(cause);
  }

}
