package edu.illinois.txcoord.service;

import java.io.IOException;

/**
 * Raised when a coordinator is requested for a transaction number that is
 * older than the latest one already coordinating on the session.
 */
public class StaleTransactionException extends IOException {

  private static final long serialVersionUID = 6608017457735812713L;

  public StaleTransactionException(String message) {
    super(message);
  }

}
