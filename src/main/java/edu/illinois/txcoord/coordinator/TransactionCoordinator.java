package edu.illinois.txcoord.coordinator;

import com.google.common.util.concurrent.ListenableFuture;

/**
 * Drives two-phase commit for one transaction on one session. The catalog
 * only observes the completion and decision futures; everything else about
 * the protocol belongs to the implementation.
 */
public interface TransactionCoordinator {

  /**
   * Completes exactly once, when the coordinator reaches a terminal state
   * (committed, aborted, or failed because the node stepped down or shut
   * down). The future may complete exceptionally.
   */
  ListenableFuture<Void> onCompletion();

  /**
   * The final commit decision. Fails if the coordinator stopped before it
   * could reach a decision.
   */
  ListenableFuture<CommitDecision> getDecision();

  /**
   * Aborts the transaction if the commit protocol has not been started yet,
   * otherwise does nothing. Invoked when a newer transaction begins
   * coordinating on the same session.
   */
  void cancelIfCommitNotYetStarted();

}
