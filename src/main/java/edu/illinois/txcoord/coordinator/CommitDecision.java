package edu.illinois.txcoord.coordinator;

/**
 * Outcome recorded by a coordinator once all participants have voted.
 */
public enum CommitDecision {
  COMMIT, ABORT
}
