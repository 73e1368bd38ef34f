package edu.illinois.txcoord.catalog;

import static edu.illinois.txcoord.Constants.CATALOG_JOIN_LOG_INTERVAL;
import static edu.illinois.txcoord.Constants.CATALOG_RETAIN_COMPLETED;
import static edu.illinois.txcoord.Constants.DEFAULT_CATALOG_JOIN_LOG_INTERVAL;
import static edu.illinois.txcoord.Constants.DEFAULT_CATALOG_RETAIN_COMPLETED;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;

import com.google.common.base.Supplier;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;

import edu.illinois.txcoord.coordinator.CommitDecision;
import edu.illinois.txcoord.coordinator.TransactionCoordinator;
import edu.illinois.txcoord.session.LogicalSessionId;
import edu.illinois.txcoord.util.OperationContext;

/**
 * In-memory index of the transaction coordinators active on this node, keyed
 * by logical session and transaction number.
 *
 * A coordinator is inserted by the request path that created it and removes
 * itself once its completion future fires, on whatever thread completes it.
 * All state is guarded by a single lock.
 *
 * After a node becomes primary, lookups and regular inserts block until
 * {@link #exitStepUp(StepUpStatus)} has been called. Recovery itself inserts
 * with {@code forStepUp} set so it can populate the catalog before that.
 */
public class TransactionCoordinatorCatalog {

  private static final Log LOG = LogFactory
      .getLog(TransactionCoordinatorCatalog.class);

  // how long join waits before logging the coordinators it is waiting for
  private final long joinLogInterval;

  private final ReentrantLock lock = new ReentrantLock();
  // signalled once exitStepUp has been called
  private final Condition stepUpComplete = lock.newCondition();
  // signalled whenever the last active coordinator is removed
  private final Condition noActiveCoordinators = lock.newCondition();

  // coordinators by session, each session ordered by txn number descending
  private final Map<LogicalSessionId, NavigableMap<Long, TransactionCoordinator>> coordinatorsBySession;
  // completed coordinators kept only when retention is enabled
  private final Map<LogicalSessionId, NavigableMap<Long, TransactionCoordinator>> coordinatorsBySessionDefunct;
  // null until recovery has finished
  private StepUpStatus stepUpCompletionStatus;
  private boolean retainCompletedCoordinators;

  public TransactionCoordinatorCatalog() {
    this(new Configuration(false));
  }

  public TransactionCoordinatorCatalog(Configuration conf) {
    this.joinLogInterval = conf.getLong(CATALOG_JOIN_LOG_INTERVAL,
        DEFAULT_CATALOG_JOIN_LOG_INTERVAL);
    this.retainCompletedCoordinators = conf.getBoolean(
        CATALOG_RETAIN_COMPLETED, DEFAULT_CATALOG_RETAIN_COMPLETED);
    this.coordinatorsBySession = new TreeMap<LogicalSessionId, NavigableMap<Long, TransactionCoordinator>>();
    this.coordinatorsBySessionDefunct = new TreeMap<LogicalSessionId, NavigableMap<Long, TransactionCoordinator>>();
  }

  /**
   * Registers a coordinator for the given session and transaction number.
   * Inserting a coordinator for a key that is already present is a bug in
   * the caller and fails with {@link IllegalStateException}.
   *
   * @param forStepUp
   *          true if called by recovery, in which case the step-up gate is
   *          not waited on
   */
  public void insert(OperationContext ctx, final LogicalSessionId lsid,
      final long txnNumber, TransactionCoordinator coordinator,
      boolean forStepUp) throws IOException {
    lock.lock();
    try {
      if (!forStepUp)
        waitForStepUpToComplete(ctx);

      NavigableMap<Long, TransactionCoordinator> coordinatorsForSession = coordinatorsBySession
          .get(lsid);
      if (coordinatorsForSession == null) {
        coordinatorsForSession = newSessionMap();
        coordinatorsBySession.put(lsid, coordinatorsForSession);
      }

      // duplicates from malformed commands must be filtered by the caller
      if (coordinatorsForSession.containsKey(txnNumber))
        throw new IllegalStateException("Cannot insert a coordinator for "
            + "transaction " + txnNumber + " on session " + lsid
            + " because one already exists");

      if (LOG.isDebugEnabled())
        LOG.debug("Inserting coordinator for transaction " + txnNumber
            + " on session " + lsid + " into in-memory catalog");
      coordinatorsForSession.put(txnNumber, coordinator);

      // may run inline if the coordinator is already complete; the lock is
      // reentrant, so the entry must be in place before this point
      coordinator.onCompletion().addListener(new Runnable() {
        @Override
        public void run() {
          remove(lsid, txnNumber);
        }
      }, MoreExecutors.directExecutor());
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return the coordinator for the given transaction, or null if there is
   *         none
   */
  public TransactionCoordinator get(OperationContext ctx,
      LogicalSessionId lsid, long txnNumber) throws IOException {
    lock.lock();
    try {
      waitForStepUpToComplete(ctx);

      TransactionCoordinator coordinator = find(coordinatorsBySession, lsid,
          txnNumber);
      // fall back to coordinators that completed and would normally be gone
      if (coordinator == null && retainCompletedCoordinators)
        coordinator = find(coordinatorsBySessionDefunct, lsid, txnNumber);
      return coordinator;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return the transaction number and coordinator of the most recent
   *         transaction coordinating on the session, or null if the session
   *         has no active coordinators
   */
  public Entry<Long, TransactionCoordinator> getLatestOnSession(
      OperationContext ctx, LogicalSessionId lsid) throws IOException {
    lock.lock();
    try {
      waitForStepUpToComplete(ctx);

      NavigableMap<Long, TransactionCoordinator> coordinatorsForSession = coordinatorsBySession
          .get(lsid);
      if (coordinatorsForSession == null)
        return null;

      // sessions are removed as soon as their last coordinator is
      if (coordinatorsForSession.isEmpty())
        throw new IllegalStateException("Empty coordinator map for session "
            + lsid);

      return coordinatorsForSession.firstEntry();
    } finally {
      lock.unlock();
    }
  }

  // invoked by the coordinator's completion future
  void remove(LogicalSessionId lsid, long txnNumber) {
    lock.lock();
    try {
      if (LOG.isDebugEnabled())
        LOG.debug("Removing coordinator for transaction " + txnNumber
            + " on session " + lsid + " from in-memory catalog");

      NavigableMap<Long, TransactionCoordinator> coordinatorsForSession = coordinatorsBySession
          .get(lsid);
      if (coordinatorsForSession != null) {
        TransactionCoordinator coordinator = coordinatorsForSession
            .remove(txnNumber);
        if (coordinator != null && retainCompletedCoordinators
            && completedSuccessfully(lsid, txnNumber, coordinator)) {
          NavigableMap<Long, TransactionCoordinator> defunct = coordinatorsBySessionDefunct
              .get(lsid);
          if (defunct == null) {
            defunct = newSessionMap();
            coordinatorsBySessionDefunct.put(lsid, defunct);
          }
          defunct.put(txnNumber, coordinator);
        }
        if (coordinatorsForSession.isEmpty())
          coordinatorsBySession.remove(lsid);
      }

      if (coordinatorsBySession.isEmpty()) {
        LOG.debug("Signaling last active coordinator removed");
        noActiveCoordinators.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Opens the step-up gate. Must be called exactly once per catalog, after
   * coordinator recovery has either finished or given up.
   */
  public void exitStepUp(StepUpStatus status) {
    if (status.isOK())
      LOG.info("Incoming coordinateCommit requests are now enabled");
    else
      LOG.warn("Coordinator recovery failed and coordinateCommit requests "
          + "will not be allowed", status.getCause());

    lock.lock();
    try {
      if (stepUpCompletionStatus != null)
        throw new IllegalStateException("Step-up already completed with "
            + stepUpCompletionStatus);
      stepUpCompletionStatus = status;
      stepUpComplete.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until every coordinator in the catalog has completed.
   */
  public void join() throws InterruptedException {
    lock.lock();
    try {
      while (!coordinatorsBySession.isEmpty()) {
        noActiveCoordinators.await(joinLogInterval, TimeUnit.MILLISECONDS);
        if (!coordinatorsBySession.isEmpty()) {
          LOG.info("After " + joinLogInterval + " ms of wait there are still "
              + coordinatorsBySession.size() + " sessions left with active "
              + "coordinators which have not yet completed");
          LOG.info(dump());
        }
      }
    } finally {
      lock.unlock();
    }
  }

  public void setRetainCompletedCoordinators(boolean retain) {
    lock.lock();
    try {
      this.retainCompletedCoordinators = retain;
    } finally {
      lock.unlock();
    }
  }

  public void forgetRetainedCoordinators() {
    lock.lock();
    try {
      coordinatorsBySessionDefunct.clear();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return dump();
    } finally {
      lock.unlock();
    }
  }

  // must hold lock
  private void waitForStepUpToComplete(OperationContext ctx)
      throws IOException {
    ctx.waitForConditionOrInterrupt(stepUpComplete, new Supplier<Boolean>() {
      @Override
      public Boolean get() {
        return stepUpCompletionStatus != null;
      }
    });
    if (!stepUpCompletionStatus.isOK())
      throw new CoordinatorStepUpFailedException(stepUpCompletionStatus);
  }

  // must hold lock
  private String dump() {
    StringBuilder sb = new StringBuilder("[");
    for (Entry<LogicalSessionId, NavigableMap<Long, TransactionCoordinator>> session : coordinatorsBySession
        .entrySet()) {
      sb.append('\n').append(session.getKey()).append(": ");
      for (Long txnNumber : session.getValue().keySet())
        sb.append(txnNumber).append(' ');
    }
    return sb.append(']').toString();
  }

  /*
   * Only coordinators whose decision is already known are retained. A failed
   * decision means the node stepped down or shut down while coordinating, in
   * which case a retry has to go through recovery instead.
   */
  private static boolean completedSuccessfully(LogicalSessionId lsid,
      long txnNumber, TransactionCoordinator coordinator) {
    ListenableFuture<CommitDecision> decision = coordinator.getDecision();
    if (!decision.isDone()) {
      LOG.warn("Coordinator for transaction " + txnNumber + " on session "
          + lsid + " completed without a decision");
      return false;
    }
    try {
      return Futures.getDone(decision) != null;
    } catch (ExecutionException e) {
      return false;
    } catch (CancellationException e) {
      return false;
    }
  }

  private static TransactionCoordinator find(
      Map<LogicalSessionId, NavigableMap<Long, TransactionCoordinator>> coordinators,
      LogicalSessionId lsid, long txnNumber) {
    NavigableMap<Long, TransactionCoordinator> coordinatorsForSession = coordinators
        .get(lsid);
    return coordinatorsForSession == null ? null : coordinatorsForSession
        .get(txnNumber);
  }

  private static NavigableMap<Long, TransactionCoordinator> newSessionMap() {
    return new TreeMap<Long, TransactionCoordinator>(
        Collections.<Long> reverseOrder());
  }

}
