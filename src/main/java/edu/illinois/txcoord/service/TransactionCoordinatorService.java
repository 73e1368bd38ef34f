package edu.illinois.txcoord.service;

import static edu.illinois.txcoord.Constants.DEFAULT_RECOVERY_DELAY;
import static edu.illinois.txcoord.Constants.DEFAULT_SERVICE_THREAD_COUNT;
import static edu.illinois.txcoord.Constants.DEFAULT_SESSION_LOCK_STRIPES;
import static edu.illinois.txcoord.Constants.RECOVERY_DELAY;
import static edu.illinois.txcoord.Constants.SERVICE_THREAD_COUNT;
import static edu.illinois.txcoord.Constants.SESSION_LOCK_STRIPES;

import java.io.IOException;
import java.util.Map.Entry;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.Striped;
import com.google.common.util.concurrent.ListeningScheduledExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import edu.illinois.txcoord.catalog.StepUpStatus;
import edu.illinois.txcoord.catalog.TransactionCoordinatorCatalog;
import edu.illinois.txcoord.coordinator.CommitDecision;
import edu.illinois.txcoord.coordinator.CoordinatorRecovery;
import edu.illinois.txcoord.coordinator.TransactionCoordinator;
import edu.illinois.txcoord.coordinator.TransactionCoordinatorFactory;
import edu.illinois.txcoord.session.LogicalSessionId;
import edu.illinois.txcoord.util.OperationContext;

/**
 * Owns the coordinator catalog of this node across role changes. Each term
 * as primary gets a fresh catalog whose gate opens once the coordinators of
 * the previous primary have been recovered. On step-down the catalog is kept
 * until the next step-up or shutdown has waited for it to drain.
 */
public class TransactionCoordinatorService {

  private static final Log LOG = LogFactory
      .getLog(TransactionCoordinatorService.class);

  private final Configuration conf;
  private final TransactionCoordinatorFactory factory;
  private final CoordinatorRecovery recovery;
  private final ListeningScheduledExecutorService pool;
  private final long recoveryDelay;
  // serializes lookup and insert of coordinators on the same session
  private final Striped<Lock> sessionLocks;

  // catalog of the current term, null while not primary
  private TransactionCoordinatorCatalog catalog;
  // catalog and recovery task of the last term, until drained
  private TransactionCoordinatorCatalog previousCatalog;
  private Future<?> previousRecovery;
  private Future<?> recoveryTask;
  private boolean shutdown;

  public TransactionCoordinatorService(Configuration conf,
      TransactionCoordinatorFactory factory, CoordinatorRecovery recovery) {
    this.conf = conf;
    this.factory = factory;
    this.recovery = recovery;
    int count = conf.getInt(SERVICE_THREAD_COUNT,
        DEFAULT_SERVICE_THREAD_COUNT);
    this.pool = MoreExecutors.listeningDecorator(Executors
        .newScheduledThreadPool(count));
    this.recoveryDelay = conf.getLong(RECOVERY_DELAY, DEFAULT_RECOVERY_DELAY);
    this.sessionLocks = Striped.lock(conf.getInt(SESSION_LOCK_STRIPES,
        DEFAULT_SESSION_LOCK_STRIPES));
  }

  /**
   * Starts a new term as primary. Waits for the previous term's coordinators
   * to drain, then schedules recovery of coordinators left by the previous
   * primary. Lookups on the new catalog block until recovery is done.
   */
  public synchronized void onStepUp() throws InterruptedException {
    if (shutdown)
      throw new IllegalStateException("Coordinator service shut down");
    if (catalog != null)
      throw new IllegalStateException("Already primary");
    joinPreviousRound();

    final TransactionCoordinatorCatalog newCatalog = new TransactionCoordinatorCatalog(
        conf);
    LOG.info("Scheduling coordinator recovery in " + recoveryDelay + " ms");
    recoveryTask = pool.schedule(new Runnable() {
      @Override
      public void run() {
        StepUpStatus status;
        try {
          recovery.recover(new OperationContext(), newCatalog);
          status = StepUpStatus.ok();
        } catch (IOException e) {
          status = StepUpStatus.failed(e);
        } catch (RuntimeException e) {
          status = StepUpStatus.failed(e);
        }
        newCatalog.exitStepUp(status);
      }
    }, recoveryDelay, TimeUnit.MILLISECONDS);
    catalog = newCatalog;
  }

  /**
   * Ends the current term. Coordinators in flight keep running and are
   * waited for on the next step-up or on shutdown.
   */
  public synchronized void onStepDown() {
    if (catalog == null)
      return;
    LOG.info("Stepping down coordinator catalog " + catalog);
    previousCatalog = catalog;
    previousRecovery = recoveryTask;
    catalog = null;
    recoveryTask = null;
  }

  /**
   * Creates a coordinator for the transaction unless the session already has
   * one for the same transaction number. A coordinator for an older
   * transaction on the session is cancelled if its commit has not started.
   */
  public void createCoordinator(OperationContext ctx, LogicalSessionId lsid,
      long txnNumber) throws IOException {
    TransactionCoordinatorCatalog current = getCatalog();

    Lock sessionLock = sessionLocks.get(lsid);
    sessionLock.lock();
    try {
      Entry<Long, TransactionCoordinator> latest = current
          .getLatestOnSession(ctx, lsid);
      if (latest != null) {
        long latestTxnNumber = latest.getKey();
        if (latestTxnNumber == txnNumber)
          return;
        if (latestTxnNumber > txnNumber)
          throw new StaleTransactionException("Transaction " + txnNumber
              + " on session " + lsid + " is older than transaction "
              + latestTxnNumber + " which is already coordinating");
        latest.getValue().cancelIfCommitNotYetStarted();
      }

      TransactionCoordinator coordinator = factory.create(lsid, txnNumber);
      current.insert(ctx, lsid, txnNumber, coordinator, false);
    } finally {
      sessionLock.unlock();
    }
  }

  /**
   * @return the decision of the transaction's coordinator, or null if this
   *         node has no coordinator for it
   */
  public ListenableFuture<CommitDecision> coordinateCommit(
      OperationContext ctx, LogicalSessionId lsid, long txnNumber)
      throws IOException {
    TransactionCoordinator coordinator = getCatalog().get(ctx, lsid,
        txnNumber);
    if (coordinator == null)
      return null;
    return coordinator.getDecision();
  }

  /**
   * Steps down and waits for every coordinator to complete.
   */
  public void shutdown() throws InterruptedException {
    synchronized (this) {
      if (shutdown)
        return;
      shutdown = true;
      onStepDown();
      joinPreviousRound();
    }
    pool.shutdown();
    pool.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
  }

  synchronized TransactionCoordinatorCatalog getCatalog() {
    if (catalog == null)
      throw new IllegalStateException("Not primary");
    return catalog;
  }

  // must hold monitor
  private void joinPreviousRound() throws InterruptedException {
    if (previousCatalog == null)
      return;
    // recovery may still be inserting into the previous catalog
    if (previousRecovery != null) {
      try {
        previousRecovery.get();
      } catch (ExecutionException e) {
        LOG.warn("Coordinator recovery of previous term failed", e.getCause());
      } catch (CancellationException e) {
        LOG.debug("Coordinator recovery of previous term cancelled");
      }
    }
    LOG.info("Waiting for coordinators of previous term to complete");
    previousCatalog.join();
    previousCatalog = null;
    previousRecovery = null;
  }

}
