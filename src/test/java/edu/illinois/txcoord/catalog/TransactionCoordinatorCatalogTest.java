package edu.illinois.txcoord.catalog;

import static edu.illinois.txcoord.test.Waiter.assertBlocked;
import static edu.illinois.txcoord.test.Waiter.assertReturns;

import java.io.IOException;
import java.util.Map.Entry;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import junit.framework.Assert;

import org.apache.hadoop.conf.Configuration;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import edu.illinois.txcoord.Constants;
import edu.illinois.txcoord.coordinator.CommitDecision;
import edu.illinois.txcoord.coordinator.TransactionCoordinator;
import edu.illinois.txcoord.session.LogicalSessionId;
import edu.illinois.txcoord.test.ControllableCoordinator;
import edu.illinois.txcoord.util.OperationContext;
import edu.illinois.txcoord.util.OperationInterruptedException;

public class TransactionCoordinatorCatalogTest {

  private TransactionCoordinatorCatalog catalog;
  private OperationContext ctx;
  private ExecutorService pool;
  private LogicalSessionId s1;
  private LogicalSessionId s2;

  @Before
  public void before() {
    Configuration conf = new Configuration(false);
    conf.setLong(Constants.CATALOG_JOIN_LOG_INTERVAL, 50);
    catalog = new TransactionCoordinatorCatalog(conf);
    ctx = new OperationContext();
    pool = Executors.newCachedThreadPool();
    s1 = LogicalSessionId.generate();
    s2 = LogicalSessionId.generate();
  }

  @After
  public void after() {
    pool.shutdownNow();
  }

  @Test
  public void testGetAndLatestOnSession() throws IOException {
    catalog.exitStepUp(StepUpStatus.ok());
    ControllableCoordinator c5 = new ControllableCoordinator();
    ControllableCoordinator c7 = new ControllableCoordinator();
    // insert out of order to make sure latest does not depend on it
    catalog.insert(ctx, s1, 7, c7, false);
    catalog.insert(ctx, s1, 5, c5, false);

    Assert.assertSame(c5, catalog.get(ctx, s1, 5));
    Assert.assertSame(c7, catalog.get(ctx, s1, 7));
    Assert.assertNull(catalog.get(ctx, s1, 6));
    Assert.assertNull(catalog.get(ctx, s2, 5));

    Entry<Long, TransactionCoordinator> latest = catalog.getLatestOnSession(
        ctx, s1);
    Assert.assertEquals(Long.valueOf(7), latest.getKey());
    Assert.assertSame(c7, latest.getValue());
    Assert.assertNull(catalog.getLatestOnSession(ctx, s2));
  }

  @Test
  public void testLatestMovesBackWhenNewestCompletes() throws IOException {
    catalog.exitStepUp(StepUpStatus.ok());
    ControllableCoordinator c5 = new ControllableCoordinator();
    ControllableCoordinator c7 = new ControllableCoordinator();
    catalog.insert(ctx, s1, 5, c5, false);
    catalog.insert(ctx, s1, 7, c7, false);

    c7.decide(CommitDecision.COMMIT);
    Entry<Long, TransactionCoordinator> latest = catalog.getLatestOnSession(
        ctx, s1);
    Assert.assertEquals(Long.valueOf(5), latest.getKey());
    Assert.assertSame(c5, latest.getValue());
  }

  @Test
  public void testDuplicateInsertFails() throws IOException {
    catalog.exitStepUp(StepUpStatus.ok());
    ControllableCoordinator first = new ControllableCoordinator();
    catalog.insert(ctx, s1, 1, first, false);
    try {
      catalog.insert(ctx, s1, 1, new ControllableCoordinator(), false);
      Assert.fail("duplicate insert should fail");
    } catch (IllegalStateException e) {
      // expected
    }
    Assert.assertSame(first, catalog.get(ctx, s1, 1));
  }

  @Test
  public void testCompletedCoordinatorIsRemoved() throws IOException {
    catalog.exitStepUp(StepUpStatus.ok());
    ControllableCoordinator c1 = new ControllableCoordinator();
    ControllableCoordinator c2 = new ControllableCoordinator();
    catalog.insert(ctx, s1, 1, c1, false);
    catalog.insert(ctx, s2, 1, c2, false);

    c1.decide(CommitDecision.COMMIT);
    c2.fail(new IOException("stepped down"));

    Assert.assertNull(catalog.get(ctx, s1, 1));
    Assert.assertNull(catalog.get(ctx, s2, 1));
    Assert.assertNull(catalog.getLatestOnSession(ctx, s1));
    Assert.assertEquals("[]", catalog.toString());
  }

  @Test
  public void testAlreadyCompletedCoordinatorIsRemovedOnInsert()
      throws IOException {
    catalog.exitStepUp(StepUpStatus.ok());
    ControllableCoordinator c1 = new ControllableCoordinator();
    c1.decide(CommitDecision.ABORT);
    catalog.insert(ctx, s1, 1, c1, false);
    Assert.assertNull(catalog.get(ctx, s1, 1));
    Assert.assertNull(catalog.getLatestOnSession(ctx, s1));
  }

  @Test
  public void testRetainCompletedCoordinators() throws IOException {
    catalog.setRetainCompletedCoordinators(true);
    catalog.exitStepUp(StepUpStatus.ok());
    ControllableCoordinator committed = new ControllableCoordinator();
    ControllableCoordinator aborted = new ControllableCoordinator();
    ControllableCoordinator failed = new ControllableCoordinator();
    catalog.insert(ctx, s1, 1, committed, false);
    catalog.insert(ctx, s1, 2, aborted, false);
    catalog.insert(ctx, s1, 3, failed, false);

    committed.decide(CommitDecision.COMMIT);
    aborted.decide(CommitDecision.ABORT);
    failed.fail(new IOException("shutting down"));

    Assert.assertSame(committed, catalog.get(ctx, s1, 1));
    Assert.assertSame(aborted, catalog.get(ctx, s1, 2));
    Assert.assertNull(catalog.get(ctx, s1, 3));
    // retained coordinators are not active
    Assert.assertNull(catalog.getLatestOnSession(ctx, s1));

    catalog.forgetRetainedCoordinators();
    Assert.assertNull(catalog.get(ctx, s1, 1));
  }

  @Test
  public void testRetainedCoordinatorsHiddenWhenRetentionDisabled()
      throws IOException {
    Configuration conf = new Configuration(false);
    conf.setBoolean(Constants.CATALOG_RETAIN_COMPLETED, true);
    catalog = new TransactionCoordinatorCatalog(conf);
    catalog.exitStepUp(StepUpStatus.ok());
    ControllableCoordinator c1 = new ControllableCoordinator();
    catalog.insert(ctx, s1, 1, c1, false);
    c1.decide(CommitDecision.COMMIT);
    Assert.assertSame(c1, catalog.get(ctx, s1, 1));

    catalog.setRetainCompletedCoordinators(false);
    Assert.assertNull(catalog.get(ctx, s1, 1));
  }

  @Test
  public void testRemoveAbsentIsNoop() throws IOException {
    catalog.exitStepUp(StepUpStatus.ok());
    catalog.remove(s1, 3);

    ControllableCoordinator c1 = new ControllableCoordinator();
    ControllableCoordinator c2 = new ControllableCoordinator();
    catalog.insert(ctx, s1, 1, c1, false);
    catalog.insert(ctx, s1, 2, c2, false);
    catalog.remove(s1, 1);
    catalog.remove(s1, 1);
    catalog.remove(s1, 5);

    Assert.assertNull(catalog.get(ctx, s1, 1));
    Assert.assertSame(c2, catalog.get(ctx, s1, 2));
    // completion after an explicit remove is also a no-op
    c1.decide(CommitDecision.COMMIT);
    Assert.assertSame(c2, catalog.getLatestOnSession(ctx, s1).getValue());
  }

  @Test
  public void testJoinReturnsWhenLastCoordinatorCompletes() throws Exception {
    catalog.exitStepUp(StepUpStatus.ok());
    ControllableCoordinator c1 = new ControllableCoordinator();
    ControllableCoordinator c2 = new ControllableCoordinator();
    catalog.insert(ctx, s1, 1, c1, false);
    catalog.insert(ctx, s2, 1, c2, false);

    Future<Void> join = pool.submit(new Callable<Void>() {
      @Override
      public Void call() throws Exception {
        catalog.join();
        return null;
      }
    });
    assertBlocked(join);
    c1.decide(CommitDecision.COMMIT);
    assertBlocked(join);
    c2.fail(new IOException("stepped down"));
    assertReturns(join);
  }

  @Test
  public void testJoinOnEmptyCatalog() throws InterruptedException {
    // gate state does not matter for draining
    catalog.join();
  }

  @Test
  public void testGatedCallsBlockUntilStepUpCompletes() throws Exception {
    final ControllableCoordinator c1 = new ControllableCoordinator();
    Future<Void> insert = pool.submit(new Callable<Void>() {
      @Override
      public Void call() throws Exception {
        catalog.insert(new OperationContext(), s1, 1, c1, false);
        return null;
      }
    });
    Future<TransactionCoordinator> get = pool
        .submit(new Callable<TransactionCoordinator>() {
          @Override
          public TransactionCoordinator call() throws Exception {
            return catalog.get(new OperationContext(), s2, 1);
          }
        });
    Future<Entry<Long, TransactionCoordinator>> latest = pool
        .submit(new Callable<Entry<Long, TransactionCoordinator>>() {
          @Override
          public Entry<Long, TransactionCoordinator> call() throws Exception {
            return catalog.getLatestOnSession(new OperationContext(), s2);
          }
        });

    assertBlocked(insert);
    assertBlocked(get);
    assertBlocked(latest);

    catalog.exitStepUp(StepUpStatus.ok());
    assertReturns(insert);
    Assert.assertNull(assertReturns(get));
    Assert.assertNull(assertReturns(latest));
    Assert.assertSame(c1, catalog.get(ctx, s1, 1));
  }

  @Test
  public void testStepUpFailureIsPropagated() throws Exception {
    Future<Void> insert = pool.submit(new Callable<Void>() {
      @Override
      public Void call() throws Exception {
        catalog.insert(new OperationContext(), s1, 2,
            new ControllableCoordinator(), false);
        return null;
      }
    });
    Future<TransactionCoordinator> get = pool
        .submit(new Callable<TransactionCoordinator>() {
          @Override
          public TransactionCoordinator call() throws Exception {
            return catalog.get(new OperationContext(), s1, 1);
          }
        });
    Future<Entry<Long, TransactionCoordinator>> latest = pool
        .submit(new Callable<Entry<Long, TransactionCoordinator>>() {
          @Override
          public Entry<Long, TransactionCoordinator> call() throws Exception {
            return catalog.getLatestOnSession(new OperationContext(), s1);
          }
        });
    assertBlocked(insert);
    assertBlocked(get);
    assertBlocked(latest);

    IOException cause = new IOException("could not read coordinator docs");
    catalog.exitStepUp(StepUpStatus.failed(cause));
    assertStepUpFailure(insert, cause);
    assertStepUpFailure(get, cause);
    assertStepUpFailure(latest, cause);

    // later calls keep failing
    try {
      catalog.get(ctx, s1, 1);
      Assert.fail("get should fail after failed step-up");
    } catch (CoordinatorStepUpFailedException e) {
      Assert.assertSame(cause, e.getStatus().getCause());
    }
    // nothing was inserted
    Assert.assertEquals("[]", catalog.toString());
  }

  private static void assertStepUpFailure(Future<?> call, Throwable cause)
      throws Exception {
    try {
      call.get(5, TimeUnit.SECONDS);
      Assert.fail("call should fail with the recovery failure");
    } catch (ExecutionException e) {
      Assert.assertTrue(e.getCause() instanceof CoordinatorStepUpFailedException);
      CoordinatorStepUpFailedException failure = (CoordinatorStepUpFailedException) e
          .getCause();
      Assert.assertSame(cause, failure.getStatus().getCause());
    }
  }

  @Test
  public void testInsertForStepUpBypassesGate() throws Exception {
    ControllableCoordinator recovered = new ControllableCoordinator();
    catalog.insert(ctx, s1, 4, recovered, true);
    Assert.assertTrue(catalog.toString().contains("4"));

    catalog.exitStepUp(StepUpStatus.ok());
    Assert.assertSame(recovered, catalog.get(ctx, s1, 4));
  }

  @Test
  public void testExitStepUpTwiceFails() {
    catalog.exitStepUp(StepUpStatus.ok());
    try {
      catalog.exitStepUp(StepUpStatus.ok());
      Assert.fail("second exitStepUp should fail");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testKilledContextInterruptsGateWait() throws Exception {
    final OperationContext killable = new OperationContext();
    Future<TransactionCoordinator> get = pool
        .submit(new Callable<TransactionCoordinator>() {
          @Override
          public TransactionCoordinator call() throws Exception {
            return catalog.get(killable, s1, 1);
          }
        });
    assertBlocked(get);
    killable.kill();
    try {
      get.get(5, TimeUnit.SECONDS);
      Assert.fail("killed wait should fail");
    } catch (ExecutionException e) {
      Assert.assertTrue(e.getCause() instanceof OperationInterruptedException);
    }

    // the catalog is unaffected
    catalog.exitStepUp(StepUpStatus.ok());
    catalog.insert(ctx, s1, 1, new ControllableCoordinator(), false);
    Assert.assertNotNull(catalog.get(ctx, s1, 1));
  }

  @Test
  public void testDeadlineInterruptsGateWait() throws IOException {
    OperationContext expiring = new OperationContext(50,
        TimeUnit.MILLISECONDS);
    try {
      catalog.getLatestOnSession(expiring, s1);
      Assert.fail("wait should time out");
    } catch (OperationInterruptedException e) {
      // expected
    }
  }

  @Test
  public void testToString() throws IOException {
    catalog.exitStepUp(StepUpStatus.ok());
    catalog.insert(ctx, s1, 5, new ControllableCoordinator(), false);
    catalog.insert(ctx, s1, 7, new ControllableCoordinator(), false);
    catalog.insert(ctx, s2, 1, new ControllableCoordinator(), false);

    String dump = catalog.toString();
    Assert.assertTrue(dump.startsWith("["));
    Assert.assertTrue(dump.endsWith("]"));
    Assert.assertTrue(dump.contains(s1 + ": 7 5 "));
    Assert.assertTrue(dump.contains(s2 + ": 1 "));
  }

}
