package edu.illinois.txcoord.util;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;

import com.google.common.base.Supplier;

/**
 * Per-request execution context. Carries an optional deadline and can be
 * killed from another thread, which makes any wait performed through
 * {@link #waitForConditionOrInterrupt(Condition, Supplier)} return early.
 */
public class OperationContext {

  // longest timeout honoured; deadlines are compared by nanoTime difference,
  // which is only meaningful below 2^63 ns
  private static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE / 2;

  private final boolean hasDeadline;
  private final long deadline;
  private volatile boolean killed;
  // thread currently blocked in a wait on behalf of this context, guarded by
  // this
  private Thread waiter;

  public OperationContext() {
    this.hasDeadline = false;
    this.deadline = 0L;
  }

  public OperationContext(long timeout, TimeUnit unit) {
    this.hasDeadline = true;
    this.deadline = System.nanoTime()
        + Math.min(unit.toNanos(timeout), MAX_TIMEOUT_NANOS);
  }

  public boolean hasDeadline() {
    return hasDeadline;
  }

  public boolean isKilled() {
    return killed;
  }

  /**
   * Marks this context killed and wakes a thread waiting on its behalf.
   */
  public synchronized void kill() {
    killed = true;
    if (waiter != null)
      waiter.interrupt();
  }

  public void checkForInterrupt() throws OperationInterruptedException {
    if (killed)
      throw new OperationInterruptedException("operation was killed");
    if (hasDeadline() && deadline - System.nanoTime() <= 0)
      throw new OperationInterruptedException("operation exceeded time limit");
  }

  /**
   * Waits on the given condition until the predicate holds. The caller must
   * hold the lock the condition belongs to; it is held again on every exit,
   * normal or exceptional.
   */
  public void waitForConditionOrInterrupt(Condition condition,
      Supplier<Boolean> predicate) throws OperationInterruptedException {
    synchronized (this) {
      waiter = Thread.currentThread();
    }
    try {
      while (!predicate.get()) {
        checkForInterrupt();
        try {
          if (hasDeadline())
            condition.awaitNanos(deadline - System.nanoTime());
          else
            condition.await();
        } catch (InterruptedException e) {
          if (killed)
            throw new OperationInterruptedException("operation was killed", e);
          Thread.currentThread().interrupt();
          throw new OperationInterruptedException("thread was interrupted", e);
        }
      }
    } finally {
      synchronized (this) {
        waiter = null;
      }
      // a kill may have interrupted this thread after the wait was decided
      if (killed)
        Thread.interrupted();
    }
  }

}
