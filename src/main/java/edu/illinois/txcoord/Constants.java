package edu.illinois.txcoord;

import static java.util.concurrent.TimeUnit.SECONDS;

public interface Constants {

  // catalog configuration properties

  public static final String CATALOG_JOIN_LOG_INTERVAL = "txcoord.catalog.join.log.interval";

  public static final long DEFAULT_CATALOG_JOIN_LOG_INTERVAL = SECONDS.toMillis(5);

  // keeps successfully completed coordinators around for inspection
  public static final String CATALOG_RETAIN_COMPLETED = "txcoord.catalog.retain.completed";

  public static final boolean DEFAULT_CATALOG_RETAIN_COMPLETED = false;

  // coordinator service configuration properties

  public static final String SERVICE_THREAD_COUNT = "txcoord.service.thread.count";

  public static final int DEFAULT_SERVICE_THREAD_COUNT = 2;

  public static final String SESSION_LOCK_STRIPES = "txcoord.service.session.lock.stripes";

  public static final int DEFAULT_SESSION_LOCK_STRIPES = 64;

  public static final String RECOVERY_DELAY = "txcoord.recovery.delay";

  public static final long DEFAULT_RECOVERY_DELAY = 0L;

}
