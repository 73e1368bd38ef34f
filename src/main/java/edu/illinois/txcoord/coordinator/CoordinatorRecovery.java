package edu.illinois.txcoord.coordinator;

import java.io.IOException;

import edu.illinois.txcoord.catalog.TransactionCoordinatorCatalog;
import edu.illinois.txcoord.util.OperationContext;

/**
 * Rebuilds the coordinators a previous primary left behind. Implementations
 * read whatever durable coordinator state exists and insert one coordinator
 * per unfinished transaction with {@code forStepUp} set, since the catalog
 * gate is still closed while recovery runs.
 */
public interface CoordinatorRecovery {

  void recover(OperationContext ctx, TransactionCoordinatorCatalog catalog)
      throws IOException;

}
