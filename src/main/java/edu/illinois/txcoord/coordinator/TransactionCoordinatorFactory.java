package edu.illinois.txcoord.coordinator;

import edu.illinois.txcoord.session.LogicalSessionId;

public interface TransactionCoordinatorFactory {

  TransactionCoordinator create(LogicalSessionId lsid, long txnNumber);

}
