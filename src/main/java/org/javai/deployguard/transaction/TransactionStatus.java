package org.javai.deployguard.transaction;

public enum TransactionStatus {
    ACTIVE,
    COMMITTED,
    ROLLED_BACK,
    /** Rollback was requested but cleanup is switched off; resources were left in place. */
    ROLLBACK_DISABLED;

    public boolean isFinished() {
        return this != ACTIVE;
    }
}
