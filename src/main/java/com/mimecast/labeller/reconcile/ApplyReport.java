package com.mimecast.labeller.reconcile;

/**
 * Outcome of applying approved suggestions.
 */
public class ApplyReport {

    private int applied;
    private int remoteFailures;
    private int pendingReconciliation;
    private int skipped;

    void applied() {
        applied++;
    }

    void remoteFailure() {
        remoteFailures++;
    }

    void pendingReconciliation() {
        pendingReconciliation++;
    }

    void skipped() {
        skipped++;
    }

    public int getApplied() {
        return applied;
    }

    /**
     * Gets suggestions whose remote call failed. They stay APPROVED.
     *
     * @return Count.
     */
    public int getRemoteFailures() {
        return remoteFailures;
    }

    /**
     * Gets suggestions applied remotely whose local update failed; their audit entries are
     * unsynced until reconciled.
     *
     * @return Count.
     */
    public int getPendingReconciliation() {
        return pendingReconciliation;
    }

    public int getSkipped() {
        return skipped;
    }

    public boolean isClean() {
        return remoteFailures == 0 && pendingReconciliation == 0 && skipped == 0;
    }

    @Override
    public String toString() {
        return "ApplyReport{applied=" + applied +
                ", remoteFailures=" + remoteFailures +
                ", pendingReconciliation=" + pendingReconciliation +
                ", skipped=" + skipped + "}";
    }
}
