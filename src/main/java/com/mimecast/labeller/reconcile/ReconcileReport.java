package com.mimecast.labeller.reconcile;

import com.mimecast.labeller.store.domain.AuditResolution;

import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of one reconciliation pass.
 */
public class ReconcileReport {

    private final Map<AuditResolution, Integer> resolutions = new EnumMap<>(AuditResolution.class);
    private int examined;
    private int remoteChecks;
    private int failures;

    void examined() {
        examined++;
    }

    void remoteCheck() {
        remoteChecks++;
    }

    void resolved(AuditResolution resolution) {
        resolutions.merge(resolution, 1, Integer::sum);
    }

    void failed() {
        failures++;
    }

    public int getExamined() {
        return examined;
    }

    /**
     * Gets read-only remote lookups made. Reconciliation never mutates the remote.
     *
     * @return Count.
     */
    public int getRemoteChecks() {
        return remoteChecks;
    }

    public int getResolved(AuditResolution resolution) {
        return resolutions.getOrDefault(resolution, 0);
    }

    /**
     * Gets entries left unsynced because the check failed.
     *
     * @return Count.
     */
    public int getFailures() {
        return failures;
    }

    public boolean isClean() {
        return failures == 0;
    }

    @Override
    public String toString() {
        return "ReconcileReport{examined=" + examined +
                ", remoteChecks=" + remoteChecks +
                ", resolutions=" + resolutions +
                ", failures=" + failures + "}";
    }
}
