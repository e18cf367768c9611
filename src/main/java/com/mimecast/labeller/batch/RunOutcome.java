package com.mimecast.labeller.batch;

import com.mimecast.labeller.reconcile.ApplyReport;
import com.mimecast.labeller.store.domain.ProcessingRun;

import java.util.Optional;

/**
 * Run after processing, with the apply report when apply mode ran.
 */
public final class RunOutcome {

    private final ProcessingRun run;
    private final ApplyReport applyReport;

    public RunOutcome(ProcessingRun run, ApplyReport applyReport) {
        this.run = run;
        this.applyReport = applyReport;
    }

    public ProcessingRun getRun() {
        return run;
    }

    public Optional<ApplyReport> getApplyReport() {
        return Optional.ofNullable(applyReport);
    }
}
