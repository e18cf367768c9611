package com.mimecast.labeller.batch;

import com.mimecast.labeller.error.ValidationException;

/**
 * Parameters of a new classification run.
 */
public final class RunRequest {

    private final String principal;
    private final String folder;
    private final Integer limit;
    private final boolean applyMode;

    /**
     * Constructs a new RunRequest instance.
     *
     * @param principal Mailbox principal.
     * @param folder    Folder to classify.
     * @param limit     Maximum items, or null until the folder is exhausted.
     * @param applyMode Approve and apply confident suggestions when the run completes.
     */
    public RunRequest(String principal, String folder, Integer limit, boolean applyMode) {
        if (limit != null && limit < 1) {
            throw new ValidationException("Limit must be positive, got " + limit);
        }
        this.principal = principal;
        this.folder = folder;
        this.limit = limit;
        this.applyMode = applyMode;
    }

    public String getPrincipal() {
        return principal;
    }

    public String getFolder() {
        return folder;
    }

    public Integer getLimit() {
        return limit;
    }

    public boolean isApplyMode() {
        return applyMode;
    }
}
