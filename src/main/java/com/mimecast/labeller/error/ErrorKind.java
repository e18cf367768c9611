package com.mimecast.labeller.error;

/**
 * Stable error kinds reported to users and logs.
 */
public enum ErrorKind {
    AUTHENTICATION,
    CONNECTION,
    RATE_LIMITED,
    VALIDATION,
    DATA_INTEGRITY,
    RESOURCE_EXHAUSTED,
    STORAGE
}
