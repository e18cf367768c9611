package com.mimecast.labeller.error;

/**
 * Local and remote state disagree. Repaired by reconciliation.
 */
public class DataIntegrityException extends LabellerException {

    public DataIntegrityException(String message) {
        super(ErrorKind.DATA_INTEGRITY, message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(ErrorKind.DATA_INTEGRITY, message, cause);
    }
}
