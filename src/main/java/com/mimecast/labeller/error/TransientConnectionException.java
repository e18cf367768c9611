package com.mimecast.labeller.error;

/**
 * Timeout, reset or unreachable server. Retried with backoff.
 */
public class TransientConnectionException extends LabellerException {

    public TransientConnectionException(String message) {
        super(ErrorKind.CONNECTION, message);
    }

    public TransientConnectionException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
    }
}
