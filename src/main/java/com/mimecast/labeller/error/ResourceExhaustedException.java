package com.mimecast.labeller.error;

/**
 * A bounded resource such as the session cap is full.
 */
public class ResourceExhaustedException extends LabellerException {

    public ResourceExhaustedException(String message) {
        super(ErrorKind.RESOURCE_EXHAUSTED, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(ErrorKind.RESOURCE_EXHAUSTED, message, cause);
    }
}
