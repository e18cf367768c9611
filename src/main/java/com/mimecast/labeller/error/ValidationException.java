package com.mimecast.labeller.error;

/**
 * Malformed input or an illegal state transition. Nothing is applied.
 */
public class ValidationException extends LabellerException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
