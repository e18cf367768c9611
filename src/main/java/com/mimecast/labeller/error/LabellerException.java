package com.mimecast.labeller.error;

/**
 * Base exception carrying a stable error kind.
 */
public class LabellerException extends RuntimeException {

    private final ErrorKind kind;

    public LabellerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LabellerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets error kind.
     *
     * @return ErrorKind.
     */
    public ErrorKind getKind() {
        return kind;
    }
}
