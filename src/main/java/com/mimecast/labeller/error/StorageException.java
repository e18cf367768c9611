package com.mimecast.labeller.error;

/**
 * Local store read or write failed. Writes are rolled back.
 */
public class StorageException extends LabellerException {

    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
