package com.mimecast.labeller.error;

/**
 * Bad credentials, revoked token or a rejected login.
 */
public class AuthenticationException extends LabellerException {

    public AuthenticationException(String message) {
        super(ErrorKind.AUTHENTICATION, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, message, cause);
    }
}
