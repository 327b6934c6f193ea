package com.warden.authz.codec;

/**
 * Thrown when a policy document cannot be read or written.
 */
public class PolicyDocumentException extends RuntimeException {

    public PolicyDocumentException(String message) {
        super(message);
    }

    public PolicyDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
