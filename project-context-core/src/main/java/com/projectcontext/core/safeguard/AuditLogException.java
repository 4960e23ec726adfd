package com.projectcontext.core.safeguard;

/**
 * An audit record could not be written. The decision it belonged to is void.
 */
public class AuditLogException extends RuntimeException {

    public AuditLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
