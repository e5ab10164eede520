package io.fullerstack.rmw.event.status;

/**
 * Raised when a status payload cannot be encoded or decoded.
 */
public class StatusPayloadException extends RuntimeException {

    public StatusPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
