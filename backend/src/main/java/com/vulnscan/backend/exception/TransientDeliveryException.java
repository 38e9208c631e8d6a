package com.vulnscan.backend.exception;

/**
 * Delivery to an external collaborator (engine channel, webhook endpoint) failed and may succeed later.
 */
public class TransientDeliveryException extends RuntimeException {
    public TransientDeliveryException(String message) {
        super(message);
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
