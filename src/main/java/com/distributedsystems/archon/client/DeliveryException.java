package com.distributedsystems.archon.client;

/**
 * A coordinator call that did not succeed. Always retryable from the outbox's point of view.
 */
public class DeliveryException extends Exception {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
