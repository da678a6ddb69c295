package com.example.agentpayments.peer;

/**
 * The registry could not answer: timeout, connection failure, non-2xx other than 404, or a malformed body.
 */
public class RegistryUnavailableException extends RuntimeException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
