package com.heronix.beacon.exception;

/**
 * Exception thrown when a binding operation does not apply to the credential's
 * current state, e.g. approving a credential no agent has connected with.
 */
public class BindingStateException extends RuntimeException {

    public BindingStateException(String message) {
        super(message);
    }
}
