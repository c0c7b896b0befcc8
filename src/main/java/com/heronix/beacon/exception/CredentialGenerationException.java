package com.heronix.beacon.exception;

/**
 * Exception thrown when a credential secret cannot be generated.
 */
public class CredentialGenerationException extends RuntimeException {

    public CredentialGenerationException(String message) {
        super(message);
    }
}
