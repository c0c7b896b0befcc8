package com.heronix.beacon.exception;

/**
 * Exception thrown when a credential or device does not exist or belongs to
 * another owner. Both cases produce the same message.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource) {
        super(resource + " not found");
    }
}
