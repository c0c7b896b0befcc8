package com.heronix.beacon.exception;

/**
 * Exception thrown when an agent request carries no usable credential.
 *
 * The reason is for server logs only. Callers always receive {@link #PUBLIC_MESSAGE}.
 */
public class AgentAuthenticationException extends RuntimeException {

    public static final String PUBLIC_MESSAGE = "Invalid or missing agent credential";

    public AgentAuthenticationException(String reason) {
        super(reason);
    }
}
