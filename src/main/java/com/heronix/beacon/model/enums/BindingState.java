package com.heronix.beacon.model.enums;

/**
 * Persisted state of the binding between a credential and an agent installation.
 */
public enum BindingState {

    /**
     * No agent has connected with the credential since it was issued or last rejected
     */
    UNBOUND,

    /**
     * Bound to an installation, awaiting approval by the owner
     */
    PENDING,

    /**
     * Bound and approved
     */
    APPROVED
}
