package com.rsfleet.repairs.error;

/**
 * The acting user lacks the capability for the requested action:
 * a price override, an override above the approval limit, or a status
 * change reserved for another party.
 */
public class AuthorizationException extends RepairEngineException {

    public AuthorizationException(String message) {
        super(Kind.AUTHORIZATION, message);
    }
}
