package com.rsfleet.repairs.error;

/**
 * Missing or invalid input. Always raised before anything is written.
 */
public class ValidationException extends RepairEngineException {

    public ValidationException(String message) {
        super(Kind.VALIDATION, message);
    }
}
