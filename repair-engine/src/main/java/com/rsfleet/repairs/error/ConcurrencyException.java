package com.rsfleet.repairs.error;

/**
 * The unit counter row could not be locked in time, or the database
 * aborted the transaction because of a concurrent writer.
 *
 * Nothing was persisted, so the caller may resubmit the same request.
 */
public class ConcurrencyException extends RepairEngineException {

    public ConcurrencyException(String message, Throwable cause) {
        super(Kind.CONCURRENCY, message, cause);
    }

    @Override
    public boolean isRetryable() { return true; }
}
