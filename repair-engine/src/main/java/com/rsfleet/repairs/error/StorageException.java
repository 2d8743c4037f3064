package com.rsfleet.repairs.error;

/**
 * The database rejected a write part-way through a unit of work.
 * Every row written by that unit of work, counter increments included, is rolled back.
 */
public class StorageException extends RepairEngineException {

    public StorageException(String message, Throwable cause) {
        super(Kind.PERSISTENCE, message, cause);
    }
}
