package com.rsfleet.repairs.model;

/**
 * Who created a Repair.
 *
 * CUSTOMER repairs are requests from the fleet owner and wait for a manager
 * to assign them. FIELD repairs are damage found on site by a technician and
 * go through the customer's approval policy.
 */
public enum RepairOrigin {
    CUSTOMER,
    FIELD
}
