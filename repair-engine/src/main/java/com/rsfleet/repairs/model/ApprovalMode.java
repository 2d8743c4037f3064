package com.rsfleet.repairs.model;

/**
 * Customer-level policy for field-discovered repairs.
 */
public enum ApprovalMode {
    AUTO_APPROVE,       // every field repair starts APPROVED
    REQUIRE_APPROVAL,   // every field repair waits for the customer (PENDING)
    UNIT_THRESHOLD      // the first N breaks of a batch are APPROVED, the rest PENDING
}
