package com.rsfleet.repairs.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Workflow state of a single Repair.
 *
 * Transitions:
 *   REQUESTED   → APPROVED              (manager assigns a technician)
 *   PENDING     → APPROVED | DENIED     (owning customer decides)
 *   APPROVED    → IN_PROGRESS           (technician starts work)
 *   IN_PROGRESS → COMPLETED             (technician finishes work)
 *
 * DENIED and COMPLETED are terminal.
 */
public enum RepairStatus {
    REQUESTED,
    PENDING,
    APPROVED,
    IN_PROGRESS,
    COMPLETED,
    DENIED;

    /** States reachable from this one in a single step. */
    public Set<RepairStatus> successors() {
        return switch (this) {
            case REQUESTED   -> EnumSet.of(APPROVED);
            case PENDING     -> EnumSet.of(APPROVED, DENIED);
            case APPROVED    -> EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS -> EnumSet.of(COMPLETED);
            case COMPLETED, DENIED -> EnumSet.noneOf(RepairStatus.class);
        };
    }

    public boolean canTransitionTo(RepairStatus target) {
        return successors().contains(target);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    /**
     * Whether a repair may be created directly in this state for the given origin.
     * Customer requests always start REQUESTED; field repairs start PENDING or APPROVED.
     */
    public boolean isInitialFor(RepairOrigin origin) {
        return switch (origin) {
            case CUSTOMER -> this == REQUESTED;
            case FIELD    -> this == PENDING || this == APPROVED;
        };
    }
}
