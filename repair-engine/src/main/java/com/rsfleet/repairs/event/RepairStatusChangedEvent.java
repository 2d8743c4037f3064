package com.rsfleet.repairs.event;

import com.rsfleet.repairs.lifecycle.Actor;
import com.rsfleet.repairs.model.RepairStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted for every accepted status transition.
 */
public record RepairStatusChangedEvent(UUID repairId,
                                       UUID customerId,
                                       RepairStatus from,
                                       RepairStatus to,
                                       Actor changedBy,
                                       Instant occurredAt) {
}
