package com.rsfleet.repairs.service.command;

import java.util.UUID;

/**
 * Customer decision on a PENDING field repair.
 */
public record ResolvePendingRepair(UUID repairId, boolean approved, String decidedBy, String notes) {
}
