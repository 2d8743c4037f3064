package com.rsfleet.repairs.service.command;

import java.util.UUID;

/**
 * Manager hands a customer-requested repair to a technician.
 */
public record AssignRequestedRepair(UUID repairId, UUID assignToTechnicianId, UUID assignedByManagerId) {
}
