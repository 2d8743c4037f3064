package com.rsfleet.repairs.api.dto;

import com.rsfleet.repairs.model.Repair;
import com.rsfleet.repairs.model.RepairOrigin;
import com.rsfleet.repairs.model.RepairStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a repair returned by every /repairs endpoint.
 *
 * repairTier is 1-based (tierIndex + 1).
 */
public record RepairResponse(
        UUID         id,
        UUID         customerId,
        UUID         technicianId,
        String       unitNumber,
        String       damageType,
        RepairStatus status,
        RepairOrigin origin,
        BigDecimal   price,
        int          repairTier,
        boolean      priceOverridden,
        String       overrideReason,
        UUID         batchId,
        int          breakNumber,
        int          totalBreaksInBatch,
        String       description,
        boolean      drilledBeforeRepair,
        Double       windshieldTemperature,
        String       resinViscosity,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static RepairResponse from(Repair r) {
        return new RepairResponse(
                r.getId(),
                r.getCustomerId(),
                r.getTechnicianId(),
                r.getUnitNumber(),
                r.getDamageType(),
                r.getStatus(),
                r.getOrigin(),
                r.getPrice(),
                r.getTierIndex() + 1,
                r.isPriceOverridden(),
                r.getOverrideReason(),
                r.getBatchId(),
                r.getBreakNumber(),
                r.getTotalBreaksInBatch(),
                r.getDescription(),
                r.isDrilledBeforeRepair(),
                r.getWindshieldTemperature(),
                r.getResinViscosity(),
                r.getCreatedAt(),
                r.getUpdatedAt()
        );
    }
}
