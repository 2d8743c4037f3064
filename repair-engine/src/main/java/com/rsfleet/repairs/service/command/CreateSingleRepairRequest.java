package com.rsfleet.repairs.service.command;

import com.rsfleet.repairs.model.RepairOrigin;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One repair, either requested by the customer or found in the field.
 *
 * origin defaults to FIELD when omitted.
 */
public record CreateSingleRepairRequest(UUID customerId,
                                        UUID technicianId,
                                        String unitNumber,
                                        String damageType,
                                        RepairOrigin origin,
                                        BigDecimal overridePrice,
                                        String overrideReason,
                                        String description,
                                        Boolean drilledBeforeRepair,
                                        Double windshieldTemperature,
                                        String resinViscosity) {

    public CreateSingleRepairRequest {
        if (origin == null) origin = RepairOrigin.FIELD;
    }

    public static CreateSingleRepairRequest field(UUID customerId, UUID technicianId,
                                                  String unitNumber, String damageType) {
        return new CreateSingleRepairRequest(customerId, technicianId, unitNumber, damageType,
                RepairOrigin.FIELD, null, null, null, null, null, null);
    }

    public static CreateSingleRepairRequest customerRequest(UUID customerId, String unitNumber,
                                                            String damageType) {
        return new CreateSingleRepairRequest(customerId, null, unitNumber, damageType,
                RepairOrigin.CUSTOMER, null, null, null, null, null, null);
    }

    /** The same repair expressed as the single break of a batch. */
    public BreakSpec toBreakSpec() {
        return new BreakSpec(damageType, overridePrice, overrideReason, description,
                drilledBeforeRepair, windshieldTemperature, resinViscosity);
    }
}
