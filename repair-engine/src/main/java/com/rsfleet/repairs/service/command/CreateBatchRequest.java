package com.rsfleet.repairs.service.command;

import java.util.List;
import java.util.UUID;

/**
 * Several breaks found on one unit during one technician visit.
 * Batches are always field-discovered.
 */
public record CreateBatchRequest(UUID customerId,
                                 UUID technicianId,
                                 String unitNumber,
                                 List<BreakSpec> breaks) {

    public CreateBatchRequest {
        breaks = breaks == null ? List.of() : List.copyOf(breaks);
    }
}
