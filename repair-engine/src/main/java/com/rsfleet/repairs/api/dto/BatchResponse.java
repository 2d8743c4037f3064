package com.rsfleet.repairs.api.dto;

import com.rsfleet.repairs.service.BatchResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /repairs/batches.
 */
public record BatchResponse(UUID batchId,
                            int totalBreaks,
                            BigDecimal totalPrice,
                            List<RepairResponse> repairs) {

    public static BatchResponse from(BatchResult result) {
        return new BatchResponse(
                result.batchId(),
                result.repairs().size(),
                result.totalPrice(),
                result.repairs().stream().map(RepairResponse::from).toList());
    }
}
