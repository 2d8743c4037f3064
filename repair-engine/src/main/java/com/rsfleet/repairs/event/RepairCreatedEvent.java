package com.rsfleet.repairs.event;

import com.rsfleet.repairs.model.Repair;
import com.rsfleet.repairs.model.RepairOrigin;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Emitted once per creation call: one event for a whole batch, never one per break.
 *
 * @param batchId null for a single repair created outside a batch
 */
public record RepairCreatedEvent(UUID batchId,
                                 UUID customerId,
                                 String unitNumber,
                                 RepairOrigin origin,
                                 List<Repair> repairs,
                                 Instant occurredAt) {

    public RepairCreatedEvent {
        repairs = List.copyOf(repairs);
    }

    public BigDecimal totalPrice() {
        return repairs.stream()
                .map(Repair::getPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
