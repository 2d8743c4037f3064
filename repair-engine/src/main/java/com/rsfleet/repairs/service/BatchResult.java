package com.rsfleet.repairs.service;

import com.rsfleet.repairs.event.RepairCreatedEvent;
import com.rsfleet.repairs.model.Repair;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a committed creation call: the repairs in break order and the
 * single event the caller should publish for them.
 */
public record BatchResult(List<Repair> repairs, RepairCreatedEvent event) {

    public BatchResult {
        repairs = List.copyOf(repairs);
    }

    public UUID batchId() { return event.batchId(); }

    public BigDecimal totalPrice() { return event.totalPrice(); }
}
