package com.rsfleet.repairs.service;

import com.rsfleet.repairs.error.ConcurrencyException;
import com.rsfleet.repairs.model.UnitRepairCount;
import com.rsfleet.repairs.repository.UnitRepairCountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Hands out tier indices for a (customer, unit) pair.
 *
 * {@link #nextIndex} must run inside the transaction that inserts the repair:
 * the counter row stays locked until that transaction ends, and a rollback
 * undoes the increment together with the repair. A unit's first row is
 * inserted in that same transaction, so a call never needs a second
 * connection.
 */
@Component
public class UnitRepairCounter {

    private static final Logger log = LoggerFactory.getLogger(UnitRepairCounter.class);

    private final UnitRepairCountRepository counterRepo;

    public UnitRepairCounter(UnitRepairCountRepository counterRepo) {
        this.counterRepo = counterRepo;
    }

    /**
     * Lock the counter, increment it, and return the value it had before (0-based).
     *
     * Blocks while another transaction holds the same (customer, unit) row;
     * other units are never blocked.
     *
     * @throws ConcurrencyException when the row lock is not granted within the timeout
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int nextIndex(UUID customerId, String unitNumber) {
        UnitRepairCount counter = lock(customerId, unitNumber);
        int index = counter.advance();
        log.debug("Counter customer={} unit={} advanced {} → {}",
                customerId, unitNumber, index, counter.getRepairCount());
        return index;
    }

    private UnitRepairCount lock(UUID customerId, String unitNumber) {
        try {
            return counterRepo.lockByCustomerAndUnit(customerId, unitNumber)
                    .orElseGet(() -> {
                        createRow(customerId, unitNumber);
                        return counterRepo.lockByCustomerAndUnit(customerId, unitNumber)
                                .orElseThrow(() -> new IllegalStateException(
                                        "Counter row vanished for customer " + customerId
                                        + " unit " + unitNumber));
                    });
        } catch (PessimisticLockingFailureException e) {
            log.warn("Timed out waiting for repair counter lock customer={} unit={}", customerId, unitNumber);
            throw new ConcurrencyException(
                    "Unit " + unitNumber + " is being updated by another submission; retry", e);
        }
    }

    private void createRow(UUID customerId, String unitNumber) {
        if (counterRepo.insertIfAbsent(UUID.randomUUID(), customerId, unitNumber) > 0) {
            log.debug("Created repair counter for customer={} unit={}", customerId, unitNumber);
        }
    }
}
