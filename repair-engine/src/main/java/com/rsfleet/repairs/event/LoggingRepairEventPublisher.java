package com.rsfleet.repairs.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default publisher: writes each event to the application log.
 *
 * Deployments with a notification service replace this bean with one that
 * forwards events to it.
 */
@Component
public class LoggingRepairEventPublisher implements RepairEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingRepairEventPublisher.class);

    @Override
    public void publish(RepairCreatedEvent event) {
        log.info("RepairCreated batch={} customer={} unit={} origin={} repairs={} total={}",
                event.batchId(), event.customerId(), event.unitNumber(), event.origin(),
                event.repairs().size(), event.totalPrice());
    }

    @Override
    public void publish(RepairStatusChangedEvent event) {
        log.info("RepairStatusChanged repair={} {} → {} by {}",
                event.repairId(), event.from(), event.to(), event.changedBy());
    }
}
