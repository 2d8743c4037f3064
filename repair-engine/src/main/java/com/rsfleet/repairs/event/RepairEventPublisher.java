package com.rsfleet.repairs.event;

/**
 * Outbound port to the notification collaborator.
 *
 * The engine never calls this itself: services return events and the caller
 * publishes them once the transaction has committed.
 */
public interface RepairEventPublisher {

    void publish(RepairCreatedEvent event);

    void publish(RepairStatusChangedEvent event);
}
