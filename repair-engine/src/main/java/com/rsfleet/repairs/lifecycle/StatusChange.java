package com.rsfleet.repairs.lifecycle;

import com.rsfleet.repairs.event.RepairStatusChangedEvent;
import com.rsfleet.repairs.model.Repair;

/**
 * A committed transition and the event to publish for it.
 */
public record StatusChange(Repair repair, RepairStatusChangedEvent event) {
}
