package com.rsfleet.repairs.lifecycle;

import java.util.Objects;
import java.util.UUID;

/**
 * Who is performing an action or looking at a repair.
 * Supplied by the surrounding authentication layer.
 */
public record Actor(ActorKind kind, UUID id) {

    public Actor {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }

    public static Actor customer(UUID customerId)     { return new Actor(ActorKind.CUSTOMER, customerId); }
    public static Actor technician(UUID technicianId) { return new Actor(ActorKind.TECHNICIAN, technicianId); }

    public boolean isCustomer() { return kind == ActorKind.CUSTOMER; }
}
