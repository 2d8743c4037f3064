package com.rsfleet.repairs.lifecycle;

public enum ActorKind {
    CUSTOMER,     // a user acting for a fleet customer; id = customer id
    TECHNICIAN    // a technician, with or without manager capabilities; id = technician id
}
