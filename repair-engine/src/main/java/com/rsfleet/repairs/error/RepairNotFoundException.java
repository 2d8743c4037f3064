package com.rsfleet.repairs.error;

import java.util.UUID;

public class RepairNotFoundException extends RuntimeException {
    public RepairNotFoundException(UUID repairId) {
        super("No repair with id: '" + repairId + "'");
    }
}
