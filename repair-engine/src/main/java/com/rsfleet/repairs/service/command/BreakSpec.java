package com.rsfleet.repairs.service.command;

import java.math.BigDecimal;

/**
 * One break inside a batch submission.
 *
 * Required: damageType
 * Optional: overridePrice + overrideReason (manager price override; the reason
 *   is mandatory whenever a price is given), and the field notes a technician
 *   records on site.
 */
public record BreakSpec(String damageType,
                        BigDecimal overridePrice,
                        String overrideReason,
                        String description,
                        Boolean drilledBeforeRepair,
                        Double windshieldTemperature,
                        String resinViscosity) {

    public static BreakSpec of(String damageType) {
        return new BreakSpec(damageType, null, null, null, null, null, null);
    }

    public static BreakSpec withOverride(String damageType, BigDecimal price, String reason) {
        return new BreakSpec(damageType, price, reason, null, null, null, null);
    }

    public boolean hasOverride() { return overridePrice != null; }
}
