package com.rsfleet.repairs.pricing;

import java.math.BigDecimal;

/**
 * Price of one repair and how it was reached.
 *
 * @param tierIndex      0-based position in the unit's repair history
 * @param basePrice      tier price before any discount
 * @param price          amount charged
 * @param discountAmount basePrice - price; zero when no volume discount applied
 */
public record PriceQuote(int tierIndex,
                         BigDecimal basePrice,
                         BigDecimal price,
                         BigDecimal discountAmount) {

    public boolean discountApplied() { return discountAmount.signum() > 0; }

    /** 1-based tier, the way customers read it ("this is the unit's 3rd repair"). */
    public int repairTier() { return tierIndex + 1; }
}
