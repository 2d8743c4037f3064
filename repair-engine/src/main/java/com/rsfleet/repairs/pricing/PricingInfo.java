package com.rsfleet.repairs.pricing;

import java.math.BigDecimal;
import java.util.List;

/**
 * Effective price list of a customer, for display next to repair forms.
 *
 * @param volumeDiscountThreshold null when no volume discount is configured
 */
public record PricingInfo(boolean usesCustomPricing,
                          List<BigDecimal> effectiveTiers,
                          List<BigDecimal> defaultTiers,
                          Integer volumeDiscountThreshold,
                          BigDecimal volumeDiscountPercent) {

    public boolean volumeDiscountEnabled() { return volumeDiscountThreshold != null; }
}
