package com.rsfleet.repairs.pricing;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Progressive pricing for a batch that has not been submitted yet.
 * Built without touching any counter.
 */
public record PricingPreview(UUID customerId,
                             String unitNumber,
                             boolean usesCustomPricing,
                             List<Line> breakdown,
                             BigDecimal totalCost,
                             BigDecimal minPrice,
                             BigDecimal maxPrice) {

    /** One break of the previewed batch. */
    public record Line(int breakNumber, int repairTier, BigDecimal price, boolean discountApplied) {}

    public int totalBreaks() { return breakdown.size(); }

    /** "$50.00 - $35.00", or "$25.00 each" when every break costs the same. */
    public String priceRange() {
        if (breakdown.isEmpty()) return "$0.00";
        if (maxPrice.compareTo(minPrice) == 0) return "$%s each".formatted(maxPrice.toPlainString());
        return "$%s - $%s".formatted(maxPrice.toPlainString(), minPrice.toPlainString());
    }
}
