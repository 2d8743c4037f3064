package com.rsfleet.repairs.pricing;

import com.rsfleet.repairs.error.ValidationException;
import com.rsfleet.repairs.model.CustomerPricingProfile;
import com.rsfleet.repairs.model.UnitRepairCount;
import com.rsfleet.repairs.repository.CustomerPricingProfileRepository;
import com.rsfleet.repairs.repository.CustomerRepository;
import com.rsfleet.repairs.repository.RepairRepository;
import com.rsfleet.repairs.repository.UnitRepairCountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Progressive per-unit pricing.
 *
 * A unit's Nth repair costs the Nth entry of the customer's tier list (the
 * last entry repeats forever). Customers with a volume discount get a
 * percentage off once their lifetime repair count, across all units, reaches
 * the threshold.
 *
 * All amounts are BigDecimal with two decimals, rounded half-up.
 */
@Component
public class PricingEngine {

    private static final Logger log = LoggerFactory.getLogger(PricingEngine.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CustomerRepository               customerRepo;
    private final CustomerPricingProfileRepository profileRepo;
    private final RepairRepository                 repairRepo;
    private final UnitRepairCountRepository        counterRepo;
    private final List<BigDecimal>                 defaultTiers;
    private final int                              maxPreviewBreaks;

    public PricingEngine(CustomerRepository customerRepo,
                         CustomerPricingProfileRepository profileRepo,
                         RepairRepository repairRepo,
                         UnitRepairCountRepository counterRepo,
                         @Value("${rsfleet.pricing.default-tiers:50,40,35,30,25}") String defaultTiers,
                         @Value("${rsfleet.pricing.max-preview-breaks:100}") int maxPreviewBreaks) {
        if (maxPreviewBreaks < 1) {
            throw new IllegalArgumentException("rsfleet.pricing.max-preview-breaks must be >= 1, was " + maxPreviewBreaks);
        }
        this.customerRepo     = customerRepo;
        this.profileRepo      = profileRepo;
        this.repairRepo       = repairRepo;
        this.counterRepo      = counterRepo;
        this.defaultTiers     = parseTiers(defaultTiers);
        this.maxPreviewBreaks = maxPreviewBreaks;
    }

    // ------------------------------------------------------------------
    // Pricing at creation
    // ------------------------------------------------------------------

    /**
     * Price of the repair at position {@code tierIndex} (0-based) in this
     * unit's history.
     *
     * Runs in the caller's transaction, so repairs saved earlier in the same
     * batch count towards the lifetime total.
     */
    public BigDecimal priceFor(UUID customerId, String unitNumber, int tierIndex) {
        PriceQuote quote = quote(customerId, tierIndex);
        log.debug("Priced customer={} unit={} tier={} base={} price={}",
                customerId, unitNumber, quote.repairTier(), quote.basePrice(), quote.price());
        return quote.price();
    }

    public PriceQuote quote(UUID customerId, int tierIndex) {
        Optional<CustomerPricingProfile> profile = profileRepo.findByCustomerId(customerId);
        long lifetimeRepairs = repairRepo.countByCustomerId(customerId);
        return quote(profile.orElse(null), tierIndex, lifetimeRepairs);
    }

    /**
     * Pure pricing function.
     *
     * @param profile         the customer's profile, or null for system defaults
     * @param lifetimeRepairs repairs already recorded for the customer, all units
     */
    public PriceQuote quote(CustomerPricingProfile profile, int tierIndex, long lifetimeRepairs) {
        if (tierIndex < 0) {
            throw new IllegalArgumentException("tierIndex must be >= 0, was " + tierIndex);
        }
        BigDecimal base  = tierPrice(tiersFor(profile), tierIndex);
        BigDecimal price = base;

        if (profile != null && volumeDiscountApplies(profile, lifetimeRepairs)) {
            price = applyDiscount(base, profile.getVolumeDiscountPercent());
        }
        return new PriceQuote(tierIndex, base, price, base.subtract(price));
    }

    // ------------------------------------------------------------------
    // Read-only previews
    // ------------------------------------------------------------------

    /**
     * Price every break of a batch the way {@code createBatch} would, without
     * advancing the unit counter.
     *
     * @throws ValidationException for an unknown customer, or a break count
     *         outside 1..rsfleet.pricing.max-preview-breaks
     */
    @Transactional(readOnly = true)
    public PricingPreview preview(UUID customerId, String unitNumber, int breaks) {
        if (breaks < 1) {
            throw new ValidationException("A batch needs at least one break");
        }
        if (breaks > maxPreviewBreaks) {
            throw new ValidationException("A preview covers at most " + maxPreviewBreaks + " breaks, got " + breaks);
        }
        requireCustomer(customerId);
        CustomerPricingProfile profile = profileRepo.findByCustomerId(customerId).orElse(null);
        int  currentCount    = currentCount(customerId, unitNumber);
        long lifetimeRepairs = repairRepo.countByCustomerId(customerId);

        List<PricingPreview.Line> lines = new ArrayList<>(breaks);
        BigDecimal total = BigDecimal.ZERO.setScale(2);
        BigDecimal min   = null;
        BigDecimal max   = null;

        for (int i = 0; i < breaks; i++) {
            // Earlier breaks of the same batch count towards the lifetime total.
            PriceQuote q = quote(profile, currentCount + i, lifetimeRepairs + i);
            lines.add(new PricingPreview.Line(i + 1, q.repairTier(), q.price(), q.discountApplied()));
            total = total.add(q.price());
            min = (min == null || q.price().compareTo(min) < 0) ? q.price() : min;
            max = (max == null || q.price().compareTo(max) > 0) ? q.price() : max;
        }
        return new PricingPreview(customerId, unitNumber, usesCustomTiers(profile),
                lines, total, min, max);
    }

    /** Price and tier of the next repair on a unit. */
    @Transactional(readOnly = true)
    public PriceQuote expectedNextPrice(UUID customerId, String unitNumber) {
        requireCustomer(customerId);
        return quote(customerId, currentCount(customerId, unitNumber));
    }

    @Transactional(readOnly = true)
    public PricingInfo pricingInfo(UUID customerId) {
        requireCustomer(customerId);
        CustomerPricingProfile profile = profileRepo.findByCustomerId(customerId).orElse(null);
        boolean discount = profile != null && volumeDiscountConfigured(profile);
        return new PricingInfo(
                usesCustomTiers(profile),
                tiersFor(profile),
                defaultTiers,
                discount ? profile.getVolumeDiscountThreshold() : null,
                discount ? profile.getVolumeDiscountPercent()   : null);
    }

    public List<BigDecimal> defaultTiers() {
        return defaultTiers;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void requireCustomer(UUID customerId) {
        if (customerId == null || !customerRepo.existsById(customerId)) {
            throw new ValidationException("Unknown customer: " + customerId);
        }
    }

    private int currentCount(UUID customerId, String unitNumber) {
        return counterRepo.findByCustomerIdAndUnitNumber(customerId, unitNumber)
                .map(UnitRepairCount::getRepairCount)
                .orElse(0);
    }

    private List<BigDecimal> tiersFor(CustomerPricingProfile profile) {
        return usesCustomTiers(profile) ? scaled(profile.getTierPrices()) : defaultTiers;
    }

    private static boolean usesCustomTiers(CustomerPricingProfile profile) {
        return profile != null && profile.usesCustomPricing() && !profile.getTierPrices().isEmpty();
    }

    static BigDecimal tierPrice(List<BigDecimal> tiers, int tierIndex) {
        return tiers.get(Math.min(tierIndex, tiers.size() - 1));
    }

    static BigDecimal applyDiscount(BigDecimal base, BigDecimal percent) {
        BigDecimal multiplier = BigDecimal.ONE.subtract(percent.divide(HUNDRED));
        return base.multiply(multiplier).setScale(2, RoundingMode.HALF_UP);
    }

    private static boolean volumeDiscountConfigured(CustomerPricingProfile profile) {
        return profile.getVolumeDiscountThreshold() != null
                && profile.getVolumeDiscountPercent() != null
                && profile.getVolumeDiscountPercent().signum() > 0;
    }

    private static boolean volumeDiscountApplies(CustomerPricingProfile profile, long lifetimeRepairs) {
        return volumeDiscountConfigured(profile)
                && lifetimeRepairs >= profile.getVolumeDiscountThreshold();
    }

    private static List<BigDecimal> scaled(List<BigDecimal> prices) {
        return prices.stream().map(p -> p.setScale(2, RoundingMode.HALF_UP)).toList();
    }

    static List<BigDecimal> parseTiers(String csv) {
        List<BigDecimal> tiers = Arrays.stream(csv.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .map(BigDecimal::new)
                .map(p -> p.setScale(2, RoundingMode.HALF_UP))
                .toList();
        if (tiers.isEmpty()) {
            throw new IllegalArgumentException("rsfleet.pricing.default-tiers must list at least one price");
        }
        return tiers;
    }
}
