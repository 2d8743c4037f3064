package com.rsfleet.repairs.model;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Customer-specific price list.
 *
 * {@code tierPrices.get(0)} is the price of a unit's first repair; the last
 * entry applies to every repair beyond the list. Only used when
 * {@code usesCustomPricing} is set.
 *
 * DB tables: customer_pricing_profiles, customer_pricing_tiers  (Flyway V1)
 */
@Entity
@Table(name = "customer_pricing_profiles")
public class CustomerPricingProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "customer_id", nullable = false, unique = true, updatable = false)
    private UUID customerId;

    @Column(name = "uses_custom_pricing", nullable = false)
    private boolean usesCustomPricing = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "customer_pricing_tiers",
                     joinColumns = @JoinColumn(name = "profile_id"))
    @OrderColumn(name = "tier_position")
    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private List<BigDecimal> tierPrices = new ArrayList<>();

    // Lifetime repair count at which the discount starts. Null = no discount.
    @Column(name = "volume_discount_threshold")
    private Integer volumeDiscountThreshold;

    // e.g. 15.00 for 15 %
    @Column(name = "volume_discount_percent", precision = 5, scale = 2)
    private BigDecimal volumeDiscountPercent;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected CustomerPricingProfile() {}   // required by JPA

    public CustomerPricingProfile(UUID customerId, List<BigDecimal> tierPrices) {
        this.customerId        = customerId;
        this.usesCustomPricing = true;
        this.tierPrices        = new ArrayList<>(tierPrices);
    }

    public UUID             getId()                      { return id; }
    public UUID             getCustomerId()              { return customerId; }
    public boolean          usesCustomPricing()          { return usesCustomPricing; }
    public List<BigDecimal> getTierPrices()              { return List.copyOf(tierPrices); }
    public Integer          getVolumeDiscountThreshold() { return volumeDiscountThreshold; }
    public BigDecimal       getVolumeDiscountPercent()   { return volumeDiscountPercent; }
    public String           getNotes()                   { return notes; }
    public Instant          getUpdatedAt()               { return updatedAt; }

    public void setUsesCustomPricing(boolean v) { this.usesCustomPricing = v; }
    public void setTierPrices(List<BigDecimal> v) { this.tierPrices = new ArrayList<>(v); }
    public void setNotes(String v)              { this.notes = v; }

    public void setVolumeDiscount(Integer threshold, BigDecimal percent) {
        this.volumeDiscountThreshold = threshold;
        this.volumeDiscountPercent   = percent;
    }
}
