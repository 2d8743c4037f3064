package com.rsfleet.repairs.pricing;

import com.rsfleet.repairs.error.ValidationException;
import com.rsfleet.repairs.model.CustomerPricingProfile;
import com.rsfleet.repairs.model.UnitRepairCount;
import com.rsfleet.repairs.repository.CustomerPricingProfileRepository;
import com.rsfleet.repairs.repository.CustomerRepository;
import com.rsfleet.repairs.repository.RepairRepository;
import com.rsfleet.repairs.repository.UnitRepairCountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PricingEngine. Repositories are mocked; the pure
 * {@code quote(profile, tierIndex, lifetime)} overload needs none of them.
 */
@ExtendWith(MockitoExtension.class)
class PricingEngineTest {

    @Mock CustomerRepository               customerRepo;
    @Mock CustomerPricingProfileRepository profileRepo;
    @Mock RepairRepository                 repairRepo;
    @Mock UnitRepairCountRepository        counterRepo;

    PricingEngine engine;
    UUID customerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        engine = new PricingEngine(customerRepo, profileRepo, repairRepo, counterRepo, "50,40,35,30,25", 20);
        lenient().when(customerRepo.existsById(customerId)).thenReturn(true);
    }

    // ------------------------------------------------------------------
    // Tier selection
    // ------------------------------------------------------------------

    @Test
    void defaultTiers_firstThreeRepairs() {
        assertThat(engine.quote(null, 0, 0).price()).isEqualByComparingTo("50.00");
        assertThat(engine.quote(null, 1, 1).price()).isEqualByComparingTo("40.00");
        assertThat(engine.quote(null, 2, 2).price()).isEqualByComparingTo("35.00");
    }

    @Test
    void defaultTiers_lastTierRepeats() {
        assertThat(engine.quote(null, 3, 3).price()).isEqualByComparingTo("30.00");
        assertThat(engine.quote(null, 4, 4).price()).isEqualByComparingTo("25.00");
        assertThat(engine.quote(null, 17, 17).price()).isEqualByComparingTo("25.00");
    }

    @Test
    void customTiers_continueFromUnitHistory() {
        CustomerPricingProfile profile = new CustomerPricingProfile(customerId, List.of(
                new BigDecimal("60"), new BigDecimal("50"), new BigDecimal("45"),
                new BigDecimal("40"), new BigDecimal("35")));

        // two repairs already on the unit → next are the 3rd and 4th tiers
        assertThat(engine.quote(profile, 2, 2).price()).isEqualByComparingTo("45.00");
        assertThat(engine.quote(profile, 3, 3).price()).isEqualByComparingTo("40.00");
    }

    @Test
    void profileWithCustomPricingOff_usesDefaultTiers() {
        CustomerPricingProfile profile = new CustomerPricingProfile(customerId, List.of(new BigDecimal("99")));
        profile.setUsesCustomPricing(false);

        assertThat(engine.quote(profile, 0, 0).price()).isEqualByComparingTo("50.00");
    }

    @Test
    void negativeTierIndex_rejected() {
        assertThatThrownBy(() -> engine.quote(null, -1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Volume discount
    // ------------------------------------------------------------------

    @Test
    void volumeDiscount_atOrAboveThreshold_appliesPercentOff() {
        CustomerPricingProfile profile = discounted(10, "15");

        PriceQuote q = engine.quote(profile, 2, 12);

        assertThat(q.basePrice()).isEqualByComparingTo("35.00");
        assertThat(q.price()).isEqualByComparingTo("29.75");
        assertThat(q.discountAmount()).isEqualByComparingTo("5.25");
        assertThat(q.discountApplied()).isTrue();
    }

    @Test
    void volumeDiscount_belowThreshold_fullPrice() {
        PriceQuote q = engine.quote(discounted(10, "15"), 2, 9);

        assertThat(q.price()).isEqualByComparingTo("35.00");
        assertThat(q.discountApplied()).isFalse();
    }

    @Test
    void volumeDiscount_roundsHalfUp() {
        // 35 * 0.875 = 30.625
        assertThat(PricingEngine.applyDiscount(new BigDecimal("35.00"), new BigDecimal("12.5")))
                .isEqualByComparingTo("30.63");
    }

    // ------------------------------------------------------------------
    // Previews
    // ------------------------------------------------------------------

    @Test
    void preview_continuesFromCurrentCountWithoutAdvancingIt() {
        UnitRepairCount counter = new UnitRepairCount(customerId, "T-104");
        counter.advance();
        counter.advance();
        when(counterRepo.findByCustomerIdAndUnitNumber(customerId, "T-104")).thenReturn(Optional.of(counter));
        when(profileRepo.findByCustomerId(customerId)).thenReturn(Optional.empty());
        when(repairRepo.countByCustomerId(customerId)).thenReturn(2L);

        PricingPreview preview = engine.preview(customerId, "T-104", 3);

        assertThat(preview.breakdown()).extracting(PricingPreview.Line::price)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("35"), new BigDecimal("30"), new BigDecimal("25"));
        assertThat(preview.breakdown()).extracting(PricingPreview.Line::repairTier).containsExactly(3, 4, 5);
        assertThat(preview.totalCost()).isEqualByComparingTo("90.00");
        assertThat(preview.priceRange()).isEqualTo("$35.00 - $25.00");
        assertThat(counter.getRepairCount()).isEqualTo(2);
    }

    @Test
    void preview_discountKicksInPartWayThroughBatch() {
        when(profileRepo.findByCustomerId(customerId)).thenReturn(Optional.of(discounted(10, "20")));
        when(repairRepo.countByCustomerId(customerId)).thenReturn(9L);

        PricingPreview preview = engine.preview(customerId, "T-200", 2);

        // lifetime 9 → no discount; lifetime 10 → 20 % off the 40 tier
        assertThat(preview.breakdown().get(0).price()).isEqualByComparingTo("50.00");
        assertThat(preview.breakdown().get(1).price()).isEqualByComparingTo("32.00");
        assertThat(preview.breakdown().get(1).discountApplied()).isTrue();
    }

    @Test
    void preview_zeroBreaks_rejected() {
        assertThatThrownBy(() -> engine.preview(customerId, "T-104", 0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void preview_moreBreaksThanConfiguredMax_rejectedBeforeAnyLookup() {
        assertThatThrownBy(() -> engine.preview(customerId, "T-104", 21))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at most 20");
        assertThatThrownBy(() -> engine.preview(customerId, "T-104", Integer.MAX_VALUE))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(profileRepo, repairRepo, counterRepo);
    }

    @Test
    void preview_atConfiguredMax_pricesEveryBreak() {
        when(profileRepo.findByCustomerId(customerId)).thenReturn(Optional.empty());
        when(counterRepo.findByCustomerIdAndUnitNumber(customerId, "T-104")).thenReturn(Optional.empty());

        PricingPreview preview = engine.preview(customerId, "T-104", 20);

        assertThat(preview.breakdown()).hasSize(20);
    }

    @Test
    void unknownCustomer_rejectedByEveryReadOnlyQuery() {
        UUID stranger = UUID.randomUUID();

        assertThatThrownBy(() -> engine.preview(stranger, "T-104", 2))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown customer");
        assertThatThrownBy(() -> engine.expectedNextPrice(stranger, "T-104"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> engine.pricingInfo(stranger))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(profileRepo, repairRepo, counterRepo);
    }

    @Test
    void maxPreviewBreaks_mustBePositive() {
        assertThatThrownBy(() -> new PricingEngine(
                customerRepo, profileRepo, repairRepo, counterRepo, "50,40", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pricingInfo_withoutProfile_reportsDefaults() {
        when(profileRepo.findByCustomerId(customerId)).thenReturn(Optional.empty());

        PricingInfo info = engine.pricingInfo(customerId);

        assertThat(info.usesCustomPricing()).isFalse();
        assertThat(info.effectiveTiers()).isEqualTo(engine.defaultTiers());
        assertThat(info.volumeDiscountEnabled()).isFalse();
    }

    @Test
    void parseTiers_emptyList_rejected() {
        assertThatThrownBy(() -> PricingEngine.parseTiers(" , "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private CustomerPricingProfile discounted(int threshold, String percent) {
        CustomerPricingProfile profile = new CustomerPricingProfile(customerId, List.of());
        profile.setUsesCustomPricing(false);
        profile.setVolumeDiscount(threshold, new BigDecimal(percent));
        return profile;
    }
}
