package com.rsfleet.repairs.approval;

import com.rsfleet.repairs.model.ApprovalMode;
import com.rsfleet.repairs.model.CustomerApprovalPreference;
import com.rsfleet.repairs.model.RepairStatus;
import com.rsfleet.repairs.repository.CustomerApprovalPreferenceRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Decides whether a field-discovered repair starts APPROVED or PENDING.
 *
 * Customer requests never come through here; they always start REQUESTED.
 */
@Component
public class ApprovalPolicyEvaluator {

    private final CustomerApprovalPreferenceRepository preferenceRepo;
    private final int defaultUnitThreshold;

    public ApprovalPolicyEvaluator(CustomerApprovalPreferenceRepository preferenceRepo,
                                   @Value("${rsfleet.approval.default-unit-threshold:5}") int defaultUnitThreshold) {
        this.preferenceRepo       = preferenceRepo;
        this.defaultUnitThreshold = defaultUnitThreshold;
    }

    /**
     * The customer's stored preference, or REQUIRE_APPROVAL when they never set one.
     */
    public CustomerApprovalPreference preferenceFor(UUID customerId) {
        return preferenceRepo.findByCustomerId(customerId)
                .orElseGet(() -> new CustomerApprovalPreference(
                        customerId, ApprovalMode.REQUIRE_APPROVAL, defaultUnitThreshold));
    }

    /**
     * @param breakPosition 1-based position of the break within the current batch;
     *                      counting starts again at 1 for every batch
     */
    public RepairStatus initialStatus(CustomerApprovalPreference preference, int breakPosition) {
        if (breakPosition < 1) {
            throw new IllegalArgumentException("breakPosition is 1-based, was " + breakPosition);
        }
        return switch (preference.getMode()) {
            case AUTO_APPROVE     -> RepairStatus.APPROVED;
            case REQUIRE_APPROVAL -> RepairStatus.PENDING;
            case UNIT_THRESHOLD   -> breakPosition <= preference.getUnitThreshold()
                                             ? RepairStatus.APPROVED
                                             : RepairStatus.PENDING;
        };
    }
}
