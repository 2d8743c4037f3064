package com.rsfleet.repairs.pricing;

import com.rsfleet.repairs.error.AuthorizationException;
import com.rsfleet.repairs.error.ValidationException;
import com.rsfleet.repairs.model.ManagerAuthorization;
import com.rsfleet.repairs.repository.ManagerAuthorizationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Gatekeeper for manual price overrides.
 *
 * Checks, in order:
 *   1. a non-empty reason accompanies the price, and the price is not negative
 *   2. the technician is a manager with the override capability
 *   3. the price is within the manager's approval limit (no limit = unrestricted)
 *
 * An approved override replaces the computed price of one repair only; the
 * unit counter still advances as for any other repair.
 */
@Component
public class OverrideAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(OverrideAuthorizer.class);

    private final ManagerAuthorizationRepository authorizationRepo;

    public OverrideAuthorizer(ManagerAuthorizationRepository authorizationRepo) {
        this.authorizationRepo = authorizationRepo;
    }

    /**
     * @return the approved price, scaled to two decimals
     * @throws ValidationException    missing reason or negative price
     * @throws AuthorizationException not allowed to override, or above the approval limit
     */
    public BigDecimal authorize(UUID technicianId, BigDecimal proposedPrice, String reason) {
        validate(proposedPrice, reason);
        ManagerAuthorization auth = technicianId == null
                ? null
                : authorizationRepo.findById(technicianId).orElse(null);
        return checkCapability(auth, technicianId, proposedPrice);
    }

    private BigDecimal checkCapability(ManagerAuthorization auth, UUID technicianId, BigDecimal proposedPrice) {
        if (auth == null || !auth.isManager() || !auth.canOverridePricing()) {
            log.warn("Price override of {} rejected: technician {} lacks override permission",
                    proposedPrice, technicianId);
            throw new AuthorizationException(
                    "Only managers with pricing override permission can override a repair price");
        }
        BigDecimal limit = auth.getApprovalLimit();
        if (limit != null && proposedPrice.compareTo(limit) > 0) {
            log.warn("Price override of {} rejected: above approval limit {} of manager {}",
                    proposedPrice, limit, technicianId);
            throw new AuthorizationException(
                    "Override price %s exceeds approval limit %s".formatted(
                            proposedPrice.toPlainString(), limit.toPlainString()));
        }
        return proposedPrice.setScale(2, RoundingMode.HALF_UP);
    }

    private static void validate(BigDecimal proposedPrice, String reason) {
        if (proposedPrice == null) {
            throw new ValidationException("An override needs a proposed price");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reason is required when overriding a repair price");
        }
        if (proposedPrice.signum() < 0) {
            throw new ValidationException("Override price cannot be negative");
        }
    }
}
