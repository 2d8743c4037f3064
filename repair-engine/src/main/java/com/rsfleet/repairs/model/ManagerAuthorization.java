package com.rsfleet.repairs.model;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Capabilities attached to a technician who manages others.
 *
 * Keyed by the technician id; a technician without a row has no manager
 * capabilities at all.
 *
 * DB table: manager_authorizations  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "manager_authorizations")
public class ManagerAuthorization {

    @Id
    @Column(name = "technician_id")
    private UUID technicianId;

    @Column(name = "is_manager", nullable = false)
    private boolean manager;

    @Column(name = "can_override_pricing", nullable = false)
    private boolean canOverridePricing;

    // Highest price a manual override may set. Null means no limit.
    @Column(name = "approval_limit", precision = 10, scale = 2)
    private BigDecimal approvalLimit;

    protected ManagerAuthorization() {}   // required by JPA

    public ManagerAuthorization(UUID technicianId, boolean manager,
                                boolean canOverridePricing, BigDecimal approvalLimit) {
        this.technicianId       = technicianId;
        this.manager            = manager;
        this.canOverridePricing = canOverridePricing;
        this.approvalLimit      = approvalLimit;
    }

    public UUID       getTechnicianId()       { return technicianId; }
    public boolean    isManager()             { return manager; }
    public boolean    canOverridePricing()    { return canOverridePricing; }
    public BigDecimal getApprovalLimit()      { return approvalLimit; }

    public void setCanOverridePricing(boolean v) { this.canOverridePricing = v; }
    public void setApprovalLimit(BigDecimal v)   { this.approvalLimit = v; }
}
