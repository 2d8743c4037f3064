package com.rsfleet.repairs.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * How a customer wants field-discovered repairs handled.
 *
 * DB table: customer_approval_preferences  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "customer_approval_preferences")
public class CustomerApprovalPreference {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "customer_id", nullable = false, unique = true, updatable = false)
    private UUID customerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ApprovalMode mode = ApprovalMode.REQUIRE_APPROVAL;

    // Only read when mode = UNIT_THRESHOLD.
    @Column(name = "unit_threshold", nullable = false)
    private int unitThreshold = 5;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected CustomerApprovalPreference() {}   // required by JPA

    public CustomerApprovalPreference(UUID customerId, ApprovalMode mode, int unitThreshold) {
        this.customerId    = customerId;
        this.mode          = mode;
        this.unitThreshold = unitThreshold;
    }

    public UUID         getId()            { return id; }
    public UUID         getCustomerId()    { return customerId; }
    public ApprovalMode getMode()          { return mode; }
    public int          getUnitThreshold() { return unitThreshold; }
    public Instant      getUpdatedAt()     { return updatedAt; }

    public void setMode(ApprovalMode mode)     { this.mode = mode; }
    public void setUnitThreshold(int v)        { this.unitThreshold = v; }
}
