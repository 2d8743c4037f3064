package com.rsfleet.repairs.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * The customer's answer to a PENDING repair.
 *
 * {@code approved} is null until the customer decides.
 *
 * DB table: approval_decisions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "approval_decisions")
public class ApprovalDecision {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "repair_id", nullable = false, unique = true, updatable = false)
    private UUID repairId;

    @Column
    private Boolean approved;

    @Column(name = "decided_by", length = 150)
    private String decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(columnDefinition = "TEXT")
    private String notes;

    protected ApprovalDecision() {}   // required by JPA

    public ApprovalDecision(UUID repairId) {
        this.repairId = repairId;
    }

    public void record(boolean approved, String decidedBy, String notes) {
        this.approved  = approved;
        this.decidedBy = decidedBy;
        this.notes     = notes;
        this.decidedAt = Instant.now();
    }

    public UUID    getId()        { return id; }
    public UUID    getRepairId()  { return repairId; }
    public Boolean getApproved()  { return approved; }
    public String  getDecidedBy() { return decidedBy; }
    public Instant getDecidedAt() { return decidedAt; }
    public String  getNotes()     { return notes; }
}
