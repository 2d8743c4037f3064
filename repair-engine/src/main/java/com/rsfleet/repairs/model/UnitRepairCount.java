package com.rsfleet.repairs.model;

import jakarta.persistence.*;

import java.util.UUID;

/**
 * How many repairs have been created for one fleet unit of one customer.
 *
 * The count only ever grows; each increment belongs to exactly one Repair
 * creation and commits or rolls back with it. Writers lock the row with
 * SELECT ... FOR UPDATE (see UnitRepairCountRepository).
 *
 * DB table: unit_repair_counts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "unit_repair_counts",
       uniqueConstraints = @UniqueConstraint(
               name = "uq_unit_repair_counts_customer_unit",
               columnNames = {"customer_id", "unit_number"}))
public class UnitRepairCount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "unit_number", nullable = false, updatable = false, length = 50)
    private String unitNumber;

    @Column(name = "repair_count", nullable = false)
    private int repairCount = 0;

    // A write from a stale read fails instead of overwriting a newer count.
    @Version
    @Column(nullable = false)
    private long version;

    protected UnitRepairCount() {}   // required by JPA

    public UnitRepairCount(UUID customerId, String unitNumber) {
        this.customerId = customerId;
        this.unitNumber = unitNumber;
    }

    /** Increment and return the count as it was before. */
    public int advance() {
        return repairCount++;
    }

    public UUID   getId()          { return id; }
    public UUID   getCustomerId()  { return customerId; }
    public String getUnitNumber()  { return unitNumber; }
    public int    getRepairCount() { return repairCount; }
    public long   getVersion()     { return version; }
}
