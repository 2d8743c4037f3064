package com.rsfleet.repairs.model;

import com.rsfleet.repairs.error.TransitionException;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One windshield repair: a single break on a single fleet unit.
 *
 * Created by BatchCoordinator (alone or as one break of a batch) and changed
 * afterwards only through RepairStatusMachine. Price, tier and batch placement
 * are written once at creation; the columns are not updatable.
 *
 * DB table: repairs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "repairs")
public class Repair {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    // Null for customer requests until a manager assigns a technician.
    @Column(name = "technician_id")
    private UUID technicianId;

    @Column(name = "unit_number", nullable = false, updatable = false, length = 50)
    private String unitNumber;

    @Column(name = "damage_type", nullable = false, length = 100)
    private String damageType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RepairStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private RepairOrigin origin;

    @Column(nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal price;

    // 0-based position in the unit's repair history at creation time.
    @Column(name = "tier_index", nullable = false, updatable = false)
    private int tierIndex;

    @Column(name = "price_overridden", nullable = false, updatable = false)
    private boolean priceOverridden = false;

    @Column(name = "override_reason", updatable = false, columnDefinition = "TEXT")
    private String overrideReason;

    @Column(name = "batch_id", updatable = false)
    private UUID batchId;

    @Column(name = "break_number", nullable = false, updatable = false)
    private int breakNumber = 1;

    @Column(name = "total_breaks_in_batch", nullable = false, updatable = false)
    private int totalBreaksInBatch = 1;

    // Technician notes recorded in the field.
    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "drilled_before_repair", nullable = false)
    private boolean drilledBeforeRepair = false;

    @Column(name = "windshield_temperature")
    private Double windshieldTemperature;

    @Column(name = "resin_viscosity", length = 50)
    private String resinViscosity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Repair() {}   // required by JPA

    public Repair(UUID customerId, UUID technicianId, String unitNumber,
                  String damageType, RepairOrigin origin) {
        this.customerId   = customerId;
        this.technicianId = technicianId;
        this.unitNumber   = unitNumber;
        this.damageType   = damageType;
        this.origin       = origin;
    }

    // ------------------------------------------------------------------
    // Creation-time writes
    // ------------------------------------------------------------------

    /**
     * Set the price for this repair. May be called once, before the first save.
     *
     * @param overrideReason non-null when the price is a manager override
     */
    public void assignPrice(BigDecimal price, int tierIndex, String overrideReason) {
        if (this.price != null) {
            throw new IllegalStateException("Price already assigned to repair " + id);
        }
        this.price           = price;
        this.tierIndex       = tierIndex;
        this.priceOverridden = overrideReason != null;
        this.overrideReason  = overrideReason;
    }

    public void placeInBatch(UUID batchId, int breakNumber, int totalBreaksInBatch) {
        this.batchId            = batchId;
        this.breakNumber        = breakNumber;
        this.totalBreaksInBatch = totalBreaksInBatch;
    }

    /**
     * Set the starting status. Only states that are legal initial states for
     * this repair's origin are accepted.
     */
    public void initializeStatus(RepairStatus initial) {
        if (this.status != null) {
            throw new IllegalStateException("Status already initialized for repair " + id);
        }
        if (!initial.isInitialFor(origin)) {
            throw new TransitionException(
                    "Status " + initial + " is not a legal initial state for a " + origin + " repair");
        }
        this.status = initial;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Move to {@code target} if the transition table allows it.
     *
     * @throws TransitionException and leaves the status unchanged otherwise
     */
    public void transitionTo(RepairStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new TransitionException(status, target);
        }
        this.status = target;
    }

    public void assignTechnician(UUID technicianId) { this.technicianId = technicianId; }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()                 { return id; }
    public UUID         getCustomerId()         { return customerId; }
    public UUID         getTechnicianId()       { return technicianId; }
    public String       getUnitNumber()         { return unitNumber; }
    public String       getDamageType()         { return damageType; }
    public RepairStatus getStatus()             { return status; }
    public RepairOrigin getOrigin()             { return origin; }
    public BigDecimal   getPrice()              { return price; }
    public int          getTierIndex()          { return tierIndex; }
    public boolean      isPriceOverridden()     { return priceOverridden; }
    public String       getOverrideReason()     { return overrideReason; }
    public UUID         getBatchId()            { return batchId; }
    public int          getBreakNumber()        { return breakNumber; }
    public int          getTotalBreaksInBatch() { return totalBreaksInBatch; }
    public Instant      getCreatedAt()          { return createdAt; }
    public Instant      getUpdatedAt()          { return updatedAt; }

    public String  getDescription()                       { return description; }
    public void    setDescription(String v)               { this.description = v; }
    public boolean isDrilledBeforeRepair()                { return drilledBeforeRepair; }
    public void    setDrilledBeforeRepair(boolean v)      { this.drilledBeforeRepair = v; }
    public Double  getWindshieldTemperature()             { return windshieldTemperature; }
    public void    setWindshieldTemperature(Double v)     { this.windshieldTemperature = v; }
    public String  getResinViscosity()                    { return resinViscosity; }
    public void    setResinViscosity(String v)            { this.resinViscosity = v; }
}
