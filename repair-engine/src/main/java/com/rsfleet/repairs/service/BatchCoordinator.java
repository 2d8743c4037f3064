package com.rsfleet.repairs.service;

import com.rsfleet.repairs.approval.ApprovalPolicyEvaluator;
import com.rsfleet.repairs.error.ConcurrencyException;
import com.rsfleet.repairs.error.RepairEngineException;
import com.rsfleet.repairs.error.StorageException;
import com.rsfleet.repairs.error.ValidationException;
import com.rsfleet.repairs.event.RepairCreatedEvent;
import com.rsfleet.repairs.lifecycle.RepairStatusMachine;
import com.rsfleet.repairs.model.*;
import com.rsfleet.repairs.pricing.OverrideAuthorizer;
import com.rsfleet.repairs.pricing.PricingEngine;
import com.rsfleet.repairs.repository.CustomerRepository;
import com.rsfleet.repairs.repository.RepairRepository;
import com.rsfleet.repairs.repository.TechnicianProfileRepository;
import com.rsfleet.repairs.service.command.BreakSpec;
import com.rsfleet.repairs.service.command.CreateBatchRequest;
import com.rsfleet.repairs.service.command.CreateSingleRepairRequest;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Creates repairs, one or many, as a single all-or-nothing unit.
 *
 * For every break, in order:
 *   1. advance the unit counter             → tier index
 *   2. price it (tier price or approved manager override)
 *   3. pick the starting status (approval policy, or REQUESTED for customer requests)
 *   4. save it with the shared batch id and its break number
 *
 * Everything runs in one transaction. Validation and override checks happen
 * before the first write; any later failure rolls back every repair and every
 * counter increment of the call.
 */
@Service
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private static final int MAX_UNIT_NUMBER_LENGTH = 50;

    private final CustomerRepository          customerRepo;
    private final TechnicianProfileRepository technicianRepo;
    private final RepairRepository            repairRepo;
    private final UnitRepairCounter           counter;
    private final PricingEngine               pricingEngine;
    private final OverrideAuthorizer          overrideAuthorizer;
    private final ApprovalPolicyEvaluator     approvalPolicy;
    private final RepairStatusMachine         statusMachine;
    private final RepairMetrics               metrics;

    public BatchCoordinator(CustomerRepository customerRepo,
                            TechnicianProfileRepository technicianRepo,
                            RepairRepository repairRepo,
                            UnitRepairCounter counter,
                            PricingEngine pricingEngine,
                            OverrideAuthorizer overrideAuthorizer,
                            ApprovalPolicyEvaluator approvalPolicy,
                            RepairStatusMachine statusMachine,
                            RepairMetrics metrics) {
        this.customerRepo       = customerRepo;
        this.technicianRepo     = technicianRepo;
        this.repairRepo         = repairRepo;
        this.counter            = counter;
        this.pricingEngine      = pricingEngine;
        this.overrideAuthorizer = overrideAuthorizer;
        this.approvalPolicy     = approvalPolicy;
        this.statusMachine      = statusMachine;
        this.metrics            = metrics;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Create every break of a field batch, or none of them.
     *
     * @return the repairs in break order plus one RepairCreated event for the whole batch
     */
    @Transactional
    public BatchResult createBatch(CreateBatchRequest req) {
        return create(req.customerId(), req.technicianId(), req.unitNumber(),
                RepairOrigin.FIELD, req.breaks(), UUID.randomUUID());
    }

    /**
     * Create one repair. A FIELD repair gets exactly the pricing and starting
     * status it would get as a batch of one; a CUSTOMER request starts REQUESTED.
     * Single repairs carry no batch id.
     */
    @Transactional
    public BatchResult createSingle(CreateSingleRepairRequest req) {
        return create(req.customerId(), req.technicianId(), req.unitNumber(),
                req.origin(), List.of(req.toBreakSpec()), null);
    }

    // ------------------------------------------------------------------
    // Core algorithm
    // ------------------------------------------------------------------

    private BatchResult create(UUID customerId, UUID technicianId, String unitNumber,
                               RepairOrigin origin, List<BreakSpec> breaks, UUID batchId) {
        Timer.Sample sample = metrics.startBatch();
        // Every log line of this submission carries the customer, unit and batch.
        MDC.put("customerId", String.valueOf(customerId));
        MDC.put("unitNumber", String.valueOf(unitNumber));
        if (batchId != null) {
            MDC.put("batchId", batchId.toString());
        }
        try {
            // ── Validate everything before the first write ──────────────────
            validate(customerId, technicianId, unitNumber, origin, breaks);
            List<BigDecimal> overrides = authorizeOverrides(technicianId, breaks);
            CustomerApprovalPreference preference = origin == RepairOrigin.FIELD
                    ? approvalPolicy.preferenceFor(customerId)
                    : null;

            // ── Create breaks strictly in order ─────────────────────────────
            String unit = unitNumber.strip();
            int total = breaks.size();
            List<Repair> created = new ArrayList<>(total);

            for (int i = 1; i <= total; i++) {
                BreakSpec breakSpec = breaks.get(i - 1);
                int tierIndex = counter.nextIndex(customerId, unit);

                Repair repair = new Repair(customerId, technicianId, unit, breakSpec.damageType().strip(), origin);
                BigDecimal override = overrides.get(i - 1);
                if (override != null) {
                    repair.assignPrice(override, tierIndex, breakSpec.overrideReason().strip());
                } else {
                    repair.assignPrice(pricingEngine.priceFor(customerId, unit, tierIndex), tierIndex, null);
                }

                RepairStatus initial = origin == RepairOrigin.CUSTOMER
                        ? RepairStatus.REQUESTED
                        : approvalPolicy.initialStatus(preference, i);
                statusMachine.initialize(repair, initial);
                repair.placeInBatch(batchId, i, total);
                copyFieldNotes(breakSpec, repair);

                // Flush per break so a storage failure surfaces at the break that caused it.
                created.add(repairRepo.saveAndFlush(repair));
            }

            RepairCreatedEvent event = new RepairCreatedEvent(
                    batchId, customerId, unit, origin, created, Instant.now());
            metrics.batchCommitted(sample, created);
            log.info("Created {} repair(s) for customer={} unit={} batch={} total={}",
                    total, customerId, unit, batchId, event.totalPrice());
            return new BatchResult(created, event);

        } catch (RepairEngineException e) {
            metrics.batchRejected(sample, e.getKind());
            throw e;
        } catch (ConcurrencyFailureException e) {
            metrics.batchRejected(sample, RepairEngineException.Kind.CONCURRENCY);
            log.warn("Concurrent update on customer={} unit={}; batch rolled back", customerId, unitNumber);
            throw new ConcurrencyException(
                    "Unit " + unitNumber + " was updated concurrently; retry the submission", e);
        } catch (DataAccessException e) {
            metrics.batchRejected(sample, RepairEngineException.Kind.PERSISTENCE);
            log.error("Storage failure creating repairs for customer={} unit={}; batch rolled back",
                    customerId, unitNumber, e);
            throw new StorageException("Could not store repairs for unit " + unitNumber, e);
        } finally {
            MDC.remove("customerId");
            MDC.remove("unitNumber");
            MDC.remove("batchId");
        }
    }

    private void validate(UUID customerId, UUID technicianId, String unitNumber,
                          RepairOrigin origin, List<BreakSpec> breaks) {
        if (breaks == null || breaks.isEmpty()) {
            throw new ValidationException("A batch needs at least one break");
        }
        if (unitNumber == null || unitNumber.isBlank()) {
            throw new ValidationException("Unit number is required");
        }
        if (unitNumber.strip().length() > MAX_UNIT_NUMBER_LENGTH) {
            throw new ValidationException("Unit number is longer than " + MAX_UNIT_NUMBER_LENGTH + " characters");
        }
        for (int i = 0; i < breaks.size(); i++) {
            BreakSpec breakSpec = breaks.get(i);
            if (breakSpec == null || breakSpec.damageType() == null || breakSpec.damageType().isBlank()) {
                throw new ValidationException("Break " + (i + 1) + " has no damage type");
            }
        }
        if (customerId == null || !customerRepo.existsById(customerId)) {
            throw new ValidationException("Unknown customer: " + customerId);
        }
        if (origin == RepairOrigin.FIELD && technicianId == null) {
            throw new ValidationException("Field repairs need a technician");
        }
        if (technicianId != null && !technicianRepo.existsById(technicianId)) {
            throw new ValidationException("Unknown technician: " + technicianId);
        }
    }

    /** Approved override per break, null where the break uses the computed price. */
    private List<BigDecimal> authorizeOverrides(UUID technicianId, List<BreakSpec> breaks) {
        List<BigDecimal> overrides = new ArrayList<>(breaks.size());
        for (BreakSpec breakSpec : breaks) {
            overrides.add(breakSpec.hasOverride()
                    ? overrideAuthorizer.authorize(technicianId, breakSpec.overridePrice(), breakSpec.overrideReason())
                    : null);
        }
        return overrides;
    }

    private static void copyFieldNotes(BreakSpec breakSpec, Repair repair) {
        repair.setDescription(breakSpec.description());
        repair.setDrilledBeforeRepair(Boolean.TRUE.equals(breakSpec.drilledBeforeRepair()));
        repair.setWindshieldTemperature(breakSpec.windshieldTemperature());
        repair.setResinViscosity(breakSpec.resinViscosity());
    }
}
