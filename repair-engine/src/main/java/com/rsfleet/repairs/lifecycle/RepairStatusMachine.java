package com.rsfleet.repairs.lifecycle;

import com.rsfleet.repairs.error.AuthorizationException;
import com.rsfleet.repairs.error.RepairNotFoundException;
import com.rsfleet.repairs.error.TransitionException;
import com.rsfleet.repairs.error.ValidationException;
import com.rsfleet.repairs.event.RepairStatusChangedEvent;
import com.rsfleet.repairs.model.*;
import com.rsfleet.repairs.repository.*;
import com.rsfleet.repairs.service.RepairMetrics;
import com.rsfleet.repairs.service.command.AssignRequestedRepair;
import com.rsfleet.repairs.service.command.ResolvePendingRepair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Owns every status change of a Repair after creation, and who may see it.
 *
 * Each transition is checked twice, in this order:
 *   1. against the table in {@link RepairStatus#successors()} → TransitionException
 *   2. against the actor allowed to trigger it              → AuthorizationException
 *
 * A rejected call leaves the repair untouched. An accepted one returns the
 * event for the caller to publish after commit.
 */
@Service
public class RepairStatusMachine {

    private static final Logger log = LoggerFactory.getLogger(RepairStatusMachine.class);

    private final RepairRepository               repairRepo;
    private final ApprovalDecisionRepository     decisionRepo;
    private final ManagerAuthorizationRepository authorizationRepo;
    private final TeamMembershipRepository       teamRepo;
    private final TechnicianProfileRepository    technicianRepo;
    private final RepairMetrics                  metrics;

    public RepairStatusMachine(RepairRepository repairRepo,
                               ApprovalDecisionRepository decisionRepo,
                               ManagerAuthorizationRepository authorizationRepo,
                               TeamMembershipRepository teamRepo,
                               TechnicianProfileRepository technicianRepo,
                               RepairMetrics metrics) {
        this.repairRepo        = repairRepo;
        this.decisionRepo      = decisionRepo;
        this.authorizationRepo = authorizationRepo;
        this.teamRepo          = teamRepo;
        this.technicianRepo    = technicianRepo;
        this.metrics           = metrics;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Give a new repair its starting status.
     *
     * @throws TransitionException if the status is not a legal initial state
     *         for the repair's origin (nothing is ever created IN_PROGRESS or COMPLETED)
     */
    public void initialize(Repair repair, RepairStatus initial) {
        repair.initializeStatus(initial);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /**
     * Customer approves or denies a PENDING field repair: PENDING → APPROVED | DENIED.
     * Only the customer that owns the repair may decide.
     */
    @Transactional
    public StatusChange resolvePending(ResolvePendingRepair cmd, Actor actor) {
        Repair repair = load(cmd.repairId());
        RepairStatus target = cmd.approved() ? RepairStatus.APPROVED : RepairStatus.DENIED;
        requireLegal(repair, RepairStatus.PENDING, target);

        if (!actor.isCustomer() || !actor.id().equals(repair.getCustomerId())) {
            throw new AuthorizationException("Only the owning customer can resolve a pending repair");
        }

        ApprovalDecision decision = decisionRepo.findByRepairId(repair.getId())
                .orElseGet(() -> new ApprovalDecision(repair.getId()));
        decision.record(cmd.approved(), cmd.decidedBy(), cmd.notes());
        decisionRepo.save(decision);

        return apply(repair, target, actor);
    }

    /**
     * Manager assigns a customer request to a technician: REQUESTED → APPROVED.
     * The assignee must be the manager or a member of the manager's team.
     */
    @Transactional
    public StatusChange assignRequested(AssignRequestedRepair cmd) {
        Repair repair = load(cmd.repairId());
        requireLegal(repair, RepairStatus.REQUESTED, RepairStatus.APPROVED);

        UUID managerId = cmd.assignedByManagerId();
        if (!isManager(managerId)) {
            throw new AuthorizationException("Only managers can assign requested repairs");
        }
        UUID assignee = cmd.assignToTechnicianId();
        if (assignee == null || !technicianRepo.existsById(assignee)) {
            throw new ValidationException("Unknown technician: " + assignee);
        }
        if (!assignee.equals(managerId) && !teamRepo.existsByManagerIdAndMemberId(managerId, assignee)) {
            throw new AuthorizationException("Technician " + assignee + " is not on manager " + managerId + "'s team");
        }

        repair.assignTechnician(assignee);
        return apply(repair, RepairStatus.APPROVED, Actor.technician(managerId));
    }

    /** APPROVED → IN_PROGRESS, by the assigned technician or one of their managers. */
    @Transactional
    public StatusChange startWork(UUID repairId, UUID technicianId) {
        return technicianStep(repairId, technicianId, RepairStatus.IN_PROGRESS);
    }

    /** IN_PROGRESS → COMPLETED, by the assigned technician or one of their managers. */
    @Transactional
    public StatusChange complete(UUID repairId, UUID technicianId) {
        return technicianStep(repairId, technicianId, RepairStatus.COMPLETED);
    }

    private StatusChange technicianStep(UUID repairId, UUID technicianId, RepairStatus target) {
        Repair repair = load(repairId);
        requireLegal(repair, null, target);
        if (!isResponsibleTechnician(technicianId, repair)) {
            throw new AuthorizationException(
                    "Technician " + technicianId + " is not assigned to repair " + repairId);
        }
        return apply(repair, target, Actor.technician(technicianId));
    }

    private StatusChange apply(Repair repair, RepairStatus target, Actor actor) {
        RepairStatus from = repair.getStatus();
        repair.transitionTo(target);
        Repair saved = repairRepo.save(repair);
        metrics.transition(from, target);
        log.info("Repair {} {} → {} by {} {}", saved.getId(), from, target, actor.kind(), actor.id());
        return new StatusChange(saved, new RepairStatusChangedEvent(
                saved.getId(), saved.getCustomerId(), from, target, actor, Instant.now()));
    }

    /**
     * @param source the only state this action starts from, or null when the
     *               transition table alone decides
     */
    private static void requireLegal(Repair repair, RepairStatus source, RepairStatus target) {
        RepairStatus current = repair.getStatus();
        if ((source != null && current != source) || !current.canTransitionTo(target)) {
            throw new TransitionException(current, target);
        }
    }

    // ------------------------------------------------------------------
    // Visibility
    // ------------------------------------------------------------------

    /**
     * Whether {@code actor} may see {@code repair}.
     *
     *   customer          → only their own repairs, any status
     *   PENDING           → hidden from every technician, managers included
     *   REQUESTED         → managers only
     *   anything else     → the assigned technician, their managers, any manager
     */
    @Transactional(readOnly = true)
    public boolean canView(Actor actor, Repair repair) {
        if (actor.isCustomer()) {
            return actor.id().equals(repair.getCustomerId());
        }
        return switch (repair.getStatus()) {
            case PENDING   -> false;
            case REQUESTED -> isManager(actor.id());
            case APPROVED, IN_PROGRESS, COMPLETED, DENIED ->
                    actor.id().equals(repair.getTechnicianId()) || isManager(actor.id());
        };
    }

    /**
     * @throws RepairNotFoundException when the repair does not exist or is hidden from the actor
     */
    @Transactional(readOnly = true)
    public Repair findVisible(UUID repairId, Actor actor) {
        Repair repair = load(repairId);
        if (!canView(actor, repair)) {
            throw new RepairNotFoundException(repairId);
        }
        return repair;
    }

    /**
     * Repairs the actor may see, newest first. A technician's list is their
     * own non-pending work; a manager sees every repair except PENDING ones.
     *
     * @param customerId optional filter; ignored for customers (they only see their own)
     */
    @Transactional(readOnly = true)
    public List<Repair> visibleRepairs(Actor actor, UUID customerId) {
        if (actor.isCustomer()) {
            return repairRepo.findByCustomerIdOrderByCreatedAtDesc(actor.id());
        }
        if (isManager(actor.id())) {
            return customerId != null
                    ? repairRepo.findByCustomerIdAndStatusNotOrderByCreatedAtDesc(customerId, RepairStatus.PENDING)
                    : repairRepo.findByStatusNotOrderByCreatedAtDesc(RepairStatus.PENDING);
        }
        List<Repair> own = repairRepo.findByTechnicianIdInAndStatusNotInOrderByCreatedAtDesc(
                Set.of(actor.id()), Set.of(RepairStatus.PENDING, RepairStatus.REQUESTED));
        return customerId == null
                ? own
                : own.stream().filter(r -> customerId.equals(r.getCustomerId())).toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Repair load(UUID repairId) {
        return repairRepo.findById(repairId).orElseThrow(() -> new RepairNotFoundException(repairId));
    }

    private boolean isManager(UUID technicianId) {
        return technicianId != null
                && authorizationRepo.findById(technicianId).map(ManagerAuthorization::isManager).orElse(false);
    }

    /** The assigned technician, or a manager whose team includes the assigned technician. */
    private boolean isResponsibleTechnician(UUID technicianId, Repair repair) {
        if (technicianId == null) return false;
        UUID assigned = repair.getTechnicianId();
        if (technicianId.equals(assigned)) return true;
        return assigned != null
                && isManager(technicianId)
                && teamRepo.existsByManagerIdAndMemberId(technicianId, assigned);
    }
}
