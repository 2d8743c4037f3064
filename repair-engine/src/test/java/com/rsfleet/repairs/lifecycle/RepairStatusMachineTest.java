package com.rsfleet.repairs.lifecycle;

import com.rsfleet.repairs.error.AuthorizationException;
import com.rsfleet.repairs.error.RepairNotFoundException;
import com.rsfleet.repairs.error.TransitionException;
import com.rsfleet.repairs.error.ValidationException;
import com.rsfleet.repairs.model.*;
import com.rsfleet.repairs.repository.*;
import com.rsfleet.repairs.service.RepairMetrics;
import com.rsfleet.repairs.service.command.AssignRequestedRepair;
import com.rsfleet.repairs.service.command.ResolvePendingRepair;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static com.rsfleet.repairs.TestRepairs.customerRequest;
import static com.rsfleet.repairs.TestRepairs.fieldRepair;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RepairStatusMachine: transition legality, who may trigger
 * each transition, and visibility.
 */
@ExtendWith(MockitoExtension.class)
class RepairStatusMachineTest {

    @Mock RepairRepository               repairRepo;
    @Mock ApprovalDecisionRepository     decisionRepo;
    @Mock ManagerAuthorizationRepository authorizationRepo;
    @Mock TeamMembershipRepository       teamRepo;
    @Mock TechnicianProfileRepository    technicianRepo;

    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    RepairStatusMachine machine;

    UUID customerId = UUID.randomUUID();
    UUID techId     = UUID.randomUUID();
    UUID managerId  = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        machine = new RepairStatusMachine(repairRepo, decisionRepo, authorizationRepo,
                teamRepo, technicianRepo, new RepairMetrics(registry));
    }

    // ------------------------------------------------------------------
    // resolvePending()
    // ------------------------------------------------------------------

    @Test
    void resolvePending_ownerDenies_repairDeniedAndDecisionRecorded() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.PENDING));
        savesReturnArgument();

        StatusChange change = machine.resolvePending(
                new ResolvePendingRepair(repair.getId(), false, "fleet manager", "wait for replacement"),
                Actor.customer(customerId));

        assertThat(change.repair().getStatus()).isEqualTo(RepairStatus.DENIED);
        assertThat(change.event().from()).isEqualTo(RepairStatus.PENDING);
        assertThat(change.event().to()).isEqualTo(RepairStatus.DENIED);
        ArgumentCaptor<ApprovalDecision> decision = ArgumentCaptor.forClass(ApprovalDecision.class);
        verify(decisionRepo).save(decision.capture());
        assertThat(decision.getValue().getApproved()).isFalse();
        assertThat(decision.getValue().getNotes()).isEqualTo("wait for replacement");
        assertThat(registry.counter("rsfleet.repairs.transitions", "from", "pending", "to", "denied").count())
                .isEqualTo(1.0);
    }

    @Test
    void deniedRepair_acceptsNoFurtherTransition() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.PENDING));
        savesReturnArgument();
        machine.resolvePending(new ResolvePendingRepair(repair.getId(), false, null, null),
                Actor.customer(customerId));

        assertThatThrownBy(() -> machine.startWork(repair.getId(), techId))
                .isInstanceOf(TransitionException.class);
        assertThatThrownBy(() -> machine.resolvePending(
                new ResolvePendingRepair(repair.getId(), true, null, null), Actor.customer(customerId)))
                .isInstanceOf(TransitionException.class);
        assertThat(repair.getStatus()).isEqualTo(RepairStatus.DENIED);
    }

    @Test
    void resolvePending_otherCustomer_rejectedAndUnchanged() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.PENDING));

        assertThatThrownBy(() -> machine.resolvePending(
                new ResolvePendingRepair(repair.getId(), true, null, null), Actor.customer(UUID.randomUUID())))
                .isInstanceOf(AuthorizationException.class);
        assertThat(repair.getStatus()).isEqualTo(RepairStatus.PENDING);
        verify(repairRepo, never()).save(any());
        verifyNoInteractions(decisionRepo);
    }

    @Test
    void resolvePending_technician_rejected() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.PENDING));

        assertThatThrownBy(() -> machine.resolvePending(
                new ResolvePendingRepair(repair.getId(), true, null, null), Actor.technician(techId)))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void resolvePending_notPending_illegalTransitionReportedFirst() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.APPROVED));

        // wrong actor as well, but the transition itself is checked first
        assertThatThrownBy(() -> machine.resolvePending(
                new ResolvePendingRepair(repair.getId(), true, null, null), Actor.technician(techId)))
                .isInstanceOf(TransitionException.class);
    }

    @Test
    void resolvePending_unknownRepair_notFound() {
        UUID id = UUID.randomUUID();
        when(repairRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> machine.resolvePending(
                new ResolvePendingRepair(id, true, null, null), Actor.customer(customerId)))
                .isInstanceOf(RepairNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // assignRequested()
    // ------------------------------------------------------------------

    @Test
    void assignRequested_toTeamMember_approvedAndAssigned() {
        Repair repair = stored(customerRequest(customerId));
        isManager(managerId);
        when(technicianRepo.existsById(techId)).thenReturn(true);
        when(teamRepo.existsByManagerIdAndMemberId(managerId, techId)).thenReturn(true);
        savesReturnArgument();

        StatusChange change = machine.assignRequested(new AssignRequestedRepair(repair.getId(), techId, managerId));

        assertThat(change.repair().getStatus()).isEqualTo(RepairStatus.APPROVED);
        assertThat(change.repair().getTechnicianId()).isEqualTo(techId);
        assertThat(change.event().changedBy()).isEqualTo(Actor.technician(managerId));
    }

    @Test
    void assignRequested_toSelf_allowedWithoutTeamRow() {
        Repair repair = stored(customerRequest(customerId));
        isManager(managerId);
        when(technicianRepo.existsById(managerId)).thenReturn(true);
        savesReturnArgument();

        StatusChange change = machine.assignRequested(new AssignRequestedRepair(repair.getId(), managerId, managerId));

        assertThat(change.repair().getTechnicianId()).isEqualTo(managerId);
    }

    @Test
    void assignRequested_outsideTeam_rejected() {
        Repair repair = stored(customerRequest(customerId));
        isManager(managerId);
        when(technicianRepo.existsById(techId)).thenReturn(true);
        when(teamRepo.existsByManagerIdAndMemberId(managerId, techId)).thenReturn(false);

        assertThatThrownBy(() -> machine.assignRequested(new AssignRequestedRepair(repair.getId(), techId, managerId)))
                .isInstanceOf(AuthorizationException.class);
        assertThat(repair.getStatus()).isEqualTo(RepairStatus.REQUESTED);
        assertThat(repair.getTechnicianId()).isNull();
    }

    @Test
    void assignRequested_byNonManager_rejected() {
        Repair repair = stored(customerRequest(customerId));
        when(authorizationRepo.findById(techId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> machine.assignRequested(new AssignRequestedRepair(repair.getId(), techId, techId)))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void assignRequested_unknownTechnician_validationError() {
        Repair repair = stored(customerRequest(customerId));
        isManager(managerId);
        when(technicianRepo.existsById(techId)).thenReturn(false);

        assertThatThrownBy(() -> machine.assignRequested(new AssignRequestedRepair(repair.getId(), techId, managerId)))
                .isInstanceOf(ValidationException.class);
    }

    // ------------------------------------------------------------------
    // startWork() / complete()
    // ------------------------------------------------------------------

    @Test
    void assignedTechnician_startsAndCompletes() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.APPROVED));
        savesReturnArgument();

        machine.startWork(repair.getId(), techId);
        StatusChange done = machine.complete(repair.getId(), techId);

        assertThat(done.repair().getStatus()).isEqualTo(RepairStatus.COMPLETED);
        assertThat(done.event().from()).isEqualTo(RepairStatus.IN_PROGRESS);
    }

    @Test
    void managerOfAssignedTechnician_mayStartWork() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.APPROVED));
        isManager(managerId);
        when(teamRepo.existsByManagerIdAndMemberId(managerId, techId)).thenReturn(true);
        savesReturnArgument();

        assertThat(machine.startWork(repair.getId(), managerId).repair().getStatus())
                .isEqualTo(RepairStatus.IN_PROGRESS);
    }

    @Test
    void otherTechnician_cannotStartWork() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.APPROVED));

        assertThatThrownBy(() -> machine.startWork(repair.getId(), UUID.randomUUID()))
                .isInstanceOf(AuthorizationException.class);
        assertThat(repair.getStatus()).isEqualTo(RepairStatus.APPROVED);
    }

    @Test
    void complete_beforeStart_illegal() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.APPROVED));

        assertThatThrownBy(() -> machine.complete(repair.getId(), techId))
                .isInstanceOf(TransitionException.class);
    }

    @Test
    void initialize_inProgress_rejected() {
        Repair repair = new Repair(customerId, techId, "T-9", "chip", RepairOrigin.FIELD);

        assertThatThrownBy(() -> machine.initialize(repair, RepairStatus.IN_PROGRESS))
                .isInstanceOf(TransitionException.class);
    }

    // ------------------------------------------------------------------
    // Visibility
    // ------------------------------------------------------------------

    @Test
    void pendingRepair_hiddenFromManagers() {
        Repair repair = fieldRepair(customerId, techId, RepairStatus.PENDING);

        assertThat(machine.canView(Actor.technician(managerId), repair)).isFalse();
        assertThat(machine.canView(Actor.customer(customerId), repair)).isTrue();
    }

    @Test
    void requestedRepair_visibleToManagersOnly() {
        Repair repair = customerRequest(customerId);
        isManager(managerId);
        when(authorizationRepo.findById(techId)).thenReturn(Optional.empty());

        assertThat(machine.canView(Actor.technician(managerId), repair)).isTrue();
        assertThat(machine.canView(Actor.technician(techId), repair)).isFalse();
    }

    @Test
    void customer_cannotSeeOtherCustomersRepairs() {
        Repair repair = fieldRepair(customerId, techId, RepairStatus.APPROVED);

        assertThat(machine.canView(Actor.customer(UUID.randomUUID()), repair)).isFalse();
    }

    @Test
    void findVisible_hiddenRepair_reportedAsNotFound() {
        Repair repair = stored(fieldRepair(customerId, techId, RepairStatus.PENDING));

        assertThatThrownBy(() -> machine.findVisible(repair.getId(), Actor.technician(techId)))
                .isInstanceOf(RepairNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Repair stored(Repair repair) {
        when(repairRepo.findById(repair.getId())).thenReturn(Optional.of(repair));
        return repair;
    }

    private void savesReturnArgument() {
        when(repairRepo.save(any(Repair.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private void isManager(UUID id) {
        when(authorizationRepo.findById(id))
                .thenReturn(Optional.of(new ManagerAuthorization(id, true, false, BigDecimal.ZERO)));
    }
}
