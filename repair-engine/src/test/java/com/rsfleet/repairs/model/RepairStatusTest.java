package com.rsfleet.repairs.model;

import com.rsfleet.repairs.error.TransitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepairStatusTest {

    @Test
    void transitionTable_matchesWorkflow() {
        assertThat(RepairStatus.REQUESTED.successors()).containsExactly(RepairStatus.APPROVED);
        assertThat(RepairStatus.PENDING.successors())
                .containsExactlyInAnyOrder(RepairStatus.APPROVED, RepairStatus.DENIED);
        assertThat(RepairStatus.APPROVED.successors()).containsExactly(RepairStatus.IN_PROGRESS);
        assertThat(RepairStatus.IN_PROGRESS.successors()).containsExactly(RepairStatus.COMPLETED);
    }

    @ParameterizedTest
    @EnumSource(value = RepairStatus.class, names = {"COMPLETED", "DENIED"})
    void terminalStates_acceptNothing(RepairStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (RepairStatus target : RepairStatus.values()) {
            assertThat(terminal.canTransitionTo(target)).isFalse();
        }
    }

    @Test
    void initialStates_dependOnOrigin() {
        assertThat(RepairStatus.REQUESTED.isInitialFor(RepairOrigin.CUSTOMER)).isTrue();
        assertThat(RepairStatus.PENDING.isInitialFor(RepairOrigin.CUSTOMER)).isFalse();
        assertThat(RepairStatus.PENDING.isInitialFor(RepairOrigin.FIELD)).isTrue();
        assertThat(RepairStatus.APPROVED.isInitialFor(RepairOrigin.FIELD)).isTrue();
        assertThat(RepairStatus.IN_PROGRESS.isInitialFor(RepairOrigin.FIELD)).isFalse();
        assertThat(RepairStatus.COMPLETED.isInitialFor(RepairOrigin.FIELD)).isFalse();
    }

    @Test
    void repair_illegalTransition_leavesStatusUnchanged() {
        Repair repair = new Repair(UUID.randomUUID(), UUID.randomUUID(), "T-1", "chip", RepairOrigin.FIELD);
        repair.assignPrice(new BigDecimal("40.00"), 1, null);
        repair.initializeStatus(RepairStatus.PENDING);

        assertThatThrownBy(() -> repair.transitionTo(RepairStatus.COMPLETED))
                .isInstanceOf(TransitionException.class);
        assertThat(repair.getStatus()).isEqualTo(RepairStatus.PENDING);
    }

    @Test
    void repair_priceAssignedOnlyOnce() {
        Repair repair = new Repair(UUID.randomUUID(), UUID.randomUUID(), "T-1", "chip", RepairOrigin.FIELD);
        repair.assignPrice(new BigDecimal("40.00"), 1, null);

        assertThatThrownBy(() -> repair.assignPrice(new BigDecimal("10.00"), 1, "goodwill"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(repair.getPrice()).isEqualByComparingTo("40.00");
    }
}
