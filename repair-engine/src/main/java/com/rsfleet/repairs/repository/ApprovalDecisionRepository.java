package com.rsfleet.repairs.repository;

import com.rsfleet.repairs.model.ApprovalDecision;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ApprovalDecisionRepository extends JpaRepository<ApprovalDecision, UUID> {

    Optional<ApprovalDecision> findByRepairId(UUID repairId);
}
