package com.rsfleet.repairs.repository;

import com.rsfleet.repairs.model.CustomerApprovalPreference;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CustomerApprovalPreferenceRepository extends JpaRepository<CustomerApprovalPreference, UUID> {

    Optional<CustomerApprovalPreference> findByCustomerId(UUID customerId);
}
