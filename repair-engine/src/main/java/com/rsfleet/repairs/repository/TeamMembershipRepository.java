package com.rsfleet.repairs.repository;

import com.rsfleet.repairs.model.TeamMembership;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface TeamMembershipRepository extends JpaRepository<TeamMembership, UUID> {

    boolean existsByManagerIdAndMemberId(UUID managerId, UUID memberId);
}
