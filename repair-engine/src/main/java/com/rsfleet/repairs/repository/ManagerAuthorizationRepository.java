package com.rsfleet.repairs.repository;

import com.rsfleet.repairs.model.ManagerAuthorization;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Manager capability rows, keyed by technician id.
 */
public interface ManagerAuthorizationRepository extends JpaRepository<ManagerAuthorization, UUID> {
}
