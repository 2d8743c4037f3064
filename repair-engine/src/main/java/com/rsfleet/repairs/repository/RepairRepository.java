package com.rsfleet.repairs.repository;

import com.rsfleet.repairs.model.Repair;
import com.rsfleet.repairs.model.RepairStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the repairs table.
 */
public interface RepairRepository extends JpaRepository<Repair, UUID> {

    /** Lifetime repair count of a customer across all units (volume discount input). */
    long countByCustomerId(UUID customerId);

    List<Repair> findByCustomerIdOrderByCreatedAtDesc(UUID customerId);

    List<Repair> findByCustomerIdAndUnitNumberOrderByTierIndexAsc(UUID customerId, String unitNumber);

    List<Repair> findByCustomerIdAndStatusNotOrderByCreatedAtDesc(UUID customerId, RepairStatus status);

    List<Repair> findByStatusNotOrderByCreatedAtDesc(RepairStatus status);

    List<Repair> findByTechnicianIdInAndStatusNotInOrderByCreatedAtDesc(Collection<UUID> technicianIds,
                                                                         Collection<RepairStatus> statuses);
}
