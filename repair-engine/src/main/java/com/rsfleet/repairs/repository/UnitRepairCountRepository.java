package com.rsfleet.repairs.repository;

import com.rsfleet.repairs.model.UnitRepairCount;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * Counter rows, one per (customer, unit).
 */
public interface UnitRepairCountRepository extends JpaRepository<UnitRepairCount, UUID> {

    /**
     * Load a counter row and hold a write lock on it until the surrounding
     * transaction ends.
     *
     * SELECT ... FOR UPDATE means a second writer for the same (customer, unit)
     * waits here until the first commits or rolls back. Rows for other units
     * are not touched, so unrelated batches never wait on each other.
     *
     * The lock timeout hint bounds the wait; PostgreSQL also enforces the
     * session lock_timeout set on every pooled connection.
     *
     * Must run inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("""
            SELECT c FROM UnitRepairCount c
            WHERE c.customerId = :customerId AND c.unitNumber = :unitNumber
            """)
    Optional<UnitRepairCount> lockByCustomerAndUnit(@Param("customerId") UUID customerId,
                                                    @Param("unitNumber") String unitNumber);

    /**
     * Insert a zero counter row unless one already exists, in the caller's
     * transaction.
     *
     * A concurrent inserter of the same (customer, unit) waits on the unique
     * key until the first transaction ends, then does nothing. A zero row that
     * is rolled back reads the same as no row.
     *
     * @return 1 if this call inserted the row, 0 otherwise
     */
    @Modifying
    @Query(value = """
            INSERT INTO unit_repair_counts (id, customer_id, unit_number, repair_count, version)
            VALUES (:id, :customerId, :unitNumber, 0, 0)
            ON CONFLICT DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("customerId") UUID customerId,
                       @Param("unitNumber") String unitNumber);

    /** Plain read, no lock. Used for previews. */
    Optional<UnitRepairCount> findByCustomerIdAndUnitNumber(UUID customerId, String unitNumber);
}
