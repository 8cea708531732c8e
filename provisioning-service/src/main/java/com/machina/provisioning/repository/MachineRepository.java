package com.machina.provisioning.repository;

import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for Machine entity.
 *
 * Note: @SQLRestriction on entity auto-filters soft-deleted machines.
 */
@Repository
public interface MachineRepository extends JpaRepository<Machine, UUID> {

    /**
     * Filtered listing for the machines endpoint.
     *
     * @param namePattern lower-case LIKE pattern, "%" when no search term was given
     */
    @Query("SELECT m FROM Machine m WHERE (:status IS NULL OR m.actualStatus = :status) "
        + "AND (:providerType IS NULL OR m.providerType = :providerType) "
        + "AND (:region IS NULL OR m.region = :region) "
        + "AND LOWER(m.name) LIKE :namePattern")
    Page<Machine> search(
        @Param("status") MachineStatus status,
        @Param("providerType") ProviderType providerType,
        @Param("region") String region,
        @Param("namePattern") String namePattern,
        Pageable pageable);

    /**
     * Candidates for reconciliation: everything not already terminated.
     */
    List<Machine> findByActualStatusNotOrderByCreatedAtAsc(MachineStatus status);

    boolean existsByProviderAccountId(UUID providerAccountId);
}
