package com.machina.provisioning.repository;

import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.DeploymentType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DeploymentRepository extends JpaRepository<Deployment, UUID> {

    /**
     * Filtered listing, newest first.
     */
    @Query("SELECT d FROM Deployment d WHERE (:machineId IS NULL OR d.machineId = :machineId) "
        + "AND (:type IS NULL OR d.type = :type) "
        + "AND (:state IS NULL OR d.state = :state) "
        + "AND d.createdAt >= :createdAfter AND d.createdAt <= :createdBefore "
        + "ORDER BY d.createdAt DESC")
    Page<Deployment> search(
        @Param("machineId") UUID machineId,
        @Param("type") DeploymentType type,
        @Param("state") DeploymentState state,
        @Param("createdAfter") Instant createdAfter,
        @Param("createdBefore") Instant createdBefore,
        Pageable pageable);

    List<Deployment> findByStateInOrderByCreatedAtAsc(Collection<DeploymentState> states);

    List<Deployment> findByMachineIdAndStateIn(UUID machineId, Collection<DeploymentState> states);

    Optional<Deployment> findFirstByMachineIdAndTypeOrderByCreatedAtAsc(UUID machineId, DeploymentType type);

    @Query("SELECT d FROM Deployment d WHERE d.state = :state AND d.updatedAt < :cutoff")
    List<Deployment> findStaleInState(@Param("state") DeploymentState state, @Param("cutoff") Instant cutoff);
}
