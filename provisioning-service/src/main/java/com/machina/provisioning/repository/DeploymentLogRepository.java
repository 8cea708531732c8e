package com.machina.provisioning.repository;

import com.machina.provisioning.entity.DeploymentLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DeploymentLogRepository extends JpaRepository<DeploymentLogEntry, Long> {

    List<DeploymentLogEntry> findByDeploymentIdOrderBySequenceAsc(UUID deploymentId);

    long countByDeploymentId(UUID deploymentId);
}
