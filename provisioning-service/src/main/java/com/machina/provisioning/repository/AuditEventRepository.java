package com.machina.provisioning.repository;

import com.machina.provisioning.entity.AuditEvent;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only queries; audit events are never updated or deleted.
 */
@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

    Page<AuditEvent> findByTargetTypeAndTargetIdOrderByCreatedAtDesc(
        String targetType, String targetId, Pageable pageable);
}
