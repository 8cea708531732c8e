package com.machina.provisioning.audit;

import com.machina.provisioning.entity.AuditEvent;
import com.machina.provisioning.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Writes audit events.
 *
 * REQUIRES_NEW: the event survives a rollback of the caller's transaction.
 * Failures are logged and never propagate to the audited operation.
 * Credential material must never be passed in {@code details}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    public static final String TARGET_MACHINE = "machine";
    public static final String TARGET_DEPLOYMENT = "deployment";
    public static final String TARGET_PROVIDER_ACCOUNT = "provider_account";
    public static final String TARGET_WORKSPACE = "workspace";

    private final AuditEventRepository auditEventRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void success(AuditAction action, Long actorId, String targetType, Object targetId, Map<String, Object> details) {
        record(action, AuditEvent.Outcome.SUCCESS, actorId, targetType, targetId, details);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void failure(AuditAction action, Long actorId, String targetType, Object targetId, Map<String, Object> details) {
        record(action, AuditEvent.Outcome.FAILURE, actorId, targetType, targetId, details);
    }

    @Transactional(readOnly = true)
    public Page<AuditEvent> history(String targetType, Object targetId, Pageable pageable) {
        return auditEventRepository.findByTargetTypeAndTargetIdOrderByCreatedAtDesc(
            targetType, String.valueOf(targetId), pageable);
    }

    private void record(
        AuditAction action,
        AuditEvent.Outcome outcome,
        Long actorId,
        String targetType,
        Object targetId,
        Map<String, Object> details
    ) {
        try {
            auditEventRepository.save(AuditEvent.builder()
                .action(action.name())
                .outcome(outcome)
                .actorId(actorId)
                .targetType(targetType)
                .targetId(targetId == null ? null : targetId.toString())
                .details(details)
                .build());
            log.debug("Audit event recorded: {} {} on {}:{}", action, outcome, targetType, targetId);
        } catch (Exception e) {
            log.error("Failed to record audit event: {} {} on {}:{}", action, outcome, targetType, targetId, e);
        }
    }
}
