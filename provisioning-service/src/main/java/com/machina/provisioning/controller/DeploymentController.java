package com.machina.provisioning.controller;

import com.machina.provisioning.deployment.DeploymentLogBroadcaster;
import com.machina.provisioning.deployment.DeploymentLogLine;
import com.machina.provisioning.deployment.DeploymentLogListener;
import com.machina.provisioning.deployment.DeploymentService;
import com.machina.provisioning.dto.response.DeploymentResponse;
import com.machina.provisioning.dto.response.PageResponse;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.DeploymentType;
import com.machina.provisioning.exception.ForbiddenException;
import com.machina.provisioning.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Deployment queries, approval, cancellation and log tailing.
 */
@RestController
@RequestMapping("/api/deployments")
@Slf4j
public class DeploymentController {

    private static final Set<String> APPROVER_ROLES = Set.of("ROLE_OPERATOR", "ROLE_ADMIN");
    private static final Instant LATEST = Instant.parse("9999-12-31T23:59:59Z");

    private final DeploymentService deploymentService;
    private final long streamTimeoutMillis;

    public DeploymentController(
        DeploymentService deploymentService,
        @Value("${provisioning.logs.stream-timeout:30m}") Duration streamTimeout
    ) {
        this.deploymentService = deploymentService;
        this.streamTimeoutMillis = streamTimeout.toMillis();
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listDeployments(
            @RequestParam(name = "machine_id", required = false) UUID machineId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String state,
            @RequestParam(name = "created_after", required = false) String createdAfter,
            @RequestParam(name = "created_before", required = false) String createdBefore,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "20") int perPage) {

        PageResponse<DeploymentResponse> response = PageResponse.of(deploymentService.list(
                machineId,
                type == null ? null : DeploymentType.fromValue(type),
                state == null ? null : DeploymentState.fromValue(state),
                parseInstant(createdAfter, "created_after", Instant.EPOCH),
                parseInstant(createdBefore, "created_before", LATEST),
                Paging.of(page, perPage, Sort.unsorted()))
            .map(DeploymentResponse::from));
        return ResponseEntity.ok(envelope(response));
    }

    @GetMapping("/{deploymentId}")
    public ResponseEntity<Map<String, Object>> getDeployment(@PathVariable UUID deploymentId) {
        return ResponseEntity.ok(envelope(DeploymentResponse.from(deploymentService.get(deploymentId))));
    }

    /**
     * Buffered log lines as JSON.
     */
    @GetMapping("/{deploymentId}/logs")
    public ResponseEntity<Map<String, Object>> getLogs(@PathVariable UUID deploymentId) {
        return ResponseEntity.ok(envelope(deploymentService.getLogs(deploymentId)));
    }

    /**
     * Server-sent events: every buffered line as {@code log}, then live lines, then one
     * {@code complete} event carrying the final state.
     */
    @GetMapping(value = "/{deploymentId}/logs", params = "stream=true")
    public SseEmitter streamLogs(@PathVariable UUID deploymentId) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMillis);
        DeploymentLogBroadcaster.Subscription subscription =
            deploymentService.subscribeLogs(deploymentId, new EmitterListener(emitter));
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(() -> {
            subscription.close();
            emitter.complete();
        });
        emitter.onError(e -> subscription.close());
        return emitter;
    }

    /**
     * Approve a plan that is awaiting approval. Operators and admins only.
     */
    @PostMapping("/{deploymentId}/approve")
    public ResponseEntity<Map<String, Object>> approve(@PathVariable UUID deploymentId,
                                                       Authentication authentication) {
        Long userId = (Long) authentication.getPrincipal();
        List<String> roles = extractRoles(authentication);
        if (roles.stream().noneMatch(APPROVER_ROLES::contains)) {
            throw new ForbiddenException("Only operators or admins can approve deployments");
        }
        log.info("User {} approving deployment {}", userId, deploymentId);
        return ResponseEntity.ok(envelope(DeploymentResponse.from(deploymentService.approve(deploymentId, userId))));
    }

    @PostMapping("/{deploymentId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable UUID deploymentId,
                                                      Authentication authentication) {
        Long userId = (Long) authentication.getPrincipal();
        log.info("User {} cancelling deployment {}", userId, deploymentId);
        return ResponseEntity.ok(envelope(DeploymentResponse.from(deploymentService.cancel(deploymentId, userId))));
    }

    private Instant parseInstant(String value, String field, Instant fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid timestamp: " + value, field);
        }
    }

    private List<String> extractRoles(Authentication authentication) {
        return authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .toList();
    }

    private Map<String, Object> envelope(Object data) {
        return Map.of(
            "data", data,
            "timestamp", Instant.now().toString()
        );
    }

    private static final class EmitterListener implements DeploymentLogListener {

        private final SseEmitter emitter;

        private EmitterListener(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void onLog(DeploymentLogLine line) throws IOException {
            emitter.send(SseEmitter.event()
                .name("log")
                .id(String.valueOf(line.sequence()))
                .data(line, MediaType.APPLICATION_JSON));
        }

        @Override
        public void onComplete(DeploymentState finalState) throws IOException {
            emitter.send(SseEmitter.event()
                .name("complete")
                .data(Map.of("state", finalState), MediaType.APPLICATION_JSON));
            emitter.complete();
        }
    }
}
