package com.machina.provisioning.controller;

import com.machina.provisioning.dto.request.CreateMachineRequest;
import com.machina.provisioning.dto.request.RestartServiceRequest;
import com.machina.provisioning.dto.request.UpdateMachineRequest;
import com.machina.provisioning.dto.response.DeploymentResponse;
import com.machina.provisioning.dto.response.MachineCreatedResponse;
import com.machina.provisioning.dto.response.MachineResponse;
import com.machina.provisioning.dto.response.PageResponse;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.reconciliation.SyncSummary;
import com.machina.provisioning.service.MachineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Machines and the lifecycle actions on them.
 *
 * Every action answers with the deployment it queued; progress is read from
 * {@code /api/deployments/{id}}.
 */
@RestController
@RequestMapping("/api/machines")
@RequiredArgsConstructor
@Slf4j
public class MachineController {

    private final MachineService machineService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> createMachine(
            @Valid @RequestBody CreateMachineRequest request,
            Authentication authentication) {

        Long userId = (Long) authentication.getPrincipal();
        MachineCreatedResponse response = machineService.createMachine(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(envelope(response));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listMachines(
            @RequestParam(required = false) String status,
            @RequestParam(name = "provider_type", required = false) String providerType,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "20") int perPage) {

        PageResponse<MachineResponse> response = PageResponse.of(machineService.listMachines(
            status == null ? null : MachineStatus.fromValue(status),
            providerType == null ? null : ProviderType.fromValue(providerType),
            region,
            search,
            Paging.of(page, perPage, Sort.by(Sort.Direction.DESC, "createdAt"))));
        return ResponseEntity.ok(envelope(response));
    }

    @GetMapping("/{machineId}")
    public ResponseEntity<Map<String, Object>> getMachine(@PathVariable UUID machineId) {
        return ResponseEntity.ok(envelope(machineService.getMachine(machineId)));
    }

    /**
     * Queue an update of size, image and/or tags.
     */
    @PatchMapping("/{machineId}")
    public ResponseEntity<Map<String, Object>> updateMachine(
            @PathVariable UUID machineId,
            @Valid @RequestBody UpdateMachineRequest request,
            Authentication authentication) {

        Long userId = (Long) authentication.getPrincipal();
        return accepted(machineService.update(machineId, request, userId));
    }

    @PostMapping("/{machineId}/reboot")
    public ResponseEntity<Map<String, Object>> reboot(@PathVariable UUID machineId, Authentication authentication) {
        Long userId = (Long) authentication.getPrincipal();
        return accepted(machineService.reboot(machineId, userId));
    }

    @PostMapping("/{machineId}/destroy")
    public ResponseEntity<Map<String, Object>> destroy(@PathVariable UUID machineId, Authentication authentication) {
        Long userId = (Long) authentication.getPrincipal();
        log.info("User {} requested destroy of machine {}", userId, machineId);
        return accepted(machineService.destroy(machineId, userId));
    }

    @PostMapping("/{machineId}/refresh")
    public ResponseEntity<Map<String, Object>> refresh(@PathVariable UUID machineId, Authentication authentication) {
        Long userId = (Long) authentication.getPrincipal();
        return accepted(machineService.refresh(machineId, userId));
    }

    @PostMapping("/{machineId}/restart-service")
    public ResponseEntity<Map<String, Object>> restartService(
            @PathVariable UUID machineId,
            @Valid @RequestBody RestartServiceRequest request,
            Authentication authentication) {

        Long userId = (Long) authentication.getPrincipal();
        return accepted(machineService.restartService(machineId, request.serviceName(), userId));
    }

    /**
     * Run a reconciliation pass now and report what changed.
     */
    @PostMapping("/sync")
    public ResponseEntity<Map<String, Object>> sync(Authentication authentication) {
        Long userId = (Long) authentication.getPrincipal();
        log.info("Manual reconciliation requested by user {}", userId);
        SyncSummary summary = machineService.sync();
        return ResponseEntity.ok(envelope(summary));
    }

    private ResponseEntity<Map<String, Object>> accepted(DeploymentResponse deployment) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(envelope(Map.of("deployment", deployment)));
    }

    private Map<String, Object> envelope(Object data) {
        return Map.of(
            "data", data,
            "timestamp", Instant.now().toString()
        );
    }
}
