package com.machina.provisioning.controller;

import com.machina.provisioning.dto.request.CreateProviderAccountRequest;
import com.machina.provisioning.dto.request.UpdateProviderAccountRequest;
import com.machina.provisioning.dto.response.ProviderAccountResponse;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.service.ProviderAccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Provider catalog and provider account CRUD.
 *
 * Credentials are write-only: no endpoint returns them.
 */
@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
@Slf4j
public class ProviderController {

    private final ProviderAccountService providerAccountService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> listProviderTypes() {
        return ResponseEntity.ok(envelope(providerAccountService.listProviderTypes()));
    }

    @GetMapping("/{providerType}/options")
    public ResponseEntity<Map<String, Object>> getOptions(@PathVariable String providerType) {
        return ResponseEntity.ok(envelope(providerAccountService.getOptions(ProviderType.fromValue(providerType))));
    }

    @GetMapping("/accounts")
    public ResponseEntity<Map<String, Object>> listAccounts(
            @RequestParam(name = "provider_type", required = false) String providerType) {
        return ResponseEntity.ok(envelope(providerAccountService.listAccounts(
            providerType == null ? null : ProviderType.fromValue(providerType))));
    }

    @GetMapping("/accounts/{accountId}")
    public ResponseEntity<Map<String, Object>> getAccount(@PathVariable UUID accountId) {
        return ResponseEntity.ok(envelope(providerAccountService.getAccount(accountId)));
    }

    @PostMapping("/accounts")
    public ResponseEntity<Map<String, Object>> createAccount(
            @Valid @RequestBody CreateProviderAccountRequest request,
            Authentication authentication) {

        Long userId = (Long) authentication.getPrincipal();
        log.info("Creating {} provider account by user {}", request.providerType().getValue(), userId);
        ProviderAccountResponse response = providerAccountService.createAccount(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(envelope(response));
    }

    @PutMapping("/accounts/{accountId}")
    public ResponseEntity<Map<String, Object>> updateAccount(
            @PathVariable UUID accountId,
            @Valid @RequestBody UpdateProviderAccountRequest request,
            Authentication authentication) {

        Long userId = (Long) authentication.getPrincipal();
        return ResponseEntity.ok(envelope(providerAccountService.updateAccount(accountId, request, userId)));
    }

    @DeleteMapping("/accounts/{accountId}")
    public ResponseEntity<Void> deleteAccount(@PathVariable UUID accountId, Authentication authentication) {
        Long userId = (Long) authentication.getPrincipal();
        providerAccountService.deleteAccount(accountId, userId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Re-check stored credentials against the provider and persist the result.
     */
    @PostMapping("/accounts/{accountId}/verify")
    public ResponseEntity<Map<String, Object>> verifyAccount(@PathVariable UUID accountId,
                                                             Authentication authentication) {
        Long userId = (Long) authentication.getPrincipal();
        return ResponseEntity.ok(envelope(providerAccountService.verifyAccount(accountId, userId)));
    }

    private Map<String, Object> envelope(Object data) {
        return Map.of(
            "data", data,
            "timestamp", Instant.now().toString()
        );
    }
}
