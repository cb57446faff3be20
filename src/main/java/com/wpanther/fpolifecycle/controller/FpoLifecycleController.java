package com.wpanther.fpolifecycle.controller;

import java.util.stream.Collectors;

import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.fpolifecycle.dto.AuditHistoryResponse;
import com.wpanther.fpolifecycle.dto.AuditLogEntryResponse;
import com.wpanther.fpolifecycle.dto.FpoRecordResponse;
import com.wpanther.fpolifecycle.dto.RegisterFpoRequest;
import com.wpanther.fpolifecycle.dto.TransitionRequest;
import com.wpanther.fpolifecycle.dto.TransitionResponse;
import com.wpanther.fpolifecycle.entity.AuditLogEntry;
import com.wpanther.fpolifecycle.entity.LifecycleAction;
import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import com.wpanther.fpolifecycle.service.FpoLifecycleService;
import com.wpanther.fpolifecycle.service.TransitionResult;
import com.wpanther.fpolifecycle.web.RequestIdFilter;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST adapter over the FPO lifecycle operations.
 * The acting user is the authenticated principal.
 */
@RestController
@RequestMapping("/api/v1/fpo")
@RequiredArgsConstructor
@Slf4j
public class FpoLifecycleController {

    private static final int MAX_REASON_LENGTH = 2000;

    private final FpoLifecycleService fpoLifecycleService;

    /**
     * Register a new FPO in DRAFT
     */
    @PostMapping
    public ResponseEntity<FpoRecordResponse> register(@Valid @RequestBody RegisterFpoRequest request) {
        log.debug("Registering FPO: {}", request.getRegistrationNumber());
        OrganizationRecord record = fpoLifecycleService.register(request, currentActor(), RequestIdFilter.currentRequestId());
        return new ResponseEntity<>(FpoRecordResponse.from(record), HttpStatus.CREATED);
    }

    @GetMapping("/{fpoId}")
    public ResponseEntity<FpoRecordResponse> getRecord(@PathVariable String fpoId) {
        return ResponseEntity.ok(withActions(fpoLifecycleService.getRecord(fpoId)));
    }

    /**
     * Look up an FPO by its AAA organization id, recovering the local record from AAA when missing
     */
    @GetMapping("/by-aaa-org/{aaaOrgId}")
    public ResponseEntity<FpoRecordResponse> getOrSyncByAaaOrg(@PathVariable String aaaOrgId) {
        OrganizationRecord record = fpoLifecycleService.getOrSyncRecord(
                aaaOrgId, currentActor(), RequestIdFilter.currentRequestId());
        return ResponseEntity.ok(withActions(record));
    }

    /**
     * Apply one public lifecycle action, e.g. POST /api/v1/fpo/{id}/approve
     */
    @PostMapping("/{fpoId}/{action:submit|approve|reject|resubmit|begin-setup|retry-setup|suspend|deactivate|reinstate|reactivate|archive}")
    public ResponseEntity<TransitionResponse> transition(
            @PathVariable String fpoId,
            @PathVariable String action,
            @Valid @RequestBody(required = false) TransitionRequest request) {
        LifecycleAction lifecycleAction = LifecycleAction.fromActionName(action);
        log.debug("Lifecycle action requested: fpoId={}, action={}", fpoId, lifecycleAction);

        TransitionResult result = fpoLifecycleService.transition(
                fpoId, lifecycleAction, currentActor(), reasonOf(request), RequestIdFilter.currentRequestId());
        return ResponseEntity.ok(toResponse(fpoId, lifecycleAction, result));
    }

    @PostMapping("/{fpoId}/reset-setup-attempts")
    public ResponseEntity<TransitionResponse> resetSetupAttempts(
            @PathVariable String fpoId,
            @Valid @RequestBody(required = false) TransitionRequest request) {
        TransitionResult result = fpoLifecycleService.resetSetupAttempts(
                fpoId, currentActor(), reasonOf(request), RequestIdFilter.currentRequestId());
        return ResponseEntity.ok(toResponse(fpoId, LifecycleAction.RESET_SETUP_ATTEMPTS, result));
    }

    /**
     * Compliance erasure, only for archived FPOs
     */
    @DeleteMapping("/{fpoId}")
    public ResponseEntity<Void> erase(
            @PathVariable String fpoId,
            @RequestParam(required = false) String reason) {
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            throw new IllegalArgumentException("Reason must be at most " + MAX_REASON_LENGTH + " characters");
        }
        fpoLifecycleService.eraseForCompliance(fpoId, currentActor(), reason, RequestIdFilter.currentRequestId());
        return ResponseEntity.noContent().build();
    }

    /**
     * Audit history, oldest first
     */
    @GetMapping("/{fpoId}/history")
    public ResponseEntity<AuditHistoryResponse> getHistory(
            @PathVariable String fpoId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        Page<AuditLogEntry> entries = fpoLifecycleService.getHistory(fpoId, page, size);
        AuditHistoryResponse response = AuditHistoryResponse.builder()
                .fpoId(fpoId)
                .entries(entries.getContent().stream()
                        .map(AuditLogEntryResponse::from)
                        .collect(Collectors.toList()))
                .page(entries.getNumber())
                .size(entries.getSize())
                .totalEntries(entries.getTotalElements())
                .totalPages(entries.getTotalPages())
                .build();
        return ResponseEntity.ok(response);
    }

    private FpoRecordResponse withActions(OrganizationRecord record) {
        return FpoRecordResponse.from(record, fpoLifecycleService.availableActions(record));
    }

    private TransitionResponse toResponse(String fpoId, LifecycleAction action, TransitionResult result) {
        return TransitionResponse.builder()
                .fpoId(fpoId)
                .action(action.getActionName())
                .previousStatus(result.getPreviousStatus())
                .status(result.getStatus())
                .record(FpoRecordResponse.from(result.getRecord()))
                .build();
    }

    private String reasonOf(TransitionRequest request) {
        return request != null ? request.getReason() : null;
    }

    private String currentActor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new IllegalStateException("No authenticated actor");
        }
        return authentication.getName();
    }
}
