package com.wpanther.fpolifecycle.service;

import com.wpanther.fpolifecycle.client.AaaOrganization;
import com.wpanther.fpolifecycle.client.AccessControlClient;
import com.wpanther.fpolifecycle.client.ExternalCallExecutor;
import com.wpanther.fpolifecycle.dto.RegisterFpoRequest;
import com.wpanther.fpolifecycle.entity.AuditLogEntry;
import com.wpanther.fpolifecycle.entity.AuditOutcome;
import com.wpanther.fpolifecycle.entity.FpoStatus;
import com.wpanther.fpolifecycle.entity.LifecycleAction;
import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import com.wpanther.fpolifecycle.entity.SetupStep;
import com.wpanther.fpolifecycle.entity.VerificationStatus;
import com.wpanther.fpolifecycle.exception.ConcurrentTransitionException;
import com.wpanther.fpolifecycle.exception.DuplicateRegistrationException;
import com.wpanther.fpolifecycle.exception.FpoNotFoundException;
import com.wpanther.fpolifecycle.exception.InvalidTransitionException;
import com.wpanther.fpolifecycle.exception.LifecycleException;
import com.wpanther.fpolifecycle.exception.PermissionDeniedException;
import com.wpanther.fpolifecycle.exception.RetryExhaustedException;
import com.wpanther.fpolifecycle.exception.TransitionCancelledException;
import com.wpanther.fpolifecycle.repository.OrganizationRecordRepository;
import com.wpanther.fpolifecycle.service.AuditLedgerService.AuditCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for every FPO lifecycle operation.
 * <p>
 * Each attempt runs the same sequence: load the record, check the actor's permission with the
 * access-control service, validate against the transition table, provision when the target is
 * PENDING_SETUP, then save the record and its audit entry in one transaction. Blocking calls all
 * happen before that transaction starts. Every attempt leaves exactly one audit entry except
 * optimistic-lock conflicts and cancellations, which persist nothing.
 * <p>
 * This is the only class that writes lifecycle fields of {@link OrganizationRecord}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FpoLifecycleService {

    public static final String RESOURCE = "fpo";

    static final String SYNC_REASON = "Synchronized from access-control service";
    static final String SYNCED_REGISTRATION_PREFIX = "AAA-";

    private final OrganizationRecordRepository organizationRecordRepository;
    private final AuditLedgerService auditLedgerService;
    private final TransitionValidator transitionValidator;
    private final ProvisioningOrchestrator provisioningOrchestrator;
    private final AccessControlClient accessControlClient;
    private final ExternalCallExecutor externalCallExecutor;
    private final TransactionTemplate transactionTemplate;

    /**
     * Register a new FPO in DRAFT
     *
     * @param request   registration details including the CEO profile
     * @param actorId   registering user
     * @param requestId correlation id, may be null
     * @return the stored record
     */
    public OrganizationRecord register(RegisterFpoRequest request, String actorId, String requestId) {
        if (organizationRecordRepository.existsByRegistrationNumberAndDeletedAtIsNull(request.getRegistrationNumber())) {
            log.warn("Duplicate FPO registration rejected: registrationNumber={}", request.getRegistrationNumber());
            throw new DuplicateRegistrationException(request.getRegistrationNumber());
        }

        Instant now = Instant.now();
        RegisterFpoRequest.CeoDetails ceo = request.getCeo();
        OrganizationRecord record = OrganizationRecord.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName())
                .registrationNumber(request.getRegistrationNumber())
                .description(request.getDescription())
                .metadata(request.getMetadata() != null ? new LinkedHashMap<>(request.getMetadata()) : new LinkedHashMap<>())
                .parentFpoId(request.getParentFpoId())
                .ceoFirstName(ceo.getFirstName())
                .ceoLastName(ceo.getLastName())
                .ceoPhoneNumber(ceo.getPhoneNumber())
                .ceoEmail(ceo.getEmail())
                .status(FpoStatus.DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build();

        OrganizationRecord saved = transactionTemplate.execute(tx -> {
            OrganizationRecord stored = organizationRecordRepository.saveAndFlush(record);
            auditLedgerService.append(AuditCommand.builder()
                    .organizationId(stored.getId())
                    .action(LifecycleAction.REGISTER.getActionName())
                    .previousState(null)
                    .newState(FpoStatus.DRAFT)
                    .outcome(AuditOutcome.SUCCESS)
                    .performedBy(actorId)
                    .details(Map.of("registration_number", stored.getRegistrationNumber()))
                    .requestId(requestId)
                    .build());
            return stored;
        });

        log.info("Registered FPO: id={}, name={}, registrationNumber={}, by={}",
                saved.getId(), saved.getName(), saved.getRegistrationNumber(), actorId);
        return saved;
    }

    public TransitionResult submit(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.SUBMIT, actorId, reason, requestId);
    }

    public TransitionResult approve(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.APPROVE, actorId, reason, requestId);
    }

    public TransitionResult reject(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.REJECT, actorId, reason, requestId);
    }

    public TransitionResult resubmit(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.RESUBMIT, actorId, reason, requestId);
    }

    public TransitionResult beginSetup(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.BEGIN_SETUP, actorId, reason, requestId);
    }

    public TransitionResult retrySetup(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.RETRY_SETUP, actorId, reason, requestId);
    }

    public TransitionResult suspend(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.SUSPEND, actorId, reason, requestId);
    }

    public TransitionResult deactivate(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.DEACTIVATE, actorId, reason, requestId);
    }

    public TransitionResult reinstate(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.REINSTATE, actorId, reason, requestId);
    }

    public TransitionResult reactivate(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.REACTIVATE, actorId, reason, requestId);
    }

    public TransitionResult archive(String orgId, String actorId, String reason, String requestId) {
        return transition(orgId, LifecycleAction.ARCHIVE, actorId, reason, requestId);
    }

    /**
     * Apply a public lifecycle action.
     *
     * @return the new status, the status it replaced and the saved record
     * @throws FpoNotFoundException          unknown or erased organization
     * @throws PermissionDeniedException     actor may not perform the action
     * @throws InvalidTransitionException    action not allowed in the current status
     * @throws RetryExhaustedException       retry-setup with the attempt cap reached
     * @throws ConcurrentTransitionException the record changed underneath this attempt
     */
    public TransitionResult transition(String orgId, LifecycleAction action, String actorId,
                                       String reason, String requestId) {
        if (!action.isPublicTransition()) {
            throw new IllegalArgumentException("Not a public lifecycle action: " + action);
        }

        return guarded(orgId, action, actorId, reason, requestId, (record, current) -> {
            FpoStatus target = transitionValidator.validate(current, action);

            if (action == LifecycleAction.RETRY_SETUP && !provisioningOrchestrator.canRetry(record)) {
                throw new RetryExhaustedException(orgId, record.getSetupAttempts(),
                        provisioningOrchestrator.getMaxAttempts(), current);
            }

            Map<String, Object> details = new LinkedHashMap<>();
            OrganizationRecord working = record;

            if (target == FpoStatus.PENDING_SETUP) {
                SetupOutcome outcome = provisioningOrchestrator.runSetup(record, this::checkpoint);
                working = outcome.getRecord();
                LifecycleAction collapse = outcome.isSucceeded()
                        ? LifecycleAction.SETUP_SUCCEEDED : LifecycleAction.SETUP_FAILED;
                target = transitionValidator.validate(FpoStatus.PENDING_SETUP, collapse);

                details.put("setup_outcome", collapse.getActionName());
                details.put("setup_attempts", working.getSetupAttempts());
                if (!outcome.isSucceeded()) {
                    details.put("failed_step", outcome.getFailedStep().getProgressKey());
                    details.put("error_code", outcome.getErrorCode());
                    details.put("cause", outcome.getCause());
                }
            }

            ensureNotCancelled(orgId, action, current);
            return commitTransition(working, action, current, target, actorId, reason, requestId, details);
        });
    }

    /**
     * Operator override that re-opens the retry budget of a failed setup.
     */
    public TransitionResult resetSetupAttempts(String orgId, String actorId, String reason, String requestId) {
        LifecycleAction action = LifecycleAction.RESET_SETUP_ATTEMPTS;
        return guarded(orgId, action, actorId, reason, requestId, (record, current) -> {
            if (current != FpoStatus.SETUP_FAILED) {
                throw new InvalidTransitionException(current, action);
            }
            int previousAttempts = record.getSetupAttempts();
            ensureNotCancelled(orgId, action, current);

            return commit(record, action, current, current, actorId, reason, requestId,
                    Map.of("previous_setup_attempts", previousAttempts), () -> record.setSetupAttempts(0));
        });
    }

    /**
     * Compliance erasure of an archived FPO. The row is kept and stamped; it then reads as not found.
     */
    public TransitionResult eraseForCompliance(String orgId, String actorId, String reason, String requestId) {
        LifecycleAction action = LifecycleAction.ERASE;
        return guarded(orgId, action, actorId, reason, requestId, (record, current) -> {
            if (current != FpoStatus.ARCHIVED) {
                throw new InvalidTransitionException(current, action);
            }
            ensureNotCancelled(orgId, action, current);

            return commit(record, action, current, current, actorId, reason, requestId,
                    Map.of(), () -> record.setDeletedAt(Instant.now()));
        });
    }

    public OrganizationRecord getRecord(String orgId) {
        return organizationRecordRepository.findByIdAndDeletedAtIsNull(orgId)
                .orElseThrow(() -> new FpoNotFoundException(orgId));
    }

    /**
     * Public actions the transition table offers from the record's status. retry-setup is left
     * out once the attempt cap is reached.
     */
    public List<LifecycleAction> availableActions(OrganizationRecord record) {
        return transitionValidator.allowedActions(record.getStatus()).stream()
                .filter(LifecycleAction::isPublicTransition)
                .filter(action -> action != LifecycleAction.RETRY_SETUP || provisioningOrchestrator.canRetry(record))
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Local record of an access-control organization. An organization that exists in the
     * access-control service but has no local record gets one, created ACTIVE with its
     * organization step marked complete. Erased records are not recreated.
     *
     * @throws FpoNotFoundException unknown to both sides, or erased locally
     */
    public OrganizationRecord getOrSyncRecord(String aaaOrgId, String actorId, String requestId) {
        if (aaaOrgId == null || aaaOrgId.isBlank()) {
            throw new IllegalArgumentException("AAA organization id is required");
        }

        Optional<OrganizationRecord> local = organizationRecordRepository.findByAaaOrgIdAndDeletedAtIsNull(aaaOrgId);
        if (local.isPresent()) {
            return local.get();
        }
        if (organizationRecordRepository.existsByAaaOrgId(aaaOrgId)) {
            throw new FpoNotFoundException(aaaOrgId);
        }

        log.info("FPO not found locally, syncing from access-control service: aaaOrgId={}", aaaOrgId);
        AaaOrganization organization = externalCallExecutor.call("get-organization",
                        () -> accessControlClient.getOrganization(aaaOrgId))
                .orElseThrow(() -> new FpoNotFoundException(aaaOrgId));

        String registrationNumber = organization.getRegistrationNumber() != null
                && !organization.getRegistrationNumber().isBlank()
                ? organization.getRegistrationNumber() : SYNCED_REGISTRATION_PREFIX + aaaOrgId;
        if (organizationRecordRepository.existsByRegistrationNumberAndDeletedAtIsNull(registrationNumber)) {
            log.warn("Cannot sync FPO, registration number already in use: aaaOrgId={}, registrationNumber={}",
                    aaaOrgId, registrationNumber);
            throw new DuplicateRegistrationException(registrationNumber);
        }

        Instant now = Instant.now();
        OrganizationRecord record = OrganizationRecord.builder()
                .id(UUID.randomUUID().toString())
                .aaaOrgId(aaaOrgId)
                .name(organization.getName())
                .registrationNumber(registrationNumber)
                .description(organization.getDescription())
                .metadata(organization.getMetadata() != null
                        ? new LinkedHashMap<>(organization.getMetadata()) : new LinkedHashMap<>())
                .status(FpoStatus.ACTIVE)
                .statusReason(SYNC_REASON)
                .statusChangedAt(now)
                .statusChangedBy(actorId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        record.markStepCompleted(SetupStep.ORGANIZATION);

        try {
            OrganizationRecord saved = transactionTemplate.execute(tx -> {
                OrganizationRecord stored = organizationRecordRepository.saveAndFlush(record);
                auditLedgerService.append(AuditCommand.builder()
                        .organizationId(stored.getId())
                        .action(LifecycleAction.SYNC.getActionName())
                        .previousState(null)
                        .newState(FpoStatus.ACTIVE)
                        .outcome(AuditOutcome.SUCCESS)
                        .reason(SYNC_REASON)
                        .performedBy(actorId)
                        .details(Map.of("aaa_org_id", aaaOrgId))
                        .requestId(requestId)
                        .build());
                return stored;
            });
            log.info("Synchronized FPO from access-control service: id={}, aaaOrgId={}, by={}",
                    saved.getId(), aaaOrgId, actorId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // A concurrent sync of the same organization committed first
            return organizationRecordRepository.findByAaaOrgIdAndDeletedAtIsNull(aaaOrgId).orElseThrow(() -> e);
        }
    }

    public Page<AuditLogEntry> getHistory(String orgId, int page, int size) {
        return auditLedgerService.getHistory(orgId, page, size);
    }

    public List<AuditLogEntry> getFullHistory(String orgId) {
        return auditLedgerService.getFullHistory(orgId);
    }

    public int getMaxSetupAttempts() {
        return provisioningOrchestrator.getMaxAttempts();
    }

    @FunctionalInterface
    private interface Attempt {
        TransitionResult apply(OrganizationRecord record, FpoStatus current);
    }

    private TransitionResult guarded(String orgId, LifecycleAction action, String actorId,
                                     String reason, String requestId, Attempt attempt) {
        if (orgId == null || orgId.isBlank()) {
            throw new IllegalArgumentException("FPO id is required");
        }

        OrganizationRecord record = organizationRecordRepository.findByIdAndDeletedAtIsNull(orgId).orElse(null);
        if (record == null) {
            FpoNotFoundException notFound = new FpoNotFoundException(orgId);
            auditFailure(orgId, action, null, actorId, reason, requestId, notFound);
            throw notFound;
        }

        FpoStatus current = record.getStatus();
        try {
            authorize(record, action, actorId);
            return attempt.apply(record, current);
        } catch (ConcurrencyFailureException e) {
            log.warn("Concurrent modification: fpoId={}, action={}, observedStatus={}", orgId, action, current);
            throw new ConcurrentTransitionException(orgId, current, e);
        } catch (TransitionCancelledException e) {
            e.attachCurrentStatus(current);
            log.info("Lifecycle attempt cancelled: fpoId={}, action={}, status={}", orgId, action, current);
            throw e;
        } catch (LifecycleException e) {
            e.attachCurrentStatus(current);
            auditFailure(orgId, action, current, actorId, reason, requestId, e);
            throw e;
        }
    }

    private void authorize(OrganizationRecord record, LifecycleAction action, String actorId) {
        String orgRef = record.getAaaOrgId() != null ? record.getAaaOrgId() : record.getId();
        boolean allowed = externalCallExecutor.call("check-permission",
                () -> accessControlClient.checkPermission(actorId, RESOURCE, action.getActionName(), orgRef));
        if (!allowed) {
            log.warn("Permission denied: actor={}, action={}, fpoId={}", actorId, action, record.getId());
            throw new PermissionDeniedException(actorId, action.getActionName(), record.getStatus());
        }
    }

    private void ensureNotCancelled(String orgId, LifecycleAction action, FpoStatus current) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TransitionCancelledException(
                    "Lifecycle action " + action + " on FPO " + orgId + " cancelled before commit", current, null);
        }
    }

    private TransitionResult commitTransition(OrganizationRecord record, LifecycleAction action, FpoStatus current,
                                              FpoStatus target, String actorId, String reason, String requestId,
                                              Map<String, Object> details) {
        return commit(record, action, current, target, actorId, reason, requestId, details, () -> {
            Instant now = Instant.now();
            record.setPreviousStatus(current);
            record.setStatus(target);
            record.setStatusReason(reason);
            record.setStatusChangedAt(now);
            record.setStatusChangedBy(actorId);
            applyVerification(record, action, actorId, reason, now);
        });
    }

    /**
     * Save the mutated record and its audit entry in one transaction.
     */
    private TransitionResult commit(OrganizationRecord record, LifecycleAction action, FpoStatus current,
                                    FpoStatus target, String actorId, String reason, String requestId,
                                    Map<String, Object> details, Runnable mutation) {
        TransitionResult result = transactionTemplate.execute(tx -> {
            mutation.run();
            record.setUpdatedAt(Instant.now());
            OrganizationRecord saved = organizationRecordRepository.saveAndFlush(record);

            auditLedgerService.append(AuditCommand.builder()
                    .organizationId(saved.getId())
                    .action(action.getActionName())
                    .previousState(current)
                    .newState(target)
                    .outcome(AuditOutcome.SUCCESS)
                    .reason(reason)
                    .performedBy(actorId)
                    .details(details)
                    .requestId(requestId)
                    .build());

            return new TransitionResult(target, current, saved);
        });

        log.info("Lifecycle action applied: fpoId={}, action={}, {} -> {}, by={}, requestId={}",
                record.getId(), action, current, target, actorId, requestId);
        return result;
    }

    private void applyVerification(OrganizationRecord record, LifecycleAction action, String actorId,
                                   String reason, Instant now) {
        switch (action) {
            case SUBMIT:
                record.setVerificationStatus(VerificationStatus.PENDING);
                break;
            case APPROVE:
                record.setVerificationStatus(VerificationStatus.VERIFIED);
                record.setVerifiedAt(now);
                record.setVerifiedBy(actorId);
                record.setVerificationNotes(reason);
                break;
            case REJECT:
                record.setVerificationStatus(VerificationStatus.REJECTED);
                record.setVerificationNotes(reason);
                break;
            case RESUBMIT:
                record.setVerificationStatus(null);
                record.setVerifiedAt(null);
                record.setVerifiedBy(null);
                record.setVerificationNotes(null);
                break;
            default:
                break;
        }
    }

    private OrganizationRecord checkpoint(OrganizationRecord record) {
        record.setUpdatedAt(Instant.now());
        return organizationRecordRepository.saveAndFlush(record);
    }

    private void auditFailure(String orgId, LifecycleAction action, FpoStatus current, String actorId,
                              String reason, String requestId, LifecycleException cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message", ProvisioningOrchestrator.describe(cause));
        try {
            auditLedgerService.append(AuditCommand.builder()
                    .organizationId(orgId)
                    .action(action.getActionName())
                    .previousState(current)
                    .newState(current)
                    .outcome(AuditOutcome.FAILED)
                    .errorCode(cause.getErrorCode())
                    .reason(reason)
                    .performedBy(actorId)
                    .details(details)
                    .requestId(requestId)
                    .build());
        } catch (RuntimeException auditError) {
            log.error("Failed to record audit entry for failed attempt: fpoId={}, action={}, status={}, errorCode={}, actor={}, requestId={}",
                    orgId, action, current, cause.getErrorCode(), actorId, requestId, auditError);
            cause.addSuppressed(auditError);
        }
    }
}
