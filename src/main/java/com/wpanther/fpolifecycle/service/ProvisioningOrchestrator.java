package com.wpanther.fpolifecycle.service;

import com.wpanther.fpolifecycle.client.AccessControlClient;
import com.wpanther.fpolifecycle.client.CeoProfile;
import com.wpanther.fpolifecycle.client.ExternalCallExecutor;
import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import com.wpanther.fpolifecycle.entity.SetupStep;
import com.wpanther.fpolifecycle.exception.CeoAlreadyAssignedException;
import com.wpanther.fpolifecycle.exception.ExternalRejectionException;
import com.wpanther.fpolifecycle.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Provisions an FPO in the access-control service: organization, CEO user, default roles
 * and the FPO's user groups.
 * <p>
 * Steps already marked in {@code setup_progress} are skipped, so a retry resumes where the
 * previous run stopped. Each completed step is checkpointed before the next one starts.
 * The orchestrator never changes {@code status}; the lifecycle service collapses the
 * outcome into ACTIVE or SETUP_FAILED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProvisioningOrchestrator {

    /** Longest error text kept in {@code setup_errors} and audit details */
    static final int MAX_ERROR_LENGTH = 1000;

    static final List<String> DEFAULT_USER_GROUPS = List.of("directors", "shareholders", "store_staff", "store_managers");

    private final AccessControlClient accessControlClient;
    private final ExternalCallExecutor externalCallExecutor;

    @Value("${app.lifecycle.setup.max-attempts:3}")
    private int maxAttempts;

    /**
     * Run the remaining setup steps for the record.
     *
     * @param record     record to provision, not yet in its new status
     * @param checkpoint persists progress after the claim and after each step
     * @return succeeded, or failed with the step that failed and why
     */
    public SetupOutcome runSetup(OrganizationRecord record, SetupCheckpoint checkpoint) {
        // Claim the record before any external side effect; a concurrent run fails its version check here
        record.setLastSetupAt(Instant.now());
        record.setSetupErrors(new LinkedHashMap<>());
        OrganizationRecord current = checkpoint.save(record);

        log.info("Starting setup: fpoId={}, attempts={}, progress={}",
                current.getId(), current.getSetupAttempts(), current.getSetupProgress());

        for (SetupStep step : SetupStep.values()) {
            if (current.isStepCompleted(step)) {
                log.debug("Skipping completed setup step: fpoId={}, step={}", current.getId(), step.getProgressKey());
                continue;
            }

            try {
                executeStep(step, current);
            } catch (ExternalServiceException e) {
                String cause = describe(e);
                current.setSetupAttempts(current.getSetupAttempts() + 1);
                current.getSetupErrors().put(step.getProgressKey(), cause);
                log.warn("Setup step failed: fpoId={}, step={}, attempts={}, error={}",
                        current.getId(), step.getProgressKey(), current.getSetupAttempts(), e.getMessage());
                return SetupOutcome.failed(current, step, e.getErrorCode(), cause);
            }

            current.markStepCompleted(step);
            current = checkpoint.save(current);
            log.info("Setup step completed: fpoId={}, step={}", current.getId(), step.getProgressKey());
        }

        log.info("Setup completed: fpoId={}, aaaOrgId={}, ceoUserId={}",
                current.getId(), current.getAaaOrgId(), current.getCeoUserId());
        return SetupOutcome.succeeded(current);
    }

    public boolean canRetry(OrganizationRecord record) {
        return record.getSetupAttempts() < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private void executeStep(SetupStep step, OrganizationRecord record) {
        switch (step) {
            case ORGANIZATION:
                String aaaOrgId = externalCallExecutor.call("create-organization",
                        () -> accessControlClient.createOrganization(record.getName(), record.getMetadata()));
                record.setAaaOrgId(aaaOrgId);
                break;
            case CEO_USER:
                record.setCeoUserId(resolveCeoUser(record));
                break;
            case DEFAULT_ROLES:
                externalCallExecutor.run("assign-default-roles",
                        () -> accessControlClient.assignDefaultRolesAndPermissions(
                                record.getAaaOrgId(), record.getCeoUserId()));
                break;
            case USER_GROUPS:
                for (String groupName : DEFAULT_USER_GROUPS) {
                    createUserGroup(record, groupName);
                }
                break;
            default:
                throw new IllegalStateException("Unknown setup step: " + step);
        }
    }

    /**
     * Reuse the user already registered with the CEO's mobile number, else create one.
     * A lookup before creation also keeps a retry from creating a second user when an
     * earlier create call timed out after the service had accepted it.
     */
    private String resolveCeoUser(OrganizationRecord record) {
        CeoProfile profile = CeoProfile.fromRecord(record);
        Optional<String> existing = externalCallExecutor.call("find-ceo-user",
                () -> accessControlClient.findUserIdByPhone(profile.getPhoneNumber()));
        if (existing.isEmpty()) {
            return externalCallExecutor.call("create-ceo-user", () -> accessControlClient.createUser(profile));
        }

        String userId = existing.get();
        ensureNotCeoElsewhere(record, userId);
        log.info("Reusing existing user as CEO: fpoId={}, userId={}", record.getId(), userId);
        return userId;
    }

    private void ensureNotCeoElsewhere(OrganizationRecord record, String userId) {
        Set<String> ceoOf;
        try {
            ceoOf = externalCallExecutor.call("check-ceo-role",
                    () -> accessControlClient.findOrganizationsWithRole(userId, CeoProfile.CEO_ROLE));
        } catch (ExternalServiceException e) {
            // A failed role lookup does not block CEO assignment
            log.warn("Could not check existing CEO roles: fpoId={}, userId={}, error={}",
                    record.getId(), userId, e.getMessage());
            return;
        }

        Set<String> others = new TreeSet<>(ceoOf);
        if (record.getAaaOrgId() != null) {
            others.remove(record.getAaaOrgId());
        }
        if (!others.isEmpty()) {
            throw new CeoAlreadyAssignedException(userId, others);
        }
    }

    private void createUserGroup(OrganizationRecord record, String groupName) {
        try {
            externalCallExecutor.run("create-user-group", () -> accessControlClient.createUserGroup(
                    record.getAaaOrgId(), groupName, groupName + " group for " + record.getName()));
        } catch (ExternalRejectionException e) {
            if (e.getResponseStatus() != 409) {
                throw e;
            }
            log.debug("User group already exists: fpoId={}, group={}", record.getId(), groupName);
        }
    }

    static String describe(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return StringUtils.truncate(message, MAX_ERROR_LENGTH);
    }
}
