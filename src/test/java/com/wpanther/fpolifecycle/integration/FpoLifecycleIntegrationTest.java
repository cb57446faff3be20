package com.wpanther.fpolifecycle.integration;

import com.wpanther.fpolifecycle.client.AaaOrganization;
import com.wpanther.fpolifecycle.client.AccessControlClient;
import com.wpanther.fpolifecycle.client.CeoProfile;
import com.wpanther.fpolifecycle.dto.RegisterFpoRequest;
import com.wpanther.fpolifecycle.entity.AuditLogEntry;
import com.wpanther.fpolifecycle.entity.AuditOutcome;
import com.wpanther.fpolifecycle.entity.FpoStatus;
import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import com.wpanther.fpolifecycle.entity.SetupStep;
import com.wpanther.fpolifecycle.exception.ConcurrentTransitionException;
import com.wpanther.fpolifecycle.exception.DuplicateRegistrationException;
import com.wpanther.fpolifecycle.exception.ExternalRejectionException;
import com.wpanther.fpolifecycle.exception.ExternalUnavailableException;
import com.wpanther.fpolifecycle.exception.FpoNotFoundException;
import com.wpanther.fpolifecycle.exception.InvalidTransitionException;
import com.wpanther.fpolifecycle.exception.LifecycleException;
import com.wpanther.fpolifecycle.exception.PermissionDeniedException;
import com.wpanther.fpolifecycle.exception.RetryExhaustedException;
import com.wpanther.fpolifecycle.repository.AuditLogEntryRepository;
import com.wpanther.fpolifecycle.repository.OrganizationRecordRepository;
import com.wpanther.fpolifecycle.service.FpoLifecycleService;
import com.wpanther.fpolifecycle.service.TransitionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.Page;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * End-to-end lifecycle scenarios against the real persistence layer (H2) with the
 * access-control service mocked out
 */
@SpringBootTest
@ActiveProfiles("test")
class FpoLifecycleIntegrationTest {

    private static final String OFFICER = "officer-1";

    @Autowired
    private FpoLifecycleService fpoLifecycleService;

    @Autowired
    private OrganizationRecordRepository organizationRecordRepository;

    @Autowired
    private AuditLogEntryRepository auditLogEntryRepository;

    @MockBean
    private AccessControlClient accessControlClient;

    @BeforeEach
    void setUp() {
        when(accessControlClient.checkPermission(anyString(), anyString(), anyString(), anyString())).thenReturn(true);
    }

    @Test
    void testHappyPathFromDraftToActive() {
        // Arrange
        when(accessControlClient.createOrganization(anyString(), anyMap())).thenReturn("aaa-org-1");
        when(accessControlClient.createUser(any(CeoProfile.class))).thenReturn("ceo-user-1");
        String id = register().getId();

        // Act
        assertThat(fpoLifecycleService.submit(id, OFFICER, "ready", "req-1").getStatus())
                .isEqualTo(FpoStatus.PENDING_VERIFICATION);
        assertThat(fpoLifecycleService.approve(id, OFFICER, "verified", "req-2").getStatus())
                .isEqualTo(FpoStatus.VERIFIED);
        TransitionResult setup = fpoLifecycleService.beginSetup(id, OFFICER, null, "req-3");

        // Assert
        assertThat(setup.getStatus()).isEqualTo(FpoStatus.ACTIVE);
        assertThat(setup.getPreviousStatus()).isEqualTo(FpoStatus.VERIFIED);

        OrganizationRecord stored = fpoLifecycleService.getRecord(id);
        assertThat(stored.getStatus()).isEqualTo(FpoStatus.ACTIVE);
        assertThat(stored.getPreviousStatus()).isEqualTo(FpoStatus.VERIFIED);
        assertThat(stored.getAaaOrgId()).isEqualTo("aaa-org-1");
        assertThat(stored.getCeoUserId()).isEqualTo("ceo-user-1");
        assertThat(stored.getSetupProgress())
                .containsEntry("org_created", true)
                .containsEntry("ceo_created", true)
                .containsEntry("roles_assigned", true)
                .containsEntry("groups_created", true);
        assertThat(stored.getSetupAttempts()).isZero();
        assertThat(stored.getSetupErrors()).isEmpty();
        verify(accessControlClient).assignDefaultRolesAndPermissions("aaa-org-1", "ceo-user-1");

        List<AuditLogEntry> history = fpoLifecycleService.getFullHistory(id);
        assertThat(history).extracting(AuditLogEntry::getAction)
                .containsExactly("register", "submit", "approve", "begin-setup");
        assertThat(history).extracting(AuditLogEntry::getNewState)
                .containsExactly(FpoStatus.DRAFT, FpoStatus.PENDING_VERIFICATION, FpoStatus.VERIFIED, FpoStatus.ACTIVE);
        assertThat(history).extracting(AuditLogEntry::getRequestId)
                .containsExactly("req-0", "req-1", "req-2", "req-3");
    }

    @Test
    void testTransientOrganizationFailureThenRetryResumesAtOrganizationStep() {
        // Arrange: both attempts of the first run fail, the retry succeeds
        when(accessControlClient.createOrganization(anyString(), anyMap()))
                .thenThrow(new ExternalUnavailableException("aaa unavailable", null))
                .thenThrow(new ExternalUnavailableException("aaa unavailable", null))
                .thenReturn("aaa-org-2");
        when(accessControlClient.createUser(any(CeoProfile.class))).thenReturn("ceo-user-2");
        String id = verified();

        // Act
        TransitionResult failed = fpoLifecycleService.beginSetup(id, OFFICER, null, null);

        // Assert
        assertThat(failed.getStatus()).isEqualTo(FpoStatus.SETUP_FAILED);
        OrganizationRecord afterFailure = fpoLifecycleService.getRecord(id);
        assertThat(afterFailure.getSetupAttempts()).isEqualTo(1);
        assertThat(afterFailure.getSetupErrors()).containsKey("org_created");
        assertThat(afterFailure.isStepCompleted(SetupStep.ORGANIZATION)).isFalse();
        verify(accessControlClient, never()).createUser(any(CeoProfile.class));

        AuditLogEntry failedEntry = last(id);
        assertThat(failedEntry.getNewState()).isEqualTo(FpoStatus.SETUP_FAILED);
        assertThat(failedEntry.getDetails())
                .containsEntry("failed_step", "org_created")
                .containsEntry("setup_outcome", "setup-failed");

        // Act
        TransitionResult retried = fpoLifecycleService.retrySetup(id, OFFICER, "AAA back", null);

        // Assert
        assertThat(retried.getStatus()).isEqualTo(FpoStatus.ACTIVE);
        assertThat(retried.getPreviousStatus()).isEqualTo(FpoStatus.SETUP_FAILED);
        verify(accessControlClient, times(3)).createOrganization(anyString(), anyMap());
        verify(accessControlClient, times(1)).createUser(any(CeoProfile.class));
        OrganizationRecord active = fpoLifecycleService.getRecord(id);
        assertThat(active.getSetupErrors()).isEmpty();
        assertThat(active.getCeoUserId()).isEqualTo("ceo-user-2");
    }

    @Test
    void testRetryDoesNotRepeatCompletedSteps() {
        // Arrange: organization is created, CEO creation is rejected once
        when(accessControlClient.createOrganization(anyString(), anyMap())).thenReturn("aaa-org-3");
        when(accessControlClient.createUser(any(CeoProfile.class)))
                .thenThrow(new ExternalRejectionException("phone in use", 409))
                .thenReturn("ceo-user-3");
        String id = verified();

        // Act
        assertThat(fpoLifecycleService.beginSetup(id, OFFICER, null, null).getStatus())
                .isEqualTo(FpoStatus.SETUP_FAILED);
        OrganizationRecord partial = fpoLifecycleService.getRecord(id);
        TransitionResult retried = fpoLifecycleService.retrySetup(id, OFFICER, null, null);

        // Assert
        assertThat(partial.isStepCompleted(SetupStep.ORGANIZATION)).isTrue();
        assertThat(partial.getAaaOrgId()).isEqualTo("aaa-org-3");
        assertThat(partial.getCeoUserId()).isNull();
        assertThat(retried.getStatus()).isEqualTo(FpoStatus.ACTIVE);
        verify(accessControlClient, times(1)).createOrganization(anyString(), anyMap());
        verify(accessControlClient, times(2)).createUser(any(CeoProfile.class));
    }

    @Test
    void testRetryCapIsEnforced() {
        // Arrange
        when(accessControlClient.createOrganization(anyString(), anyMap()))
                .thenThrow(new ExternalRejectionException("invalid organization", 422));
        String id = verified();

        // Act: three failed runs
        assertThat(fpoLifecycleService.beginSetup(id, OFFICER, null, null).getStatus()).isEqualTo(FpoStatus.SETUP_FAILED);
        assertThat(fpoLifecycleService.retrySetup(id, OFFICER, null, null).getStatus()).isEqualTo(FpoStatus.SETUP_FAILED);
        assertThat(fpoLifecycleService.retrySetup(id, OFFICER, null, null).getStatus()).isEqualTo(FpoStatus.SETUP_FAILED);
        assertThat(fpoLifecycleService.getRecord(id).getSetupAttempts()).isEqualTo(3);
        long entriesBefore = auditLogEntryRepository.countByOrganizationId(id);

        // Assert: the fourth is refused without another attempt
        assertThatThrownBy(() -> fpoLifecycleService.retrySetup(id, OFFICER, null, null))
                .isInstanceOf(RetryExhaustedException.class)
                .satisfies(ex -> assertThat(((LifecycleException) ex).getCurrentStatus()).isEqualTo(FpoStatus.SETUP_FAILED));

        OrganizationRecord stored = fpoLifecycleService.getRecord(id);
        assertThat(stored.getStatus()).isEqualTo(FpoStatus.SETUP_FAILED);
        assertThat(stored.getSetupAttempts()).isEqualTo(3);
        verify(accessControlClient, times(3)).createOrganization(anyString(), anyMap());
        assertThat(auditLogEntryRepository.countByOrganizationId(id)).isEqualTo(entriesBefore + 1);
        assertThat(last(id).getErrorCode()).isEqualTo("RETRY_EXHAUSTED");

        // Operator override re-opens the budget
        fpoLifecycleService.resetSetupAttempts(id, OFFICER, "root cause fixed", null);
        assertThat(fpoLifecycleService.getRecord(id).getSetupAttempts()).isZero();
    }

    @Test
    void testArchiveFromActiveIsInvalid() {
        // Arrange
        when(accessControlClient.createOrganization(anyString(), anyMap())).thenReturn("aaa-org-4");
        when(accessControlClient.createUser(any(CeoProfile.class))).thenReturn("ceo-user-4");
        String id = verified();
        fpoLifecycleService.beginSetup(id, OFFICER, null, null);
        long entriesBefore = auditLogEntryRepository.countByOrganizationId(id);

        // Act / Assert
        assertThatThrownBy(() -> fpoLifecycleService.archive(id, OFFICER, "closing", null))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(ex -> assertThat(((LifecycleException) ex).getCurrentStatus()).isEqualTo(FpoStatus.ACTIVE));

        assertThat(fpoLifecycleService.getRecord(id).getStatus()).isEqualTo(FpoStatus.ACTIVE);
        assertThat(auditLogEntryRepository.countByOrganizationId(id)).isEqualTo(entriesBefore + 1);
        AuditLogEntry entry = last(id);
        assertThat(entry.getOutcome()).isEqualTo(AuditOutcome.FAILED);
        assertThat(entry.getPreviousState()).isEqualTo(FpoStatus.ACTIVE);
        assertThat(entry.getNewState()).isEqualTo(FpoStatus.ACTIVE);

        // Archival is reachable through suspension
        fpoLifecycleService.suspend(id, OFFICER, "inactive for a season", null);
        TransitionResult archived = fpoLifecycleService.archive(id, OFFICER, "closing", null);
        assertThat(archived.getStatus()).isEqualTo(FpoStatus.ARCHIVED);
        assertThat(archived.getRecord().getPreviousStatus()).isEqualTo(FpoStatus.SUSPENDED);
    }

    @Test
    void testEveryAttemptWritesExactlyOneAuditEntry() {
        String id = register().getId();
        List<Runnable> attempts = new ArrayList<>();
        attempts.add(() -> fpoLifecycleService.approve(id, OFFICER, null, null));   // invalid from DRAFT
        attempts.add(() -> fpoLifecycleService.submit(id, OFFICER, null, null));
        attempts.add(() -> fpoLifecycleService.submit(id, OFFICER, null, null));    // invalid, already submitted
        attempts.add(() -> fpoLifecycleService.reject(id, OFFICER, "incomplete", null));
        attempts.add(() -> fpoLifecycleService.resubmit(id, OFFICER, null, null));

        for (Runnable attempt : attempts) {
            FpoStatus before = organizationRecordRepository.findById(id).orElseThrow().getStatus();
            long countBefore = auditLogEntryRepository.countByOrganizationId(id);
            try {
                attempt.run();
            } catch (LifecycleException e) {
                assertThat(e.getCurrentStatus()).isEqualTo(before);
            }
            FpoStatus after = organizationRecordRepository.findById(id).orElseThrow().getStatus();

            assertThat(auditLogEntryRepository.countByOrganizationId(id)).isEqualTo(countBefore + 1);
            AuditLogEntry entry = last(id);
            assertThat(entry.getPreviousState()).isEqualTo(before);
            assertThat(entry.getNewState()).isEqualTo(after);
        }

        OrganizationRecord stored = fpoLifecycleService.getRecord(id);
        assertThat(stored.getStatus()).isEqualTo(FpoStatus.DRAFT);
        assertThat(stored.getPreviousStatus()).isEqualTo(FpoStatus.REJECTED);
        assertThat(stored.getVerificationStatus()).isNull();
    }

    @Test
    void testPermissionDeniedLeavesStateUnchanged() {
        String id = register().getId();
        when(accessControlClient.checkPermission(anyString(), anyString(), eq("submit"), anyString())).thenReturn(false);

        assertThatThrownBy(() -> fpoLifecycleService.submit(id, "intruder", null, null))
                .isInstanceOf(PermissionDeniedException.class);

        assertThat(fpoLifecycleService.getRecord(id).getStatus()).isEqualTo(FpoStatus.DRAFT);
        AuditLogEntry entry = last(id);
        assertThat(entry.getErrorCode()).isEqualTo("PERMISSION_DENIED");
        assertThat(entry.getPerformedBy()).isEqualTo("intruder");
    }

    @Test
    void testUnknownOrganizationIsAudited() {
        String unknownId = UUID.randomUUID().toString();

        assertThatThrownBy(() -> fpoLifecycleService.submit(unknownId, OFFICER, null, null))
                .isInstanceOf(FpoNotFoundException.class);

        List<AuditLogEntry> history = fpoLifecycleService.getFullHistory(unknownId);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getErrorCode()).isEqualTo("FPO_NOT_FOUND");
        assertThat(history.get(0).getPreviousState()).isNull();
    }

    @Test
    void testConcurrentApprovalsProduceOneSuccessAndOneConflict() throws Exception {
        // Arrange
        String id = register().getId();
        fpoLifecycleService.submit(id, OFFICER, null, null);
        long entriesBefore = auditLogEntryRepository.countByOrganizationId(id);

        CountDownLatch bothLoaded = new CountDownLatch(2);
        CountDownLatch firstFinished = new CountDownLatch(1);
        AtomicInteger tickets = new AtomicInteger();
        when(accessControlClient.checkPermission(anyString(), anyString(), eq("approve"), anyString()))
                .thenAnswer(invocation -> {
                    int ticket = tickets.incrementAndGet();
                    bothLoaded.countDown();
                    bothLoaded.await(5, TimeUnit.SECONDS);
                    if (ticket == 2) {
                        firstFinished.await(5, TimeUnit.SECONDS);
                    }
                    return true;
                });

        Callable<Object> approve = () -> {
            try {
                return fpoLifecycleService.approve(id, OFFICER, null, null);
            } catch (LifecycleException e) {
                return e;
            } finally {
                firstFinished.countDown();
            }
        };

        // Act
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Object> outcomes = new ArrayList<>();
        try {
            Future<Object> first = pool.submit(approve);
            Future<Object> second = pool.submit(approve);
            outcomes.add(first.get(10, TimeUnit.SECONDS));
            outcomes.add(second.get(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        // Assert
        assertThat(outcomes).filteredOn(TransitionResult.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(ConcurrentTransitionException.class::isInstance).hasSize(1);
        assertThat(fpoLifecycleService.getRecord(id).getStatus()).isEqualTo(FpoStatus.VERIFIED);
        assertThat(auditLogEntryRepository.countByOrganizationId(id)).isEqualTo(entriesBefore + 1);
    }

    @Test
    void testHistoryIsPagedOldestFirst() {
        String id = register().getId();
        fpoLifecycleService.submit(id, OFFICER, null, null);
        fpoLifecycleService.reject(id, OFFICER, "incomplete", null);
        fpoLifecycleService.resubmit(id, OFFICER, null, null);

        Page<AuditLogEntry> firstPage = fpoLifecycleService.getHistory(id, 0, 2);
        Page<AuditLogEntry> secondPage = fpoLifecycleService.getHistory(id, 1, 2);

        assertThat(firstPage.getTotalElements()).isEqualTo(4);
        assertThat(firstPage.getContent()).extracting(AuditLogEntry::getAction).containsExactly("register", "submit");
        assertThat(secondPage.getContent()).extracting(AuditLogEntry::getAction).containsExactly("reject", "resubmit");
    }

    @Test
    void testErasedRecordReadsAsNotFound() {
        String id = register().getId();
        fpoLifecycleService.submit(id, OFFICER, null, null);
        fpoLifecycleService.reject(id, OFFICER, "fraudulent", null);

        assertThatThrownBy(() -> fpoLifecycleService.eraseForCompliance(id, OFFICER, null, null))
                .isInstanceOf(InvalidTransitionException.class);

        fpoLifecycleService.archive(id, OFFICER, null, null);
        fpoLifecycleService.eraseForCompliance(id, OFFICER, "retention", null);

        assertThatThrownBy(() -> fpoLifecycleService.getRecord(id)).isInstanceOf(FpoNotFoundException.class);
        assertThat(organizationRecordRepository.findById(id)).isPresent();
        assertThat(last(id).getAction()).isEqualTo("erase");
    }

    @Test
    void testDuplicateRegistrationIsRejected() {
        OrganizationRecord record = register();

        assertThatThrownBy(() -> fpoLifecycleService.register(
                registration(record.getRegistrationNumber()), OFFICER, null))
                .isInstanceOf(DuplicateRegistrationException.class);
    }

    @Test
    void testOverlongRejectionIsStoredAndAudited() {
        when(accessControlClient.createOrganization(anyString(), anyMap()))
                .thenThrow(new ExternalRejectionException("rejected: " + "x".repeat(10_000), 422));
        String id = verified();
        int entriesBefore = fpoLifecycleService.getFullHistory(id).size();

        TransitionResult failed = fpoLifecycleService.beginSetup(id, OFFICER, null, null);

        assertThat(failed.getStatus()).isEqualTo(FpoStatus.SETUP_FAILED);
        OrganizationRecord stored = fpoLifecycleService.getRecord(id);
        assertThat(stored.getSetupAttempts()).isEqualTo(1);
        assertThat(stored.getSetupErrors().get("org_created")).startsWith("rejected: xxx").hasSizeLessThan(1100);
        assertThat(fpoLifecycleService.getFullHistory(id)).hasSize(entriesBefore + 1);
        assertThat(last(id).getDetails()).containsEntry("cause", stored.getSetupErrors().get("org_created"));
    }

    @Test
    void testExistingUserIsReusedAsCeo() {
        when(accessControlClient.createOrganization(anyString(), anyMap())).thenReturn("aaa-org-5");
        when(accessControlClient.findUserIdByPhone("+919876543210")).thenReturn(Optional.of("existing-user"));
        when(accessControlClient.findOrganizationsWithRole("existing-user", "CEO")).thenReturn(Set.of());
        String id = verified();

        TransitionResult setup = fpoLifecycleService.beginSetup(id, OFFICER, null, null);

        assertThat(setup.getStatus()).isEqualTo(FpoStatus.ACTIVE);
        assertThat(fpoLifecycleService.getRecord(id).getCeoUserId()).isEqualTo("existing-user");
        verify(accessControlClient, never()).createUser(any(CeoProfile.class));
        verify(accessControlClient).assignDefaultRolesAndPermissions("aaa-org-5", "existing-user");
    }

    @Test
    void testCeoOfAnotherFpoFailsSetup() {
        when(accessControlClient.createOrganization(anyString(), anyMap())).thenReturn("aaa-org-6");
        when(accessControlClient.findUserIdByPhone("+919876543210")).thenReturn(Optional.of("busy-ceo"));
        when(accessControlClient.findOrganizationsWithRole("busy-ceo", "CEO")).thenReturn(Set.of("aaa-org-other"));
        String id = verified();

        TransitionResult failed = fpoLifecycleService.beginSetup(id, OFFICER, null, null);

        assertThat(failed.getStatus()).isEqualTo(FpoStatus.SETUP_FAILED);
        OrganizationRecord stored = fpoLifecycleService.getRecord(id);
        assertThat(stored.isStepCompleted(SetupStep.ORGANIZATION)).isTrue();
        assertThat(stored.isStepCompleted(SetupStep.CEO_USER)).isFalse();
        assertThat(stored.getSetupErrors().get("ceo_created")).contains("aaa-org-other");
        assertThat(last(id).getDetails()).containsEntry("error_code", "CEO_ALREADY_ASSIGNED");
    }

    @Test
    void testOrganizationKnownOnlyToAccessControlIsSyncedOnce() {
        String aaaOrgId = "aaa-remote-" + UUID.randomUUID();
        when(accessControlClient.getOrganization(aaaOrgId)).thenReturn(Optional.of(AaaOrganization.builder()
                .id(aaaOrgId)
                .name("Hill Millets FPO")
                .metadata(Map.of("district", "Dharwad"))
                .build()));

        OrganizationRecord synced = fpoLifecycleService.getOrSyncRecord(aaaOrgId, OFFICER, "req-sync");
        OrganizationRecord again = fpoLifecycleService.getOrSyncRecord(aaaOrgId, OFFICER, "req-sync-2");

        assertThat(again.getId()).isEqualTo(synced.getId());
        verify(accessControlClient, times(1)).getOrganization(aaaOrgId);
        OrganizationRecord stored = fpoLifecycleService.getRecord(synced.getId());
        assertThat(stored.getStatus()).isEqualTo(FpoStatus.ACTIVE);
        assertThat(stored.getRegistrationNumber()).isEqualTo("AAA-" + aaaOrgId);
        assertThat(stored.isStepCompleted(SetupStep.ORGANIZATION)).isTrue();
        assertThat(fpoLifecycleService.getFullHistory(synced.getId())).extracting(AuditLogEntry::getAction)
                .containsExactly("sync");
    }

    @Test
    void testUnknownAaaOrganizationIsNotFound() {
        when(accessControlClient.getOrganization("aaa-nowhere")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> fpoLifecycleService.getOrSyncRecord("aaa-nowhere", OFFICER, null))
                .isInstanceOf(FpoNotFoundException.class);
    }

    private OrganizationRecord register() {
        return fpoLifecycleService.register(registration("REG-" + UUID.randomUUID()), OFFICER, "req-0");
    }

    private String verified() {
        String id = register().getId();
        fpoLifecycleService.submit(id, OFFICER, null, null);
        fpoLifecycleService.approve(id, OFFICER, null, null);
        return id;
    }

    private RegisterFpoRequest registration(String registrationNumber) {
        return RegisterFpoRequest.builder()
                .name("Green Valley FPO")
                .registrationNumber(registrationNumber)
                .description("Vegetable growers collective")
                .metadata(Map.of("district", "Nashik"))
                .ceo(RegisterFpoRequest.CeoDetails.builder()
                        .firstName("Ravi")
                        .lastName("Kumar")
                        .phoneNumber("+919876543210")
                        .email("ravi@example.org")
                        .build())
                .build();
    }

    private AuditLogEntry last(String id) {
        List<AuditLogEntry> history = fpoLifecycleService.getFullHistory(id);
        return history.get(history.size() - 1);
    }
}
