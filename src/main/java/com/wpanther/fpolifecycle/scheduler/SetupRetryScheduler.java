package com.wpanther.fpolifecycle.scheduler;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import com.wpanther.fpolifecycle.exception.LifecycleException;
import com.wpanther.fpolifecycle.repository.OrganizationRecordRepository;
import com.wpanther.fpolifecycle.service.FpoLifecycleService;
import com.wpanther.fpolifecycle.service.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Scheduled retry of failed FPO setups.
 * Picks SETUP_FAILED records below the attempt cap whose last run is older than the backoff
 * and retries them through the lifecycle service as a service actor.
 * Disabled unless app.lifecycle.auto-retry.enabled=true.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "app.lifecycle.auto-retry.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SetupRetryScheduler {

    static final String RETRY_REASON = "Scheduled setup retry";

    private final OrganizationRecordRepository organizationRecordRepository;
    private final FpoLifecycleService fpoLifecycleService;

    @Value("${app.lifecycle.auto-retry.backoff-minutes:15}")
    private int backoffMinutes;

    @Value("${app.lifecycle.auto-retry.actor-id:system-setup-retry}")
    private String actorId;

    /**
     * Runs every ten minutes by default (configurable via app.lifecycle.auto-retry.cron)
     */
    @Scheduled(cron = "${app.lifecycle.auto-retry.cron:0 */10 * * * *}")
    public void retryFailedSetups() {
        log.info("Starting scheduled retry of failed FPO setups (backoff: {} minutes)", backoffMinutes);

        try {
            Instant cutoff = Instant.now().minus(backoffMinutes, ChronoUnit.MINUTES);
            List<OrganizationRecord> candidates = organizationRecordRepository
                    .findByStatusAndSetupAttemptsLessThanAndLastSetupAtBeforeAndDeletedAtIsNull(
                            FpoStatus.SETUP_FAILED, fpoLifecycleService.getMaxSetupAttempts(), cutoff);

            int activated = 0;
            int failed = 0;
            for (OrganizationRecord record : candidates) {
                String requestId = "scheduled-" + UUID.randomUUID();
                try {
                    TransitionResult result = fpoLifecycleService.retrySetup(record.getId(), actorId, RETRY_REASON, requestId);
                    if (result.getStatus() == FpoStatus.ACTIVE) {
                        activated++;
                    } else {
                        failed++;
                    }
                    log.debug("Scheduled setup retry: fpoId={}, status={}, requestId={}",
                            record.getId(), result.getStatus(), requestId);
                } catch (LifecycleException e) {
                    failed++;
                    log.warn("Scheduled setup retry rejected: fpoId={}, code={}, message={}",
                            record.getId(), e.getErrorCode(), e.getMessage());
                }
            }

            log.info("Scheduled setup retry completed: candidates={}, activated={}, stillFailed={}",
                    candidates.size(), activated, failed);

        } catch (Exception e) {
            log.error("Error during scheduled setup retry", e);
        }
    }
}
