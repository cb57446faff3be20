package com.wpanther.fpolifecycle.service;

import com.wpanther.fpolifecycle.entity.AuditLogEntry;
import com.wpanther.fpolifecycle.entity.AuditOutcome;
import com.wpanther.fpolifecycle.entity.FpoStatus;
import com.wpanther.fpolifecycle.repository.AuditLogEntryRepository;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only ledger of lifecycle attempts
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLedgerService {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 200;

    private final AuditLogEntryRepository auditLogEntryRepository;

    /**
     * Append one entry. Joins the caller's transaction when there is one.
     *
     * @param command what happened
     * @return the stored entry
     */
    @Transactional
    public AuditLogEntry append(AuditCommand command) {
        Objects.requireNonNull(command.getOrganizationId(), "organizationId is required");
        Objects.requireNonNull(command.getAction(), "action is required");
        Objects.requireNonNull(command.getOutcome(), "outcome is required");

        AuditLogEntry entry = AuditLogEntry.builder()
                .organizationId(command.getOrganizationId())
                .action(command.getAction())
                .previousState(command.getPreviousState())
                .newState(command.getNewState())
                .outcome(command.getOutcome())
                .errorCode(command.getErrorCode())
                .reason(command.getReason())
                .performedBy(command.getPerformedBy() != null ? command.getPerformedBy() : "unknown")
                .performedAt(Instant.now())
                .details(command.getDetails() != null ? new LinkedHashMap<>(command.getDetails()) : new LinkedHashMap<>())
                .requestId(command.getRequestId())
                .build();

        AuditLogEntry saved = auditLogEntryRepository.save(entry);

        log.info("Audit entry recorded: fpoId={}, action={}, outcome={}, {} -> {}, by={}, requestId={}",
                saved.getOrganizationId(), saved.getAction(), saved.getOutcome(),
                saved.getPreviousState(), saved.getNewState(), saved.getPerformedBy(), saved.getRequestId());

        return saved;
    }

    /**
     * Page through an organization's history, oldest first
     *
     * @param organizationId FPO id
     * @param page           zero-based page
     * @param size           page size, clamped to [1, MAX_PAGE_SIZE]
     */
    @Transactional(readOnly = true)
    public Page<AuditLogEntry> getHistory(String organizationId, int page, int size) {
        int pageSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);
        return auditLogEntryRepository.findByOrganizationIdOrderByPerformedAtAscIdAsc(
                organizationId, PageRequest.of(Math.max(page, 0), pageSize));
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntry> getFullHistory(String organizationId) {
        return auditLogEntryRepository.findByOrganizationIdOrderByPerformedAtAscIdAsc(organizationId);
    }

    @Getter
    @Builder
    public static class AuditCommand {
        private final String organizationId;
        private final String action;
        private final FpoStatus previousState;
        private final FpoStatus newState;
        private final AuditOutcome outcome;
        private final String errorCode;
        private final String reason;
        private final String performedBy;
        private final Map<String, Object> details;
        private final String requestId;
    }
}
