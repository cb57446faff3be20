package com.wpanther.fpolifecycle.dto;

import com.wpanther.fpolifecycle.entity.AuditLogEntry;
import com.wpanther.fpolifecycle.entity.AuditOutcome;
import com.wpanther.fpolifecycle.entity.FpoStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntryResponse {
    private Long id;
    private String fpoId;
    private String action;
    private FpoStatus previousState;
    private FpoStatus newState;
    private AuditOutcome outcome;
    private String errorCode;
    private String reason;
    private String performedBy;
    private Instant performedAt;
    private Map<String, Object> details;
    private String requestId;

    public static AuditLogEntryResponse from(AuditLogEntry entry) {
        return AuditLogEntryResponse.builder()
                .id(entry.getId())
                .fpoId(entry.getOrganizationId())
                .action(entry.getAction())
                .previousState(entry.getPreviousState())
                .newState(entry.getNewState())
                .outcome(entry.getOutcome())
                .errorCode(entry.getErrorCode())
                .reason(entry.getReason())
                .performedBy(entry.getPerformedBy())
                .performedAt(entry.getPerformedAt())
                .details(entry.getDetails())
                .requestId(entry.getRequestId())
                .build();
    }
}
