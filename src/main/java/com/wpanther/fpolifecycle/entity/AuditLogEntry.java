package com.wpanther.fpolifecycle.entity;

import com.wpanther.fpolifecycle.entity.converter.JsonMapConverter;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only ledger row, one per lifecycle attempt (successful or not).
 * Rows are never updated; history is replayed in performed_at order.
 */
@Entity
@Immutable
@Table(name = "fpo_audit_logs", indexes = {
        @Index(name = "idx_fpo_audit_logs_fpo_id", columnList = "fpo_id"),
        @Index(name = "idx_fpo_audit_logs_performed_at", columnList = "performed_at"),
        @Index(name = "idx_fpo_audit_logs_action", columnList = "action")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false)
    private Long id;

    // Plain reference, attempts against unknown organizations are recorded too
    @Column(name = "fpo_id", nullable = false, updatable = false)
    private String organizationId;

    @Column(name = "action", nullable = false, updatable = false, length = 100)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_state", updatable = false, length = 50)
    private FpoStatus previousState;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_state", updatable = false, length = 50)
    private FpoStatus newState;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, updatable = false, length = 20)
    private AuditOutcome outcome;

    @Column(name = "error_code", updatable = false, length = 100)
    private String errorCode;

    @Column(name = "reason", updatable = false, length = 2000)
    private String reason;

    @Column(name = "performed_by", nullable = false, updatable = false)
    private String performedBy;

    @Column(name = "performed_at", nullable = false, updatable = false)
    private Instant performedAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "details", updatable = false, length = 4000)
    private Map<String, Object> details;

    @Column(name = "request_id", updatable = false)
    private String requestId;
}
