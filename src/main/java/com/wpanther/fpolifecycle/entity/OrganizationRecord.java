package com.wpanther.fpolifecycle.entity;

import com.wpanther.fpolifecycle.entity.converter.JsonMapConverter;
import com.wpanther.fpolifecycle.entity.converter.SetupProgressConverter;
import com.wpanther.fpolifecycle.entity.converter.StringMapConverter;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entity for an FPO under lifecycle management.
 * Lifecycle fields are only written by FpoLifecycleService; the version column
 * makes every update conditional on the state that was read.
 */
@Entity
@Table(name = "fpo_refs", indexes = {
        @Index(name = "idx_fpo_refs_status", columnList = "status"),
        @Index(name = "idx_fpo_refs_registration_no", columnList = "registration_number")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationRecord {

    @Id
    private String id;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "aaa_org_id", unique = true)
    private String aaaOrgId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "registration_number", nullable = false)
    private String registrationNumber;

    @Column(name = "description", length = 2000)
    private String description;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 4000)
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    // CEO profile captured at registration, used by the CEO provisioning step
    @Column(name = "ceo_first_name")
    private String ceoFirstName;

    @Column(name = "ceo_last_name")
    private String ceoLastName;

    @Column(name = "ceo_phone_number")
    private String ceoPhoneNumber;

    @Column(name = "ceo_email")
    private String ceoEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 50)
    @Builder.Default
    private FpoStatus status = FpoStatus.DRAFT;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 50)
    private FpoStatus previousStatus;

    @Column(name = "status_reason", length = 2000)
    private String statusReason;

    @Column(name = "status_changed_at")
    private Instant statusChangedAt;

    @Column(name = "status_changed_by")
    private String statusChangedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", length = 50)
    private VerificationStatus verificationStatus;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "verified_by")
    private String verifiedBy;

    @Column(name = "verification_notes", length = 2000)
    private String verificationNotes;

    @Column(name = "setup_attempts", nullable = false)
    @Builder.Default
    private int setupAttempts = 0;

    @Column(name = "last_setup_at")
    private Instant lastSetupAt;

    @Convert(converter = SetupProgressConverter.class)
    @Column(name = "setup_progress", length = 1000)
    @Builder.Default
    private Map<String, Boolean> setupProgress = new LinkedHashMap<>();

    // Errors of the most recent failed setup run, keyed by progress key
    @Convert(converter = StringMapConverter.class)
    @Column(name = "setup_errors", length = 4000)
    @Builder.Default
    private Map<String, String> setupErrors = new LinkedHashMap<>();

    @Column(name = "ceo_user_id")
    private String ceoUserId;

    @Column(name = "parent_fpo_id")
    private String parentFpoId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Compliance erasure only; lifecycle end is ARCHIVED
    @Column(name = "deleted_at")
    private Instant deletedAt;

    public boolean isStepCompleted(SetupStep step) {
        return setupProgress != null && Boolean.TRUE.equals(setupProgress.get(step.getProgressKey()));
    }

    public void markStepCompleted(SetupStep step) {
        if (setupProgress == null) {
            setupProgress = new LinkedHashMap<>();
        }
        setupProgress.put(step.getProgressKey(), Boolean.TRUE);
    }
}
