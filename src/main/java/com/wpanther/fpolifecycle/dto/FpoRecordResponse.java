package com.wpanther.fpolifecycle.dto;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import com.wpanther.fpolifecycle.entity.LifecycleAction;
import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import com.wpanther.fpolifecycle.entity.VerificationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FpoRecordResponse {
    private String id;
    private String aaaOrgId;
    private String name;
    private String registrationNumber;
    private String description;
    private Map<String, Object> metadata;
    private String parentFpoId;
    private String ceoUserId;
    private FpoStatus status;
    private FpoStatus previousStatus;
    private String statusReason;
    private Instant statusChangedAt;
    private String statusChangedBy;
    private VerificationStatus verificationStatus;
    private Instant verifiedAt;
    private String verifiedBy;
    private String verificationNotes;
    private int setupAttempts;
    private Instant lastSetupAt;
    private Map<String, Boolean> setupProgress;
    private Map<String, String> setupErrors;
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;
    // Only filled on single-record reads
    private List<String> availableActions;

    public static FpoRecordResponse from(OrganizationRecord record, List<LifecycleAction> availableActions) {
        FpoRecordResponse response = from(record);
        response.setAvailableActions(availableActions.stream()
                .map(LifecycleAction::getActionName)
                .collect(Collectors.toList()));
        return response;
    }

    public static FpoRecordResponse from(OrganizationRecord record) {
        return FpoRecordResponse.builder()
                .id(record.getId())
                .aaaOrgId(record.getAaaOrgId())
                .name(record.getName())
                .registrationNumber(record.getRegistrationNumber())
                .description(record.getDescription())
                .metadata(copy(record.getMetadata()))
                .parentFpoId(record.getParentFpoId())
                .ceoUserId(record.getCeoUserId())
                .status(record.getStatus())
                .previousStatus(record.getPreviousStatus())
                .statusReason(record.getStatusReason())
                .statusChangedAt(record.getStatusChangedAt())
                .statusChangedBy(record.getStatusChangedBy())
                .verificationStatus(record.getVerificationStatus())
                .verifiedAt(record.getVerifiedAt())
                .verifiedBy(record.getVerifiedBy())
                .verificationNotes(record.getVerificationNotes())
                .setupAttempts(record.getSetupAttempts())
                .lastSetupAt(record.getLastSetupAt())
                .setupProgress(copy(record.getSetupProgress()))
                .setupErrors(copy(record.getSetupErrors()))
                .version(record.getVersion())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source != null ? new LinkedHashMap<>(source) : new LinkedHashMap<>();
    }
}
