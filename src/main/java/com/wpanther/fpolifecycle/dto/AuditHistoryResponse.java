package com.wpanther.fpolifecycle.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditHistoryResponse {
    private String fpoId;
    private List<AuditLogEntryResponse> entries;
    private int page;
    private int size;
    private long totalEntries;
    private int totalPages;
}
