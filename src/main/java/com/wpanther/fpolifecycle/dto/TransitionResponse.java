package com.wpanther.fpolifecycle.dto;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionResponse {
    private String fpoId;
    private String action;
    private FpoStatus previousStatus;
    private FpoStatus status;
    private FpoRecordResponse record;
}
