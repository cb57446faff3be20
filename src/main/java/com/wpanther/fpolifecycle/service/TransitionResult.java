package com.wpanther.fpolifecycle.service;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TransitionResult {

    private final FpoStatus status;
    private final FpoStatus previousStatus;
    private final OrganizationRecord record;
}
