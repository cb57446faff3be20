package com.wpanther.fpolifecycle.client;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Organization as held by the access-control service
 */
@Getter
@Builder
@ToString
public class AaaOrganization {
    private final String id;
    private final String name;
    private final String description;
    private final String registrationNumber;
    private final Map<String, Object> metadata;
}
