package com.wpanther.fpolifecycle.entity;

/**
 * Provisioning steps in execution order. The progress key is the entry
 * written into {@code setup_progress} once the step has succeeded.
 */
public enum SetupStep {
    ORGANIZATION("org_created"),
    CEO_USER("ceo_created"),
    DEFAULT_ROLES("roles_assigned"),
    USER_GROUPS("groups_created");

    private final String progressKey;

    SetupStep(String progressKey) {
        this.progressKey = progressKey;
    }

    public String getProgressKey() {
        return progressKey;
    }
}
