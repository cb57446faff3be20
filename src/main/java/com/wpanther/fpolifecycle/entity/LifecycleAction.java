package com.wpanther.fpolifecycle.entity;

import java.util.Arrays;

/**
 * Operations that can be requested against an FPO record.
 * The action name is what gets written to the audit ledger and what the REST layer accepts.
 */
public enum LifecycleAction {

    SUBMIT("submit", Kind.TRANSITION),
    APPROVE("approve", Kind.TRANSITION),
    REJECT("reject", Kind.TRANSITION),
    RESUBMIT("resubmit", Kind.TRANSITION),
    BEGIN_SETUP("begin-setup", Kind.TRANSITION),
    RETRY_SETUP("retry-setup", Kind.TRANSITION),
    SUSPEND("suspend", Kind.TRANSITION),
    DEACTIVATE("deactivate", Kind.TRANSITION),
    REINSTATE("reinstate", Kind.TRANSITION),
    REACTIVATE("reactivate", Kind.TRANSITION),
    ARCHIVE("archive", Kind.TRANSITION),

    // Outcome of provisioning, only ever applied by the lifecycle service itself
    SETUP_SUCCEEDED("setup-succeeded", Kind.INTERNAL),
    SETUP_FAILED("setup-failed", Kind.INTERNAL),

    // Record-level operations that do not move the status
    REGISTER("register", Kind.ADMINISTRATIVE),
    RESET_SETUP_ATTEMPTS("reset-setup-attempts", Kind.ADMINISTRATIVE),
    ERASE("erase", Kind.ADMINISTRATIVE),
    SYNC("sync", Kind.ADMINISTRATIVE);

    public enum Kind {
        TRANSITION,
        INTERNAL,
        ADMINISTRATIVE
    }

    private final String actionName;
    private final Kind kind;

    LifecycleAction(String actionName, Kind kind) {
        this.actionName = actionName;
        this.kind = kind;
    }

    public String getActionName() {
        return actionName;
    }

    public boolean isPublicTransition() {
        return kind == Kind.TRANSITION;
    }

    public static LifecycleAction fromActionName(String actionName) {
        return Arrays.stream(values())
                .filter(action -> action.actionName.equalsIgnoreCase(actionName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown lifecycle action: " + actionName));
    }

    @Override
    public String toString() {
        return actionName;
    }
}
