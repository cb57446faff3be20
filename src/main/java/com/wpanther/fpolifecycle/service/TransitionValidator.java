package com.wpanther.fpolifecycle.service;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import com.wpanther.fpolifecycle.entity.LifecycleAction;
import com.wpanther.fpolifecycle.exception.InvalidTransitionException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static com.wpanther.fpolifecycle.entity.FpoStatus.*;
import static com.wpanther.fpolifecycle.entity.LifecycleAction.*;

/**
 * The FPO lifecycle transition table. Pure lookup, no side effects.
 * ARCHIVED has no outgoing edges.
 */
@Component
public class TransitionValidator {

    private static final Map<FpoStatus, Map<LifecycleAction, FpoStatus>> TRANSITIONS = new EnumMap<>(FpoStatus.class);

    static {
        edge(DRAFT, SUBMIT, PENDING_VERIFICATION);
        edge(PENDING_VERIFICATION, APPROVE, VERIFIED);
        edge(PENDING_VERIFICATION, REJECT, REJECTED);
        edge(REJECTED, RESUBMIT, DRAFT);
        edge(REJECTED, ARCHIVE, ARCHIVED);
        edge(VERIFIED, BEGIN_SETUP, PENDING_SETUP);
        edge(PENDING_SETUP, LifecycleAction.SETUP_SUCCEEDED, ACTIVE);
        edge(PENDING_SETUP, LifecycleAction.SETUP_FAILED, FpoStatus.SETUP_FAILED);
        edge(FpoStatus.SETUP_FAILED, RETRY_SETUP, PENDING_SETUP);
        edge(FpoStatus.SETUP_FAILED, ARCHIVE, ARCHIVED);
        edge(ACTIVE, SUSPEND, SUSPENDED);
        edge(ACTIVE, DEACTIVATE, INACTIVE);
        edge(SUSPENDED, REINSTATE, ACTIVE);
        edge(SUSPENDED, ARCHIVE, ARCHIVED);
        edge(INACTIVE, REACTIVATE, ACTIVE);
        edge(INACTIVE, ARCHIVE, ARCHIVED);
    }

    private static void edge(FpoStatus from, LifecycleAction action, FpoStatus to) {
        TRANSITIONS.computeIfAbsent(from, key -> new EnumMap<>(LifecycleAction.class)).put(action, to);
    }

    /**
     * @return the target state of {@code action} applied in {@code from}
     * @throws InvalidTransitionException if the pair is not in the table
     */
    public FpoStatus validate(FpoStatus from, LifecycleAction action) {
        FpoStatus target = TRANSITIONS.getOrDefault(from, Collections.emptyMap()).get(action);
        if (target == null) {
            throw new InvalidTransitionException(from, action);
        }
        return target;
    }

    public Set<LifecycleAction> allowedActions(FpoStatus from) {
        Map<LifecycleAction, FpoStatus> edges = TRANSITIONS.get(from);
        return edges == null ? Collections.emptySet() : Collections.unmodifiableSet(edges.keySet());
    }
}
