package com.wpanther.fpolifecycle.exception;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import com.wpanther.fpolifecycle.entity.LifecycleAction;
import org.springframework.http.HttpStatus;

public class InvalidTransitionException extends LifecycleException {

    private final LifecycleAction action;

    public InvalidTransitionException(FpoStatus from, LifecycleAction action) {
        super("INVALID_TRANSITION", HttpStatus.CONFLICT,
                "Action " + action + " is not allowed from state " + from, from, null);
        this.action = action;
    }

    public LifecycleAction getAction() {
        return action;
    }
}
