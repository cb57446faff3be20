package com.wpanther.fpolifecycle.exception;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import org.springframework.http.HttpStatus;

public class PermissionDeniedException extends LifecycleException {

    public PermissionDeniedException(String actorId, String action, FpoStatus currentStatus) {
        super("PERMISSION_DENIED", HttpStatus.FORBIDDEN,
                "Actor " + actorId + " is not permitted to perform " + action, currentStatus, null);
    }
}
