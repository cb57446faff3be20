package com.wpanther.fpolifecycle.exception;

import org.springframework.http.HttpStatus;

import java.util.Set;

/**
 * The existing access-control user chosen as CEO already leads another FPO.
 * A user can be CEO of one FPO at a time.
 */
public class CeoAlreadyAssignedException extends ExternalServiceException {

    public CeoAlreadyAssignedException(String userId, Set<String> otherOrganizations) {
        super("CEO_ALREADY_ASSIGNED", HttpStatus.CONFLICT,
                "User " + userId + " is already CEO of organization(s) " + otherOrganizations, null, null);
    }
}
