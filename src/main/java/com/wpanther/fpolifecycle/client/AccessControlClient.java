package com.wpanther.fpolifecycle.client;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operations consumed from the external identity/access-control (AAA) service.
 * Implementations report failures through the exceptions in
 * {@code com.wpanther.fpolifecycle.exception}: transient ones (timeout, unavailable)
 * are retried by {@link ExternalCallExecutor}, rejections are not.
 */
public interface AccessControlClient {

    /**
     * @param actorId  subject performing the operation
     * @param resource resource type, always "fpo" for lifecycle operations
     * @param action   lifecycle action name
     * @param orgId    organization reference (AAA org id once provisioned, else the record id)
     * @return true when the actor may perform the action
     */
    boolean checkPermission(String actorId, String resource, String action, String orgId);

    /**
     * @return the AAA organization id
     */
    String createOrganization(String name, Map<String, Object> metadata);

    /**
     * @return the AAA user id of the created CEO
     */
    String createUser(CeoProfile profile);

    void assignDefaultRolesAndPermissions(String aaaOrgId, String ceoUserId);

    /**
     * @param phoneNumber normalized local number
     * @return the id of the user registered with that mobile number, if any
     */
    Optional<String> findUserIdByPhone(String phoneNumber);

    /**
     * @return ids of the organizations in which the user holds {@code role}
     */
    Set<String> findOrganizationsWithRole(String userId, String role);

    /**
     * Fails with an {@code ExternalRejectionException} carrying 409 when the group already exists.
     */
    void createUserGroup(String aaaOrgId, String groupName, String description);

    Optional<AaaOrganization> getOrganization(String aaaOrgId);
}
