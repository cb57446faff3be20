package com.wpanther.fpolifecycle.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.fpolifecycle.exception.ExternalRejectionException;
import com.wpanther.fpolifecycle.exception.ExternalServiceException;
import com.wpanther.fpolifecycle.exception.ExternalTimeoutException;
import com.wpanther.fpolifecycle.exception.ExternalUnavailableException;
import com.wpanther.fpolifecycle.exception.TransitionCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JSON over HTTP client for the access-control service
 */
@Component
@Slf4j
public class HttpAccessControlClient implements AccessControlClient {

    private static final String API_KEY_HEADER = "X-API-Key";

    // Error bodies are quoted into exception messages up to this length
    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() { };

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    public HttpAccessControlClient(ObjectMapper objectMapper,
                                   @Value("${app.aaa.base-url:http://localhost:8081}") String baseUrl,
                                   @Value("${app.aaa.api-key:}") String apiKey,
                                   @Value("${app.aaa.request-timeout:10s}") Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public boolean checkPermission(String actorId, String resource, String action, String orgId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", actorId);
        body.put("resource", resource);
        body.put("action", action);
        body.put("org_id", orgId);

        JsonNode response = post("/api/v1/permissions/check", body);
        boolean allowed = response.path("allowed").asBoolean(false);
        log.debug("Permission check: actor={}, action={}, org={}, allowed={}", actorId, action, orgId, allowed);
        return allowed;
    }

    @Override
    public String createOrganization(String name, Map<String, Object> metadata) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("type", "FPO");
        body.put("metadata", metadata != null ? metadata : Map.of());

        JsonNode response = post("/api/v1/organizations", body);
        String orgId = requireText(response, "org_id", "create organization");
        log.info("Created AAA organization: name={}, orgId={}", name, orgId);
        return orgId;
    }

    @Override
    public String createUser(CeoProfile profile) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", profile.getUsername());
        body.put("first_name", profile.getFirstName());
        body.put("last_name", profile.getLastName());
        body.put("full_name", profile.getFullName());
        body.put("phone_number", profile.getPhoneNumber());
        body.put("country_code", profile.getCountryCode());
        body.put("email", profile.getEmail());
        body.put("role", profile.getRole());

        JsonNode response = post("/api/v1/users", body);
        String userId = requireText(response, "id", "create user");
        log.info("Created AAA user: username={}, userId={}", profile.getUsername(), userId);
        return userId;
    }

    @Override
    public void assignDefaultRolesAndPermissions(String aaaOrgId, String ceoUserId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ceo_user_id", ceoUserId);

        post("/api/v1/organizations/" + segment(aaaOrgId) + "/default-roles", body);
        log.info("Assigned default roles: orgId={}, ceoUserId={}", aaaOrgId, ceoUserId);
    }

    @Override
    public Optional<String> findUserIdByPhone(String phoneNumber) {
        Optional<String> userId = get("/api/v1/users/by-mobile/" + segment(phoneNumber))
                .map(response -> requireText(response, "id", "find user by mobile"));
        log.debug("User lookup by mobile: found={}", userId.isPresent());
        return userId;
    }

    @Override
    public Set<String> findOrganizationsWithRole(String userId, String role) {
        Optional<JsonNode> response = get("/api/v1/users/" + segment(userId) + "/roles");
        if (response.isEmpty()) {
            return Collections.emptySet();
        }

        Set<String> organizations = new LinkedHashSet<>();
        for (JsonNode assignment : response.get().path("roles")) {
            String orgId = assignment.path("org_id").asText("");
            if (role.equalsIgnoreCase(assignment.path("role").asText()) && !orgId.isBlank()) {
                organizations.add(orgId);
            }
        }
        return organizations;
    }

    @Override
    public void createUserGroup(String aaaOrgId, String groupName, String description) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", groupName);
        body.put("description", description);
        body.put("org_id", aaaOrgId);

        post("/api/v1/organizations/" + segment(aaaOrgId) + "/groups", body);
        log.info("Created user group: orgId={}, group={}", aaaOrgId, groupName);
    }

    @Override
    public Optional<AaaOrganization> getOrganization(String aaaOrgId) {
        return get("/api/v1/organizations/" + segment(aaaOrgId)).map(response -> AaaOrganization.builder()
                .id(response.path("org_id").asText(response.path("id").asText(aaaOrgId)))
                .name(requireText(response, "name", "get organization"))
                .description(response.path("description").asText(null))
                .registrationNumber(response.path("registration_number").asText(null))
                .metadata(response.path("metadata").isObject()
                        ? objectMapper.convertValue(response.get("metadata"), METADATA_TYPE)
                        : new LinkedHashMap<>())
                .build());
    }

    private JsonNode post(String path, Map<String, Object> body) {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Failed to serialize request for " + path, e);
        }

        HttpRequest.Builder builder = request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody));
        return readResponse(send(builder, path), path);
    }

    /**
     * @return empty when the service answers 404
     */
    private Optional<JsonNode> get(String path) {
        HttpResponse<String> response = send(request(path).GET(), path);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        return Optional.of(readResponse(response, path));
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header(API_KEY_HEADER, apiKey);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest.Builder builder, String path) {
        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ExternalTimeoutException("Access-control request timed out: " + path, e);
        } catch (ConnectException e) {
            throw new ExternalUnavailableException("Access-control service unreachable: " + path, e);
        } catch (IOException e) {
            throw new ExternalUnavailableException("I/O error calling access-control service: " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransitionCancelledException("Interrupted while calling " + path, null, e);
        }
    }

    private JsonNode readResponse(HttpResponse<String> response, String path) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return readBody(response.body(), path);
        }

        String message = "Access-control service returned " + status + " for " + path + ": "
                + StringUtils.truncate(response.body() != null ? response.body() : "", MAX_ERROR_BODY_LENGTH);
        switch (status) {
            case 408:
            case 504:
                throw new ExternalTimeoutException(message);
            case 502:
            case 503:
                throw new ExternalUnavailableException(message, null);
            case 400:
            case 409:
            case 422:
                throw new ExternalRejectionException(message, status);
            default:
                throw new ExternalServiceException(message);
        }
    }

    private JsonNode readBody(String body, String path) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Invalid JSON response from " + path, e);
        }
    }

    private static String segment(String value) {
        return UriUtils.encodePathSegment(value, StandardCharsets.UTF_8);
    }

    private String requireText(JsonNode response, String field, String operation) {
        JsonNode value = response.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new ExternalServiceException("Invalid " + operation + " response: missing " + field);
        }
        return value.asText();
    }
}
