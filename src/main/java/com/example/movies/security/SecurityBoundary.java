package com.example.movies.security;

import com.example.movies.storage.StorageIdentity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The complete set of permissions an execution context holds. The runtime grant covers
 * item writes on the catalog table, log emission into the function's log group and the
 * access log group, trace emission and the certificate lookup. Table provisioning is a
 * separate, narrower grant. Either set is checked when it is built, so an over-broad grant
 * stops the service from starting instead of surfacing on a request.
 */
@Slf4j
public final class SecurityBoundary {

    public static final String GET_ITEM = "dynamodb:GetItem";
    public static final String PUT_ITEM = "dynamodb:PutItem";
    public static final String UPDATE_ITEM = "dynamodb:UpdateItem";
    public static final String DESCRIBE_TABLE = "dynamodb:DescribeTable";
    public static final String CREATE_TABLE = "dynamodb:CreateTable";
    public static final String CREATE_LOG_GROUP = "logs:CreateLogGroup";
    public static final String PUT_RETENTION_POLICY = "logs:PutRetentionPolicy";
    public static final String CREATE_LOG_STREAM = "logs:CreateLogStream";
    public static final String PUT_LOG_EVENTS = "logs:PutLogEvents";
    public static final String PUT_TRACE_SEGMENTS = "xray:PutTraceSegments";
    public static final String PUT_TELEMETRY_RECORDS = "xray:PutTelemetryRecords";
    public static final String DESCRIBE_CERTIFICATE = "acm:DescribeCertificate";

    static final Set<String> STORAGE_ACTIONS = Set.of(GET_ITEM, PUT_ITEM, UPDATE_ITEM);
    static final Set<String> PROVISIONING_ACTIONS = Set.of(DESCRIBE_TABLE, CREATE_TABLE);
    static final Set<String> LOG_GROUP_ACTIONS = Set.of(CREATE_LOG_GROUP, PUT_RETENTION_POLICY);
    static final Set<String> LOG_STREAM_ACTIONS = Set.of(CREATE_LOG_STREAM, PUT_LOG_EVENTS);
    static final Set<String> TRACE_ACTIONS = Set.of(PUT_TRACE_SEGMENTS, PUT_TELEMETRY_RECORDS);
    static final Set<String> CERTIFICATE_ACTIONS = Set.of(DESCRIBE_CERTIFICATE);

    private static final String LOG_ARN_PREFIX = "arn:aws:logs:";
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public enum Scope {
        /** What the function needs while serving requests. */
        RUNTIME,
        /** Creating the table; never part of the function's role. */
        PROVISIONING
    }

    private final Scope scope;
    private final Set<Permission> permissions;
    private final String storageResource;

    @Builder
    private SecurityBoundary(Scope scope, @Singular Set<Permission> permissions) {
        this.scope = scope != null ? scope : Scope.RUNTIME;
        this.permissions = Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
        this.storageResource = this.scope == Scope.RUNTIME
                ? validateRuntime(this.permissions)
                : validateProvisioning(this.permissions);
    }

    public static class SecurityBoundaryBuilder {

        public SecurityBoundaryBuilder allow(String action, String resource) {
            return permission(new Permission(action, resource));
        }
    }

    /**
     * The runtime grant: the three item actions on exactly this table, log emission into the
     * function's log group, creation and writing of the access log group, trace emission and,
     * when a custom domain is configured, the lookup of its certificate.
     *
     * @param certificateArn may be null or empty when no custom domain is bound
     */
    public static SecurityBoundary forCatalogTable(StorageIdentity table, String functionLogGroupArn,
                                                   String accessLogGroupArn, String certificateArn) {
        SecurityBoundaryBuilder builder = builder();
        for (String action : List.of(GET_ITEM, PUT_ITEM, UPDATE_ITEM)) {
            builder.allow(action, table.getTableArn());
        }
        builder.allow(CREATE_LOG_STREAM, functionLogGroupArn)
                .allow(PUT_LOG_EVENTS, functionLogGroupArn)
                .allow(CREATE_LOG_GROUP, accessLogGroupArn)
                .allow(PUT_RETENTION_POLICY, accessLogGroupArn)
                .allow(CREATE_LOG_STREAM, streamsOf(accessLogGroupArn))
                .allow(PUT_LOG_EVENTS, streamsOf(accessLogGroupArn))
                // X-Ray has no resource-level permissions
                .allow(PUT_TRACE_SEGMENTS, "*")
                .allow(PUT_TELEMETRY_RECORDS, "*");
        if (certificateArn != null && !certificateArn.isEmpty()) {
            builder.allow(DESCRIBE_CERTIFICATE, certificateArn);
        }
        return builder.build();
    }

    /**
     * The grant a deployment step needs to create the table when it is missing.
     */
    public static SecurityBoundary forTableProvisioning(StorageIdentity table) {
        return builder()
                .scope(Scope.PROVISIONING)
                .allow(DESCRIBE_TABLE, table.getTableArn())
                .allow(CREATE_TABLE, table.getTableArn())
                .build();
    }

    /** ARN pattern covering every stream in a log group. */
    public static String streamsOf(String logGroupArn) {
        return logGroupArn + ":*";
    }

    /** ARN of one stream in a log group. */
    public static String streamArn(String logGroupArn, String streamName) {
        return logGroupArn + ":log-stream:" + streamName;
    }

    public boolean isGranted(String action, String resource) {
        return permissions.stream().anyMatch(p -> p.covers(action, resource));
    }

    public void authorize(String action, String resource) {
        if (!isGranted(action, resource)) {
            log.warn("Denied {} on {}", action, resource);
            throw new AuthorizationDeniedException(action + " is not allowed on " + resource);
        }
    }

    public Scope scope() {
        return scope;
    }

    public Set<Permission> permissions() {
        return permissions;
    }

    public String storageResource() {
        return storageResource;
    }

    /**
     * Renders the grant as an IAM policy document, one statement per resource.
     */
    public String toPolicyDocument() {
        Map<String, List<String>> actionsByResource = new LinkedHashMap<>();
        for (Permission p : permissions) {
            actionsByResource.computeIfAbsent(p.getResource(), r -> new ArrayList<>()).add(p.getAction());
        }

        ObjectNode policy = objectMapper.createObjectNode();
        policy.put("Version", "2012-10-17");
        ArrayNode statements = policy.putArray("Statement");
        actionsByResource.forEach((resource, actions) -> {
            ObjectNode statement = statements.addObject();
            statement.put("Effect", "Allow");
            ArrayNode actionArray = statement.putArray("Action");
            actions.forEach(actionArray::add);
            statement.put("Resource", resource);
        });

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(policy);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render policy document", e);
        }
    }

    private static String validateRuntime(Set<Permission> permissions) {
        String storage = null;
        boolean canLog = false;
        boolean canTrace = false;

        for (Permission p : permissions) {
            String action = p.getAction();
            String resource = requireResource(p);
            if (STORAGE_ACTIONS.contains(action)) {
                storage = singleTable(storage, action, resource);
            } else if (LOG_GROUP_ACTIONS.contains(action)) {
                if (!resource.startsWith(LOG_ARN_PREFIX) || resource.contains("*")) {
                    throw new IllegalStateException("Log permission " + action + " must name one log group, got "
                            + resource);
                }
            } else if (LOG_STREAM_ACTIONS.contains(action)) {
                // Streams are only ever granted as the group's own ":*"
                if (!resource.startsWith(LOG_ARN_PREFIX) || resource.indexOf('*') != resource.length() - 1
                        || !resource.endsWith(":*")) {
                    throw new IllegalStateException("Log permission " + action
                            + " must name the streams of one log group, got " + resource);
                }
                canLog = true;
            } else if (TRACE_ACTIONS.contains(action)) {
                canTrace = true;
            } else if (CERTIFICATE_ACTIONS.contains(action)) {
                if (resource.contains("*")) {
                    throw new IllegalStateException("Certificate permission " + action
                            + " must name a single certificate, got " + resource);
                }
            } else if (PROVISIONING_ACTIONS.contains(action)) {
                throw new IllegalStateException("Action " + action + " belongs to the provisioning grant");
            } else {
                throw new IllegalStateException("Action " + action + " is outside the compute grant");
            }
        }

        if (storage == null) {
            throw new IllegalStateException("No storage permission granted");
        }
        if (!canLog || !canTrace) {
            throw new IllegalStateException("Log and trace emission must both be granted");
        }
        return storage;
    }

    private static String validateProvisioning(Set<Permission> permissions) {
        String storage = null;
        for (Permission p : permissions) {
            String action = p.getAction();
            String resource = requireResource(p);
            if (!PROVISIONING_ACTIONS.contains(action)) {
                throw new IllegalStateException("Action " + action + " is outside the provisioning grant");
            }
            storage = singleTable(storage, action, resource);
        }
        if (storage == null) {
            throw new IllegalStateException("No table named for provisioning");
        }
        return storage;
    }

    private static String requireResource(Permission p) {
        if (p.getResource() == null || p.getResource().isEmpty()) {
            throw new IllegalStateException("Permission " + p.getAction() + " has no resource");
        }
        return p.getResource();
    }

    private static String singleTable(String current, String action, String resource) {
        if (resource.contains("*")) {
            throw new IllegalStateException("Storage permission " + action
                    + " must name a single table, got " + resource);
        }
        if (current != null && !current.equals(resource)) {
            throw new IllegalStateException("Storage permissions span more than one table: "
                    + current + ", " + resource);
        }
        return resource;
    }
}
