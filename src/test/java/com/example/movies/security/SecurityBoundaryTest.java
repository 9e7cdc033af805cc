package com.example.movies.security;

import com.example.movies.storage.StorageIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurityBoundaryTest {

    static final String TABLE_ARN = "arn:aws:dynamodb:us-east-1:000000000000:table/Movies";
    static final String LOG_GROUP = "arn:aws:logs:us-east-1:000000000000:log-group:/aws/lambda/movies-write-api:*";
    static final String ACCESS_LOG_GROUP =
            "arn:aws:logs:us-east-1:000000000000:log-group:/aws/http-api/movies-access-logs";
    static final String CERT_ARN = "arn:aws:acm:us-east-1:000000000000:certificate/abc";

    private static final StorageIdentity MOVIES = new StorageIdentity("Movies", TABLE_ARN);

    private final SecurityBoundary boundary = SecurityBoundary.forCatalogTable(
            MOVIES, LOG_GROUP, ACCESS_LOG_GROUP, CERT_ARN);

    @Test
    void grantsItemActionsOnTheTableOnly() {
        assertThat(boundary.isGranted(SecurityBoundary.PUT_ITEM, TABLE_ARN)).isTrue();
        assertThat(boundary.isGranted(SecurityBoundary.GET_ITEM, TABLE_ARN)).isTrue();
        assertThat(boundary.isGranted(SecurityBoundary.UPDATE_ITEM, TABLE_ARN)).isTrue();
        assertThat(boundary.isGranted("dynamodb:DeleteItem", TABLE_ARN)).isFalse();
        assertThat(boundary.isGranted(SecurityBoundary.PUT_ITEM, TABLE_ARN + "-archive")).isFalse();
    }

    @Test
    void logStreamsInsideTheGroupAreCovered() {
        assertThat(boundary.isGranted(SecurityBoundary.PUT_LOG_EVENTS,
                "arn:aws:logs:us-east-1:000000000000:log-group:/aws/lambda/movies-write-api:log-stream:2026/01/01"))
                .isTrue();
        assertThat(boundary.isGranted(SecurityBoundary.PUT_LOG_EVENTS,
                "arn:aws:logs:us-east-1:000000000000:log-group:/aws/lambda/other:log-stream:x"))
                .isFalse();
    }

    @Test
    void accessLogGroupCanBeCreatedAndWritten() {
        String stream = SecurityBoundary.streamArn(ACCESS_LOG_GROUP, "2026-10-17/abc");

        assertThat(boundary.isGranted(SecurityBoundary.CREATE_LOG_GROUP, ACCESS_LOG_GROUP)).isTrue();
        assertThat(boundary.isGranted(SecurityBoundary.PUT_RETENTION_POLICY, ACCESS_LOG_GROUP)).isTrue();
        assertThat(boundary.isGranted(SecurityBoundary.CREATE_LOG_STREAM, stream)).isTrue();
        assertThat(boundary.isGranted(SecurityBoundary.PUT_LOG_EVENTS, stream)).isTrue();
        assertThat(boundary.isGranted(SecurityBoundary.CREATE_LOG_GROUP,
                "arn:aws:logs:us-east-1:000000000000:log-group:/aws/http-api/other")).isFalse();
    }

    @Test
    void onlyTheConfiguredCertificateCanBeDescribed() {
        assertThat(boundary.isGranted(SecurityBoundary.DESCRIBE_CERTIFICATE, CERT_ARN)).isTrue();
        assertThat(boundary.isGranted(SecurityBoundary.DESCRIBE_CERTIFICATE,
                "arn:aws:acm:us-east-1:000000000000:certificate/other")).isFalse();

        SecurityBoundary withoutDomain = SecurityBoundary.forCatalogTable(MOVIES, LOG_GROUP, ACCESS_LOG_GROUP, null);
        assertThat(withoutDomain.isGranted(SecurityBoundary.DESCRIBE_CERTIFICATE, CERT_ARN)).isFalse();
    }

    @Test
    void runtimeGrantCannotProvisionTables() {
        assertThat(boundary.isGranted(SecurityBoundary.CREATE_TABLE, TABLE_ARN)).isFalse();
        assertThat(boundary.isGranted(SecurityBoundary.DESCRIBE_TABLE, TABLE_ARN)).isFalse();

        assertThatThrownBy(() -> baseGrant()
                .allow(SecurityBoundary.PUT_ITEM, TABLE_ARN)
                .allow(SecurityBoundary.CREATE_TABLE, TABLE_ARN)
                .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("provisioning");
    }

    @Test
    void provisioningGrantCoversOnlyTableCreation() {
        SecurityBoundary provisioning = SecurityBoundary.forTableProvisioning(MOVIES);

        assertThat(provisioning.scope()).isEqualTo(SecurityBoundary.Scope.PROVISIONING);
        assertThat(provisioning.storageResource()).isEqualTo(TABLE_ARN);
        assertThat(provisioning.isGranted(SecurityBoundary.CREATE_TABLE, TABLE_ARN)).isTrue();
        assertThat(provisioning.isGranted(SecurityBoundary.DESCRIBE_TABLE, TABLE_ARN)).isTrue();
        assertThat(provisioning.isGranted(SecurityBoundary.PUT_ITEM, TABLE_ARN)).isFalse();

        assertThatThrownBy(() -> SecurityBoundary.builder()
                .scope(SecurityBoundary.Scope.PROVISIONING)
                .allow(SecurityBoundary.CREATE_TABLE, TABLE_ARN)
                .allow(SecurityBoundary.PUT_ITEM, TABLE_ARN)
                .build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void otherResourceIsDenied() {
        assertThatThrownBy(() -> boundary.authorize(SecurityBoundary.PUT_ITEM,
                "arn:aws:dynamodb:us-east-1:000000000000:table/Users"))
                .isInstanceOf(AuthorizationDeniedException.class)
                .hasMessageContaining("table/Users");
        assertThatThrownBy(() -> boundary.authorize("s3:GetObject", "arn:aws:s3:::bucket/key"))
                .isInstanceOf(AuthorizationDeniedException.class);
    }

    @Test
    void wildcardTableIsRejectedAtConstruction() {
        assertThatThrownBy(() -> baseGrant()
                .allow(SecurityBoundary.PUT_ITEM, "arn:aws:dynamodb:us-east-1:000000000000:table/*")
                .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("single table");
    }

    @Test
    void wildcardLogGroupAndCertificateAreRejectedAtConstruction() {
        assertThatThrownBy(() -> baseGrant()
                .allow(SecurityBoundary.PUT_ITEM, TABLE_ARN)
                .allow(SecurityBoundary.CREATE_LOG_GROUP, "arn:aws:logs:us-east-1:000000000000:log-group:*")
                .build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> baseGrant()
                .allow(SecurityBoundary.PUT_ITEM, TABLE_ARN)
                .allow(SecurityBoundary.PUT_LOG_EVENTS, "*")
                .build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> baseGrant()
                .allow(SecurityBoundary.PUT_ITEM, TABLE_ARN)
                .allow(SecurityBoundary.DESCRIBE_CERTIFICATE, "arn:aws:acm:us-east-1:000000000000:certificate/*")
                .build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void secondTableIsRejectedAtConstruction() {
        assertThatThrownBy(() -> baseGrant()
                .allow(SecurityBoundary.PUT_ITEM, TABLE_ARN)
                .allow(SecurityBoundary.PUT_ITEM, "arn:aws:dynamodb:us-east-1:000000000000:table/Users")
                .build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unknownActionIsRejectedAtConstruction() {
        assertThatThrownBy(() -> baseGrant()
                .allow(SecurityBoundary.PUT_ITEM, TABLE_ARN)
                .allow("dynamodb:DeleteTable", TABLE_ARN)
                .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("dynamodb:DeleteTable");
    }

    @Test
    void missingTraceGrantIsRejected() {
        assertThatThrownBy(() -> SecurityBoundary.builder()
                .allow(SecurityBoundary.PUT_ITEM, TABLE_ARN)
                .allow(SecurityBoundary.PUT_LOG_EVENTS, LOG_GROUP)
                .build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void policyDocumentHasOneStatementPerResource() throws Exception {
        JsonNode policy = new ObjectMapper().readTree(boundary.toPolicyDocument());

        assertThat(policy.get("Version").asText()).isEqualTo("2012-10-17");
        // table, function logs, access log group, its streams, traces, certificate
        assertThat(policy.get("Statement")).hasSize(6);
        JsonNode storage = policy.get("Statement").get(0);
        assertThat(storage.get("Resource").asText()).isEqualTo(TABLE_ARN);
        assertThat(storage.get("Action")).hasSize(3);
        JsonNode accessGroup = policy.get("Statement").get(2);
        assertThat(accessGroup.get("Resource").asText()).isEqualTo(ACCESS_LOG_GROUP);
        assertThat(accessGroup.get("Action")).extracting(JsonNode::asText)
                .containsExactly(SecurityBoundary.CREATE_LOG_GROUP, SecurityBoundary.PUT_RETENTION_POLICY);
    }

    private static SecurityBoundary.SecurityBoundaryBuilder baseGrant() {
        return SecurityBoundary.builder()
                .allow(SecurityBoundary.CREATE_LOG_STREAM, LOG_GROUP)
                .allow(SecurityBoundary.PUT_LOG_EVENTS, LOG_GROUP)
                .allow(SecurityBoundary.PUT_TRACE_SEGMENTS, "*");
    }
}
