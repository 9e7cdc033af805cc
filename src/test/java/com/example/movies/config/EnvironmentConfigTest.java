package com.example.movies.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentConfigTest {

    @Test
    void testDefaults() {
        EnvironmentConfig config = EnvironmentConfig.loadFrom(Map.of());

        assertEquals("Movies", config.getTableName());
        assertEquals("arn:aws:dynamodb:us-east-1:000000000000:table/Movies", config.getTableArn());
        assertEquals(3000L, config.getHandlerTimeoutMillis());
        assertEquals(7, config.getAccessLogRetentionDays());
        assertEquals("$default", config.getStageName());
        assertFalse(config.hasCustomDomain());
        assertFalse(config.isDryRun());
        assertEquals(60, config.getCertificateRecheckSeconds());
    }

    @Test
    void testTableArnFollowsRegionAndAccount() {
        EnvironmentConfig config = EnvironmentConfig.loadFrom(Map.of(
                "AWS_REGION", "eu-west-1",
                "AWS_ACCOUNT_ID", "123456789012",
                "TABLE_NAME", "MoviesTable"));

        assertEquals("arn:aws:dynamodb:eu-west-1:123456789012:table/MoviesTable", config.getTableArn());
        assertEquals("arn:aws:logs:eu-west-1:123456789012:log-group:/aws/lambda/movies-write-api:*",
                config.functionLogGroupArn());
    }

    @Test
    void testExplicitTableArnWins() {
        EnvironmentConfig config = EnvironmentConfig.loadFrom(Map.of(
                "TABLE_ARN", "arn:aws:dynamodb:us-east-2:111111111111:table/Movies"));

        assertEquals("arn:aws:dynamodb:us-east-2:111111111111:table/Movies", config.getTableArn());
    }

    @Test
    void testInvalidTimeoutFailsFast() {
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfig.loadFrom(Map.of("HANDLER_TIMEOUT_MILLIS", "soon")));
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfig.loadFrom(Map.of("HANDLER_TIMEOUT_MILLIS", "0")));
    }

    @Test
    void testRetentionBeyondIntRangeIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfig.loadFrom(Map.of("ACCESS_LOG_RETENTION_DAYS", "4294967303")));
        assertTrue(e.getMessage().contains("ACCESS_LOG_RETENTION_DAYS"));
    }

    @Test
    void testNegativeRecheckIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfig.loadFrom(Map.of("CERTIFICATE_RECHECK_SECONDS", "-1")));
        assertEquals(0, EnvironmentConfig.loadFrom(Map.of("CERTIFICATE_RECHECK_SECONDS", "0"))
                .getCertificateRecheckSeconds());
    }

    @Test
    void testAccessLogGroupArn() {
        EnvironmentConfig config = EnvironmentConfig.loadFrom(Map.of());

        assertEquals("arn:aws:logs:us-east-1:000000000000:log-group:/aws/http-api/movies-access-logs",
                config.accessLogGroupArn());
    }
}
