package com.example.movies.config;

import lombok.*;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvironmentConfig {
    private String tableName;
    private String tableArn;
    private String region;
    private String accountId;
    private long handlerTimeoutMillis;
    private String stageName;
    private String accessLogGroup;
    private int accessLogRetentionDays;
    private String customDomainName;
    private String certificateArn;
    private String apiEndpointTarget;
    private String hostedZoneId;
    private int certificateRecheckSeconds;
    private String serviceName;
    private String otlpEndpoint;
    private String dynamoDbEndpoint;
    private boolean ensureTable;
    private boolean dryRun;

    public static EnvironmentConfig loadFromSystemEnv() {
        return loadFrom(System.getenv());
    }

    /**
     * Reads the configuration from an arbitrary variable map, so tests don't have to
     * touch the process environment.
     */
    public static EnvironmentConfig loadFrom(Map<String, String> env) {
        String region = getenvOrDefault(env, "AWS_REGION", "us-east-1");
        String account = getenvOrDefault(env, "AWS_ACCOUNT_ID", "000000000000");
        String tableName = getenvOrDefault(env, "TABLE_NAME", "Movies");
        String tableArn = getenvOrDefault(env, "TABLE_ARN",
                "arn:aws:dynamodb:" + region + ":" + account + ":table/" + tableName);

        long timeout = parseLong(env, "HANDLER_TIMEOUT_MILLIS", 3000L, 1L);
        int retention = parseInt(env, "ACCESS_LOG_RETENTION_DAYS", 7, 1);
        int recheck = parseInt(env, "CERTIFICATE_RECHECK_SECONDS", 60, 0);

        return EnvironmentConfig.builder()
                .tableName(tableName)
                .tableArn(tableArn)
                .region(region)
                .accountId(account)
                .handlerTimeoutMillis(timeout)
                .stageName(getenvOrDefault(env, "STAGE_NAME", "$default"))
                .accessLogGroup(getenvOrDefault(env, "ACCESS_LOG_GROUP", "/aws/http-api/movies-access-logs"))
                .accessLogRetentionDays(retention)
                .customDomainName(getenvOrDefault(env, "CUSTOM_DOMAIN_NAME", ""))
                .certificateArn(getenvOrDefault(env, "CERTIFICATE_ARN", ""))
                .apiEndpointTarget(getenvOrDefault(env, "API_ENDPOINT_TARGET", ""))
                .hostedZoneId(getenvOrDefault(env, "HOSTED_ZONE_ID", ""))
                .certificateRecheckSeconds(recheck)
                .serviceName(getenvOrDefault(env, "SERVICE_NAME", "movies-write-api"))
                .otlpEndpoint(getenvOrDefault(env, "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317"))
                .dynamoDbEndpoint(getenvOrDefault(env, "DYNAMODB_ENDPOINT", ""))
                .ensureTable(Boolean.parseBoolean(env.get("ENSURE_TABLE")))
                .dryRun(Boolean.parseBoolean(env.get("DRY_RUN")))
                .build();
    }

    public boolean hasCustomDomain() {
        return customDomainName != null && !customDomainName.isEmpty();
    }

    /** Log group the function itself writes to; Lambda derives it from the function name. */
    public String functionLogGroupArn() {
        return "arn:aws:logs:" + region + ":" + accountId + ":log-group:/aws/lambda/" + serviceName + ":*";
    }

    /** Log group the access log sink creates and writes to. */
    public String accessLogGroupArn() {
        return "arn:aws:logs:" + region + ":" + accountId + ":log-group:" + accessLogGroup;
    }

    private static long parseLong(Map<String, String> env, String key, long defaultVal, long min) {
        String raw = getenvOrDefault(env, key, null);
        if (raw == null) {
            return defaultVal;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
        if (value < min) {
            throw new IllegalArgumentException(key + " must be at least " + min + ", got " + raw);
        }
        return value;
    }

    private static int parseInt(Map<String, String> env, String key, int defaultVal, int min) {
        long value = parseLong(env, key, defaultVal, min);
        if (value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " is out of range: " + value);
        }
        return (int) value;
    }

    private static String getenvOrDefault(Map<String, String> env, String key, String defaultVal) {
        String val = env.get(key);
        return (val != null && !val.isEmpty()) ? val : defaultVal;
    }
}
