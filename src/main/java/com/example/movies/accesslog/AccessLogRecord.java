package com.example.movies.accesslog;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One line in the access log. {@code integrationErrorMessage} is null unless the handler
 * timed out or failed; {@code routeKey} is {@code "-"} when no route matched.
 */
@Value
@Builder
public class AccessLogRecord {
    String requestId;
    String sourceIp;
    Instant requestTime;
    String protocol;
    String httpMethod;
    String routeKey;
    int status;
    long responseLength;
    String integrationErrorMessage;
}
