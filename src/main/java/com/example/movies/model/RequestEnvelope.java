package com.example.movies.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Normalized view of an inbound HTTP request, independent of the event format the
 * platform delivers it in.
 */
@Value
@Builder(toBuilder = true)
public class RequestEnvelope {
    String requestId;
    String method;
    String path;
    @Singular
    Map<String, String> headers;
    String body;
    String sourceIp;
    String protocol;
    Instant requestTime;

    public String routeKey() {
        return method + " " + path;
    }
}
