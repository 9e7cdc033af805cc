package com.example.movies.router;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Map;

@Value
@Builder
public class RouterResponse {
    int statusCode;
    @Singular
    Map<String, String> headers;
    String body;

    public long contentLength() {
        return body == null ? 0 : body.getBytes(StandardCharsets.UTF_8).length;
    }
}
