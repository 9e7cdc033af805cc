package com.example.movies.router;

import com.example.movies.accesslog.AccessLogRecord;
import com.example.movies.compute.ComputeInvoker;
import com.example.movies.compute.ComputeResult;
import com.example.movies.compute.IntegrationFailureException;
import com.example.movies.compute.IntegrationTimeoutException;
import com.example.movies.model.RequestEnvelope;
import com.example.movies.storage.StorageIdentity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a request against the registered route bindings and invokes the bound handler.
 * Every request, matched or not, leaves exactly one access log record behind, written
 * before the response is handed back.
 */
@Slf4j
public class IngressRouter {

    static final String NO_ROUTE = "-";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final List<RouteBinding> bindings;
    private final Stage stage;
    private final ComputeInvoker invoker;
    private final StorageIdentity storage;

    public IngressRouter(List<RouteBinding> bindings, Stage stage, ComputeInvoker invoker,
                         StorageIdentity storage) {
        Set<String> keys = new HashSet<>();
        for (RouteBinding binding : bindings) {
            if (!keys.add(binding.routeKey())) {
                throw new IllegalArgumentException("Duplicate route " + binding.routeKey());
            }
        }
        this.bindings = List.copyOf(bindings);
        this.stage = stage;
        this.invoker = invoker;
        this.storage = storage;
    }

    public Stage stage() {
        return stage;
    }

    public List<RouteBinding> bindings() {
        return bindings;
    }

    public RouterResponse route(RequestEnvelope request) {
        Optional<RouteBinding> match = bindings.stream()
                .filter(b -> b.matches(request.getMethod(), request.getPath()))
                .findFirst();

        if (match.isEmpty()) {
            log.info("No route for {} (request {})", request.routeKey(), request.getRequestId());
            RouterResponse response = jsonResponse(404, "Not Found");
            record(request, NO_ROUTE, response, null);
            return response;
        }

        RouteBinding binding = match.get();
        RouterResponse response;
        String integrationError = null;
        try {
            ComputeResult result = invoker.invoke(binding.getTarget(), request, storage);
            int status = result.getOutcome().getStatusCode();
            if (result.isSuccess()) {
                response = RouterResponse.builder()
                        .statusCode(status)
                        .header("Content-Type", "application/json")
                        .body(result.getBody())
                        .build();
            } else {
                response = jsonResponse(status, result.getErrorMessage());
                if (status >= 500) {
                    integrationError = result.getErrorMessage();
                }
            }
        } catch (IntegrationTimeoutException e) {
            response = jsonResponse(504, "Endpoint request timed out");
            integrationError = e.getMessage();
        } catch (IntegrationFailureException e) {
            response = jsonResponse(502, "Internal Server Error");
            integrationError = e.getMessage();
        } catch (RuntimeException e) {
            log.error("Invocation of {} failed before reaching the handler", binding.routeKey(), e);
            response = jsonResponse(502, "Internal Server Error");
            integrationError = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        record(request, binding.routeKey(), response, integrationError);
        return response;
    }

    private void record(RequestEnvelope request, String routeKey, RouterResponse response, String integrationError) {
        AccessLogRecord record = AccessLogRecord.builder()
                .requestId(request.getRequestId())
                .sourceIp(request.getSourceIp())
                .requestTime(request.getRequestTime() != null ? request.getRequestTime() : Instant.now())
                .protocol(request.getProtocol())
                .httpMethod(request.getMethod())
                .routeKey(routeKey)
                .status(response.getStatusCode())
                .responseLength(response.contentLength())
                .integrationErrorMessage(integrationError)
                .build();
        try {
            stage.getAccessLogSink().append(record);
        } catch (RuntimeException e) {
            log.error("Access log append failed for request {}", request.getRequestId(), e);
        }
    }

    private static RouterResponse jsonResponse(int status, String message) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("message", message);
        return RouterResponse.builder()
                .statusCode(status)
                .header("Content-Type", "application/json")
                .body(body.toString())
                .build();
    }
}
