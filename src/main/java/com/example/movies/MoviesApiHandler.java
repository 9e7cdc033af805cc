package com.example.movies;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.example.movies.config.EnvironmentConfig;
import com.example.movies.edge.InboundConnection;
import com.example.movies.edge.TransportRejectedException;
import com.example.movies.model.RequestEnvelope;
import com.example.movies.router.RouterResponse;
import com.example.movies.router.Stage;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Lambda entry point behind the HTTP API's {@code $default} route. Requests that arrived on
 * the custom domain pass through the transport checks first; everything then goes through the
 * router, which owns route matching and access logging.
 */
@Slf4j
public class MoviesApiHandler implements RequestHandler<APIGatewayV2HTTPEvent, APIGatewayV2HTTPResponse> {

    // Built once per container, on the first invocation
    private static ServiceTopology sharedTopology;

    private final ServiceTopology topology;

    public MoviesApiHandler() {
        this(sharedTopology());
    }

    public MoviesApiHandler(ServiceTopology topology) {
        this.topology = topology;
    }

    private static synchronized ServiceTopology sharedTopology() {
        if (sharedTopology == null) {
            EnvironmentConfig config = EnvironmentConfig.loadFromSystemEnv();
            log.info("Loaded config: {}", config);
            sharedTopology = ServiceTopology.fromEnvironment(config);
        }
        return sharedTopology;
    }

    @Override
    public APIGatewayV2HTTPResponse handleRequest(APIGatewayV2HTTPEvent event, Context context) {
        long startTime = System.currentTimeMillis();

        RequestEnvelope request = toEnvelope(event, context, topology.getRouter().stage().getName());
        String domainName = event.getRequestContext() != null ? event.getRequestContext().getDomainName() : null;

        RouterResponse response;
        if (topology.hasDomainBinding() && topology.getDomainBinding().getHostname().equalsIgnoreCase(domainName)) {
            try {
                // API Gateway only completes handshakes that meet the domain's security policy
                response = topology.getTransportTerminator().terminate(new InboundConnection(
                        domainName, topology.getDomainBinding().getMinimumTlsVersion(), request));
            } catch (TransportRejectedException e) {
                response = RouterResponse.builder()
                        .statusCode(403)
                        .header("Content-Type", "application/json")
                        .body("{\"message\":\"Forbidden\"}")
                        .build();
            }
        } else {
            response = topology.getRouter().route(request);
        }

        String resultMsg = String.format("%s %s -> %d in %d ms", request.getMethod(), request.getPath(),
                response.getStatusCode(), System.currentTimeMillis() - startTime);
        if (context != null) {
            LambdaLogger logger = context.getLogger();
            logger.log("Request " + request.getRequestId() + ": " + resultMsg + "\n");
        }
        log.info("Request {} completed. {}", request.getRequestId(), resultMsg);

        // The container may be frozen as soon as we return
        topology.flushTraces();

        APIGatewayV2HTTPResponse result = new APIGatewayV2HTTPResponse();
        result.setStatusCode(response.getStatusCode());
        result.setHeaders(response.getHeaders());
        result.setBody(response.getBody());
        return result;
    }

    static RequestEnvelope toEnvelope(APIGatewayV2HTTPEvent event, Context context, String stageName) {
        APIGatewayV2HTTPEvent.RequestContext requestContext = event.getRequestContext();
        APIGatewayV2HTTPEvent.RequestContext.Http http = requestContext != null ? requestContext.getHttp() : null;

        String requestId = requestContext != null ? requestContext.getRequestId() : null;
        if (requestId == null && context != null) {
            requestId = context.getAwsRequestId();
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }

        Instant requestTime = requestContext != null && requestContext.getTimeEpoch() > 0
                ? Instant.ofEpochMilli(requestContext.getTimeEpoch())
                : Instant.now();

        Map<String, String> headers = event.getHeaders() != null ? event.getHeaders() : Map.of();

        return RequestEnvelope.builder()
                .requestId(requestId)
                .method(http != null ? http.getMethod() : null)
                .path(stripStage(http != null && http.getPath() != null ? http.getPath() : event.getRawPath(), stageName))
                .headers(headers)
                .body(event.getBody())
                .sourceIp(http != null ? http.getSourceIp() : null)
                .protocol(http != null ? http.getProtocol() : null)
                .requestTime(requestTime)
                .build();
    }

    /** Named stages prefix the path with {@code /<stage>}; {@code $default} does not. */
    static String stripStage(String path, String stageName) {
        if (path == null || stageName == null || Stage.DEFAULT_STAGE.equals(stageName)) {
            return path;
        }
        String prefix = "/" + stageName;
        if (path.equals(prefix)) {
            return "/";
        }
        return path.startsWith(prefix + "/") ? path.substring(prefix.length()) : path;
    }
}
