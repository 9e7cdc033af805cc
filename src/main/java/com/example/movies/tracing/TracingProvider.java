package com.example.movies.tracing;

import com.example.movies.config.EnvironmentConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Sets up span export to the collector running next to the function. Lambda freezes the
 * container between invocations, so spans are flushed at the end of each one.
 */
@Slf4j
public final class TracingProvider {

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final String INSTRUMENTATION_SCOPE = "com.example.movies";

    private TracingProvider() {
    }

    public static OpenTelemetry create(EnvironmentConfig config) {
        if (config.isDryRun()) {
            log.info("Dry run, spans are not exported");
            return OpenTelemetry.noop();
        }

        log.info("Configuring OpenTelemetry with endpoint: {}", config.getOtlpEndpoint());

        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(SERVICE_NAME, config.getServiceName())));

        SdkTracerProvider sdkTracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(
                                OtlpGrpcSpanExporter.builder()
                                        .setEndpoint(config.getOtlpEndpoint())
                                        .build())
                        .build())
                .setResource(resource)
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(sdkTracerProvider::close));

        return OpenTelemetrySdk.builder()
                .setTracerProvider(sdkTracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
    }

    public static Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
    }

    /**
     * Pushes every finished span to the exporter, waiting at most {@code timeout}. A no-op
     * for anything but an SDK instance.
     *
     * @return false if the export failed or did not finish in time
     */
    public static boolean flush(OpenTelemetry openTelemetry, Duration timeout) {
        if (!(openTelemetry instanceof OpenTelemetrySdk)) {
            return true;
        }
        CompletableResultCode result = ((OpenTelemetrySdk) openTelemetry).getSdkTracerProvider()
                .forceFlush()
                .join(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!result.isSuccess()) {
            log.warn("Span export did not complete within {} ms", timeout.toMillis());
        }
        return result.isSuccess();
    }
}
