package com.example.movies.compute;

import com.example.movies.TestUtils;
import com.example.movies.storage.StorageIdentity;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComputeInvokerTest {

    private static final StorageIdentity MOVIES =
            new StorageIdentity("Movies", "arn:aws:dynamodb:us-east-1:000000000000:table/Movies");

    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;
    private ExecutorService executor;
    private ComputeInvoker invoker;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        executor = Executors.newCachedThreadPool();
        invoker = new ComputeInvoker(executor, Duration.ofMillis(200), tracerProvider.get("test"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        tracerProvider.close();
    }

    @Test
    void successfulCallIsTraced() {
        ComputeResult result = invoker.invoke((request, storage) -> ComputeResult.success("{}"),
                TestUtils.envelope("POST", "/movies", "{}"), MOVIES);

        assertThat(result.isSuccess()).isTrue();
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        SpanData span = spans.get(0);
        assertThat(span.getName()).isEqualTo(ComputeInvoker.SPAN_NAME);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("http.route"))).isEqualTo("POST /movies");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("compute.outcome"))).isEqualTo("SUCCESS");
        assertThat(span.getStatus().getStatusCode()).isNotEqualTo(StatusCode.ERROR);
    }

    @Test
    void typedFailureMarksSpanAsError() {
        ComputeResult result = invoker.invoke((request, storage) -> ComputeResult.validationError("bad"),
                TestUtils.envelope("POST", "/movies", "{}"), MOVIES);

        assertThat(result.getOutcome()).isEqualTo(ComputeResult.Outcome.VALIDATION_ERROR);
        assertThat(spanExporter.getFinishedSpanItems().get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    }

    @Test
    void slowHandlerTimesOutAndIsCancelled() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        ComputeContract slow = (request, storage) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return ComputeResult.success("{}");
        };

        assertThatThrownBy(() -> invoker.invoke(slow, TestUtils.envelope("POST", "/movies", "{}"), MOVIES))
                .isInstanceOf(IntegrationTimeoutException.class)
                .hasMessageContaining("200 ms");
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(spanExporter.getFinishedSpanItems().get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    }

    @Test
    void unhandledFaultBecomesIntegrationFailure() {
        ComputeContract broken = (request, storage) -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() -> invoker.invoke(broken, TestUtils.envelope("POST", "/movies", "{}"), MOVIES))
                .isInstanceOf(IntegrationFailureException.class)
                .hasMessageContaining("boom")
                .hasCauseInstanceOf(IllegalStateException.class);
        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getEvents()).anyMatch(event -> event.getName().equals("exception"));
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThatThrownBy(() -> new ComputeInvoker(executor, Duration.ZERO, tracerProvider.get("test")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
