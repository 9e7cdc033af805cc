package com.example.movies.compute;

import com.example.movies.model.RequestEnvelope;
import com.example.movies.storage.StorageIdentity;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link ComputeContract} inside a trace span and gives up on it once the timeout
 * elapses. A timed-out call is cancelled, but a write it already issued stays in the table.
 */
@Slf4j
public class ComputeInvoker {

    static final String SPAN_NAME = "compute.invoke";

    private final ExecutorService executor;
    private final Duration timeout;
    private final Tracer tracer;

    public ComputeInvoker(ExecutorService executor, Duration timeout, Tracer tracer) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.executor = executor;
        this.timeout = timeout;
        this.tracer = tracer;
    }

    public Duration timeout() {
        return timeout;
    }

    public ComputeResult invoke(ComputeContract contract, RequestEnvelope request, StorageIdentity storage) {
        Span span = tracer.spanBuilder(SPAN_NAME)
                .setSpanKind(SpanKind.SERVER)
                .setAttribute("http.route", request.routeKey())
                .setAttribute("aws.request_id", String.valueOf(request.getRequestId()))
                .setAttribute("db.name", storage.getTableName())
                .startSpan();

        Future<ComputeResult> future = null;
        try (Scope ignored = span.makeCurrent()) {
            Callable<ComputeResult> task = () -> contract.handle(request, storage);
            future = executor.submit(Context.current().wrap(task));
            ComputeResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new IntegrationFailureException("Handler returned no result");
            }

            span.setAttribute("compute.outcome", result.getOutcome().name());
            if (!result.isSuccess()) {
                span.setStatus(StatusCode.ERROR, String.valueOf(result.getErrorMessage()));
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Request {} exceeded {} ms", request.getRequestId(), timeout.toMillis());
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "timeout");
            throw new IntegrationTimeoutException("Handler did not complete within " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Request {} failed in handler: {}", request.getRequestId(), cause.getMessage(), cause);
            span.recordException(cause);
            span.setStatus(StatusCode.ERROR, String.valueOf(cause.getMessage()));
            throw new IntegrationFailureException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "interrupted");
            throw new IntegrationFailureException("Invocation interrupted", e);
        } catch (IntegrationFailureException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }
}
