package com.example.movies.accesslog;

import java.time.Duration;

/**
 * Append-only destination for access log records.
 */
public interface AccessLogSink {

    /**
     * Creates whatever the sink writes into and applies its retention. Must be called before
     * a stage is allowed to route through this sink.
     */
    void initialize();

    boolean isReady();

    Duration retention();

    /**
     * Appends one record. Delivery is best effort: a failing sink never changes the
     * response a client receives.
     */
    void append(AccessLogRecord record);
}
