package com.example.movies.accesslog;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps records in memory and drops them once they are older than the retention window.
 * Expired records are purged on every append. Used for dry runs; every record is also
 * written to the application log.
 */
@Slf4j
public class InMemoryAccessLogSink implements AccessLogSink {

    private final Duration retention;
    private final Clock clock;
    private final List<AccessLogRecord> records = new ArrayList<>();
    private volatile boolean ready;

    public InMemoryAccessLogSink(Duration retention) {
        this(retention, Clock.systemUTC());
    }

    public InMemoryAccessLogSink(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public void initialize() {
        ready = true;
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public Duration retention() {
        return retention;
    }

    @Override
    public synchronized void append(AccessLogRecord record) {
        records.add(record);
        log.info("access {}", AccessLogFormatter.toJson(record));
        int purged = purgeExpired(clock.instant());
        if (purged > 0) {
            log.debug("Purged {} access log records past {} retention", purged, retention);
        }
    }

    public synchronized List<AccessLogRecord> records() {
        return new ArrayList<>(records);
    }

    /**
     * Removes records whose request time is before {@code now - retention}.
     *
     * @return number of records removed
     */
    public synchronized int purgeExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        int before = records.size();
        records.removeIf(r -> r.getRequestTime() != null && r.getRequestTime().isBefore(cutoff));
        return before - records.size();
    }
}
