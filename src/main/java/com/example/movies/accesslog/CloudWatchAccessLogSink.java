package com.example.movies.accesslog;

import com.example.movies.security.SecurityBoundary;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CloudWatchLogsException;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogGroupRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutRetentionPolicyRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.UUID;

/**
 * Writes access log records as JSON lines into a CloudWatch Logs group. The group is created
 * with a fixed retention; CloudWatch discards events once they age out. Every call is
 * authorized against the {@link SecurityBoundary} before it is sent.
 */
@Slf4j
public class CloudWatchAccessLogSink implements AccessLogSink {

    // Retention values CloudWatch Logs accepts
    static final Set<Integer> SUPPORTED_RETENTION_DAYS = Set.of(
            1, 3, 5, 7, 14, 30, 60, 90, 120, 150, 180, 365, 400, 545, 731, 1096, 1827, 2192, 2557,
            2922, 3288, 3653);

    private final CloudWatchLogsClient logsClient;
    private final String logGroupName;
    private final String logGroupArn;
    private final int retentionDays;
    private final String logStreamName;
    private final SecurityBoundary boundary;
    private volatile boolean ready;

    public CloudWatchAccessLogSink(CloudWatchLogsClient logsClient, String logGroupName, String logGroupArn,
                                   int retentionDays, Clock clock, SecurityBoundary boundary) {
        if (!SUPPORTED_RETENTION_DAYS.contains(retentionDays)) {
            throw new IllegalArgumentException("Unsupported log retention: " + retentionDays + " days");
        }
        this.logsClient = logsClient;
        this.logGroupName = logGroupName;
        this.logGroupArn = logGroupArn;
        this.retentionDays = retentionDays;
        this.logStreamName = LocalDate.now(clock.withZone(ZoneOffset.UTC)) + "/" + UUID.randomUUID();
        this.boundary = boundary;
    }

    @Override
    public void initialize() {
        String streamArn = SecurityBoundary.streamArn(logGroupArn, logStreamName);
        boundary.authorize(SecurityBoundary.CREATE_LOG_GROUP, logGroupArn);
        boundary.authorize(SecurityBoundary.PUT_RETENTION_POLICY, logGroupArn);
        boundary.authorize(SecurityBoundary.CREATE_LOG_STREAM, streamArn);

        try {
            logsClient.createLogGroup(CreateLogGroupRequest.builder().logGroupName(logGroupName).build());
            log.info("Created log group {}", logGroupName);
        } catch (ResourceAlreadyExistsException e) {
            log.info("Log group {} already exists", logGroupName);
        }

        logsClient.putRetentionPolicy(PutRetentionPolicyRequest.builder()
                .logGroupName(logGroupName)
                .retentionInDays(retentionDays)
                .build());

        logsClient.createLogStream(CreateLogStreamRequest.builder()
                .logGroupName(logGroupName)
                .logStreamName(logStreamName)
                .build());

        ready = true;
        log.info("Access log sink ready: group={} stream={} retention={}d",
                logGroupName, logStreamName, retentionDays);
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public Duration retention() {
        return Duration.ofDays(retentionDays);
    }

    public String logStreamName() {
        return logStreamName;
    }

    @Override
    public synchronized void append(AccessLogRecord record) {
        boundary.authorize(SecurityBoundary.PUT_LOG_EVENTS, SecurityBoundary.streamArn(logGroupArn, logStreamName));
        InputLogEvent event = InputLogEvent.builder()
                .timestamp(record.getRequestTime().toEpochMilli())
                .message(AccessLogFormatter.toJson(record))
                .build();
        try {
            logsClient.putLogEvents(PutLogEventsRequest.builder()
                    .logGroupName(logGroupName)
                    .logStreamName(logStreamName)
                    .logEvents(event)
                    .build());
        } catch (CloudWatchLogsException e) {
            log.error("Failed to deliver access log record {}: {}", record.getRequestId(), e.getMessage(), e);
        }
    }
}
