package com.example.movies.storage;

import com.example.movies.config.EnvironmentConfig;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClientBuilder;

import java.net.URI;
import java.time.Duration;

public final class DynamoDBClientProvider {

    private DynamoDBClientProvider() {
    }

    /**
     * Builds the async client used for catalog writes. SDK retries are switched off: a
     * write is sent at most once and the caller decides whether to retry.
     */
    public static DynamoDbAsyncClient create(EnvironmentConfig config) {
        Duration bound = Duration.ofMillis(config.getHandlerTimeoutMillis());

        SdkAsyncHttpClient asyncHttpClient = NettyNioAsyncHttpClient.builder()
                .maxConcurrency(50)
                .connectionAcquisitionTimeout(bound)
                .connectionTimeToLive(Duration.ofMinutes(2))  // Keep connections for reuse across invocations
                .readTimeout(bound)
                .build();

        DynamoDbAsyncClientBuilder builder = DynamoDbAsyncClient.builder()
                .region(Region.of(config.getRegion()))
                .httpClient(asyncHttpClient)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.none())
                        .apiCallTimeout(bound)
                        .build());

        // DynamoDB Local or another compatible endpoint
        if (config.getDynamoDbEndpoint() != null && !config.getDynamoDbEndpoint().isEmpty()) {
            builder.endpointOverride(URI.create(config.getDynamoDbEndpoint()));
        }
        return builder.build();
    }
}
