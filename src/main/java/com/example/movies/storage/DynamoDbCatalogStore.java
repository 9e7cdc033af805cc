package com.example.movies.storage;

import com.example.movies.model.CatalogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Writes catalog entries with an unconditional PutItem. Concurrent writes to the same
 * key race and the last one to land wins; no version attribute is kept.
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoDbCatalogStore implements CatalogStore {

    private final DynamoDbAsyncClient dynamoDbAsyncClient;
    private final StorageIdentity identity;

    @Override
    public StorageIdentity identity() {
        return identity;
    }

    @Override
    public CompletableFuture<Void> upsert(CatalogEntry entry) {
        StorageSchema.validate(entry);

        PutItemRequest request = PutItemRequest.builder()
                .tableName(identity.getTableName())
                .item(StorageSchema.toItem(entry))
                .build();

        log.info("Starting put for key={} table={}", entry.key(), identity.getTableName());
        return dynamoDbAsyncClient.putItem(request)
                .<Void>thenApply(response -> {
                    log.info("Completed put for key={}", entry.key());
                    return null;
                })
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                            ? ex.getCause() : ex;
                    log.error("Put failed for key={}: {}", entry.key(), cause.getMessage(), cause);
                    throw new CatalogStorageException("Write to " + identity.getTableName()
                            + " failed: " + cause.getMessage(), cause);
                });
    }
}
