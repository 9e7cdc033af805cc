package com.example.movies.storage;

import com.example.movies.security.SecurityBoundary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.util.concurrent.CompletionException;

/**
 * Creates the movies table from {@link StorageSchema} when it does not exist yet.
 * Meant for local endpoints and fresh accounts; in a deployed stack the table already exists.
 * Runs under its own provisioning grant, never the function's runtime grant.
 */
@Slf4j
@RequiredArgsConstructor
public class TableProvisioner {

    private final DynamoDbAsyncClient dynamoDbAsyncClient;
    private final SecurityBoundary boundary;

    /**
     * @return true if the table was created by this call
     */
    public boolean ensureTable(StorageIdentity table) {
        String tableName = table.getTableName();
        boundary.authorize(SecurityBoundary.DESCRIBE_TABLE, table.getTableArn());
        try {
            dynamoDbAsyncClient.describeTable(DescribeTableRequest.builder().tableName(tableName).build()).join();
            log.info("Table {} already exists", tableName);
            return false;
        } catch (CompletionException e) {
            if (!(e.getCause() instanceof ResourceNotFoundException)) {
                throw new CatalogStorageException("Cannot describe table " + tableName, e.getCause());
            }
        }

        boundary.authorize(SecurityBoundary.CREATE_TABLE, table.getTableArn());
        log.info("Creating table {}", tableName);
        try {
            dynamoDbAsyncClient.createTable(StorageSchema.createTableRequest(tableName)).join();
            dynamoDbAsyncClient.waiter()
                    .waitUntilTableExists(DescribeTableRequest.builder().tableName(tableName).build())
                    .join();
        } catch (CompletionException e) {
            throw new CatalogStorageException("Cannot create table " + tableName, e.getCause());
        }
        log.info("Table {} is active", tableName);
        return true;
    }
}
