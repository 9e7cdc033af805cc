package com.example.movies.storage;

import lombok.Value;

/**
 * Identity of the backing table: what the handler writes to, never how it authenticates.
 */
@Value
public class StorageIdentity {
    String tableName;
    String tableArn;
}
