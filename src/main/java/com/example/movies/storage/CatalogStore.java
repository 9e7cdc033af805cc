package com.example.movies.storage;

import com.example.movies.model.CatalogEntry;

import java.util.concurrent.CompletableFuture;

/**
 * Upsert-only access to the catalog table. A write replaces whatever is stored under
 * the same (year, title) key.
 */
public interface CatalogStore {

    StorageIdentity identity();

    CompletableFuture<Void> upsert(CatalogEntry entry);
}
