package com.example.movies.security;

import com.example.movies.model.CatalogEntry;
import com.example.movies.storage.CatalogStore;
import com.example.movies.storage.StorageIdentity;

import java.util.concurrent.CompletableFuture;

/**
 * Puts a {@link SecurityBoundary} in front of a store. The grant is checked once when the
 * store is wrapped and again on every write.
 */
public class GuardedCatalogStore implements CatalogStore {

    private final CatalogStore delegate;
    private final SecurityBoundary boundary;

    public GuardedCatalogStore(CatalogStore delegate, SecurityBoundary boundary) {
        this.delegate = delegate;
        this.boundary = boundary;
        boundary.authorize(SecurityBoundary.PUT_ITEM, delegate.identity().getTableArn());
    }

    @Override
    public StorageIdentity identity() {
        return delegate.identity();
    }

    @Override
    public CompletableFuture<Void> upsert(CatalogEntry entry) {
        boundary.authorize(SecurityBoundary.PUT_ITEM, delegate.identity().getTableArn());
        return delegate.upsert(entry);
    }
}
