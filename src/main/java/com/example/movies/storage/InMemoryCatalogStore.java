package com.example.movies.storage;

import com.example.movies.model.CatalogEntry;
import com.example.movies.model.CatalogKey;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog store kept in process memory, used for dry runs. Entries are copied on the way
 * in and out so callers cannot mutate what is stored.
 */
public class InMemoryCatalogStore implements CatalogStore {

    private final StorageIdentity identity;
    private final Map<CatalogKey, CatalogEntry> entries = new ConcurrentHashMap<>();

    public InMemoryCatalogStore(StorageIdentity identity) {
        this.identity = identity;
    }

    @Override
    public StorageIdentity identity() {
        return identity;
    }

    @Override
    public CompletableFuture<Void> upsert(CatalogEntry entry) {
        StorageSchema.validate(entry);
        entries.put(entry.key(), copy(entry));
        return CompletableFuture.completedFuture(null);
    }

    public Optional<CatalogEntry> find(CatalogKey key) {
        return Optional.ofNullable(entries.get(key)).map(InMemoryCatalogStore::copy);
    }

    public int size() {
        return entries.size();
    }

    private static CatalogEntry copy(CatalogEntry entry) {
        return CatalogEntry.builder()
                .year(entry.getYear())
                .title(entry.getTitle())
                .attributes(entry.getAttributes() == null
                        ? new LinkedHashMap<>() : new LinkedHashMap<>(entry.getAttributes()))
                .build();
    }
}
