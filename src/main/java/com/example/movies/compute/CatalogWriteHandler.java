package com.example.movies.compute;

import com.example.movies.model.CatalogEntry;
import com.example.movies.model.RequestEnvelope;
import com.example.movies.storage.CatalogStorageException;
import com.example.movies.storage.CatalogStore;
import com.example.movies.storage.CatalogValidationException;
import com.example.movies.storage.StorageIdentity;
import com.example.movies.storage.StorageSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;

/**
 * Handler for {@code POST /movies}: parses the body into a {@link CatalogEntry}, validates it
 * and upserts it. Sending the same entry twice leaves the table as sending it once.
 */
@Slf4j
@RequiredArgsConstructor
public class CatalogWriteHandler implements ComputeContract {

    // Decimals stay BigDecimal so extra attributes are stored exactly as sent
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final CatalogStore store;

    @Override
    public ComputeResult handle(RequestEnvelope request, StorageIdentity storage) {
        if (!store.identity().equals(storage)) {
            return ComputeResult.internalError("Handler is bound to " + store.identity().getTableName()
                    + ", not " + storage.getTableName());
        }

        CatalogEntry entry;
        try {
            entry = parse(request.getBody());
            StorageSchema.validate(entry);
        } catch (CatalogValidationException e) {
            log.warn("Rejected request {}: {}", request.getRequestId(), e.getMessage());
            return ComputeResult.validationError(e.getMessage());
        }

        try {
            store.upsert(entry).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ComputeResult.internalError("Write interrupted for " + entry.key());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CatalogValidationException) {
                return ComputeResult.validationError(cause.getMessage());
            }
            if (cause instanceof CatalogStorageException) {
                return ComputeResult.storageError(cause.getMessage());
            }
            return ComputeResult.internalError(String.valueOf(cause));
        }

        log.info("Stored {} in {}", entry.key(), storage.getTableName());
        try {
            return ComputeResult.success(objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            return ComputeResult.internalError("Cannot render stored entry: " + e.getOriginalMessage());
        }
    }

    private static CatalogEntry parse(String body) {
        if (body == null || body.trim().isEmpty()) {
            throw new CatalogValidationException("Request body is required");
        }
        try {
            return objectMapper.readValue(body, CatalogEntry.class);
        } catch (JsonProcessingException e) {
            throw new CatalogValidationException("Malformed request body: " + e.getOriginalMessage(), e);
        }
    }
}
