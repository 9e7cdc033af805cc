package com.example.movies.compute;

import com.example.movies.model.RequestEnvelope;
import com.example.movies.storage.StorageIdentity;

/**
 * What a handler behind the router has to implement. Implementations are stateless; the
 * table they write to is handed in with every call rather than looked up.
 */
@FunctionalInterface
public interface ComputeContract {

    /**
     * Handles one request. Expected failures come back as a typed {@link ComputeResult};
     * anything thrown is treated by the router as an unhandled fault.
     */
    ComputeResult handle(RequestEnvelope request, StorageIdentity storage);
}
