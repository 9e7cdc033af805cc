package com.example.movies.storage;

import com.example.movies.MoviesApiException;

/** The store rejected the write or could not be reached. */
public class CatalogStorageException extends MoviesApiException {

    public CatalogStorageException(String message) {
        super(message);
    }

    public CatalogStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
