package com.example.movies.storage;

import com.example.movies.MoviesApiException;

/** The candidate entry does not fit the catalog schema. */
public class CatalogValidationException extends MoviesApiException {

    public CatalogValidationException(String message) {
        super(message);
    }

    public CatalogValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
