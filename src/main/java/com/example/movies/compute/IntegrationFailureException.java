package com.example.movies.compute;

import com.example.movies.MoviesApiException;

/** The compute contract failed with an unhandled fault. */
public class IntegrationFailureException extends MoviesApiException {

    public IntegrationFailureException(String message) {
        super(message);
    }

    public IntegrationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
