package com.example.movies.compute;

import com.example.movies.MoviesApiException;

/** The compute contract did not finish within its configured bound. */
public class IntegrationTimeoutException extends MoviesApiException {

    public IntegrationTimeoutException(String message) {
        super(message);
    }

    public IntegrationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
