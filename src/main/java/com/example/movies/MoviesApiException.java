package com.example.movies;

/**
 * Base type for every failure raised by the write path.
 */
public class MoviesApiException extends RuntimeException {

    public MoviesApiException(String message) {
        super(message);
    }

    public MoviesApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
