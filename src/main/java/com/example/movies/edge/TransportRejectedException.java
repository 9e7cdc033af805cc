package com.example.movies.edge;

import com.example.movies.MoviesApiException;

/** The connection was refused before it reached the router. */
public class TransportRejectedException extends MoviesApiException {

    public TransportRejectedException(String message) {
        super(message);
    }

    public TransportRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
