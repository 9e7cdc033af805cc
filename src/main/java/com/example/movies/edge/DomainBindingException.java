package com.example.movies.edge;

import com.example.movies.MoviesApiException;

/** The custom domain cannot be bound to the stage. */
public class DomainBindingException extends MoviesApiException {

    public DomainBindingException(String message) {
        super(message);
    }

    public DomainBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
