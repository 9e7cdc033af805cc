package com.example.movies.security;

import com.example.movies.MoviesApiException;

/** Raised when the execution context touches a resource outside its granted permissions. */
public class AuthorizationDeniedException extends MoviesApiException {

    public AuthorizationDeniedException(String message) {
        super(message);
    }

    public AuthorizationDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
