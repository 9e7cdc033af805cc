package com.example.movies.security;

import lombok.Value;

/**
 * One allowed action on one resource ARN. A resource ending in {@code *} covers every ARN
 * with that prefix.
 */
@Value
public class Permission {
    String action;
    String resource;

    public boolean covers(String requestedAction, String requestedResource) {
        if (!action.equals(requestedAction) || requestedResource == null) {
            return false;
        }
        if (resource.endsWith("*")) {
            return requestedResource.startsWith(resource.substring(0, resource.length() - 1));
        }
        return resource.equals(requestedResource);
    }
}
