package com.example.movies.router;

import com.example.movies.compute.ComputeContract;
import lombok.Value;

import java.util.Locale;

/**
 * Static mapping of one HTTP method and path to the handler that serves it.
 */
@Value
public class RouteBinding {
    String method;
    String path;
    ComputeContract target;

    public RouteBinding(String method, String path, ComputeContract target) {
        if (method == null || path == null || target == null) {
            throw new IllegalArgumentException("method, path and target are required");
        }
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("Route path must start with '/': " + path);
        }
        this.method = method.toUpperCase(Locale.ROOT);
        this.path = path;
        this.target = target;
    }

    /** Method is compared case-insensitively, path exactly. */
    public boolean matches(String requestMethod, String requestPath) {
        return requestMethod != null
                && method.equals(requestMethod.toUpperCase(Locale.ROOT))
                && path.equals(requestPath);
    }

    public String routeKey() {
        return method + " " + path;
    }
}
