package com.example.movies.router;

import com.example.movies.accesslog.AccessLogSink;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A deployed stage of the router. It can only come into existence on top of an access log
 * sink that is already initialized, so no request is ever routed without a place to log it.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class Stage {

    public static final String DEFAULT_STAGE = "$default";

    private final String name;
    private final AccessLogSink accessLogSink;

    public static Stage activate(String name, AccessLogSink accessLogSink) {
        if (accessLogSink == null || !accessLogSink.isReady()) {
            throw new IllegalStateException("Stage " + name + " cannot activate before its access log sink is initialized");
        }
        return new Stage(name, accessLogSink);
    }
}
