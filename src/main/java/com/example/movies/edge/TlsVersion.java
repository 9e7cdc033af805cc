package com.example.movies.edge;

import java.util.Locale;

/**
 * TLS protocol versions in ascending order, so {@code compareTo} reads as "older than".
 */
public enum TlsVersion {
    TLS_1_0("TLSv1"),
    TLS_1_1("TLSv1.1"),
    TLS_1_2("TLSv1.2"),
    TLS_1_3("TLSv1.3");

    private final String protocolName;

    TlsVersion(String protocolName) {
        this.protocolName = protocolName;
    }

    public String protocolName() {
        return protocolName;
    }

    public boolean isAtLeast(TlsVersion minimum) {
        return compareTo(minimum) >= 0;
    }

    /** Accepts JSSE names ({@code TLSv1.2}) as well as the enum names. */
    public static TlsVersion fromProtocolName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("TLS protocol name is required");
        }
        String normalized = name.trim();
        for (TlsVersion version : values()) {
            if (version.protocolName.equalsIgnoreCase(normalized) || version.name().equalsIgnoreCase(normalized)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Unknown TLS protocol: " + name.toUpperCase(Locale.ROOT));
    }
}
