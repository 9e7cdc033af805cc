package com.example.movies.edge;

import com.example.movies.model.RequestEnvelope;
import lombok.Value;

/**
 * A request as it arrives at the edge: the SNI host name and negotiated TLS version, plus
 * the HTTP request carried over the connection.
 */
@Value
public class InboundConnection {
    String serverName;
    TlsVersion tlsVersion;
    RequestEnvelope request;
}
