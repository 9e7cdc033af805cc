package com.example.movies.edge;

import com.example.movies.router.RouterResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class TransportTerminator {

    private final DomainBinding binding;

    /**
     * Checks the connection against the binding and hands the request to the router.
     *
     * An inactive binding first gets a chance to pick up a newly issued certificate.
     *
     * @throws TransportRejectedException if the binding is not active, the host does not match,
     *                                    or the TLS version is below the minimum
     */
    public RouterResponse terminate(InboundConnection connection) {
        if (!binding.refresh()) {
            throw reject("Domain " + binding.getHostname() + " is not active");
        }
        if (connection.getServerName() == null || !binding.getHostname().equalsIgnoreCase(connection.getServerName())) {
            throw reject("No certificate for host " + connection.getServerName());
        }
        if (connection.getTlsVersion() == null || !connection.getTlsVersion().isAtLeast(binding.getMinimumTlsVersion())) {
            throw reject("TLS version " + connection.getTlsVersion() + " is below "
                    + binding.getMinimumTlsVersion().protocolName());
        }
        return binding.getRouter().route(connection.getRequest());
    }

    private static TransportRejectedException reject(String reason) {
        log.warn("Connection rejected: {}", reason);
        return new TransportRejectedException(reason);
    }
}
