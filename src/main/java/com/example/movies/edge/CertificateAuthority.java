package com.example.movies.edge;

/**
 * External certificate service. Only lookups are needed here; issuance and validation
 * happen outside this service.
 */
@FunctionalInterface
public interface CertificateAuthority {

    TlsCertificate describe(String certificateArn);
}
