package com.example.movies.edge;

import lombok.Value;

@Value
public class TlsCertificate {
    String arn;
    String domainName;
    CertificateStatus status;

    public boolean isValidatedFor(String hostname) {
        return status == CertificateStatus.ISSUED && domainName != null && domainName.equalsIgnoreCase(hostname);
    }
}
