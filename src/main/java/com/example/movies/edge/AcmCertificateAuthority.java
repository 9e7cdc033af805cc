package com.example.movies.edge;

import com.example.movies.security.SecurityBoundary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.acm.AcmClient;
import software.amazon.awssdk.services.acm.model.AcmException;
import software.amazon.awssdk.services.acm.model.CertificateDetail;
import software.amazon.awssdk.services.acm.model.DescribeCertificateRequest;

@Slf4j
@RequiredArgsConstructor
public class AcmCertificateAuthority implements CertificateAuthority {

    private final AcmClient acmClient;
    private final SecurityBoundary boundary;

    @Override
    public TlsCertificate describe(String certificateArn) {
        boundary.authorize(SecurityBoundary.DESCRIBE_CERTIFICATE, certificateArn);
        try {
            CertificateDetail detail = acmClient.describeCertificate(DescribeCertificateRequest.builder()
                    .certificateArn(certificateArn)
                    .build()).certificate();
            log.info("Certificate {} for {} is {}", certificateArn, detail.domainName(), detail.statusAsString());
            return new TlsCertificate(certificateArn, detail.domainName(),
                    CertificateStatus.fromAcm(detail.statusAsString()));
        } catch (AcmException e) {
            throw new DomainBindingException("Cannot describe certificate " + certificateArn, e);
        }
    }
}
