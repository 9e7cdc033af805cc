package com.example.movies.edge;

import com.example.movies.router.IngressRouter;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Binds a public hostname to the router's stage. The binding stays inactive, and serves
 * nothing, until the certificate authority reports the certificate as issued for exactly
 * that hostname. While inactive, the certificate is looked up again at most once per
 * recheck interval, so the binding goes live once validation completes.
 */
@Slf4j
@Getter
public class DomainBinding {

    public static final TlsVersion MINIMUM_TLS_POLICY = TlsVersion.TLS_1_2;
    public static final Duration DEFAULT_RECHECK_INTERVAL = Duration.ofSeconds(60);

    private final String hostname;
    private final String certificateArn;
    private final CertificateAuthority certificateAuthority;
    private final TlsVersion minimumTlsVersion;
    private final DnsAliasRecord alias;
    private final IngressRouter router;
    private final Clock clock;
    private final Duration recheckInterval;
    private volatile TlsCertificate certificate;
    private volatile Instant lastChecked;
    private volatile boolean active;

    @Builder
    private DomainBinding(String hostname, String certificateArn, CertificateAuthority certificateAuthority,
                          TlsVersion minimumTlsVersion, DnsAliasRecord alias, IngressRouter router,
                          Clock clock, Duration recheckInterval) {
        TlsVersion minimum = minimumTlsVersion != null ? minimumTlsVersion : MINIMUM_TLS_POLICY;
        if (!minimum.isAtLeast(MINIMUM_TLS_POLICY)) {
            throw new DomainBindingException("Minimum TLS version " + minimum.protocolName()
                    + " is below policy " + MINIMUM_TLS_POLICY.protocolName());
        }
        if (!alias.getHostname().equalsIgnoreCase(hostname)) {
            throw new DomainBindingException("Alias record is for " + alias.getHostname() + ", not " + hostname);
        }
        this.hostname = hostname;
        this.certificateArn = certificateArn;
        this.certificateAuthority = certificateAuthority;
        this.minimumTlsVersion = minimum;
        this.alias = alias;
        this.router = router;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.recheckInterval = recheckInterval != null ? recheckInterval : DEFAULT_RECHECK_INTERVAL;
    }

    /**
     * Looks the certificate up and activates the binding.
     *
     * @throws DomainBindingException if the lookup fails or the certificate is not issued for
     *                                this hostname
     */
    public synchronized void activate() {
        lastChecked = clock.instant();
        TlsCertificate current = certificateAuthority.describe(certificateArn);
        certificate = current;
        if (!current.isValidatedFor(hostname)) {
            throw new DomainBindingException("Certificate " + current.getArn() + " (" + current.getDomainName()
                    + ", " + current.getStatus() + ") is not validated for " + hostname);
        }
        active = true;
        log.info("Domain {} bound to stage {} via {}", hostname, router.stage().getName(),
                alias.getTargetDomainName());
    }

    /**
     * Returns whether the binding is active, first retrying activation if it is not and the
     * recheck interval has passed since the last lookup.
     */
    public boolean refresh() {
        if (active) {
            return true;
        }
        synchronized (this) {
            if (active) {
                return true;
            }
            Instant last = lastChecked;
            if (last != null && clock.instant().isBefore(last.plus(recheckInterval))) {
                return false;
            }
            try {
                activate();
            } catch (DomainBindingException e) {
                log.warn("Domain {} still inactive: {}", hostname, e.getMessage());
            }
            return active;
        }
    }
}
