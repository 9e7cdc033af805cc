package com.example.movies;

import com.example.movies.accesslog.AccessLogSink;
import com.example.movies.accesslog.CloudWatchAccessLogSink;
import com.example.movies.accesslog.InMemoryAccessLogSink;
import com.example.movies.compute.CatalogWriteHandler;
import com.example.movies.compute.ComputeInvoker;
import com.example.movies.config.EnvironmentConfig;
import com.example.movies.edge.AcmCertificateAuthority;
import com.example.movies.edge.CertificateAuthority;
import com.example.movies.edge.CertificateStatus;
import com.example.movies.edge.DnsAliasRecord;
import com.example.movies.edge.DomainBinding;
import com.example.movies.edge.TlsCertificate;
import com.example.movies.edge.TransportTerminator;
import com.example.movies.router.IngressRouter;
import com.example.movies.router.RouteBinding;
import com.example.movies.router.Stage;
import com.example.movies.security.GuardedCatalogStore;
import com.example.movies.security.SecurityBoundary;
import com.example.movies.storage.CatalogStore;
import com.example.movies.storage.DynamoDBClientProvider;
import com.example.movies.storage.DynamoDbCatalogStore;
import com.example.movies.storage.InMemoryCatalogStore;
import com.example.movies.storage.StorageIdentity;
import com.example.movies.storage.TableProvisioner;
import com.example.movies.tracing.TracingProvider;
import io.opentelemetry.api.OpenTelemetry;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.acm.AcmClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the write path together. Components are created strictly in this order:
 * <ol>
 *     <li>storage identity and store</li>
 *     <li>security boundary, wrapped around the store</li>
 *     <li>compute handler</li>
 *     <li>access log sink, initialized</li>
 *     <li>stage, activated on the ready sink</li>
 *     <li>router with the single {@code POST /movies} binding</li>
 *     <li>domain binding, only if a custom domain is configured</li>
 * </ol>
 */
@Slf4j
@Getter
public class ServiceTopology {

    public static final String ROUTE_METHOD = "POST";
    public static final String ROUTE_PATH = "/movies";

    static final Duration TRACE_FLUSH_TIMEOUT = Duration.ofSeconds(2);

    private final EnvironmentConfig config;
    private final StorageIdentity storageIdentity;
    private final SecurityBoundary securityBoundary;
    private final CatalogStore catalogStore;
    private final IngressRouter router;
    private final DomainBinding domainBinding;
    private final TransportTerminator transportTerminator;
    private final OpenTelemetry openTelemetry;

    /**
     * @param securityBoundary optional; defaults to {@link #securityBoundaryFor(EnvironmentConfig)}
     */
    @Builder
    private ServiceTopology(EnvironmentConfig config, CatalogStore catalogStore, AccessLogSink accessLogSink,
                            CertificateAuthority certificateAuthority, ExecutorService executor,
                            OpenTelemetry openTelemetry, SecurityBoundary securityBoundary) {
        if (config == null || catalogStore == null || accessLogSink == null || executor == null
                || openTelemetry == null) {
            throw new IllegalStateException("config, catalogStore, accessLogSink, executor and openTelemetry are required");
        }
        if (config.hasCustomDomain() && certificateAuthority == null) {
            throw new IllegalStateException("A custom domain needs a certificate authority");
        }
        this.config = config;
        this.openTelemetry = openTelemetry;

        // 1. storage
        this.storageIdentity = new StorageIdentity(config.getTableName(), config.getTableArn());
        if (!storageIdentity.equals(catalogStore.identity())) {
            throw new IllegalStateException("Store is bound to " + catalogStore.identity()
                    + " but the configured table is " + storageIdentity);
        }

        // 2. security boundary; an over-broad grant fails here
        this.securityBoundary = securityBoundary != null ? securityBoundary : securityBoundaryFor(config);
        this.catalogStore = new GuardedCatalogStore(catalogStore, this.securityBoundary);
        log.info("Security boundary: {} permissions, storage={}",
                this.securityBoundary.permissions().size(), this.securityBoundary.storageResource());

        // 3. compute
        CatalogWriteHandler handler = new CatalogWriteHandler(this.catalogStore);
        ComputeInvoker invoker = new ComputeInvoker(executor,
                Duration.ofMillis(config.getHandlerTimeoutMillis()), TracingProvider.tracer(openTelemetry));

        // 4. access logging must be in place before the stage goes live
        if (!accessLogSink.isReady()) {
            accessLogSink.initialize();
        }

        // 5. stage
        Stage stage = Stage.activate(config.getStageName(), accessLogSink);

        // 6. router
        this.router = new IngressRouter(
                List.of(new RouteBinding(ROUTE_METHOD, ROUTE_PATH, handler)),
                stage, invoker, storageIdentity);
        log.info("Stage {} routing {} {}", stage.getName(), ROUTE_METHOD, ROUTE_PATH);

        // 7. custom domain
        if (config.hasCustomDomain()) {
            this.domainBinding = bindDomain(certificateAuthority);
            this.transportTerminator = new TransportTerminator(domainBinding);
        } else {
            this.domainBinding = null;
            this.transportTerminator = null;
        }
    }

    private DomainBinding bindDomain(CertificateAuthority certificateAuthority) {
        String hostname = config.getCustomDomainName();
        DomainBinding binding = DomainBinding.builder()
                .hostname(hostname)
                .certificateArn(config.getCertificateArn())
                .certificateAuthority(certificateAuthority)
                .minimumTlsVersion(DomainBinding.MINIMUM_TLS_POLICY)
                .alias(new DnsAliasRecord(hostname, config.getApiEndpointTarget(), config.getHostedZoneId()))
                .router(router)
                .recheckInterval(Duration.ofSeconds(config.getCertificateRecheckSeconds()))
                .build();
        if (!binding.refresh()) {
            // The stage stays reachable on its own endpoint; the hostname serves nothing yet
            log.warn("Domain {} left inactive, rechecking every {}s", hostname, config.getCertificateRecheckSeconds());
        }
        return binding;
    }

    public boolean hasDomainBinding() {
        return domainBinding != null;
    }

    /**
     * Exports the spans of the invocation that just finished.
     */
    public void flushTraces() {
        TracingProvider.flush(openTelemetry, TRACE_FLUSH_TIMEOUT);
    }

    /**
     * The runtime grant for this configuration: the table, the function's log group, the
     * access log group and, with a custom domain, its certificate.
     */
    public static SecurityBoundary securityBoundaryFor(EnvironmentConfig config) {
        return SecurityBoundary.forCatalogTable(
                new StorageIdentity(config.getTableName(), config.getTableArn()),
                config.functionLogGroupArn(),
                config.accessLogGroupArn(),
                config.hasCustomDomain() ? config.getCertificateArn() : null);
    }

    /**
     * Builds the production topology from the environment, or an in-memory one when
     * {@code DRY_RUN} is set.
     */
    public static ServiceTopology fromEnvironment(EnvironmentConfig config) {
        SecurityBoundary boundary = securityBoundaryFor(config);
        ServiceTopologyBuilder builder = builder(config)
                .securityBoundary(boundary)
                .executor(Executors.newCachedThreadPool())
                .openTelemetry(TracingProvider.create(config));

        StorageIdentity identity = new StorageIdentity(config.getTableName(), config.getTableArn());
        if (config.isDryRun()) {
            log.info("DRY_RUN enabled, using in-memory store and access log");
            return builder
                    .catalogStore(new InMemoryCatalogStore(identity))
                    .accessLogSink(new InMemoryAccessLogSink(Duration.ofDays(config.getAccessLogRetentionDays())))
                    // Dry runs take the configured certificate as issued for the configured host
                    .certificateAuthority(arn -> new TlsCertificate(arn, config.getCustomDomainName(),
                            CertificateStatus.ISSUED))
                    .build();
        }

        Region region = Region.of(config.getRegion());
        DynamoDbAsyncClient dynamoDbClient = DynamoDBClientProvider.create(config);
        if (config.isEnsureTable()) {
            SecurityBoundary provisioning = SecurityBoundary.forTableProvisioning(identity);
            log.info("Provisioning grant: {}", provisioning.toPolicyDocument());
            new TableProvisioner(dynamoDbClient, provisioning).ensureTable(identity);
        }

        return builder
                .catalogStore(new DynamoDbCatalogStore(dynamoDbClient, identity))
                .accessLogSink(new CloudWatchAccessLogSink(
                        CloudWatchLogsClient.builder().region(region).build(),
                        config.getAccessLogGroup(),
                        config.accessLogGroupArn(),
                        config.getAccessLogRetentionDays(),
                        Clock.systemUTC(),
                        boundary))
                .certificateAuthority(new AcmCertificateAuthority(AcmClient.builder().region(region).build(), boundary))
                .build();
    }

    public static ServiceTopologyBuilder builder(EnvironmentConfig config) {
        return new ServiceTopologyBuilder().config(config);
    }
}
