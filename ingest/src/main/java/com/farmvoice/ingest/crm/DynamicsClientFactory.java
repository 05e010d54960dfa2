package com.farmvoice.ingest.crm;

import com.farmvoice.ingest.model.Tenant;
import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.PipelineException.Kind;
import com.farmvoice.ingest.port.RemoteCreator;
import com.farmvoice.ingest.port.RemoteCreatorFactory;
import com.farmvoice.ingest.repository.TenantRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link DynamicsClient} per tenant, built from the tenant's stored
 * CRM credentials and reused across jobs so its access token is too.
 *
 * The tenant row is read on every lookup. When its credentials no longer
 * match the ones the cached client was built with (a rotated secret, a
 * moved environment) the client is replaced.
 */
@Component
public class DynamicsClientFactory implements RemoteCreatorFactory {

    private static final Logger log = LoggerFactory.getLogger(DynamicsClientFactory.class);

    /** The settings a client is built from. */
    record Credentials(String url, String directoryId, String clientId, String clientSecret) {

        static Credentials of(Tenant tenant) {
            return new Credentials(tenant.getDynamicsUrl(), tenant.getDynamicsTenantId(),
                    tenant.getDynamicsClientId(), tenant.getDynamicsClientSecret());
        }

        @Override
        public String toString() {
            return "Credentials[url=" + url + ", clientId=" + clientId + "]";
        }
    }

    private record CachedClient(Credentials credentials, DynamicsClient client) {}

    private final Map<UUID, CachedClient> clients = new ConcurrentHashMap<>();

    private final TenantRepository tenantRepo;
    private final ObjectMapper     json;
    private final String           loginUrl;
    private final HttpClient       http;

    public DynamicsClientFactory(TenantRepository tenantRepo,
                                 ObjectMapper objectMapper,
                                 @Value("${farmvoice.dynamics.login-url:https://login.microsoftonline.com}") String loginUrl) {
        this.tenantRepo = tenantRepo;
        this.json       = objectMapper;
        this.loginUrl   = loginUrl;
        this.http       = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * @throws PipelineException of kind REMOTE_SYNC if the tenant is gone or
     *                           has no CRM credentials configured
     */
    @Override
    public RemoteCreator forTenant(UUID tenantId) {
        Tenant tenant = tenantRepo.findById(tenantId)
                .orElseThrow(() -> new PipelineException(Kind.REMOTE_SYNC, "Client not found: " + tenantId));
        requireConfigured(tenant);
        Credentials current = Credentials.of(tenant);

        return clients.compute(tenantId, (id, cached) -> {
            if (cached != null && cached.credentials().equals(current)) {
                return cached;
            }
            if (cached != null) {
                log.info("Dynamics credentials changed for client {}, rebuilding its CRM client", tenant.getName());
            }
            return new CachedClient(current, new DynamicsClient(
                    current.url(),
                    loginUrl,
                    current.directoryId(),
                    current.clientId(),
                    current.clientSecret(),
                    http,
                    json,
                    Clock.systemUTC()));
        }).client();
    }

    static void requireConfigured(Tenant tenant) {
        if (isBlank(tenant.getDynamicsUrl())
                || isBlank(tenant.getDynamicsTenantId())
                || isBlank(tenant.getDynamicsClientId())
                || isBlank(tenant.getDynamicsClientSecret())) {
            throw new PipelineException(Kind.REMOTE_SYNC,
                    "Dynamics credentials are not configured for client " + tenant.getName());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
