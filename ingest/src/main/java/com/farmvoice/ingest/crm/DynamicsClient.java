package com.farmvoice.ingest.crm;

import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.PipelineException.Kind;
import com.farmvoice.ingest.port.RemoteCreator;
import com.farmvoice.ingest.port.RemoteRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Creates records through the Dynamics 365 Web API for one tenant.
 *
 * Authentication is Azure AD client credentials. The access token is
 * cached and refreshed five minutes before it expires; a 401 from the
 * Web API drops the cached token and the create is tried once more with
 * a fresh one.
 */
public class DynamicsClient implements RemoteCreator {

    private static final Logger log = LoggerFactory.getLogger(DynamicsClient.class);

    static final String   API_PATH       = "/api/data/v9.2/";
    static final Duration EXPIRY_MARGIN  = Duration.ofMinutes(5);
    static final long     DEFAULT_EXPIRY = 3600;

    private static final Pattern GUID =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final String       baseUrl;
    private final String       tokenUrl;
    private final String       clientId;
    private final String       clientSecret;
    private final HttpClient   http;
    private final ObjectMapper json;
    private final Clock        clock;

    // Guarded by 'this'.
    private String  accessToken;
    private Instant tokenExpiresAt;

    public DynamicsClient(String baseUrl,
                          String loginUrl,
                          String directoryId,
                          String clientId,
                          String clientSecret,
                          HttpClient http,
                          ObjectMapper json,
                          Clock clock) {
        this.baseUrl      = stripTrailingSlash(baseUrl);
        this.tokenUrl     = stripTrailingSlash(loginUrl) + "/" + directoryId + "/oauth2/v2.0/token";
        this.clientId     = clientId;
        this.clientSecret = clientSecret;
        this.http         = http;
        this.json         = json;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // RemoteCreator
    // ------------------------------------------------------------------

    @Override
    public RemoteRecord create(String entityName, Map<String, Object> fields) {
        try {
            String body = json.writeValueAsString(fields);
            HttpResponse<String> response = post(entityName, body, accessToken());
            if (response.statusCode() == 401) {
                log.warn("Dynamics rejected the cached token, re-authenticating");
                invalidateToken();
                response = post(entityName, body, accessToken());
            }
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new PipelineException(Kind.REMOTE_SYNC,
                        "Dynamics API error %d: %s".formatted(response.statusCode(), response.body()));
            }

            String id = recordId(json, entityName, response.body(), response.headers().firstValue("OData-EntityId"))
                    .orElseThrow(() -> new PipelineException(Kind.REMOTE_SYNC,
                            "Dynamics did not return an id for the new " + entityName + " record"));
            log.info("Created {} record {}", entityName, id);
            return new RemoteRecord(id);

        } catch (PipelineException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(Kind.REMOTE_SYNC, "interrupted", e);
        } catch (Exception e) {
            throw new PipelineException(Kind.REMOTE_SYNC, e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Authentication
    // ------------------------------------------------------------------

    synchronized String accessToken() throws Exception {
        if (accessToken == null || tokenExpiresAt == null || !clock.instant().isBefore(tokenExpiresAt)) {
            authenticate();
        }
        return accessToken;
    }

    synchronized void invalidateToken() {
        accessToken    = null;
        tokenExpiresAt = null;
    }

    private void authenticate() throws Exception {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id",     clientId);
        form.put("client_secret", clientSecret);
        form.put("scope",         baseUrl + "/.default");
        form.put("grant_type",    "client_credentials");

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
                .build();

        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new PipelineException(Kind.REMOTE_SYNC,
                    "Dynamics authentication failed %d: %s".formatted(response.statusCode(), response.body()));
        }

        JsonNode token = json.readTree(response.body());
        String value = token.path("access_token").asText(null);
        if (value == null || value.isBlank()) {
            throw new PipelineException(Kind.REMOTE_SYNC, "Dynamics authentication returned no access token");
        }
        long expiresIn = token.path("expires_in").asLong(DEFAULT_EXPIRY);

        this.accessToken    = value;
        this.tokenExpiresAt = tokenExpiry(clock.instant(), expiresIn);
        log.info("Authenticated with Dynamics 365 at {}", baseUrl);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> post(String entityName, String body, String token) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + API_PATH + entityName))
                .timeout(Duration.ofSeconds(60))
                .header("Authorization",    "Bearer " + token)
                .header("Content-Type",     "application/json")
                .header("Accept",           "application/json")
                .header("OData-MaxVersion", "4.0")
                .header("OData-Version",    "4.0")
                .header("Prefer",           "return=representation")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    /** Tokens are treated as expired five minutes early. */
    static Instant tokenExpiry(Instant issuedAt, long expiresInSeconds) {
        return issuedAt.plusSeconds(expiresInSeconds).minus(EXPIRY_MARGIN);
    }

    /**
     * The new record's id, looked up in this order:
     * <ol>
     *   <li>an "id" property in the returned representation</li>
     *   <li>the entity's primary key, {@code <logical name>id}, where the
     *       logical name is the singular of the entity set
     *       ({@code bt_animals -> bt_animalid})</li>
     *   <li>the GUID inside the OData-EntityId header
     *       ({@code .../accounts(00000000-0000-0000-0000-000000000001)})</li>
     *   <li>the only GUID-valued {@code *id} property of the representation</li>
     * </ol>
     * Lookups ({@code _x_value}) and annotations ({@code @odata.*}) are never
     * taken for the primary key.
     */
    static Optional<String> recordId(ObjectMapper json, String entitySetName, String body,
                                     Optional<String> entityIdHeader) throws JsonProcessingException {
        JsonNode representation = body == null || body.isBlank() ? null : json.readTree(body);
        if (representation != null && representation.isObject()) {
            Optional<String> direct = textValue(representation, "id");
            if (direct.isPresent()) {
                return direct;
            }
            for (String logicalName : logicalNameCandidates(entitySetName)) {
                Optional<String> key = textValue(representation, logicalName + "id");
                if (key.isPresent()) {
                    return key;
                }
            }
        }

        Optional<String> fromHeader = entityIdHeader
                .filter(h -> h.contains("("))
                .map(h -> h.substring(h.lastIndexOf('(') + 1).replace(")", ""))
                .filter(s -> !s.isBlank());
        if (fromHeader.isPresent() || representation == null || !representation.isObject()) {
            return fromHeader;
        }

        List<String> guidKeys = new ArrayList<>();
        representation.fields().forEachRemaining(f -> {
            String name = f.getKey();
            if (name.endsWith("id") && !name.startsWith("_") && !name.startsWith("@")
                    && f.getValue().isTextual() && GUID.matcher(f.getValue().asText()).matches()) {
                guidKeys.add(f.getValue().asText());
            }
        });
        return guidKeys.size() == 1 ? Optional.of(guidKeys.get(0)) : Optional.empty();
    }

    /** Singular forms an entity set name may have come from, most likely first. */
    static List<String> logicalNameCandidates(String entitySetName) {
        if (entitySetName == null || entitySetName.isBlank()) {
            return List.of();
        }
        String name = entitySetName.toLowerCase(Locale.ROOT);
        Set<String> candidates = new LinkedHashSet<>();
        if (name.endsWith("ies")) {
            candidates.add(name.substring(0, name.length() - 3) + "y");
        }
        if (name.endsWith("es")) {
            candidates.add(name.substring(0, name.length() - 1));
            candidates.add(name.substring(0, name.length() - 2));
        } else if (name.endsWith("s")) {
            candidates.add(name.substring(0, name.length() - 1));
        }
        candidates.add(name);
        return List.copyOf(candidates);
    }

    private static Optional<String> textValue(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
            return Optional.of(value.asText());
        }
        return Optional.empty();
    }

    static String formEncode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                        + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
