package com.platform.accessplane.ccloud;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.accessplane.ccloud.CCloudModels.CreateApiKeyRequest;
import com.platform.accessplane.ccloud.CCloudModels.CreateServiceAccountRequest;
import com.platform.accessplane.config.AccessPlaneProperties;
import com.platform.accessplane.effector.ProviderEffector;
import com.platform.accessplane.error.ErrorCode;
import com.platform.accessplane.error.ProviderException;
import com.platform.accessplane.inventory.Cluster;
import com.platform.accessplane.inventory.ObservedApiKey;
import com.platform.accessplane.inventory.ObservedServiceAccount;
import com.platform.accessplane.inventory.ProviderInventory;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Client for the Confluent Cloud REST API: service accounts, API keys and Kafka clusters.
 * 
 * List calls follow {@code metadata.next} until every page is read. Secrets of keys created
 * by this client are kept in memory and attached to the keys on later list calls, since the
 * API never returns them again.
 */
@Slf4j
@Component
public class ConfluentCloudClient implements ProviderInventory, ProviderEffector {
    
    static final String SERVICE_ACCOUNTS_PATH = "/iam/v2/service-accounts";
    static final String API_KEYS_PATH = "/iam/v2/api-keys";
    static final String ENVIRONMENTS_PATH = "/org/v2/environments";
    static final String CLUSTERS_PATH = "/cmk/v2/clusters";
    
    private static final String CLUSTER_ID_PREFIX = "lkc-";
    
    private final AccessPlaneProperties.Ccloud config;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Retry retry;
    
    // Secrets of keys created in this process, by key id
    private final Map<String, String> capturedSecrets = new ConcurrentHashMap<>();
    
    public ConfluentCloudClient(
            AccessPlaneProperties properties,
            ObjectMapper objectMapper,
            HttpClient ccloudHttpClient,
            RetryRegistry ccloudRetryRegistry) {
        this.config = properties.getCcloud();
        this.objectMapper = objectMapper;
        this.httpClient = ccloudHttpClient;
        this.retry = ccloudRetryRegistry.retry("ccloud");
        this.retry.getEventPublisher().onRetry(event -> 
            log.warn("Retrying Confluent Cloud call (attempt {}): {}", 
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }
    
    // ==================== Service Accounts ====================
    
    @Override
    public List<ObservedServiceAccount> listServiceAccounts() {
        return readAllPages(SERVICE_ACCOUNTS_PATH + "?page_size=" + config.getPageSize(), this::toServiceAccount);
    }
    
    public Optional<ObservedServiceAccount> findServiceAccount(String name) {
        return listServiceAccounts().stream()
            .filter(sa -> sa.name().equals(name))
            .findFirst();
    }
    
    @Override
    public ObservedServiceAccount createServiceAccount(String name, String description) {
        Optional<ObservedServiceAccount> existing = findServiceAccount(name);
        if (existing.isPresent()) {
            log.info("Service account {} already exists as {}", name, existing.get().resourceId());
            return existing.get();
        }
        
        CreateServiceAccountRequest req = new CreateServiceAccountRequest();
        req.setDisplayName(name);
        req.setDescription(description);
        
        HttpResponse<String> response = sendOnce(post(SERVICE_ACCOUNTS_PATH, req));
        if (response.statusCode() != 201 && response.statusCode() != 200) {
            throw ProviderException.ccloud(response.statusCode(), response.body());
        }
        ObservedServiceAccount created = toServiceAccount(readTree(response.body()));
        log.info("Created service account {} ({})", created.name(), created.resourceId());
        return created;
    }
    
    @Override
    public boolean deleteServiceAccount(String name) {
        Optional<ObservedServiceAccount> existing = findServiceAccount(name);
        if (existing.isEmpty()) {
            log.info("Did not find service account with name '{}'. Not deleting anything.", name);
            return false;
        }
        return delete(SERVICE_ACCOUNTS_PATH + "/" + existing.get().resourceId());
    }
    
    private ObservedServiceAccount toServiceAccount(JsonNode item) {
        return new ObservedServiceAccount(
            item.path("id").asText(),
            item.path("display_name").asText(),
            item.path("description").asText(""),
            timestamp(item.path("metadata").path("created_at")),
            timestamp(item.path("metadata").path("updated_at")),
            false
        );
    }
    
    // ==================== API Keys ====================
    
    @Override
    public List<ObservedApiKey> listApiKeys() {
        return readAllPages(API_KEYS_PATH + "?page_size=" + config.getPageSize(), this::toApiKey).stream()
            .filter(key -> key.clusterId() != null && key.clusterId().startsWith(CLUSTER_ID_PREFIX))
            .map(key -> Optional.ofNullable(capturedSecrets.get(key.keyId()))
                .map(key::withSecretValue)
                .orElse(key))
            .toList();
    }
    
    @Override
    public ObservedApiKey createApiKey(String envId, String clusterId, String saId, String description) {
        CreateApiKeyRequest req = CreateApiKeyRequest.forCluster(envId, clusterId, saId, description);
        HttpResponse<String> response = sendOnce(post(API_KEYS_PATH, req));
        if (response.statusCode() != 202 && response.statusCode() != 201 && response.statusCode() != 200) {
            throw ProviderException.ccloud(response.statusCode(), response.body());
        }
        JsonNode body = readTree(response.body());
        ObservedApiKey created = toApiKey(body);
        String secret = body.path("spec").path("secret").asText(null);
        if (secret == null) {
            throw new ProviderException(ErrorCode.CCLOUD_ERROR, "ccloud", response.statusCode(),
                "API key " + created.keyId() + " was created without a secret in the response");
        }
        capturedSecrets.put(created.keyId(), secret);
        log.info("Created API key {} for {} on cluster {}", created.keyId(), saId, clusterId);
        return created.withSecretValue(secret);
    }
    
    @Override
    public boolean deleteApiKey(String keyId) {
        capturedSecrets.remove(keyId);
        return delete(API_KEYS_PATH + "/" + keyId);
    }
    
    private ObservedApiKey toApiKey(JsonNode item) {
        JsonNode spec = item.path("spec");
        JsonNode resource = spec.path("resource");
        return new ObservedApiKey(
            item.path("id").asText(),
            spec.path("owner").path("id").asText(null),
            resource.path("id").asText(null),
            resource.path("environment").path("id").asText(null),
            null,
            timestamp(item.path("metadata").path("created_at"))
        );
    }
    
    // ==================== Clusters ====================
    
    @Override
    public List<Cluster> listClusters() {
        List<String> envIds = readAllPages(ENVIRONMENTS_PATH + "?page_size=" + config.getPageSize(),
            item -> item.path("id").asText());
        List<Cluster> clusters = new ArrayList<>();
        for (String envId : envIds) {
            clusters.addAll(readAllPages(
                CLUSTERS_PATH + "?environment=" + URLEncoder.encode(envId, StandardCharsets.UTF_8)
                    + "&page_size=" + config.getPageSize(),
                this::toCluster));
        }
        return clusters;
    }
    
    private Cluster toCluster(JsonNode item) {
        JsonNode spec = item.path("spec");
        return new Cluster(
            item.path("id").asText(),
            spec.path("display_name").asText(""),
            spec.path("environment").path("id").asText(null),
            spec.path("kafka_bootstrap_endpoint").asText(null),
            spec.path("http_endpoint").asText(null)
        );
    }
    
    // ==================== HTTP plumbing ====================
    
    private <T> List<T> readAllPages(String firstPath, Function<JsonNode, T> mapper) {
        List<T> results = new ArrayList<>();
        URI next = uri(firstPath);
        while (next != null) {
            HttpResponse<String> response = sendWithRetry(get(next));
            if (response.statusCode() != 200) {
                throw ProviderException.ccloud(response.statusCode(), response.body());
            }
            JsonNode body = readTree(response.body());
            body.path("data").forEach(item -> results.add(mapper.apply(item)));
            String nextUrl = body.path("metadata").path("next").asText(null);
            next = nextUrl == null || nextUrl.isEmpty() ? null : resolveNext(nextUrl);
        }
        return results;
    }
    
    /**
     * Page links are absolute; only their path and query are kept so the configured base URL wins.
     */
    private URI resolveNext(String nextUrl) {
        URI link = URI.create(nextUrl);
        String pathAndQuery = link.getRawPath() + (link.getRawQuery() != null ? "?" + link.getRawQuery() : "");
        return uri(pathAndQuery);
    }
    
    private boolean delete(String path) {
        HttpRequest request = authorized(HttpRequest.newBuilder(uri(path)))
            .DELETE()
            .build();
        HttpResponse<String> response = sendWithRetry(request);
        if (response.statusCode() == 204 || response.statusCode() == 200) {
            log.info("Deleted {}", path);
            return true;
        }
        if (response.statusCode() == 404) {
            log.info("{} not found (may already be removed)", path);
            return false;
        }
        throw ProviderException.ccloud(response.statusCode(), response.body());
    }
    
    private HttpRequest get(URI uri) {
        return authorized(HttpRequest.newBuilder(uri))
            .GET()
            .build();
    }
    
    private HttpRequest post(String path, Object body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorCode.INTERNAL_ERROR, "ccloud", "Cannot serialize request", e);
        }
        return authorized(HttpRequest.newBuilder(uri(path)))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
    }
    
    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        String credentials = config.getApiKey() + ":" + config.getApiSecret();
        return builder
            .header("Authorization", "Basic " + 
                Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)))
            .header("Accept", "application/json")
            .timeout(Duration.ofMillis(config.getReadTimeoutMs()));
    }
    
    private URI uri(String pathAndQuery) {
        String base = config.getBaseUrl().endsWith("/") 
            ? config.getBaseUrl().substring(0, config.getBaseUrl().length() - 1)
            : config.getBaseUrl();
        return URI.create(base + pathAndQuery);
    }
    
    /**
     * Idempotent calls: throttling and server errors are retried.
     */
    private HttpResponse<String> sendWithRetry(HttpRequest request) {
        return retry.executeSupplier(() -> {
            HttpResponse<String> response = sendOnce(request);
            if (response.statusCode() == 429 || response.statusCode() >= 500) {
                throw ProviderException.ccloud(response.statusCode(), response.body());
            }
            return response;
        });
    }
    
    private HttpResponse<String> sendOnce(HttpRequest request) {
        try {
            log.debug("{} {}", request.method(), request.uri());
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw ProviderException.ccloudUnavailable(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.ccloudUnavailable("Interrupted", e);
        }
    }
    
    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorCode.CCLOUD_ERROR, "ccloud", "Malformed response: " + body, e);
        }
    }
    
    /**
     * @return the parsed instant, or null when the provider reported none
     */
    private static Instant timestamp(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isEmpty()) {
            return null;
        }
        return Instant.parse(node.asText());
    }
}
