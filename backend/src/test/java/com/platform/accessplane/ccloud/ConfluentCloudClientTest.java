package com.platform.accessplane.ccloud;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.platform.accessplane.config.AccessPlaneProperties;
import com.platform.accessplane.error.ProviderException;
import com.platform.accessplane.inventory.Cluster;
import com.platform.accessplane.inventory.ObservedApiKey;
import com.platform.accessplane.inventory.ObservedServiceAccount;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matching;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfluentCloudClientTest {

    private static final String SERVICE_ACCOUNTS = "/iam/v2/service-accounts";
    private static final String API_KEYS = "/iam/v2/api-keys";

    private WireMockServer wireMock;
    private ConfluentCloudClient client;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(options().dynamicPort());
        wireMock.start();

        AccessPlaneProperties properties = new AccessPlaneProperties();
        properties.getCcloud().setBaseUrl(wireMock.baseUrl());
        properties.getCcloud().setApiKey("CLOUDKEY");
        properties.getCcloud().setApiSecret("cloud-secret");
        properties.getCcloud().setPageSize(2);

        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(1))
            .retryOnException(e -> e instanceof ProviderException pe && pe.isRetryable())
            .build());

        HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .build();
        client = new ConfluentCloudClient(properties, new ObjectMapper(), httpClient, retryRegistry);
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void shouldFollowPaginationWhenListingServiceAccounts() {
        wireMock.stubFor(get(urlPathEqualTo(SERVICE_ACCOUNTS))
            .withQueryParam("page_token", absent())
            .willReturn(okJson("""
                {"data": [{"id": "sa-1", "display_name": "svc-a", "description": "A"},
                          {"id": "sa-2", "display_name": "svc-b"}],
                 "metadata": {"next": "https://api.confluent.cloud/iam/v2/service-accounts?page_size=2&page_token=p2"}}
                """)));
        wireMock.stubFor(get(urlPathEqualTo(SERVICE_ACCOUNTS))
            .withQueryParam("page_token", equalTo("p2"))
            .willReturn(okJson("""
                {"data": [{"id": "sa-3", "display_name": "svc-c",
                           "metadata": {"created_at": "2026-01-01T00:00:00Z"}}],
                 "metadata": {"next": null}}
                """)));

        List<ObservedServiceAccount> accounts = client.listServiceAccounts();

        assertThat(accounts).extracting(ObservedServiceAccount::name).containsExactly("svc-a", "svc-b", "svc-c");
        assertThat(accounts.get(0).description()).isEqualTo("A");
        assertThat(accounts.get(2).createdAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        wireMock.verify(2, getRequestedFor(urlPathEqualTo(SERVICE_ACCOUNTS))
            .withQueryParam("page_size", equalTo("2"))
            .withHeader("Authorization", matching("Basic .+")));
    }

    @Test
    void shouldReturnExistingAccountInsteadOfCreatingDuplicate() {
        wireMock.stubFor(get(urlPathEqualTo(SERVICE_ACCOUNTS))
            .willReturn(okJson("""
                {"data": [{"id": "sa-1", "display_name": "svc-a"}], "metadata": {}}
                """)));

        ObservedServiceAccount account = client.createServiceAccount("svc-a", "A");

        assertThat(account.resourceId()).isEqualTo("sa-1");
        wireMock.verify(0, postRequestedFor(anyUrl()));
    }

    @Test
    void shouldCreateServiceAccount() {
        wireMock.stubFor(get(urlPathEqualTo(SERVICE_ACCOUNTS))
            .willReturn(okJson("{\"data\": [], \"metadata\": {}}")));
        wireMock.stubFor(post(urlPathEqualTo(SERVICE_ACCOUNTS))
            .willReturn(aResponse()
                .withStatus(201)
                .withHeader("Content-Type", "application/json")
                .withBody("""
                    {"id": "sa-9", "display_name": "svc-new", "description": "New account"}
                    """)));

        ObservedServiceAccount account = client.createServiceAccount("svc-new", "New account");

        assertThat(account.resourceId()).isEqualTo("sa-9");
        assertThat(account.name()).isEqualTo("svc-new");
        assertThat(account.description()).isEqualTo("New account");
        wireMock.verify(postRequestedFor(urlPathEqualTo(SERVICE_ACCOUNTS))
            .withRequestBody(matchingJsonPath("$.display_name", equalTo("svc-new")))
            .withRequestBody(matchingJsonPath("$.description", equalTo("New account"))));
    }

    @Test
    void shouldReportMissingAccountOnDelete() {
        wireMock.stubFor(get(urlPathEqualTo(SERVICE_ACCOUNTS))
            .willReturn(okJson("{\"data\": [], \"metadata\": {}}")));

        assertThat(client.deleteServiceAccount("ghost")).isFalse();
        wireMock.verify(0, deleteRequestedFor(anyUrl()));
    }

    @Test
    void shouldKeepSecretOfCreatedKeyAndFilterNonClusterKeys() {
        wireMock.stubFor(post(urlPathEqualTo(API_KEYS))
            .willReturn(aResponse()
                .withStatus(202)
                .withHeader("Content-Type", "application/json")
                .withBody("""
                    {"id": "KEY1",
                     "spec": {"secret": "s3cr3t", "owner": {"id": "sa-1"},
                              "resource": {"id": "lkc-1", "environment": {"id": "env-1"}}},
                     "metadata": {"created_at": "2026-03-01T12:00:00Z"}}
                    """)));
        wireMock.stubFor(get(urlPathEqualTo(API_KEYS))
            .willReturn(okJson("""
                {"data": [
                   {"id": "KEY1", "spec": {"owner": {"id": "sa-1"},
                                           "resource": {"id": "lkc-1", "environment": {"id": "env-1"}}},
                    "metadata": {"created_at": "2026-03-01T12:00:00Z"}},
                   {"id": "CLOUD1", "spec": {"owner": {"id": "sa-1"}, "resource": {"id": "cloud"}}}
                 ], "metadata": {}}
                """)));

        ObservedApiKey created = client.createApiKey("env-1", "lkc-1", "sa-1", "Key for svc-a");
        List<ObservedApiKey> listed = client.listApiKeys();

        assertThat(created.secretValue()).isEqualTo("s3cr3t");
        assertThat(listed).hasSize(1);
        assertThat(listed.get(0).keyId()).isEqualTo("KEY1");
        assertThat(listed.get(0).secretValue()).isEqualTo("s3cr3t");
        assertThat(listed.get(0).clusterId()).isEqualTo("lkc-1");
        wireMock.verify(postRequestedFor(urlPathEqualTo(API_KEYS))
            .withRequestBody(matchingJsonPath("$.spec.owner.id", equalTo("sa-1")))
            .withRequestBody(matchingJsonPath("$.spec.resource.id", equalTo("lkc-1")))
            .withRequestBody(matchingJsonPath("$.spec.resource.environment.id", equalTo("env-1"))));
    }

    @Test
    void shouldLeaveCreationTimeUnsetWhenProviderOmitsIt() {
        wireMock.stubFor(get(urlPathEqualTo(API_KEYS))
            .willReturn(okJson("""
                {"data": [
                   {"id": "KEY1", "spec": {"owner": {"id": "sa-1"}, "resource": {"id": "lkc-1"}}},
                   {"id": "KEY2", "spec": {"owner": {"id": "sa-1"}, "resource": {"id": "lkc-1"}},
                    "metadata": {"created_at": ""}}
                 ], "metadata": {}}
                """)));

        List<ObservedApiKey> listed = client.listApiKeys();

        assertThat(listed).extracting(ObservedApiKey::createdAt).containsOnlyNulls();
        assertThat(listed).noneMatch(ObservedApiKey::hasCreationTime);
    }

    @Test
    void shouldTreatMissingKeyAsAlreadyDeleted() {
        wireMock.stubFor(delete(urlPathEqualTo(API_KEYS + "/GONE"))
            .willReturn(aResponse().withStatus(404).withBody("{}")));
        wireMock.stubFor(delete(urlPathEqualTo(API_KEYS + "/KEY1"))
            .willReturn(aResponse().withStatus(204)));

        assertThat(client.deleteApiKey("GONE")).isFalse();
        assertThat(client.deleteApiKey("KEY1")).isTrue();
    }

    @Test
    void shouldRetryServerErrorsOnReads() {
        wireMock.stubFor(get(urlPathEqualTo(SERVICE_ACCOUNTS))
            .inScenario("flaky listing")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(503).withBody("{}"))
            .willSetStateTo("recovered"));
        wireMock.stubFor(get(urlPathEqualTo(SERVICE_ACCOUNTS))
            .inScenario("flaky listing")
            .whenScenarioStateIs("recovered")
            .willReturn(okJson("{\"data\": [{\"id\": \"sa-1\", \"display_name\": \"svc-a\"}], \"metadata\": {}}")));

        assertThat(client.listServiceAccounts()).hasSize(1);
        wireMock.verify(2, getRequestedFor(urlPathEqualTo(SERVICE_ACCOUNTS)));
    }

    @Test
    void shouldNotRetryClientErrors() {
        wireMock.stubFor(get(urlPathEqualTo(API_KEYS))
            .willReturn(aResponse().withStatus(401).withBody("{\"error\": \"unauthorized\"}")));

        assertThatThrownBy(() -> client.listApiKeys())
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("401");
        wireMock.verify(1, getRequestedFor(urlPathEqualTo(API_KEYS)));
    }

    @Test
    void shouldNotRetryCreates() {
        wireMock.stubFor(post(urlPathEqualTo(API_KEYS))
            .willReturn(aResponse().withStatus(503).withBody("{}")));

        assertThatThrownBy(() -> client.createApiKey("env-1", "lkc-1", "sa-1", "Key for svc-a"))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("503");
        wireMock.verify(1, postRequestedFor(urlPathEqualTo(API_KEYS)));
    }

    @Test
    void shouldListClustersOfEveryEnvironment() {
        wireMock.stubFor(get(urlPathEqualTo("/org/v2/environments"))
            .willReturn(okJson("""
                {"data": [{"id": "env-1"}, {"id": "env-2"}], "metadata": {}}
                """)));
        for (String env : List.of("env-1", "env-2")) {
            String id = env.equals("env-1") ? "lkc-1" : "lkc-2";
            wireMock.stubFor(get(urlPathEqualTo("/cmk/v2/clusters"))
                .withQueryParam("environment", equalTo(env))
                .willReturn(okJson("""
                    {"data": [{"id": "%s", "spec": {"display_name": "%s-cluster",
                      "kafka_bootstrap_endpoint": "SASL_SSL://%s:9092", "http_endpoint": "https://%s",
                      "environment": {"id": "%s"}}}], "metadata": {}}
                    """.formatted(id, id, id, id, env))));
        }

        List<Cluster> clusters = client.listClusters();

        assertThat(clusters).extracting(Cluster::clusterId).containsExactly("lkc-1", "lkc-2");
        assertThat(clusters.get(1).envId()).isEqualTo("env-2");
        assertThat(clusters.get(0).bootstrapUrl()).isEqualTo("SASL_SSL://lkc-1:9092");
    }
}
