package com.platform.accessplane.secretstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.accessplane.config.AccessPlaneProperties;
import com.platform.accessplane.effector.SecretStoreEffector;
import com.platform.accessplane.error.ErrorCode;
import com.platform.accessplane.error.ProviderException;
import com.platform.accessplane.inventory.Cluster;
import com.platform.accessplane.inventory.ObservedApiKey;
import com.platform.accessplane.inventory.ObservedServiceAccount;
import com.platform.accessplane.inventory.SecretInventory;
import com.platform.accessplane.inventory.StoredSecret;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Secret store persisted as one JSON document. Holds the metadata of each secret plus its
 * credential contents, and rewrites the whole document after every change.
 *
 * Slot secrets hold {@code api_key}, {@code api_secret}, {@code bootstrap_url}, {@code sa_id} and
 * {@code cluster_id}. Rest proxy aggregates map every merged key id to its secret.
 *
 * Without a configured file the store only lives as long as the process; the configuration
 * validator refuses to apply changes in that mode.
 */
@Slf4j
@Component
public class FileSecretStore implements SecretInventory, SecretStoreEffector {

    static final String API_KEY = "api_key";
    static final String API_SECRET = "api_secret";

    private final String secretPrefix;
    private final ObjectMapper objectMapper;
    private final Path storeFile;
    private final Map<String, StoredSecret> secrets = new TreeMap<>();
    private final Map<String, Map<String, String>> contents = new TreeMap<>();

    public FileSecretStore(AccessPlaneProperties properties, ObjectMapper objectMapper) {
        this.secretPrefix = properties.getSecretStore().getSecretPrefix();
        this.objectMapper = objectMapper;
        String file = properties.getSecretStore().getFile();
        this.storeFile = file == null || file.isBlank() ? null : Path.of(file);
        load();
    }

    public boolean isPersistent() {
        return storeFile != null;
    }

    @Override
    public synchronized List<StoredSecret> listSecrets() {
        return new ArrayList<>(secrets.values());
    }

    public synchronized Optional<StoredSecret> getSecret(String secretName) {
        return Optional.ofNullable(secrets.get(secretName));
    }

    public synchronized Map<String, String> getSecretContents(String secretName) {
        Map<String, String> stored = contents.get(secretName);
        if (stored == null) {
            throw new ProviderException(ErrorCode.SECRET_NOT_FOUND, "secret-store", 404,
                "Secret not found: " + secretName);
        }
        return Map.copyOf(stored);
    }

    /**
     * Places a secret as-is, for seeding a store that was populated outside this process.
     */
    public synchronized void put(StoredSecret secret, Map<String, String> secretContents) {
        secrets.put(secret.secretName(), secret);
        contents.put(secret.secretName(), new LinkedHashMap<>(secretContents));
        save();
    }

    @Override
    public synchronized StoredSecret upsertSecret(ObservedApiKey apiKey, ObservedServiceAccount serviceAccount,
                                                  Cluster cluster, boolean restProxyAccess) {
        if (!apiKey.hasSecret()) {
            throw new ProviderException(ErrorCode.API_KEY_SECRET_UNAVAILABLE, "secret-store", -1,
                "API key " + apiKey.keyId() + " carries no secret value");
        }
        String secretName = secretName(serviceAccount.name(), cluster.clusterId());
        boolean exists = secrets.containsKey(secretName);

        Map<String, String> values = new LinkedHashMap<>();
        values.put(API_KEY, apiKey.keyId());
        values.put(API_SECRET, apiKey.secretValue());
        values.put("bootstrap_url", cluster.bootstrapUrl() != null ? cluster.bootstrapUrl() : "");
        values.put("sa_id", serviceAccount.resourceId());
        values.put("cluster_id", cluster.clusterId());

        StoredSecret secret = new StoredSecret(
            secretName,
            serviceAccount.name(),
            serviceAccount.resourceId(),
            cluster.clusterId(),
            apiKey.keyId(),
            restProxyAccess,
            restProxyAccess,
            false
        );
        secrets.put(secretName, secret);
        contents.put(secretName, values);
        save();
        log.info("{} secret {} with API key {}", exists ? "Updated" : "Created", secretName, apiKey.keyId());
        return secret;
    }

    @Override
    public synchronized StoredSecret tagSecret(String secretName, Map<String, String> tags) {
        StoredSecret existing = secrets.get(secretName);
        if (existing == null) {
            throw new ProviderException(ErrorCode.SECRET_NOT_FOUND, "secret-store", 404,
                "Cannot tag missing secret " + secretName);
        }
        boolean access = Boolean.parseBoolean(
            tags.getOrDefault(TAG_REST_PROXY_ACCESS, String.valueOf(existing.restProxyAccess())));
        boolean syncNeeded = Boolean.parseBoolean(
            tags.getOrDefault(TAG_SYNC_NEEDED_FOR_RP, String.valueOf(existing.restProxySyncNeeded())));
        StoredSecret tagged = existing.withRestProxyTags(access, syncNeeded);
        secrets.put(secretName, tagged);
        save();
        log.info("Tagged secret {} with {}", secretName, tags);
        return tagged;
    }

    @Override
    public synchronized StoredSecret upsertRestProxySecret(String secretName, ObservedServiceAccount restProxyUser,
                                                           Cluster cluster, List<ObservedApiKey> newApiKeys,
                                                           List<StoredSecret> syncedSecrets, boolean isNew) {
        Map<String, String> values = isNew || !contents.containsKey(secretName)
            ? new LinkedHashMap<>()
            : new LinkedHashMap<>(contents.get(secretName));

        for (ObservedApiKey key : newApiKeys) {
            if (!key.hasSecret()) {
                throw new ProviderException(ErrorCode.API_KEY_SECRET_UNAVAILABLE, "secret-store", -1,
                    "API key " + key.keyId() + " carries no secret value");
            }
            values.put(key.keyId(), key.secretValue());
        }
        for (StoredSecret synced : syncedSecrets) {
            Map<String, String> slot = contents.get(synced.secretName());
            if (slot == null) {
                throw new ProviderException(ErrorCode.SECRET_NOT_FOUND, "secret-store", 404,
                    "Secret not found: " + synced.secretName());
            }
            values.put(slot.get(API_KEY), slot.get(API_SECRET));
        }

        StoredSecret aggregate = new StoredSecret(
            secretName,
            restProxyUser.name(),
            restProxyUser.resourceId(),
            cluster.clusterId(),
            null,
            false,
            false,
            true
        );
        secrets.put(secretName, aggregate);
        contents.put(secretName, values);

        for (StoredSecret synced : syncedSecrets) {
            secrets.computeIfPresent(synced.secretName(),
                (name, current) -> current.withRestProxyTags(current.restProxyAccess(), false));
        }
        save();
        log.info("{} rest proxy secret {} with {} new keys and {} synced secrets",
            isNew ? "Created" : "Updated", secretName, newApiKeys.size(), syncedSecrets.size());
        return aggregate;
    }

    private String secretName(String saName, String clusterId) {
        return secretPrefix + saName + "/" + clusterId;
    }

    private void load() {
        if (storeFile == null) {
            log.warn("No secret store file configured, secrets are kept in memory only");
            return;
        }
        if (!Files.exists(storeFile)) {
            log.info("Secret store file {} does not exist yet, starting empty", storeFile);
            return;
        }
        try {
            StoreDocument document = objectMapper.readValue(storeFile.toFile(), StoreDocument.class);
            if (document.secrets() != null) {
                for (StoreEntry entry : document.secrets()) {
                    secrets.put(entry.secret().secretName(), entry.secret());
                    contents.put(entry.secret().secretName(), new LinkedHashMap<>(entry.contents()));
                }
            }
            log.info("Loaded {} secrets from {}", secrets.size(), storeFile);
        } catch (IOException e) {
            throw new ProviderException(ErrorCode.SECRET_STORE_ERROR, "secret-store",
                "Failed to read secret store file " + storeFile, e);
        }
    }

    private void save() {
        if (storeFile == null) {
            return;
        }
        List<StoreEntry> entries = new ArrayList<>();
        secrets.forEach((name, secret) -> entries.add(new StoreEntry(secret, contents.getOrDefault(name, Map.of()))));
        try {
            Path parent = storeFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path staged = Files.createTempFile(parent, storeFile.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(staged.toFile(), new StoreDocument(entries));
            try {
                Files.move(staged, storeFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(staged, storeFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ProviderException(ErrorCode.SECRET_STORE_ERROR, "secret-store",
                "Failed to write secret store file " + storeFile, e);
        }
    }

    record StoreDocument(List<StoreEntry> secrets) {
    }

    record StoreEntry(StoredSecret secret, Map<String, String> contents) {
    }
}
