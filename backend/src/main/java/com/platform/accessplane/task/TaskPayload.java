package com.platform.accessplane.task;

import java.util.List;

/**
 * Typed task payload. Each variant belongs to exactly one object type and carries a fixed
 * set of fields; effector results are merged back by building a new variant instance.
 */
public sealed interface TaskPayload {
    
    ObjectType objectType();
    
    /**
     * Service account create/delete. {@code saId} is known for deletes and after a create succeeds.
     */
    record ServiceAccountPayload(String saName, String description, String saId) implements TaskPayload {
        
        public static ServiceAccountPayload forCreate(String saName, String description) {
            return new ServiceAccountPayload(saName, description, null);
        }
        
        public ServiceAccountPayload withSaId(String newSaId) {
            return new ServiceAccountPayload(saName, description, newSaId);
        }
        
        @Override
        public ObjectType objectType() {
            return ObjectType.SERVICE_ACCOUNT;
        }
    }
    
    /**
     * API key slot. {@code apiKeyId} is set for deletes and after a create succeeds.
     */
    record ApiKeyPayload(String saName, String clusterId, String envId, String apiKeyId) implements TaskPayload {
        
        public ApiKeyPayload withApiKeyId(String newApiKeyId) {
            return new ApiKeyPayload(saName, clusterId, envId, newApiKeyId);
        }
        
        @Override
        public ObjectType objectType() {
            return ObjectType.API_KEY;
        }
    }
    
    /**
     * Secret-store entry for one API key slot.
     */
    record SecretPayload(
        String saName,
        String clusterId,
        String envId,
        boolean needsRestProxyAccess,
        boolean restProxyUser,
        String secretName
    ) implements TaskPayload {
        
        public SecretPayload withSecretName(String newSecretName) {
            return new SecretPayload(saName, clusterId, envId, needsRestProxyAccess, restProxyUser, newSecretName);
        }
        
        @Override
        public ObjectType objectType() {
            return ObjectType.SECRET;
        }
    }
    
    /**
     * Rest proxy access tag update on an existing secret.
     */
    record SecretTagPayload(String secretName, String saName, String clusterId, boolean restProxyAccess)
        implements TaskPayload {
        
        @Override
        public ObjectType objectType() {
            return ObjectType.SECRET;
        }
    }
    
    /**
     * Rest proxy aggregate secret for one rest proxy user on one cluster.
     */
    record RestProxyPayload(
        String saName,
        String clusterId,
        String restProxySecretName,
        List<String> newApiKeyIds,
        List<String> syncedSecretNames
    ) implements TaskPayload {
        
        public RestProxyPayload {
            newApiKeyIds = List.copyOf(newApiKeyIds);
            syncedSecretNames = List.copyOf(syncedSecretNames);
        }
        
        @Override
        public ObjectType objectType() {
            return ObjectType.REST_PROXY_USER;
        }
    }
}
