package com.platform.accessplane.ccloud;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Request DTOs for the Confluent Cloud IAM API.
 */
public class CCloudModels {
    
    /**
     * Request to create a service account.
     */
    @Data
    public static class CreateServiceAccountRequest {
        @JsonProperty("display_name")
        private String displayName;
        private String description;
    }
    
    /**
     * Request to create a cluster-scoped API key.
     */
    @Data
    public static class CreateApiKeyRequest {
        private ApiKeySpec spec = new ApiKeySpec();
        
        public static CreateApiKeyRequest forCluster(String envId, String clusterId, String saId, String description) {
            CreateApiKeyRequest req = new CreateApiKeyRequest();
            req.getSpec().setDisplayName(saId + "-" + clusterId);
            req.getSpec().setDescription(description);
            req.getSpec().setOwner(new ObjectReference(saId, null));
            req.getSpec().setResource(new ObjectReference(clusterId, new ObjectReference(envId, null)));
            return req;
        }
    }
    
    @Data
    public static class ApiKeySpec {
        @JsonProperty("display_name")
        private String displayName;
        private String description;
        private ObjectReference owner;
        private ObjectReference resource;
    }
    
    /**
     * Reference to another object by id, optionally scoped to an environment.
     */
    @Data
    public static class ObjectReference {
        private String id;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private ObjectReference environment;
        
        public ObjectReference() {
        }
        
        public ObjectReference(String id, ObjectReference environment) {
            this.id = id;
            this.environment = environment;
        }
    }
}
