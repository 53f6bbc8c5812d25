package com.platform.accessplane.declaration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Declared service account and the clusters it needs API keys for.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceAccountDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("cluster_list") List<String> clusterList,
    @JsonProperty("rest_proxy_user") boolean restProxyUser,
    @JsonProperty("rest_proxy_access") boolean needsRestProxyAccess
) {
    
    /**
     * Cluster list entry meaning "every cluster currently known to the provider".
     */
    public static final String ALL_CLUSTERS = "FORCE_ALL_CLUSTERS";
    
    public ServiceAccountDefinition {
        clusterList = clusterList == null ? List.of() : List.copyOf(clusterList);
    }
    
    public boolean targetsAllClusters() {
        return clusterList.contains(ALL_CLUSTERS);
    }
    
    /**
     * Cluster ids this account needs keys on, expanding the wildcard against {@code knownClusterIds}.
     */
    public Set<String> resolveClusters(Set<String> knownClusterIds) {
        if (targetsAllClusters()) {
            return Set.copyOf(knownClusterIds);
        }
        return Set.copyOf(clusterList);
    }
    
    public String descriptionOrDefault() {
        if (description == null || description.isBlank()) {
            return "Account for " + name + " created by CI/CD framework";
        }
        return description;
    }
}
