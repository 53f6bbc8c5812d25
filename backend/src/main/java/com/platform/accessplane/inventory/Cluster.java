package com.platform.accessplane.inventory;

/**
 * Kafka cluster known to the provider.
 */
public record Cluster(
    String clusterId,
    String clusterName,
    String envId,
    String bootstrapUrl,
    String restEndpoint
) {
}
