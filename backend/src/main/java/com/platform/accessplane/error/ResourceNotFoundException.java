package com.platform.accessplane.error;

/**
 * Exception for resources that a task depends on but that cannot be resolved.
 */
public class ResourceNotFoundException extends AccessPlaneException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException serviceAccount(String saName) {
        return new ResourceNotFoundException(ErrorCode.SERVICE_ACCOUNT_NOT_FOUND, "Service account", saName);
    }
    
    public static ResourceNotFoundException cluster(String clusterId) {
        return new ResourceNotFoundException(ErrorCode.CLUSTER_NOT_FOUND, "Cluster", clusterId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
