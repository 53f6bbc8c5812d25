package com.platform.accessplane.task;

/**
 * Type of resource a task targets.
 */
public enum ObjectType {
    SERVICE_ACCOUNT("service-account"),
    API_KEY("api-key"),
    SECRET("secret"),
    REST_PROXY_USER("rest-proxy-user");
    
    private final String label;
    
    ObjectType(String label) {
        this.label = label;
    }
    
    public String label() {
        return label;
    }
}
