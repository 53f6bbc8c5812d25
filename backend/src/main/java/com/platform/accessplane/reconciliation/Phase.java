package com.platform.accessplane.reconciliation;

/**
 * Reconciliation phases, in execution order.
 */
public enum Phase {
    SERVICE_ACCOUNT_CREATE("sa-create"),
    SERVICE_ACCOUNT_DELETE("sa-delete"),
    API_KEY_CREATE("api-key-create"),
    API_KEY_DELETE("api-key-delete"),
    SECRET_UPSERT("secret-upsert"),
    SECRET_TAGS("secret-tags"),
    REST_PROXY("rest-proxy");
    
    private final String label;
    
    Phase(String label) {
        this.label = label;
    }
    
    public String label() {
        return label;
    }
    
    /**
     * Phases that only run when API key management is enabled.
     */
    public boolean managesApiKeys() {
        return ordinal() >= API_KEY_CREATE.ordinal();
    }
}
