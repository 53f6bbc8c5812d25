package com.platform.accessplane.declaration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The declared desired state: every service account the provider should hold.
 * Immutable for the duration of a run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Declaration(
    @JsonProperty("service_accounts") List<ServiceAccountDefinition> serviceAccounts
) {
    
    public Declaration {
        serviceAccounts = serviceAccounts == null ? List.of() : List.copyOf(serviceAccounts);
    }
    
    public Optional<ServiceAccountDefinition> findServiceAccount(String name) {
        return serviceAccounts.stream()
            .filter(sa -> sa.name().equals(name))
            .findFirst();
    }
    
    public Set<String> names() {
        return serviceAccounts.stream()
            .map(ServiceAccountDefinition::name)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
    
    public List<ServiceAccountDefinition> restProxyUsers() {
        return serviceAccounts.stream()
            .filter(ServiceAccountDefinition::restProxyUser)
            .toList();
    }
}
