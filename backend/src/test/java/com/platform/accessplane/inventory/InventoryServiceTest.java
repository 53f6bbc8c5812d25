package com.platform.accessplane.inventory;

import com.platform.accessplane.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static com.platform.accessplane.Fixtures.cluster;
import static com.platform.accessplane.Fixtures.key;
import static com.platform.accessplane.Fixtures.sa;
import static com.platform.accessplane.Fixtures.secret;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InventoryServiceTest {
    
    private ProviderInventory provider;
    private SecretInventory secrets;
    private InventoryService inventoryService;
    
    @BeforeEach
    void setUp() {
        provider = mock(ProviderInventory.class);
        secrets = mock(SecretInventory.class);
        inventoryService = new InventoryService(provider, secrets, new InternalAccountDetector(),
            Clock.fixed(Fixtures.NOW, ZoneOffset.UTC));
        
        when(provider.listServiceAccounts()).thenReturn(List.of(
            sa("sa-1", "svc-a"), sa("sa-2", "Connect.lcc-xyz"), sa("sa-3", "KSQL.lksqlc-abc"), sa("sa-4", "ops")));
        when(provider.listApiKeys()).thenReturn(List.of(key("KEY1", "sa-1", "lkc-1", 5)));
        when(provider.listClusters()).thenReturn(List.of(cluster("lkc-1")));
        when(secrets.listSecrets()).thenReturn(List.of(secret("svc-a", "sa-1", "lkc-1", "KEY1")));
    }
    
    @Test
    void shouldAddInternalAccountsToReturnedIgnoreSet() {
        Set<String> configured = Set.of("sa-4");
        
        ObservedState state = inventoryService.read(configured, true);
        
        assertThat(state.ignoredAccountIds()).containsExactlyInAnyOrder("sa-2", "sa-3", "sa-4");
        assertThat(state.serviceAccounts().get("sa-2").ignored()).isTrue();
        assertThat(state.serviceAccounts().get("sa-1").ignored()).isFalse();
        assertThat(configured).containsExactly("sa-4");
        assertThat(state.readAt()).isEqualTo(Fixtures.NOW);
        assertThat(state.referencedApiKeyIds()).containsExactly("KEY1");
    }
    
    @Test
    void shouldLeaveInternalAccountsAloneWhenDetectionDisabled() {
        ObservedState state = inventoryService.read(Set.of(), false);
        
        assertThat(state.ignoredAccountIds()).isEmpty();
        assertThat(state.ignoredAccountNames()).isEmpty();
    }
}
