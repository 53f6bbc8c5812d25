package com.platform.accessplane.declaration;

import com.platform.accessplane.error.ErrorCode;
import com.platform.accessplane.error.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefinitionsLoaderTest {
    
    private final DefinitionsLoader loader = 
        new DefinitionsLoader(new EnvSubstitution(Map.of("REST_PROXY_DESCRIPTION", "Gateway")::get));
    
    @Test
    void shouldLoadDefinitionsWithEnvironmentSubstitution() throws IOException {
        Declaration declaration;
        try (InputStream in = getClass().getResourceAsStream("/definitions.yaml")) {
            declaration = loader.load(in);
        }
        
        assertThat(declaration.names()).containsExactly("svc-a", "svc-b", "rest-proxy");
        
        ServiceAccountDefinition svcB = declaration.findServiceAccount("svc-b").orElseThrow();
        assertThat(svcB.targetsAllClusters()).isTrue();
        assertThat(svcB.needsRestProxyAccess()).isTrue();
        assertThat(svcB.restProxyUser()).isFalse();
        
        ServiceAccountDefinition restProxy = declaration.findServiceAccount("rest-proxy").orElseThrow();
        assertThat(restProxy.description()).isEqualTo("Gateway");
        assertThat(declaration.restProxyUsers()).containsExactly(restProxy);
    }
    
    @Test
    void shouldLoadFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("definitions.yaml");
        Files.writeString(file, """
            service_accounts:
              - name: svc-a
                cluster_list: [lkc-1, lkc-2]
            """, StandardCharsets.UTF_8);
        
        Declaration declaration = loader.load(file);
        
        assertThat(declaration.serviceAccounts()).hasSize(1);
        assertThat(declaration.serviceAccounts().get(0).clusterList()).containsExactly("lkc-1", "lkc-2");
        assertThat(declaration.serviceAccounts().get(0).descriptionOrDefault())
            .isEqualTo("Account for svc-a created by CI/CD framework");
    }
    
    @Test
    void shouldRejectMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.load(dir.resolve("absent.yaml")))
            .isInstanceOf(ValidationException.class)
            .extracting(e -> ((ValidationException) e).getErrorCode())
            .isEqualTo(ErrorCode.INVALID_DEFINITIONS_FILE);
    }
    
    @Test
    void shouldRejectDuplicateNames(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("definitions.yaml");
        Files.writeString(file, """
            service_accounts:
              - name: svc-a
              - name: svc-a
            """, StandardCharsets.UTF_8);
        
        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Duplicate");
    }
    
    @Test
    void shouldRejectNamesContainingTheSlotSeparator(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("definitions.yaml");
        Files.writeString(file, """
            service_accounts:
              - name: svc~a
            """, StandardCharsets.UTF_8);
        
        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("~");
    }
    
    @Test
    void shouldRejectMissingEnvironmentVariable(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("definitions.yaml");
        Files.writeString(file, """
            service_accounts:
              - name: env::UNSET_VARIABLE
            """, StandardCharsets.UTF_8);
        
        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(ValidationException.class)
            .extracting(e -> ((ValidationException) e).getErrorCode())
            .isEqualTo(ErrorCode.MISSING_ENVIRONMENT_VARIABLE);
    }
}
