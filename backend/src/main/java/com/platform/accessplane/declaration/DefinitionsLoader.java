package com.platform.accessplane.declaration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.platform.accessplane.error.ErrorCode;
import com.platform.accessplane.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Loads and validates the service account definitions file.
 */
@Slf4j
@Component
public class DefinitionsLoader {
    
    private final ObjectMapper yamlMapper;
    private final EnvSubstitution envSubstitution;
    
    public DefinitionsLoader() {
        this(EnvSubstitution.fromSystemEnvironment());
    }
    
    public DefinitionsLoader(EnvSubstitution envSubstitution) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.envSubstitution = envSubstitution;
    }
    
    public Declaration load(Path path) {
        if (!Files.isReadable(path)) {
            throw new ValidationException(
                ErrorCode.INVALID_DEFINITIONS_FILE, "definitions-file", "Cannot read definitions file " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            Declaration declaration = load(in);
            log.info("Loaded {} service account definitions from {}", declaration.serviceAccounts().size(), path);
            return declaration;
        } catch (IOException e) {
            throw new ValidationException(
                ErrorCode.INVALID_DEFINITIONS_FILE, "definitions-file", "Cannot parse definitions file " + path, e);
        }
    }
    
    public Declaration load(InputStream in) throws IOException {
        JsonNode tree = yamlMapper.readTree(in);
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            throw new ValidationException(
                ErrorCode.INVALID_DEFINITIONS_FILE, "definitions-file", "Definitions file is empty");
        }
        envSubstitution.apply(tree);
        Declaration declaration = yamlMapper.treeToValue(tree, Declaration.class);
        validate(declaration);
        return declaration;
    }
    
    /**
     * Rejects declarations the reconcilers cannot act on.
     */
    void validate(Declaration declaration) {
        Set<String> seen = new HashSet<>();
        for (ServiceAccountDefinition sa : declaration.serviceAccounts()) {
            if (sa.name() == null || sa.name().isBlank()) {
                throw ValidationException.missing("service_accounts[].name");
            }
            if (sa.name().contains("~")) {
                throw new ValidationException(ErrorCode.VALIDATION_ERROR, "service_accounts[].name",
                    "Service account name must not contain '~': " + sa.name());
            }
            if (!seen.add(sa.name())) {
                throw new ValidationException(ErrorCode.VALIDATION_ERROR, "service_accounts[].name",
                    "Duplicate service account definition: " + sa.name());
            }
        }
    }
}
