package com.platform.accessplane.declaration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.platform.accessplane.error.ErrorCode;
import com.platform.accessplane.error.ValidationException;

import java.util.Iterator;
import java.util.Map;
import java.util.function.Function;

/**
 * Replaces {@code env::NAME} string values in a parsed document with the value of
 * environment variable {@code NAME}. Objects and arrays are walked recursively, in place.
 */
public class EnvSubstitution {
    
    public static final String ENV_PREFIX = "env::";
    
    private final Function<String, String> environment;
    
    public EnvSubstitution(Function<String, String> environment) {
        this.environment = environment;
    }
    
    public static EnvSubstitution fromSystemEnvironment() {
        return new EnvSubstitution(System::getenv);
    }
    
    public JsonNode apply(JsonNode node) {
        if (node instanceof ObjectNode objectNode) {
            Iterator<Map.Entry<String, JsonNode>> fields = objectNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual()) {
                    field.setValue(TextNode.valueOf(resolve(field.getValue().asText())));
                } else {
                    apply(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode arrayNode) {
            for (int i = 0; i < arrayNode.size(); i++) {
                JsonNode element = arrayNode.get(i);
                if (element.isTextual()) {
                    arrayNode.set(i, TextNode.valueOf(resolve(element.asText())));
                } else {
                    apply(element);
                }
            }
        }
        return node;
    }
    
    public String resolve(String value) {
        if (!value.startsWith(ENV_PREFIX)) {
            return value;
        }
        String name = value.substring(ENV_PREFIX.length()).strip();
        String resolved = environment.apply(name);
        if (resolved == null) {
            throw new ValidationException(
                ErrorCode.MISSING_ENVIRONMENT_VARIABLE, name, "Cannot find environment variable " + name);
        }
        return resolved;
    }
}
