package com.resource.naming.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resource.naming.error.ConfigurationException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses JSON rule layer documents:
 * <pre>
 * {
 *   "metadata":  {"name": "base", "priority": 0, "enabled": true},
 *   "default":   {"segments": ["slug", "region", "environment"], "max_length": 80},
 *   "resources": {"storage_account": {"max_length": 24, "require_prefix": true}}
 * }
 * </pre>
 */
public class RuleLayerParser {

    private final ObjectMapper objectMapper;

    public RuleLayerParser() {
        this(new ObjectMapper());
    }

    public RuleLayerParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param source label for error messages and priority tie-breaks, usually the file name
     * @param json   the layer document
     * @throws ConfigurationException if the document is malformed
     */
    public RuleLayer parse(String source, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Rule layer '" + source + "' is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Rule layer '" + source + "' must contain a JSON object at the top level");
        }

        JsonNode metadata = root.get("metadata");
        if (metadata == null || !metadata.isObject()) {
            throw new ConfigurationException("Rule layer '" + source + "' is missing its 'metadata' object");
        }
        JsonNode name = metadata.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw new ConfigurationException("Rule layer '" + source + "' is missing metadata.name");
        }
        JsonNode priority = metadata.get("priority");
        if (priority == null || !priority.canConvertToInt() || !priority.isIntegralNumber()) {
            throw new ConfigurationException("Rule layer '" + source + "' is missing an integer metadata.priority");
        }
        JsonNode enabled = metadata.get("enabled");
        if (enabled != null && !enabled.isBoolean()) {
            throw new ConfigurationException("Rule layer '" + source + "' has a non-boolean metadata.enabled");
        }

        RuleFragment defaultFragment = null;
        JsonNode defaultNode = root.get("default");
        if (defaultNode != null && !defaultNode.isNull()) {
            defaultFragment = parseFragment(defaultNode, source + ":default");
        }

        Map<String, RuleFragment> resources = new LinkedHashMap<>();
        JsonNode resourcesNode = root.get("resources");
        if (resourcesNode != null && !resourcesNode.isNull()) {
            if (!resourcesNode.isObject()) {
                throw new ConfigurationException("'resources' in '" + source
                        + "' must be an object mapping resource types to definitions");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = resourcesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                resources.put(entry.getKey(), parseFragment(entry.getValue(), source + ":" + entry.getKey()));
            }
        }

        return new RuleLayer(name.asText().trim(), priority.asInt(),
                enabled == null || enabled.asBoolean(), source, defaultFragment, resources);
    }

    private RuleFragment parseFragment(JsonNode node, String context) {
        if (!node.isObject()) {
            throw new ConfigurationException("Rule definition '" + context + "' must be an object");
        }
        JsonNode prefix = node.has("require_prefix") ? node.get("require_prefix") : node.get("require_sanmar_prefix");
        return new RuleFragment(
                stringList(node.get("segments"), context, "segments"),
                integer(node.get("max_length"), context),
                bool(prefix, context),
                text(node.get("name_template"), context, "name_template"),
                text(node.get("summary_template"), context, "summary_template"),
                displayFields(node.get("display"), context),
                validators(node.get("validators"), context)
        );
    }

    private static List<String> stringList(JsonNode node, String context, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new ConfigurationException("'" + field + "' in '" + context + "' must be an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new ConfigurationException("'" + field + "' in '" + context + "' must only contain non-blank strings");
            }
            values.add(item.asText().trim());
        }
        return values;
    }

    private static Integer integer(JsonNode node, String context) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ConfigurationException("'max_length' in '" + context + "' must be an integer");
        }
        return node.asInt();
    }

    private static Boolean bool(JsonNode node, String context) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isBoolean()) {
            throw new ConfigurationException("'require_prefix' in '" + context + "' must be a boolean");
        }
        return node.asBoolean();
    }

    private static String text(JsonNode node, String context, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ConfigurationException("'" + field + "' in '" + context + "' must be a string");
        }
        return node.asText();
    }

    private static List<DisplayField> displayFields(JsonNode node, String context) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new ConfigurationException("'display' in '" + context + "' must be an array");
        }
        List<DisplayField> fields = new ArrayList<>();
        for (JsonNode item : node) {
            JsonNode key = item.get("key");
            if (key == null || !key.isTextual() || key.asText().isBlank()) {
                throw new ConfigurationException("Every 'display' entry in '" + context + "' needs a key");
            }
            JsonNode optional = item.get("optional");
            fields.add(new DisplayField(
                    key.asText(),
                    item.hasNonNull("label") ? item.get("label").asText() : null,
                    item.hasNonNull("description") ? item.get("description").asText() : null,
                    optional == null || optional.asBoolean(true)));
        }
        return fields;
    }

    private static List<PayloadValidator> validators(JsonNode node, String context) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new ConfigurationException("'validators' in '" + context + "' must be an object");
        }
        List<PayloadValidator> validators = new ArrayList<>();

        JsonNode allowed = node.get("allowed_values");
        if (allowed != null && !allowed.isNull()) {
            if (!allowed.isObject()) {
                throw new ConfigurationException("'allowed_values' in '" + context + "' must be an object");
            }
            Map<String, List<String>> values = new LinkedHashMap<>();
            allowed.fields().forEachRemaining(entry ->
                    values.put(entry.getKey(), stringList(entry.getValue(), context, "allowed_values." + entry.getKey())));
            validators.add(new AllowedValuesValidator(values));
        }

        List<String> required = stringList(node.get("required"), context, "required");
        if (required != null) {
            validators.add(new RequiredFieldsValidator(required));
        }

        JsonNode requireAny = node.get("require_any");
        if (requireAny != null && !requireAny.isNull()) {
            if (!requireAny.isObject()) {
                throw new ConfigurationException("'require_any' in '" + context + "' must be an object");
            }
            Map<String, List<String>> groups = new LinkedHashMap<>();
            requireAny.fields().forEachRemaining(entry -> {
                List<String> fields = stringList(entry.getValue(), context, "require_any." + entry.getKey());
                if (fields == null || fields.isEmpty()) {
                    throw new ConfigurationException("'require_any' group '" + entry.getKey() + "' in '" + context
                            + "' must list at least one field");
                }
                groups.put(entry.getKey(), fields);
            });
            validators.add(new RequireAnyValidator(groups));
        }
        return validators;
    }
}
