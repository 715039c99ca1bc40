package strongbox.core.model.backend;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON encoding of backend configuration.
 *
 * <p>The encoded form is a flat JSON object whose values are strings, numbers,
 * booleans or nested objects. Decoding is lossy for numbers: every JSON number
 * comes back as {@link ConfigValue.Real}, so an {@link ConfigValue.Int} of 10
 * round-trips to a real 10.0.
 */
public final class ConfigValueCodec {

    private final ObjectMapper mapper;

    public ConfigValueCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Map<String, ConfigValue> config) {
        final var root = mapper.createObjectNode();
        if (config != null) {
            config.forEach((key, value) -> put(root, key, value));
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode backend config", e);
        }
    }

    public Map<String, ConfigValue> decode(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("backend config is not valid JSON", e);
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("backend config must be a JSON object");
        }
        return decodeObject(root);
    }

    private void put(ObjectNode node, String key, ConfigValue value) {
        if (value instanceof ConfigValue.Text t) {
            node.put(key, t.value());
        } else if (value instanceof ConfigValue.Int i) {
            node.put(key, i.value());
        } else if (value instanceof ConfigValue.Real r) {
            node.put(key, r.value());
        } else if (value instanceof ConfigValue.Bool b) {
            node.put(key, b.value());
        } else if (value instanceof ConfigValue.Nested n) {
            final var child = node.putObject(key);
            n.values().forEach((k, v) -> put(child, k, v));
        }
    }

    private Map<String, ConfigValue> decodeObject(JsonNode node) {
        final Map<String, ConfigValue> values = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            values.put(field.getKey(), decodeValue(field.getKey(), field.getValue()));
        }
        return values;
    }

    private ConfigValue decodeValue(String key, JsonNode node) {
        if (node.isTextual()) {
            return new ConfigValue.Text(node.textValue());
        }
        if (node.isNumber()) {
            return new ConfigValue.Real(node.doubleValue());
        }
        if (node.isBoolean()) {
            return new ConfigValue.Bool(node.booleanValue());
        }
        if (node.isObject()) {
            return new ConfigValue.Nested(decodeObject(node));
        }
        throw new IllegalArgumentException("unsupported JSON value for config key \"" + key + "\"");
    }
}
