package work.lcod.miniconf.option;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import work.lcod.miniconf.api.DataType;
import work.lcod.miniconf.api.Value;
import work.lcod.miniconf.document.DocumentException;
import work.lcod.miniconf.shared.ValueParser;

/**
 * Builds an {@link OptionRegistry} from a JSON or YAML schema document:
 *
 * <pre>
 * description: Demo program
 * options:
 *   - key: numOpt
 *     shortflag: n
 *     description: A number value
 *     default: 3.14
 *     required: false
 * </pre>
 */
public final class OptionRegistryLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private OptionRegistryLoader() {}

    public static OptionRegistry load(Path schemaPath) {
        String name = schemaPath.getFileName() == null ? "" : schemaPath.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
        try {
            return fromTree(mapper.readTree(Files.readString(schemaPath)));
        } catch (JsonProcessingException ex) {
            throw new DocumentException("Invalid option schema " + schemaPath + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new DocumentException("Unable to read option schema " + schemaPath, ex);
        }
    }

    public static OptionRegistry fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DocumentException("Option schema must be an object");
        }
        var registry = new OptionRegistry();
        if (root.hasNonNull("description")) {
            registry.withDescription(root.get("description").asText());
        }
        JsonNode options = root.path("options");
        if (!options.isMissingNode() && !options.isArray()) {
            throw new DocumentException("'options' must be a list");
        }
        for (JsonNode node : options) {
            registry.register(toSpec(node));
        }
        return registry;
    }

    private static OptionSpec toSpec(JsonNode node) {
        String key = node.path("key").asText("");
        if (key.isBlank()) {
            throw new DocumentException("Option entry without key: " + node);
        }
        return OptionSpec.builder(key)
            .shortflag(node.path("shortflag").asText(""))
            .description(node.path("description").asText(""))
            .defaultValue(readDefault(key, node))
            .required(node.path("required").asBoolean(false))
            .hidden(node.path("hidden").asBoolean(false))
            .build();
    }

    private static Value readDefault(String key, JsonNode node) {
        JsonNode raw = node.get("default");
        Value value = raw == null || raw.isNull() ? Value.unknown() : toValue(raw);
        if (!node.hasNonNull("type") || value.isEmpty()) {
            return value;
        }
        DataType type = parseType(key, node.get("type").asText());
        Value coerced = ValueParser.coerce(value, type);
        if (coerced.isEmpty()) {
            throw new DocumentException("Default of " + key + " is not a valid " + type.label());
        }
        return coerced;
    }

    private static DataType parseType(String key, String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "int", "integer" -> DataType.INT;
            case "number", "double", "float" -> DataType.NUMBER;
            case "bool", "boolean" -> DataType.BOOL;
            case "text", "string" -> DataType.TEXT;
            default -> throw new DocumentException("Unsupported type '" + raw + "' for option " + key);
        };
    }

    private static Value toValue(JsonNode node) {
        if (node.isInt()) {
            return Value.of(node.intValue());
        }
        if (node.isNumber()) {
            return Value.of(node.doubleValue());
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isValueNode()) {
            return Value.of(node.asText());
        }
        throw new DocumentException("Option defaults must be scalars: " + node);
    }
}
