package work.lcod.miniconf.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.ArrayList;
import java.util.List;
import work.lcod.miniconf.api.Value;

/**
 * JSON and YAML documents through Jackson's tree model.
 */
public final class JacksonDocumentFormat implements DocumentFormat {
    private static final JacksonDocumentFormat JSON =
        new JacksonDocumentFormat("json", List.of("json"), new ObjectMapper());
    private static final JacksonDocumentFormat YAML =
        new JacksonDocumentFormat("yaml", List.of("yaml", "yml"), new ObjectMapper(new YAMLFactory()));

    private final String name;
    private final List<String> extensions;
    private final ObjectMapper mapper;

    private JacksonDocumentFormat(String name, List<String> extensions, ObjectMapper mapper) {
        this.name = name;
        this.extensions = extensions;
        this.mapper = mapper;
    }

    public static JacksonDocumentFormat json() {
        return JSON;
    }

    public static JacksonDocumentFormat yaml() {
        return YAML;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> extensions() {
        return extensions;
    }

    @Override
    public DocumentTree read(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new DocumentException(name + " parse error: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return DocumentTree.empty();
        }
        if (!root.isObject()) {
            throw new DocumentException(name + " document must be an object at the top level");
        }
        var ignored = new ArrayList<String>();
        return new DocumentTree(toMapNode(root, "", ignored), ignored);
    }

    @Override
    public String write(DocumentTree tree) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toObjectNode(tree.root()));
        } catch (JsonProcessingException ex) {
            throw new DocumentException("Unable to write " + name + " document: " + ex.getOriginalMessage(), ex);
        }
    }

    private MapNode toMapNode(JsonNode node, String prefix, List<String> ignored) {
        var map = new MapNode();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            String path = prefix.isEmpty() ? entry.getKey() : prefix + DocumentTree.SEPARATOR + entry.getKey();
            JsonNode child = entry.getValue();
            if (child.isObject()) {
                map.put(entry.getKey(), toMapNode(child, path, ignored));
            } else if (child.isValueNode() && !child.isNull()) {
                map.put(entry.getKey(), new ScalarNode(toValue(child)));
            } else {
                ignored.add(path);
            }
        }
        return map;
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
        return Value.of(node.asText());
    }

    private ObjectNode toObjectNode(MapNode map) {
        ObjectNode node = mapper.createObjectNode();
        for (var entry : map.children().entrySet()) {
            if (entry.getValue() instanceof MapNode child) {
                node.set(entry.getKey(), toObjectNode(child));
            } else if (entry.getValue() instanceof ScalarNode scalar) {
                putScalar(node, entry.getKey(), scalar.value());
            }
        }
        return node;
    }

    private static void putScalar(ObjectNode node, String key, Value value) {
        switch (value.type()) {
            case INT -> node.put(key, value.getInt());
            case NUMBER -> node.put(key, value.getNumber());
            case BOOL -> node.put(key, value.getBoolean());
            case TEXT -> node.put(key, value.getText());
            case UNKNOWN -> node.putNull(key);
        }
    }
}
