package work.lcod.miniconf.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.miniconf.api.Value;

/**
 * Hierarchical document (nested maps, scalar leaves) with dot-path flattening.
 *
 * <p>Arrays and nulls have no place in the tree: readers skip them and report their paths through
 * {@link #ignoredPaths()}.
 */
public final class DocumentTree {
    public static final String SEPARATOR = ".";

    private final MapNode root;
    private final List<String> ignoredPaths;

    public DocumentTree(MapNode root, List<String> ignoredPaths) {
        this.root = Objects.requireNonNull(root, "root");
        this.ignoredPaths = ignoredPaths == null ? List.of() : List.copyOf(ignoredPaths);
    }

    public DocumentTree(MapNode root) {
        this(root, List.of());
    }

    public static DocumentTree empty() {
        return new DocumentTree(new MapNode());
    }

    public MapNode root() {
        return root;
    }

    public List<String> ignoredPaths() {
        return ignoredPaths;
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    public Map<String, Value> flatten() {
        Map<String, Value> flat = new LinkedHashMap<>();
        flatten(root, "", flat);
        return flat;
    }

    /**
     * Rebuilds a tree from dot-path keys, reusing intermediate maps for shared prefixes.
     *
     * @throws DocumentException on empty path segments or when a key needs a map where a scalar
     *     already sits (or the other way round)
     */
    public static DocumentTree unflatten(Map<String, Value> flat) {
        var root = new MapNode();
        for (var entry : flat.entrySet()) {
            String key = entry.getKey();
            List<String> segments = split(key);
            MapNode current = root;
            for (int i = 0; i < segments.size() - 1; i++) {
                String segment = segments.get(i);
                DocumentNode child = current.get(segment);
                if (child == null) {
                    var created = new MapNode();
                    current.put(segment, created);
                    current = created;
                } else if (child instanceof MapNode map) {
                    current = map;
                } else {
                    throw new DocumentException("Key '" + key + "' nests below the scalar at '"
                        + String.join(SEPARATOR, segments.subList(0, i + 1)) + "'");
                }
            }
            String leaf = segments.get(segments.size() - 1);
            if (current.get(leaf) instanceof MapNode) {
                throw new DocumentException("Key '" + key + "' collides with a nested section");
            }
            current.put(leaf, new ScalarNode(entry.getValue() == null ? Value.unknown() : entry.getValue()));
        }
        return new DocumentTree(root);
    }

    /**
     * Whether {@code key} is a usable dot path: non-empty, with no empty segment.
     */
    public static boolean isPath(String key) {
        return key != null && !key.isEmpty() && !key.startsWith(SEPARATOR) && !key.endsWith(SEPARATOR)
            && !key.contains(SEPARATOR + SEPARATOR);
    }

    /**
     * Whether one key names a section the other key nests below, so both cannot sit in one tree.
     */
    public static boolean overlaps(String key, String other) {
        return key.startsWith(other + SEPARATOR) || other.startsWith(key + SEPARATOR);
    }

    static List<String> split(String key) {
        if (key == null || key.isEmpty()) {
            throw new DocumentException("Document keys must not be empty");
        }
        List<String> segments = new ArrayList<>();
        int start = 0;
        int dot;
        while ((dot = key.indexOf('.', start)) >= 0) {
            segments.add(key.substring(start, dot));
            start = dot + 1;
        }
        segments.add(key.substring(start));
        if (segments.contains("")) {
            throw new DocumentException("Key '" + key + "' has an empty segment");
        }
        return Collections.unmodifiableList(segments);
    }

    private static void flatten(MapNode node, String prefix, Map<String, Value> out) {
        for (var entry : node.children().entrySet()) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + SEPARATOR + entry.getKey();
            if (entry.getValue() instanceof MapNode child) {
                flatten(child, path, out);
            } else if (entry.getValue() instanceof ScalarNode scalar) {
                out.put(path, scalar.value());
            }
        }
    }
}
