package work.lcod.miniconf.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered mapping of child keys to nodes.
 */
public final class MapNode implements DocumentNode {
    private final Map<String, DocumentNode> children = new LinkedHashMap<>();

    public MapNode put(String key, DocumentNode child) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(child, "child");
        children.put(key, child);
        return this;
    }

    public DocumentNode get(String key) {
        return children.get(key);
    }

    public Map<String, DocumentNode> children() {
        return Collections.unmodifiableMap(children);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public boolean isScalar() {
        return false;
    }
}
