package work.lcod.miniconf.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.miniconf.api.Value;
import work.lcod.miniconf.document.DocumentTree;

/**
 * Flat key to value map produced by a resolution. Entries remember whether their key was declared
 * in the registry; undeclared ("stray") entries come from unknown flags or document keys.
 */
public final class ResolvedOptions {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    void put(String key, Value value, boolean declared) {
        entries.put(key, new Entry(value.copy(), declared));
    }

    void remove(String key) {
        entries.remove(key);
    }

    /**
     * Returns a copy of the value, or an empty value when the key is absent.
     */
    public Value get(String key) {
        Entry entry = entries.get(key);
        return entry == null ? Value.unknown() : entry.value().copy();
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public boolean isDeclared(String key) {
        Entry entry = entries.get(key);
        return entry != null && entry.declared();
    }

    public List<String> keys() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    public List<String> strayKeys() {
        List<String> stray = new ArrayList<>();
        for (var entry : entries.entrySet()) {
            if (!entry.getValue().declared()) {
                stray.add(entry.getKey());
            }
        }
        return Collections.unmodifiableList(stray);
    }

    public Map<String, Value> values() {
        Map<String, Value> copy = new LinkedHashMap<>();
        for (var entry : entries.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().value().copy());
        }
        return copy;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public DocumentTree toDocument() {
        return DocumentTree.unflatten(values());
    }

    private record Entry(Value value, boolean declared) {}
}
