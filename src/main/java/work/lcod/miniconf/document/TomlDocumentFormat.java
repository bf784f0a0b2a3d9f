package work.lcod.miniconf.document;

import java.util.ArrayList;
import java.util.List;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.miniconf.api.Value;

/**
 * Read-only TOML support through tomlj.
 */
public final class TomlDocumentFormat implements DocumentFormat {
    @Override
    public String name() {
        return "toml";
    }

    @Override
    public List<String> extensions() {
        return List.of("toml");
    }

    @Override
    public DocumentTree read(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new DocumentException("toml parse error: " + result.errors().get(0).toString());
        }
        var ignored = new ArrayList<String>();
        return new DocumentTree(convertTable(result, "", ignored), ignored);
    }

    @Override
    public String write(DocumentTree tree) {
        throw new DocumentException("Writing toml documents is not supported");
    }

    private static MapNode convertTable(TomlTable table, String prefix, List<String> ignored) {
        var map = new MapNode();
        for (String key : table.keySet()) {
            String path = prefix.isEmpty() ? key : prefix + DocumentTree.SEPARATOR + key;
            Object value = table.get(List.of(key));
            if (value instanceof TomlTable child) {
                map.put(key, convertTable(child, path, ignored));
            } else if (value == null || value instanceof TomlArray) {
                ignored.add(path);
            } else {
                map.put(key, new ScalarNode(toValue(value)));
            }
        }
        return map;
    }

    private static Value toValue(Object value) {
        if (value instanceof Long l) {
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return Value.of(l.intValue());
            }
            return Value.of(l.doubleValue());
        }
        if (value instanceof Double d) {
            return Value.of(d.doubleValue());
        }
        if (value instanceof Boolean b) {
            return Value.of(b.booleanValue());
        }
        return Value.of(value.toString());
    }
}
