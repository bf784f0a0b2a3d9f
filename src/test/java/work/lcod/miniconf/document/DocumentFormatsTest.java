package work.lcod.miniconf.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.miniconf.api.DataType;
import work.lcod.miniconf.api.Value;

class DocumentFormatsTest {
    @Test
    void dispatchesOnExtension() {
        assertEquals("json", DocumentFormats.forPath(Path.of("settings.json")).name());
        assertEquals("yaml", DocumentFormats.forPath(Path.of("settings.YML")).name());
        assertEquals("toml", DocumentFormats.forPath(Path.of("settings.toml")).name());
        assertEquals("csv", DocumentFormats.forPath(Path.of("settings.txt")).name());
        assertSame(DocumentFormats.defaultFormat(), DocumentFormats.forPath(Path.of("settings")));
        assertSame(DocumentFormats.defaultFormat(), DocumentFormats.forPath(Path.of("settings.conf")));
    }

    @Test
    void findsFormatsByName() {
        assertEquals("yaml", DocumentFormats.forName("YAML").orElseThrow().name());
        assertEquals("yaml", DocumentFormats.forName("yml").orElseThrow().name());
        assertTrue(DocumentFormats.forName("xml").isEmpty());
    }

    @Test
    void readsTypedJsonScalars() {
        var tree = JacksonDocumentFormat.json().read(
            "{\"numOpt\": 2.0, \"intOpt\": 5, \"boolOpt\": true, \"part1\": {\"value1\": \"x\"}}");
        var flat = tree.flatten();
        assertEquals(DataType.NUMBER, flat.get("numOpt").type());
        assertEquals(5, flat.get("intOpt").getInt());
        assertTrue(flat.get("boolOpt").getBoolean());
        assertEquals("x", flat.get("part1.value1").getText());
    }

    @Test
    void skipsArraysAndNulls() {
        var tree = JacksonDocumentFormat.json().read("{\"list\": [1, 2], \"nested\": {\"gone\": null, \"kept\": 1}}");
        assertEquals(List.of("list", "nested.gone"), tree.ignoredPaths());
        assertEquals(List.of("nested.kept"), List.copyOf(tree.flatten().keySet()));
    }

    @Test
    void rejectsMalformedJson() {
        assertThrows(DocumentException.class, () -> JacksonDocumentFormat.json().read("{ not json"));
        assertThrows(DocumentException.class, () -> JacksonDocumentFormat.json().read("[1, 2]"));
    }

    @Test
    void readsYaml() {
        var flat = JacksonDocumentFormat.yaml().read("part2:\n  subpart1:\n    value2: hello\n  value1: 2.1\n").flatten();
        assertEquals("hello", flat.get("part2.subpart1.value2").getText());
        assertEquals(2.1, flat.get("part2.value1").getNumber());
    }

    @Test
    void readsToml() {
        var tree = new TomlDocumentFormat().read("numOpt = 2.5\nports = [1, 2]\n[part1]\nvalue1 = \"abc\"\ncount = 3\n");
        var flat = tree.flatten();
        assertEquals(2.5, flat.get("numOpt").getNumber());
        assertEquals("abc", flat.get("part1.value1").getText());
        assertEquals(3, flat.get("part1.count").getInt());
        assertEquals(List.of("ports"), tree.ignoredPaths());
        assertThrows(DocumentException.class, () -> new TomlDocumentFormat().write(tree));
    }

    @Test
    void readsFlatKeyValueLines() {
        var tree = new CsvDocumentFormat().read("# exported settings\nnumOpt,3.14\nintOpt,122\nboolOpt,false\npart1.value1,\"hello, world\"\nbroken\n");
        var flat = tree.flatten();
        assertEquals(3.14, flat.get("numOpt").getNumber());
        assertEquals(122, flat.get("intOpt").getInt());
        assertFalse(flat.get("boolOpt").getBoolean());
        assertEquals("hello, world", flat.get("part1.value1").getText());
        assertEquals(List.of("broken"), tree.ignoredPaths());
    }

    @Test
    void quotedFlatValuesStayText() {
        Map<String, Value> flat = new LinkedHashMap<>();
        flat.put("ver", Value.of("1.50"));
        flat.put("code", Value.of("007"));
        flat.put("flag", Value.of("true"));
        flat.put("ratio", Value.of(2.0));
        var format = new CsvDocumentFormat();

        String text = format.write(DocumentTree.unflatten(flat));
        assertEquals("ver,\"1.50\"\ncode,\"007\"\nflag,\"true\"\nratio,2.0\n", text);

        var read = format.read("# exported\n\n" + text).flatten();
        assertEquals("1.50", read.get("ver").getText());
        assertEquals("007", read.get("code").getText());
        assertEquals("true", read.get("flag").getText());
        assertEquals(2.0, read.get("ratio").getNumber());
    }

    @Test
    void writesAndReadsBackEveryWritableFormat() throws Exception {
        Map<String, Value> flat = new LinkedHashMap<>();
        flat.put("numOpt", Value.of(3.5));
        flat.put("intOpt", Value.of(122));
        flat.put("boolOpt", Value.of(true));
        flat.put("part2.subpart1.value1", Value.of("p2-1v1"));
        var tree = DocumentTree.unflatten(flat);
        Path dir = Files.createTempDirectory("miniconf-formats");

        for (String name : List.of("settings.json", "settings.yaml", "settings.csv")) {
            Path file = dir.resolve(name);
            DocumentFormats.write(file, tree);
            var read = DocumentFormats.read(file).flatten();
            assertEquals(flat.keySet(), read.keySet(), name);
            assertEquals(3.5, read.get("numOpt").getNumber(), name);
            assertEquals(122, read.get("intOpt").getInt(), name);
            assertTrue(read.get("boolOpt").getBoolean(), name);
            assertEquals("p2-1v1", read.get("part2.subpart1.value1").getText(), name);
        }
    }

    @Test
    void writesNestedJsonWithQuotedText() {
        var tree = DocumentTree.unflatten(Map.of("part1.value1", Value.of("p1v1")));
        String json = JacksonDocumentFormat.json().write(tree);
        assertTrue(json.contains("\"part1\""));
        assertTrue(json.contains("\"value1\" : \"p1v1\""));
    }

    @Test
    void missingFileIsADocumentError() {
        assertThrows(DocumentException.class, () -> DocumentFormats.read(Path.of("does-not-exist.json")));
    }
}
