package work.lcod.miniconf.option;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import work.lcod.miniconf.api.DataType;
import work.lcod.miniconf.document.DocumentException;

class OptionRegistryLoaderTest {
    @Test
    void loadsYamlSchema() throws Exception {
        Path dir = Files.createTempDirectory("miniconf-schema");
        Path schema = dir.resolve("options.yaml");
        Files.writeString(schema, String.join("\n",
            "description: A simple example",
            "options:",
            "  - key: numOpt",
            "    shortflag: n",
            "    description: A number value",
            "    default: 3.14",
            "  - key: intOpt",
            "    shortflag: d",
            "    default: \"122\"",
            "    type: int",
            "  - key: strOpt",
            "    shortflag: s",
            "    required: true",
            ""));

        var registry = OptionRegistryLoader.load(schema);
        assertEquals("A simple example", registry.description());
        assertEquals(3, registry.size());
        assertEquals(3.14, registry.option("numOpt").orElseThrow().defaultValue().getNumber());
        assertEquals(122, registry.option("intOpt").orElseThrow().defaultValue().getInt());
        var strOpt = registry.option("strOpt").orElseThrow();
        assertTrue(strOpt.required());
        assertEquals(DataType.UNKNOWN, strOpt.type());
        assertFalse(strOpt.hidden());
    }

    @Test
    void loadsJsonSchema() throws Exception {
        Path dir = Files.createTempDirectory("miniconf-schema");
        Path schema = dir.resolve("options.json");
        Files.writeString(schema, "{\"options\":[{\"key\":\"boolOpt\",\"shortflag\":\"b\",\"default\":false}]}");

        var registry = OptionRegistryLoader.load(schema);
        assertEquals(DataType.BOOL, registry.option("boolOpt").orElseThrow().type());
        assertEquals("b", registry.option("boolOpt").orElseThrow().shortflag());
    }

    @Test
    void rejectsDefaultsThatDoNotMatchTheType() throws Exception {
        Path dir = Files.createTempDirectory("miniconf-schema");
        Path schema = dir.resolve("options.json");
        Files.writeString(schema, "{\"options\":[{\"key\":\"n\",\"default\":\"abc\",\"type\":\"int\"}]}");

        assertThrows(DocumentException.class, () -> OptionRegistryLoader.load(schema));
    }

    @Test
    void rejectsEntriesWithoutKey() throws Exception {
        Path dir = Files.createTempDirectory("miniconf-schema");
        Path schema = dir.resolve("options.json");
        Files.writeString(schema, "{\"options\":[{\"default\":1}]}");

        assertThrows(DocumentException.class, () -> OptionRegistryLoader.load(schema));
    }
}
