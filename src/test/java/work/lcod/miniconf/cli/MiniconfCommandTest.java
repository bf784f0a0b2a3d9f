package work.lcod.miniconf.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class MiniconfCommandTest {
    private static final String SCHEMA = String.join("\n",
        "description: Demo program",
        "options:",
        "  - key: numOpt",
        "    shortflag: n",
        "    description: A number value",
        "    default: 3.14",
        "  - key: strOpt",
        "    shortflag: s",
        "    description: A string value",
        "    required: true",
        "");

    @Test
    void printsResolvedValuesAsJson() throws Exception {
        Path schema = writeSchema();
        var run = execute("--schema", schema.toString(), "--json", "--", "-n", "-2.5", "--strOpt", "hi");

        assertEquals(0, run.exitCode());
        assertTrue(run.out().contains("\"numOpt\" : -2.5"), run.out());
        assertTrue(run.out().contains("\"strOpt\" : \"hi\""), run.out());
    }

    @Test
    void failsWhenRequiredOptionIsMissing() throws Exception {
        Path schema = writeSchema();
        var run = execute("--schema", schema.toString(), "--json", "--", "-n", "1");

        assertEquals(1, run.exitCode());
        assertTrue(run.out().contains("\"status\" : \"failure\""), run.out());
        assertTrue(run.out().contains("\"subject\" : \"strOpt\""), run.out());
    }

    @Test
    void rendersUsageForTheResolvedSchema() throws Exception {
        Path schema = writeSchema();
        var run = execute("--schema", schema.toString(), "--", "--help");

        assertEquals(0, run.exitCode());
        assertTrue(run.out().contains("Demo program"), run.out());
        assertTrue(run.out().contains("--numOpt"), run.out());
        assertTrue(run.out().contains("(required)"), run.out());
    }

    @Test
    void exportsResolvedValues() throws Exception {
        Path schema = writeSchema();
        Path export = schema.getParent().resolve("out.settings");
        var run = execute("--schema", schema.toString(), "--export", export.toString(), "--format", "csv",
            "--", "--strOpt", "value");

        assertEquals(0, run.exitCode());
        assertTrue(Files.readAllLines(export).contains("strOpt,\"value\""));
    }

    @Test
    void reportsBadLogLevelBriefly() throws Exception {
        Path schema = writeSchema();
        var run = execute("--schema", schema.toString(), "--log-level", "chatty");

        assertEquals(1, run.exitCode());
        assertTrue(run.err().contains("Unsupported log level: chatty"), run.err());
    }

    @Test
    void reportsUnreadableSchemaAsDocumentError() throws Exception {
        Path missing = Files.createTempDirectory("miniconf-cli").resolve("missing.yaml");
        var run = execute("--schema", missing.toString());

        assertEquals(1, run.exitCode());
        assertTrue(run.err().contains("document error: Unable to read option schema"), run.err());
    }

    private static Path writeSchema() throws Exception {
        Path dir = Files.createTempDirectory("miniconf-cli");
        Path schema = dir.resolve("options.yaml");
        Files.writeString(schema, SCHEMA);
        return schema;
    }

    private static Run execute(String... args) {
        var out = new StringWriter();
        var err = new StringWriter();
        CommandLine cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        int exitCode = cmd.execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    private record Run(int exitCode, String out, String err) {}
}
