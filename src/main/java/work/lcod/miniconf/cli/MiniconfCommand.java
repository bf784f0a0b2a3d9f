package work.lcod.miniconf.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.miniconf.api.EngineSettings;
import work.lcod.miniconf.api.LogLevel;
import work.lcod.miniconf.api.Miniconf;
import work.lcod.miniconf.api.ResolutionResult;
import work.lcod.miniconf.document.DocumentFormat;
import work.lcod.miniconf.document.DocumentFormats;
import work.lcod.miniconf.option.OptionRegistry;
import work.lcod.miniconf.option.OptionRegistryLoader;

/**
 * Resolves arguments against an option schema. Diagnostics go to the log (stderr), values to stdout.
 */
@CommandLine.Command(
    name = "miniconf",
    description = "Resolve declared options from defaults, a configuration file and arguments (given after '--').",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class MiniconfCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--schema"},
        required = true,
        description = "Option schema (JSON or YAML)."
    )
    private Path schema;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (info|warning|error|silent).",
        defaultValue = "warning"
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = {"-o", "--export"},
        description = "Write the resolved values to this file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path export;

    @CommandLine.Option(
        names = "--format",
        description = "Export format (json|yaml|csv); defaults to the export file extension.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String format;

    @CommandLine.Option(
        names = "--json",
        description = "Print the result as JSON instead of a table."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--no-help-option",
        description = "Do not add the reserved --help option to the schema."
    )
    private boolean noHelpOption;

    @CommandLine.Option(
        names = "--no-config-option",
        description = "Do not add the reserved --config option to the schema."
    )
    private boolean noConfigOption;

    @CommandLine.Parameters(
        paramLabel = "ARGS",
        arity = "0..*",
        description = "Arguments to resolve against the schema."
    )
    private List<String> arguments = new ArrayList<>();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        OptionRegistry registry = OptionRegistryLoader.load(schema);
        var renderer = new UsageTableRenderer(out);

        EngineSettings settings = EngineSettings.builder()
            .logLevel(LogLevel.from(logLevelRaw))
            .helpEnabled(!noHelpOption)
            .configOptionEnabled(!noConfigOption)
            .helpRenderer(renderer)
            .build();
        var conf = new Miniconf(settings).description(registry.description());
        registry.options().forEach(conf::declare);

        ResolutionResult result = conf.resolve(arguments);
        if (result.helpRequested()) {
            return 0;
        }
        if (json) {
            out.println(result.toPrettyJson());
            out.flush();
        } else {
            renderer.renderValues(result.options());
        }
        if (export != null && result.success()) {
            conf.serialize(export, exportFormat());
        }
        return result.exitCode();
    }

    private DocumentFormat exportFormat() {
        if (format == null) {
            return DocumentFormats.forPath(export);
        }
        return DocumentFormats.forName(format).orElseThrow(() ->
            new CommandLine.ParameterException(spec.commandLine(), "Unsupported export format: " + format));
    }
}
