package work.lcod.miniconf.cli;

import java.io.PrintWriter;
import picocli.CommandLine;
import work.lcod.miniconf.api.Value;
import work.lcod.miniconf.option.OptionRegistry;
import work.lcod.miniconf.option.OptionSpec;
import work.lcod.miniconf.runtime.HelpRenderer;
import work.lcod.miniconf.runtime.ResolvedOptions;

/**
 * Plain-text tables for the usage screen and the resolved values, laid out with picocli.
 */
final class UsageTableRenderer implements HelpRenderer {
    private static final CommandLine.Help.ColorScheme PLAIN =
        CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.OFF);

    private final PrintWriter out;

    UsageTableRenderer(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void render(OptionRegistry registry) {
        if (!registry.description().isBlank()) {
            out.println(registry.description());
            out.println();
        }
        out.println("Options:");
        var table = CommandLine.Help.TextTable.forColumnWidths(PLAIN, 28, 10, 16, 40);
        for (OptionSpec spec : registry.options()) {
            if (spec.hidden() && !OptionRegistry.HELP_KEY.equals(spec.key())) {
                continue;
            }
            table.addRowValues(
                "--" + spec.key(),
                spec.hasShortflag() ? "-" + spec.shortflag() : "",
                spec.required() && spec.defaultValue().isEmpty() ? "(required)" : spec.defaultValue().print(),
                spec.description()
            );
        }
        out.print(table);
        out.flush();
    }

    void renderValues(ResolvedOptions options) {
        var table = CommandLine.Help.TextTable.forColumnWidths(PLAIN, 28, 8, 32, 10);
        for (String key : options.keys()) {
            Value value = options.get(key);
            table.addRowValues(key, value.printType(), value.print(), options.isDeclared(key) ? "" : "(stray)");
        }
        out.print(table);
        out.flush();
    }
}
