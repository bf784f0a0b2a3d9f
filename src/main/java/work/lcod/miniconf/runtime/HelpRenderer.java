package work.lcod.miniconf.runtime;

import work.lcod.miniconf.option.OptionRegistry;

/**
 * Receives the registry when the {@code help} option resolves to {@code true}.
 */
@FunctionalInterface
public interface HelpRenderer {
    HelpRenderer NONE = registry -> {};

    void render(OptionRegistry registry);
}
