package work.lcod.miniconf.api;

import java.util.Locale;

/**
 * Tag of a {@link Value}. The tag of an option's default fixes the option's declared type.
 */
public enum DataType {
    UNKNOWN,
    INT,
    NUMBER,
    BOOL,
    TEXT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
