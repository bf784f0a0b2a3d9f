package work.lcod.miniconf.shared;

import java.math.BigDecimal;
import java.util.Locale;
import work.lcod.miniconf.api.DataType;
import work.lcod.miniconf.api.Value;

/**
 * Converts command-line text and document scalars into values of a declared type.
 *
 * <p>Booleans follow a permissive policy: only {@code false} and {@code f} (any case) read as
 * {@code false}; every other text, {@code 0} and {@code no} included, reads as {@code true}.
 */
public final class ValueParser {
    private ValueParser() {}

    /**
     * Parses {@code token} as {@code type}; an unparseable token yields an empty value.
     */
    public static Value parse(String token, DataType type) {
        if (token == null) {
            return Value.unknown();
        }
        return switch (type) {
            case INT -> parseInt(token);
            case NUMBER -> parseNumber(token);
            case BOOL -> Value.of(parseBoolean(token));
            case TEXT, UNKNOWN -> Value.of(token);
        };
    }

    public static boolean parseBoolean(String token) {
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return !("false".equals(normalized) || "f".equals(normalized));
    }

    /**
     * Converts a document scalar to {@code declared}. Text scalars are re-parsed with
     * {@link #parse(String, DataType)}; an incompatible scalar yields an empty value.
     */
    public static Value coerce(Value scalar, DataType declared) {
        if (scalar == null || scalar.isEmpty()) {
            return Value.unknown();
        }
        if (declared == DataType.UNKNOWN || scalar.type() == declared) {
            return scalar.copy();
        }
        if (declared == DataType.TEXT) {
            return Value.of(plainText(scalar));
        }
        if (scalar.type() == DataType.TEXT) {
            return parse(scalar.getText(), declared);
        }
        if (declared == DataType.NUMBER && scalar.type() == DataType.INT) {
            return Value.of((double) scalar.getInt());
        }
        if (declared == DataType.INT && scalar.type() == DataType.NUMBER) {
            double number = scalar.getNumber();
            if (number == Math.rint(number) && number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return Value.of((int) number);
            }
        }
        return Value.unknown();
    }

    /**
     * Text form of a scalar that reads back as the same scalar: numbers keep every significant
     * digit and always carry a decimal point.
     */
    public static String plainText(Value scalar) {
        if (scalar.type() == DataType.NUMBER) {
            double number = scalar.getNumber();
            if (!Double.isFinite(number)) {
                return Double.toString(number);
            }
            String plain = BigDecimal.valueOf(number).toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        return scalar.asText();
    }

    private static Value parseInt(String token) {
        try {
            return Value.of(Integer.parseInt(token.trim()));
        } catch (NumberFormatException ex) {
            return Value.unknown();
        }
    }

    private static Value parseNumber(String token) {
        try {
            return Value.of(Double.parseDouble(token.trim()));
        } catch (NumberFormatException ex) {
            return Value.unknown();
        }
    }
}
