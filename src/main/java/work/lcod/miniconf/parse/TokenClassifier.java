package work.lcod.miniconf.parse;

import java.util.regex.Pattern;

/**
 * Classifies command-line tokens into long flags, short flags and values.
 *
 * <p>A dash-prefixed token that reads fully as a decimal number is a value, so {@code -3.14}
 * can follow a flag.
 */
public final class TokenClassifier {
    private static final Pattern NUMERIC_LITERAL =
        Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private TokenClassifier() {}

    public static Token classify(String token) {
        if (token == null || token.isEmpty()) {
            return new Token(TokenKind.UNKNOWN, token, "");
        }
        if (!token.startsWith("-")) {
            return new Token(TokenKind.VALUE, token, token);
        }
        if (isNumeric(token)) {
            return new Token(TokenKind.VALUE, token, token);
        }
        if (token.startsWith("--")) {
            return new Token(TokenKind.LONG_FLAG, token, token.substring(2));
        }
        return new Token(TokenKind.SHORT_FLAG, token, token.substring(1));
    }

    static boolean isNumeric(String token) {
        return NUMERIC_LITERAL.matcher(token).matches();
    }
}
