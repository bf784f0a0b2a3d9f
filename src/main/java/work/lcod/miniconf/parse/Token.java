package work.lcod.miniconf.parse;

import java.util.Objects;

/**
 * A classified token. {@code key} is the flag name without its dashes for flags, and the raw text
 * for values.
 */
public record Token(TokenKind kind, String raw, String key) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        raw = raw == null ? "" : raw;
        key = key == null ? "" : key;
    }

    public boolean isFlag() {
        return kind == TokenKind.LONG_FLAG || kind == TokenKind.SHORT_FLAG;
    }
}
