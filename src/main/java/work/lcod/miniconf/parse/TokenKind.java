package work.lcod.miniconf.parse;

/**
 * Classification of one command-line token.
 */
public enum TokenKind {
    UNKNOWN,
    LONG_FLAG,
    SHORT_FLAG,
    VALUE
}
