package work.lcod.miniconf.api;

/**
 * Raised when a {@link Value} is read through an accessor that disagrees with its tag.
 */
public final class ValueTypeException extends IllegalStateException {
    private final DataType expected;
    private final DataType actual;

    public ValueTypeException(DataType expected, DataType actual) {
        super("Value holds " + actual.label() + ", not " + expected.label());
        this.expected = expected;
        this.actual = actual;
    }

    public DataType expected() {
        return expected;
    }

    public DataType actual() {
        return actual;
    }
}
