package work.lcod.miniconf.api;

import java.util.Locale;

/**
 * Single-slot dynamic container holding nothing, an int, a double, a boolean or a text.
 *
 * <p>A {@code Value} owns its payload: {@link #copy()} hands out an independent container,
 * {@link #take()} moves the payload out and leaves this container empty. Typed getters refuse to
 * read a payload of another tag and throw {@link ValueTypeException}.
 */
public final class Value {
    private DataType type;
    private Object payload;

    private Value(DataType type, Object payload) {
        this.type = type;
        this.payload = payload;
    }

    public static Value unknown() {
        return new Value(DataType.UNKNOWN, null);
    }

    public static Value of(int value) {
        return new Value(DataType.INT, value);
    }

    public static Value of(double value) {
        return new Value(DataType.NUMBER, value);
    }

    public static Value of(boolean value) {
        return new Value(DataType.BOOL, value);
    }

    public static Value of(String value) {
        return value == null ? unknown() : new Value(DataType.TEXT, value);
    }

    /**
     * Wraps a boxed scalar as produced by the document readers; anything else yields an empty value.
     */
    public static Value ofObject(Object value) {
        if (value instanceof Integer i) {
            return of(i.intValue());
        }
        if (value instanceof Double d) {
            return of(d.doubleValue());
        }
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (value instanceof String s) {
            return of(s);
        }
        return unknown();
    }

    public Value set(int value) {
        return assign(DataType.INT, value);
    }

    public Value set(double value) {
        return assign(DataType.NUMBER, value);
    }

    public Value set(boolean value) {
        return assign(DataType.BOOL, value);
    }

    public Value set(String value) {
        return value == null ? clear() : assign(DataType.TEXT, value);
    }

    public Value set(Value other) {
        if (other == this) {
            return this;
        }
        return assign(other.type, other.payload);
    }

    public Value clear() {
        return assign(DataType.UNKNOWN, null);
    }

    public Value copy() {
        return new Value(type, payload);
    }

    /**
     * Moves the payload into a new container; this one is left {@link DataType#UNKNOWN}.
     */
    public Value take() {
        var moved = new Value(type, payload);
        clear();
        return moved;
    }

    public DataType type() {
        return type;
    }

    public boolean isEmpty() {
        return type == DataType.UNKNOWN || payload == null;
    }

    public int getInt() {
        require(DataType.INT);
        return (Integer) payload;
    }

    public double getNumber() {
        require(DataType.NUMBER);
        return (Double) payload;
    }

    public boolean getBoolean() {
        require(DataType.BOOL);
        return (Boolean) payload;
    }

    public String getText() {
        require(DataType.TEXT);
        return (String) payload;
    }

    /**
     * Boxed payload for serializers, {@code null} when empty.
     */
    public Object toJavaObject() {
        return payload;
    }

    /**
     * Canonical scalar rendering; text is double-quoted.
     */
    public String print() {
        if (type == DataType.TEXT) {
            return "\"" + payload + "\"";
        }
        return asText();
    }

    /**
     * Same as {@link #print()} without quoting text.
     */
    public String asText() {
        if (isEmpty()) {
            return "";
        }
        return switch (type) {
            case INT -> Integer.toString((Integer) payload);
            case NUMBER -> String.format(Locale.ROOT, "%f", (Double) payload);
            case BOOL -> ((Boolean) payload) ? "true" : "false";
            case TEXT -> (String) payload;
            case UNKNOWN -> "";
        };
    }

    public String printType() {
        return type.label();
    }

    @Override
    public String toString() {
        return printType() + ":" + print();
    }

    private Value assign(DataType newType, Object newPayload) {
        this.type = newType;
        this.payload = newPayload;
        return this;
    }

    private void require(DataType expected) {
        if (type != expected || payload == null) {
            throw new ValueTypeException(expected, type);
        }
    }
}
