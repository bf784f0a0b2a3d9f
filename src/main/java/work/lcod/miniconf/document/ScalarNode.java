package work.lcod.miniconf.document;

import java.util.Objects;
import work.lcod.miniconf.api.Value;

/**
 * Leaf holding one typed scalar.
 */
public record ScalarNode(Value value) implements DocumentNode {
    public ScalarNode {
        Objects.requireNonNull(value, "value");
        value = value.copy();
    }

    @Override
    public Value value() {
        return value.copy();
    }

    @Override
    public boolean isScalar() {
        return true;
    }
}
