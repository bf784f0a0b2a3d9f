package work.lcod.miniconf.document;

/**
 * Node of a {@link DocumentTree}: either a {@link ScalarNode} or a {@link MapNode}.
 */
public interface DocumentNode {
    boolean isScalar();
}
