package work.lcod.miniconf.document;

import java.util.List;

/**
 * A textual document format that maps to and from {@link DocumentTree}.
 */
public interface DocumentFormat {
    String name();

    /**
     * File extensions (lower case, without the dot) served by this format.
     */
    List<String> extensions();

    DocumentTree read(String text);

    String write(DocumentTree tree);
}
