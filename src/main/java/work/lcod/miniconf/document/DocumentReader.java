package work.lcod.miniconf.document;

import java.nio.file.Path;

/**
 * Loads the document at a path. The resolution engine only depends on this seam.
 */
@FunctionalInterface
public interface DocumentReader {
    DocumentTree read(Path path);
}
