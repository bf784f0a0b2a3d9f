package work.lcod.miniconf.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Extension-based dispatch over the supported document formats. Paths without a known extension
 * are treated as JSON.
 */
public final class DocumentFormats {
    private static final List<DocumentFormat> FORMATS = List.of(
        JacksonDocumentFormat.json(),
        JacksonDocumentFormat.yaml(),
        new TomlDocumentFormat(),
        new CsvDocumentFormat()
    );
    private static final Map<String, DocumentFormat> BY_EXTENSION = indexByExtension();

    private DocumentFormats() {}

    public static DocumentFormat defaultFormat() {
        return JacksonDocumentFormat.json();
    }

    public static List<DocumentFormat> all() {
        return FORMATS;
    }

    public static DocumentFormat forPath(Path path) {
        return extension(path).map(BY_EXTENSION::get).orElse(defaultFormat());
    }

    public static Optional<DocumentFormat> forName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DocumentFormat format : FORMATS) {
            if (format.name().equals(normalized) || format.extensions().contains(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static DocumentTree read(Path path) {
        return read(path, forPath(path));
    }

    public static DocumentTree read(Path path, DocumentFormat format) {
        try {
            return format.read(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new DocumentException("Unable to read " + path, ex);
        }
    }

    public static void write(Path path, DocumentTree tree) {
        write(path, tree, forPath(path));
    }

    public static void write(Path path, DocumentTree tree, DocumentFormat format) {
        String text = format.write(tree);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new DocumentException("Unable to write " + path, ex);
        }
    }

    static Optional<String> extension(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static Map<String, DocumentFormat> indexByExtension() {
        Map<String, DocumentFormat> index = new LinkedHashMap<>();
        for (DocumentFormat format : FORMATS) {
            for (String ext : format.extensions()) {
                index.put(ext, format);
            }
        }
        return Map.copyOf(index);
    }
}
