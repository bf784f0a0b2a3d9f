package work.lcod.miniconf.document;

/**
 * Raised when a document cannot be read, written or rebuilt from dot-path keys.
 */
public final class DocumentException extends RuntimeException {
    public DocumentException(String message) {
        super(message);
    }

    public DocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
