package work.citeproc.engine.style;

/**
 * Raised when a style cannot be loaded: malformed XML, unknown root, missing required sections.
 */
public final class StyleException extends RuntimeException {
    private final String code;

    public StyleException(String code, String message) {
        super(message);
        this.code = code;
    }

    public StyleException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
