package io.synphot.core.error;

/**
 * Abstract base for all synphot-engine exceptions. Never thrown directly: each concrete subclass
 * fixes its {@link ErrorKind}. Carries an optional {@code source} naming the expression, mode
 * string or table that triggered the error.
 */
public abstract class SynphotException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String source;

    protected SynphotException(String message, ErrorKind kind, String source) {
        super(message);
        this.kind = kind;
        this.source = source;
    }

    protected SynphotException(String message, Throwable cause, ErrorKind kind, String source) {
        super(message, cause);
        this.kind = kind;
        this.source = source;
    }

    /** The failure classification. */
    public ErrorKind kind() {
        return kind;
    }

    /** The expression, mode string or file involved, or {@code null} if not identified. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
