package io.synphot.core.error;

/**
 * Thrown for graph-table problems: traversal failures (through the concrete subclasses) and
 * table-integrity errors such as a loop met during traversal.
 */
public class GraphTableException extends SynphotException {

    private static final long serialVersionUID = 1L;

    public GraphTableException(String message, String source) {
        super(message, ErrorKind.TABLE_INTEGRITY, source);
    }

    protected GraphTableException(String message, ErrorKind kind, String source) {
        super(message, kind, source);
    }
}
