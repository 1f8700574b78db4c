package io.synphot.core.error;

/** Thrown when traversal completes without consuming every mode keyword. */
public final class UnusedKeywordException extends GraphTableException {

    private static final long serialVersionUID = 1L;

    public UnusedKeywordException(String message, String obsmode) {
        super(message, ErrorKind.UNUSED_KEYWORD, obsmode);
    }
}
