package io.synphot.core.error;

/** Thrown when traversal reaches a node with no successor for the given keywords. */
public final class IncompleteObsmodeException extends GraphTableException {

    private static final long serialVersionUID = 1L;

    public IncompleteObsmodeException(String message, String obsmode) {
        super(message, ErrorKind.INCOMPLETE_MODE, obsmode);
    }
}
