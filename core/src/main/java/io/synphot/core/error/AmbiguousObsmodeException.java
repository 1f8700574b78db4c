package io.synphot.core.error;

/** Thrown when several mode keywords (or duplicated table rows) match at one graph node. */
public final class AmbiguousObsmodeException extends GraphTableException {

    private static final long serialVersionUID = 1L;

    public AmbiguousObsmodeException(String message, String obsmode) {
        super(message, ErrorKind.AMBIGUOUS_MODE, obsmode);
    }
}
