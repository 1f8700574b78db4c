package io.synphot.core.error;

/** Thrown when an expression cannot be scanned, parsed or interpreted. */
public final class ParserException extends SynphotException {

    private static final long serialVersionUID = 1L;

    public ParserException(String message, String source) {
        super(message, ErrorKind.PARSE, source);
    }

    public ParserException(String message, Throwable cause, String source) {
        super(message, cause, ErrorKind.PARSE, source);
    }
}
