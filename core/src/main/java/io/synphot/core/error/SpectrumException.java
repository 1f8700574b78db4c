package io.synphot.core.error;

/**
 * Thrown for invalid spectrum operations: unsupported operand combinations, missing
 * interpolation columns, unresolvable paths, unsupported catalogs.
 */
public final class SpectrumException extends SynphotException {

    private static final long serialVersionUID = 1L;

    public SpectrumException(String message) {
        super(message, ErrorKind.DATA, null);
    }

    public SpectrumException(String message, String source) {
        super(message, ErrorKind.DATA, source);
    }

    public SpectrumException(String message, Throwable cause, String source) {
        super(message, cause, ErrorKind.DATA, source);
    }
}
