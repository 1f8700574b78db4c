package io.synphot.core.error;

/** Thrown when a data table is missing, unreadable or lacks a required column. */
public final class TableReadException extends SynphotException {

    private static final long serialVersionUID = 1L;

    public TableReadException(String message, String file) {
        super(message, ErrorKind.DATA, file);
    }

    public TableReadException(String message, Throwable cause, String file) {
        super(message, cause, ErrorKind.DATA, file);
    }
}
