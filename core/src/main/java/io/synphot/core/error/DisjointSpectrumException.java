package io.synphot.core.error;

/** Thrown when a spectrum and a passband share no wavelength range at all. */
public final class DisjointSpectrumException extends SynphotException {

    private static final long serialVersionUID = 1L;

    public DisjointSpectrumException(String message, String source) {
        super(message, ErrorKind.DISJOINT_OVERLAP, source);
    }
}
