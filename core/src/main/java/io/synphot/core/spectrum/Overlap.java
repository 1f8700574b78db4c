package io.synphot.core.spectrum;

/** How a spectrum's wavelength coverage relates to a passband's non-zero range. */
public enum Overlap {
    /** The spectrum covers the whole passband (or is defined everywhere). */
    FULL,
    /** The spectrum covers only part of the passband. */
    PARTIAL,
    /** No common wavelengths. */
    NONE
}
