package io.synphot.core.model;

import io.synphot.core.spectrum.SourceSpectrum;
import java.util.Objects;

/**
 * Outcome of renormalizing a source spectrum in a passband. Exactly one of three states:
 *
 * <ul>
 * <li>{@link Type#NORMALIZED}: {@code spectrum} holds the renormalized source.
 * <li>{@link Type#PARTIAL_OVERLAP}: the source only partly covers the passband and the
 * caller did not force renormalization; no spectrum.
 * <li>{@link Type#DISJOINT}: the source and the passband do not overlap; no spectrum.
 * </ul>
 */
public final class NormalizationResult {

    /** The type of normalization outcome. */
    public enum Type {
        NORMALIZED,
        PARTIAL_OVERLAP,
        DISJOINT
    }

    private static final NormalizationResult PARTIAL = new NormalizationResult(Type.PARTIAL_OVERLAP, null);
    private static final NormalizationResult NONE = new NormalizationResult(Type.DISJOINT, null);

    private final Type type;
    private final SourceSpectrum spectrum;

    private NormalizationResult(Type type, SourceSpectrum spectrum) {
        this.type = type;
        this.spectrum = spectrum;
    }

    public static NormalizationResult normalized(SourceSpectrum spectrum) {
        Objects.requireNonNull(spectrum, "spectrum must not be null for NORMALIZED");
        return new NormalizationResult(Type.NORMALIZED, spectrum);
    }

    public static NormalizationResult partialOverlap() {
        return PARTIAL;
    }

    public static NormalizationResult disjoint() {
        return NONE;
    }

    public Type type() {
        return type;
    }

    /** Returns the renormalized spectrum. Only valid when {@code type() == NORMALIZED}. */
    public SourceSpectrum spectrum() {
        return spectrum;
    }

    public boolean isNormalized() {
        return type == Type.NORMALIZED;
    }

    @Override
    public String toString() {
        return "NormalizationResult[" + type + "]";
    }
}
