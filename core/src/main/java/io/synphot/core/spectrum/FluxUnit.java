package io.synphot.core.spectrum;

import java.util.Optional;

/**
 * Flux units known to the expression language. Wavelengths are always Angstrom; internally all
 * source fluxes are held in {@link #PHOTLAM} (photons s⁻¹ cm⁻² Å⁻¹).
 *
 * <p>
 * {@link #COUNTS}, {@link #OBMAG} and {@link #VEGAMAG} are not flux densities: they depend on a
 * passband, a collecting area or a reference spectrum, so only renormalization accepts them.
 */
public enum FluxUnit {
    ABMAG("abmag"),
    COUNTS("counts"),
    FLAM("flam"),
    FNU("fnu"),
    JY("jy"),
    MJY("mjy"),
    OBMAG("obmag"),
    PHOTLAM("photlam"),
    PHOTNU("photnu"),
    STMAG("stmag"),
    VEGAMAG("vegamag");

    /** Planck constant, erg s. */
    public static final double H = 6.62607015e-27;
    /** Speed of light, Å/s. */
    public static final double C = 2.99792458e18;
    /** h·c in erg Å. */
    public static final double HC = H * C;

    private final String languageName;

    FluxUnit(String languageName) {
        this.languageName = languageName;
    }

    /** Exact, lower-case name used in expressions. */
    public String languageName() {
        return languageName;
    }

    public static Optional<FluxUnit> fromName(String name) {
        for (FluxUnit unit : values()) {
            if (unit.languageName.equals(name)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    public boolean isMagnitude() {
        return this == ABMAG || this == STMAG || this == OBMAG || this == VEGAMAG;
    }

    /** Whether a value in this unit converts to PHOTLAM at a single wavelength. */
    public boolean isDensity() {
        return this != COUNTS && this != OBMAG && this != VEGAMAG;
    }

    /** The linear flux unit a magnitude system is defined on; the unit itself otherwise. */
    public FluxUnit linearUnit() {
        return switch (this) {
            case ABMAG -> FNU;
            case STMAG -> FLAM;
            default -> this;
        };
    }

    /** Converts an AB or ST magnitude to its {@link #linearUnit()}; other values pass through. */
    public double toLinear(double value) {
        return switch (this) {
            case ABMAG -> Math.pow(10.0, -0.4 * (value + 48.6));
            case STMAG -> Math.pow(10.0, -0.4 * (value + 21.1));
            default -> value;
        };
    }

    /**
     * Converts a value in this unit at the given wavelength to PHOTLAM.
     *
     * @throws IllegalStateException for units that are not flux densities
     */
    public double toPhotlam(double value, double wavelength) {
        return switch (this) {
            case PHOTLAM -> value;
            case PHOTNU -> value * C / (wavelength * wavelength);
            case FLAM -> value * wavelength / HC;
            case FNU -> value / (H * wavelength);
            case JY -> value * 1e-23 / (H * wavelength);
            case MJY -> value * 1e-26 / (H * wavelength);
            case ABMAG, STMAG -> linearUnit().toPhotlam(toLinear(value), wavelength);
            case COUNTS, OBMAG, VEGAMAG -> throw new IllegalStateException(
                    languageName + " is not a flux density and cannot be converted at a single wavelength");
        };
    }

    @Override
    public String toString() {
        return languageName;
    }
}
