package io.synphot.core.spectrum;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.table.DataTable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A tabulated extinction law, A(λ)/E(B−V) against wavelength. Combined with a colour excess it
 * yields an {@link ExtinctionCurve}.
 */
public final class ReddeningLaw {

    /** Column holding A(λ)/E(B−V). */
    public static final String K = "K";

    /** Law names the expression language accepts. */
    public static final List<String> NAMES =
            List.of("lmc30dor", "lmcavg", "mwavg", "mwdense", "mwrv21", "mwrv40", "smcbar", "xgalsb");

    private static final Map<String, String> ALIASES = Map.of("gal3", "mwavg");

    private final String name;
    private final double[] wavelengths;
    private final double[] k;

    public ReddeningLaw(String name, double[] wavelengths, double[] k) {
        this.name = name;
        this.wavelengths = wavelengths.clone();
        this.k = k.clone();
    }

    public static ReddeningLaw fromTable(String name, DataTable table) {
        double[] wavelengths = table.doubles(Spectrum.WAVELENGTH);
        double[] k = table.doubles(K);
        for (int i = 1; i < wavelengths.length; i++) {
            if (!(wavelengths[i] > wavelengths[i - 1])) {
                throw new SpectrumException(
                        "Wavelengths must be strictly increasing in " + table.source(), table.source());
            }
        }
        return new ReddeningLaw(name, wavelengths, k);
    }

    /**
     * Canonical law name for a name given in an expression: known names map to themselves,
     * aliases to their target, anything else to empty. Names are case-sensitive.
     */
    public static Optional<String> canonicalName(String name) {
        if (NAMES.contains(name)) {
            return Optional.of(name);
        }
        return Optional.ofNullable(ALIASES.get(name));
    }

    public String name() {
        return name;
    }

    /** Transmission {@code 10^(-0.4 · E(B−V) · k(λ))} on the law's wavelength grid. */
    public ExtinctionCurve extinctionCurve(double ebv) {
        double[] transmission = new double[k.length];
        for (int i = 0; i < k.length; i++) {
            transmission[i] = Math.pow(10.0, -0.4 * ebv * k[i]);
        }
        return new ExtinctionCurve(new SpectralModel.Empirical(wavelengths, transmission), name, ebv, null, Map.of());
    }
}
