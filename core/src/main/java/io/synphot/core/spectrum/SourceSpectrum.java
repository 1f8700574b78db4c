package io.synphot.core.spectrum;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.model.NormalizationResult;
import io.synphot.core.table.DataTable;
import java.util.Locale;
import java.util.Map;

/**
 * A source spectrum with flux in PHOTLAM. Carries an optional redshift applied on top of its
 * rest-frame model; re-applying a redshift replaces it rather than compounding.
 */
public class SourceSpectrum extends Spectrum {

    /** Default flux column of spectrum files. */
    public static final String FLUX = "FLUX";

    private final SpectralModel restModel;
    private final double z;

    protected SourceSpectrum(SpectralModel restModel, double z, String tag, Map<String, String> warnings) {
        super(z == 0.0 ? restModel : new SpectralModel.Redshifted(restModel, z), tag, warnings);
        this.restModel = restModel;
        this.z = z;
    }

    public SourceSpectrum(SpectralModel model) {
        this(model, 0.0, null, Map.of());
    }

    public static SourceSpectrum constFlux(double amplitude, FluxUnit unit) {
        if (unit == FluxUnit.PHOTLAM) {
            return new SourceSpectrum(new SpectralModel.Constant(amplitude));
        }
        return new SourceSpectrum(new SpectralModel.PowerLaw(amplitude, 1.0, 0.0, unit));
    }

    /** Blackbody of one solar radius seen from 1 kpc. */
    public static SourceSpectrum blackbody(double temperature) {
        return new SourceSpectrum(new SpectralModel.BlackBody(temperature));
    }

    /** {@code (λ / reference)^exponent} with amplitude 1 in {@code unit}. */
    public static SourceSpectrum powerLaw(double reference, double exponent, FluxUnit unit) {
        return new SourceSpectrum(new SpectralModel.PowerLaw(1.0, reference, exponent, unit));
    }

    /**
     * Gaussian emission line. {@code totalFlux} is the line integral in {@code unit}·Å,
     * converted to PHOTLAM at the line center.
     */
    public static SourceSpectrum gaussianLine(double center, double fwhm, double totalFlux, FluxUnit unit) {
        double integral = unit.toPhotlam(totalFlux, center);
        return new SourceSpectrum(new SpectralModel.Gaussian(center, fwhm, integral));
    }

    /** Tabulated PHOTLAM values, zero outside the table. */
    public static SourceSpectrum tabulated(double[] wavelengths, double[] photlam) {
        return new SourceSpectrum(new SpectralModel.Empirical(wavelengths, photlam));
    }

    /**
     * Reads a spectrum from a table with a {@code WAVELENGTH} column and the given flux column.
     * The {@code FLUXUNIT} header keyword names the flux unit; {@code flam} when absent.
     */
    public static SourceSpectrum fromTable(DataTable table, String fluxColumn) {
        double[] wavelengths = table.doubles(WAVELENGTH);
        double[] flux = table.doubles(fluxColumn);
        String unitName = table.keyword("FLUXUNIT");
        FluxUnit unit = unitName == null
                ? FluxUnit.FLAM
                : FluxUnit.fromName(unitName.trim().toLowerCase(Locale.ROOT))
                        .filter(FluxUnit::isDensity)
                        .orElseThrow(() -> new SpectrumException(
                                "Unsupported FLUXUNIT '" + unitName + "' in " + table.source(), table.source()));
        double[] photlam = new double[flux.length];
        for (int i = 0; i < flux.length; i++) {
            photlam[i] = unit.toPhotlam(flux[i], wavelengths[i]);
        }
        try {
            return new SourceSpectrum(new SpectralModel.Empirical(wavelengths, photlam), 0.0, table.source(), Map.of());
        } catch (IllegalArgumentException e) {
            throw new SpectrumException(e.getMessage() + " in " + table.source(), e, table.source());
        }
    }

    public double z() {
        return z;
    }

    /** Returns this spectrum redshifted by {@code z}, replacing any earlier redshift. */
    public SourceSpectrum redshift(double z) {
        return new SourceSpectrum(restModel, z, tag(), warnings());
    }

    public SourceSpectrum plus(SourceSpectrum other) {
        return new SourceSpectrum(new SpectralModel.Sum(model(), other.model()));
    }

    public SourceSpectrum minus(SourceSpectrum other) {
        return plus(other.negate());
    }

    public SourceSpectrum times(SpectralElement element) {
        return new SourceSpectrum(new SpectralModel.Product(model(), element.model()));
    }

    public SourceSpectrum times(double factor) {
        return new SourceSpectrum(new SpectralModel.Scaled(restModel, factor), z, null, Map.of());
    }

    public SourceSpectrum dividedBy(double divisor) {
        if (divisor == 0.0) {
            throw new SpectrumException("Division of " + this + " by zero", tag());
        }
        return times(1.0 / divisor);
    }

    public SourceSpectrum negate() {
        return times(-1.0);
    }

    /**
     * Renormalizes this spectrum so that its integrated flux through {@code band} equals
     * {@code level} in {@code unit}.
     *
     * <p>
     * Overlap is checked first: no overlap gives {@link NormalizationResult.Type#DISJOINT}, and
     * partial overlap gives {@link NormalizationResult.Type#PARTIAL_OVERLAP} unless
     * {@code force} is set.
     *
     * @param vega reference spectrum, required only for {@link FluxUnit#VEGAMAG}
     * @param area collecting area in cm², used for {@link FluxUnit#COUNTS} and
     *             {@link FluxUnit#OBMAG}
     */
    public NormalizationResult normalize(
            double level, FluxUnit unit, SpectralElement band, boolean force, SourceSpectrum vega, double area) {
        Overlap overlap = band.checkOverlap(this);
        if (overlap == Overlap.NONE) {
            return NormalizationResult.disjoint();
        }
        if (overlap == Overlap.PARTIAL && !force) {
            return NormalizationResult.partialOverlap();
        }

        double current = times(band).integrate();
        if (current == 0.0 || !Double.isFinite(current)) {
            throw new SpectrumException(
                    "Cannot renormalize " + this + ": integrated flux in " + band + " is " + current, tag());
        }
        double target =
                switch (unit) {
                    case COUNTS -> level / area;
                    case OBMAG -> Math.pow(10.0, -0.4 * level) / area;
                    case VEGAMAG -> {
                        if (vega == null) {
                            throw new SpectrumException("Vega spectrum is required for vegamag", tag());
                        }
                        yield vega.times(Math.pow(10.0, -0.4 * level)).times(band).integrate();
                    }
                    default -> constFlux(level, unit).times(band).integrate();
                };
        return NormalizationResult.normalized(times(target / current));
    }

    @Override
    public SourceSpectrum withTag(String tag) {
        return new SourceSpectrum(restModel, z, tag, warnings());
    }

    @Override
    public SourceSpectrum withWarning(String key, String message) {
        return new SourceSpectrum(restModel, z, tag(), warningsWith(key, message));
    }
}
