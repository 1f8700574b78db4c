package io.synphot.core.spectrum;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.table.DataTable;
import java.util.Map;

/** A dimensionless throughput curve: filter, detector, passband. */
public class SpectralElement extends Spectrum {

    /** Default throughput column of component files. */
    public static final String THROUGHPUT = "THROUGHPUT";

    protected SpectralElement(SpectralModel model, String tag, Map<String, String> warnings) {
        super(model, tag, warnings);
    }

    public SpectralElement(SpectralModel model) {
        this(model, null, Map.of());
    }

    /** Rectangular passband of unit throughput. */
    public static SpectralElement box(double center, double width) {
        return new SpectralElement(new SpectralModel.Box(center, width));
    }

    public static SpectralElement tabulated(double[] wavelengths, double[] throughput) {
        return new SpectralElement(new SpectralModel.Empirical(wavelengths, throughput));
    }

    /** Reads a throughput curve from a {@code WAVELENGTH} column and the given column. */
    public static SpectralElement fromTable(DataTable table, String column) {
        try {
            return new SpectralElement(
                    new SpectralModel.Empirical(table.doubles(WAVELENGTH), table.doubles(column)),
                    table.source(),
                    Map.of());
        } catch (IllegalArgumentException e) {
            throw new SpectrumException(e.getMessage() + " in " + table.source(), e, table.source());
        }
    }

    public SpectralElement times(SpectralElement other) {
        return new SpectralElement(new SpectralModel.Product(model(), other.model()));
    }

    public SourceSpectrum times(SourceSpectrum source) {
        return source.times(this);
    }

    public SpectralElement times(double factor) {
        return new SpectralElement(new SpectralModel.Scaled(model(), factor));
    }

    public SpectralElement plus(SpectralElement other) {
        return new SpectralElement(new SpectralModel.Sum(model(), other.model()));
    }

    public SpectralElement minus(SpectralElement other) {
        return plus(other.negate());
    }

    public SpectralElement dividedBy(double divisor) {
        if (divisor == 0.0) {
            throw new SpectrumException("Division of " + this + " by zero", tag());
        }
        return times(1.0 / divisor);
    }

    public SpectralElement negate() {
        return times(-1.0);
    }

    /**
     * Compares another spectrum's wavelength coverage with the range where this element is
     * non-zero. Spectra defined everywhere always overlap fully.
     */
    public Overlap checkOverlap(Spectrum other) {
        double[] own = waveset();
        double[] theirs = other.waveset();
        if (own == null || theirs == null || theirs.length == 0) {
            return Overlap.FULL;
        }

        int first = -1;
        int last = -1;
        for (int i = 0; i < own.length; i++) {
            if (evaluate(own[i]) != 0.0) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        double lo = first < 0 ? own[0] : own[first];
        double hi = first < 0 ? own[own.length - 1] : own[last];

        double otherLo = theirs[0];
        double otherHi = theirs[theirs.length - 1];
        if (otherHi < lo || otherLo > hi) {
            return Overlap.NONE;
        }
        if (otherLo <= lo && otherHi >= hi) {
            return Overlap.FULL;
        }
        return Overlap.PARTIAL;
    }

    /** Pivot wavelength, sqrt(∫T·λ dλ / ∫T/λ dλ). */
    public double pivotWavelength() {
        double[] w = waveset();
        if (w == null) {
            throw new SpectrumException("Cannot compute pivot wavelength of " + this + ": undefined wavelength set", tag());
        }
        double[] num = new double[w.length];
        double[] den = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            double t = evaluate(w[i]);
            num[i] = t * w[i];
            den[i] = t / w[i];
        }
        return Math.sqrt(Sampling.trapezoid(w, num) / Sampling.trapezoid(w, den));
    }

    @Override
    public SpectralElement withTag(String tag) {
        return new SpectralElement(model(), tag, warnings());
    }

    @Override
    public SpectralElement withWarning(String key, String message) {
        return new SpectralElement(model(), tag(), warningsWith(key, message));
    }
}
