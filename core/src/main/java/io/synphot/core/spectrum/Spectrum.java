package io.synphot.core.spectrum;

import io.synphot.core.error.SpectrumException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common base of sampled spectra: a {@link SpectralModel}, a descriptive tag and a map of
 * warnings raised while the spectrum was built. Instances are immutable; operations return new
 * spectra.
 */
public abstract class Spectrum {

    /** Wavelength column name in data files. */
    public static final String WAVELENGTH = "WAVELENGTH";

    private final SpectralModel model;
    private final String tag;
    private final Map<String, String> warnings;

    protected Spectrum(SpectralModel model, String tag, Map<String, String> warnings) {
        this.model = model;
        this.tag = tag;
        this.warnings = Collections.unmodifiableMap(new LinkedHashMap<>(warnings));
    }

    public SpectralModel model() {
        return model;
    }

    public double evaluate(double wavelength) {
        return model.evaluate(wavelength);
    }

    /** Natural sampling of this spectrum, or {@code null} when it is defined everywhere. */
    public double[] waveset() {
        return model.waveset();
    }

    /** Description of how the spectrum was made, e.g. {@code bb(5000.0)}; may be {@code null}. */
    public String tag() {
        return tag;
    }

    /** Warning key → message, e.g. {@code force_renorm}. */
    public Map<String, String> warnings() {
        return warnings;
    }

    /**
     * Integrates over the spectrum's own wavelength set with the trapezoid rule.
     *
     * @throws SpectrumException if the spectrum has no wavelength set
     */
    public double integrate() {
        double[] wavelengths = waveset();
        if (wavelengths == null) {
            throw new SpectrumException("Cannot integrate " + this + ": undefined wavelength set", tag);
        }
        return integrate(wavelengths);
    }

    public double integrate(double[] wavelengths) {
        double[] values = new double[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            values[i] = evaluate(wavelengths[i]);
        }
        return Sampling.trapezoid(wavelengths, values);
    }

    public abstract Spectrum withTag(String tag);

    public abstract Spectrum withWarning(String key, String message);

    protected Map<String, String> warningsWith(String key, String message) {
        Map<String, String> merged = new LinkedHashMap<>(warnings);
        merged.put(key, message);
        return merged;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + (tag != null ? tag : model) + "]";
    }
}
