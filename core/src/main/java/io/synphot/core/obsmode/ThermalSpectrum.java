package io.synphot.core.obsmode;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.spectrum.Sampling;
import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spectrum.ThermalElement;
import java.util.Arrays;
import java.util.List;

/**
 * Thermal emission of an observation mode in PHOTLAM per square arcsecond.
 *
 * <p>
 * Starting from zero flux, each component in light-path order first transmits what reaches it
 * (its optical throughput) and then adds its own emission. The result is sampled on the merged
 * emissivity wavelengths that lie inside the default wavelength range, narrowed to the
 * emissivity ranges of every component but the first, and inside the Vega spectrum's range.
 */
public final class ThermalSpectrum {

    /** Default wavelength range, Å. */
    public static final double[] DEFAULT_WAVESET = Sampling.logspace(500.0, 26000.0, 10000);

    private ThermalSpectrum() {}

    /**
     * @param components  non-empty thermal components in light-path order
     * @param vegaWaveset wavelengths of the Vega spectrum
     * @throws SpectrumException if no component emits or the wavelength ranges do not intersect
     */
    public static SourceSpectrum compute(
            String obsmode, List<ThermalComponent> components, double[] defaultWaveset, double[] vegaWaveset) {
        double[] x = waveIntersection(obsmode, components, defaultWaveset, vegaWaveset);
        double minw = x[0];
        double maxw = x[x.length - 1];

        SourceSpectrum sp = SourceSpectrum.tabulated(x, new double[x.length]);
        for (ThermalComponent component : components) {
            if (component.throughput() != null) {
                sp = sp.times(component.throughput());
            }
            if (component.emissivity() != null) {
                sp = trim(sp.plus(component.emissivity().thermalSource()), minw, maxw);
            }
        }
        return sp.withTag(obsmode + " ThermalSpectrum");
    }

    static double[] waveIntersection(
            String obsmode, List<ThermalComponent> components, double[] defaultWaveset, double[] vegaWaveset) {
        double minw = defaultWaveset[0];
        double maxw = defaultWaveset[defaultWaveset.length - 1];
        for (ThermalComponent component : components.subList(Math.min(1, components.size()), components.size())) {
            ThermalElement emissivity = component.emissivity();
            if (emissivity != null) {
                double[] w = emissivity.waveset();
                minw = Math.max(minw, w[0]);
                maxw = Math.min(maxw, w[w.length - 1]);
            }
        }

        double[] merged = null;
        for (ThermalComponent component : components) {
            if (component.emissivity() != null) {
                merged = Sampling.merge(merged, component.emissivity().waveset());
            }
        }
        if (merged == null) {
            throw new SpectrumException("No thermal support provided for " + obsmode, obsmode);
        }

        double lo = minw;
        double hi = maxw;
        double vegaLo = vegaWaveset[0];
        double vegaHi = vegaWaveset[vegaWaveset.length - 1];
        double[] result = Arrays.stream(merged)
                .filter(w -> w > lo && w < hi)
                .filter(w -> w > vegaLo && w < vegaHi)
                .toArray();
        if (result.length == 0) {
            throw new SpectrumException(
                    "Thermal wavelengths of " + obsmode + " do not intersect the default and Vega ranges", obsmode);
        }
        return result;
    }

    private static SourceSpectrum trim(SourceSpectrum sp, double minw, double maxw) {
        double[] w = Arrays.stream(sp.waveset()).filter(v -> v >= minw && v <= maxw).toArray();
        double[] y = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            y[i] = sp.evaluate(w[i]);
        }
        return SourceSpectrum.tabulated(w, y);
    }
}
