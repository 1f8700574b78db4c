package io.synphot.core.obsmode;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.spectrum.Binning;
import io.synphot.core.spectrum.SpectralElement;
import io.synphot.core.spectrum.SpectralModel;
import java.util.Map;

/** The combined passband of an observation mode. */
public final class ObservationSpectralElement extends SpectralElement {

    private final ObservationMode mode;

    ObservationSpectralElement(SpectralModel model, String tag, Map<String, String> warnings, ObservationMode mode) {
        super(model, tag, warnings);
        this.mode = mode;
    }

    public ObservationMode observationMode() {
        return mode;
    }

    /** Collecting area of the mode's telescope, cm². */
    public double primaryArea() {
        return mode.primaryArea();
    }

    /** Detector wavelengths of the mode, or {@code null} if the wave catalog has none. */
    public double[] binset() {
        return mode.binset();
    }

    /**
     * Wavelength range covered by {@code npix} detector pixels centered on {@code cenwave}.
     *
     * @return {@code {lower, upper}} in Å
     * @throws SpectrumException if the mode has no binset or the range leaves it
     */
    public double[] binnedWaverange(double cenwave, int npix, Binning.Mode binMode) {
        return Binning.waveRange(requireBinset(), cenwave, npix, binMode);
    }

    /**
     * Number of detector pixels between two wavelengths.
     *
     * @throws SpectrumException if the mode has no binset or the range leaves it
     */
    public double binnedPixelrange(double lower, double upper, Binning.Mode binMode) {
        return Binning.pixelRange(requireBinset(), lower, upper, binMode);
    }

    private double[] requireBinset() {
        double[] binset = mode.binset();
        if (binset == null) {
            throw new SpectrumException("No binset specified for this passband.", tag());
        }
        return binset;
    }

    @Override
    public ObservationSpectralElement withTag(String tag) {
        return new ObservationSpectralElement(model(), tag, warnings(), mode);
    }

    @Override
    public ObservationSpectralElement withWarning(String key, String message) {
        return new ObservationSpectralElement(model(), tag(), warningsWith(key, message), mode);
    }
}
