package io.synphot.core.spi;

import io.synphot.core.spectrum.ExtinctionCurve;
import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spectrum.SpectralElement;
import io.synphot.core.spectrum.Spectrum;

/**
 * Everything the interpreter needs from outside the syntax tree: data files, observation modes,
 * catalog grids, reddening laws and instrument constants.
 */
public interface SpectralResources {

    /**
     * Loads a file as a source spectrum if it has a {@code FLUX} column, otherwise as a spectral
     * element.
     */
    Spectrum load(String reference);

    SourceSpectrum loadSource(String reference);

    SpectralElement loadElement(String reference);

    /** Passband of an observation mode, e.g. {@code acs,wfc1,f555w}. */
    SpectralElement band(String obsmode);

    SourceSpectrum catalogSpectrum(String grid, double tEff, double metallicity, double logG);

    /** @param law canonical reddening-law name */
    ExtinctionCurve extinction(String law, double ebv);

    SourceSpectrum vega();

    /** Collecting area in cm². */
    double area();
}
