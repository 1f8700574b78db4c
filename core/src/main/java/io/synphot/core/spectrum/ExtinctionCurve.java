package io.synphot.core.spectrum;

import java.util.Map;

/** Interstellar extinction for one reddening law and colour excess. */
public final class ExtinctionCurve extends SpectralElement {

    private final String law;
    private final double ebv;

    ExtinctionCurve(SpectralModel model, String law, double ebv, String tag, Map<String, String> warnings) {
        super(model, tag, warnings);
        this.law = law;
        this.ebv = ebv;
    }

    public String law() {
        return law;
    }

    /** Colour excess E(B−V) in magnitudes. */
    public double ebv() {
        return ebv;
    }

    @Override
    public ExtinctionCurve withTag(String tag) {
        return new ExtinctionCurve(model(), law, ebv, tag, warnings());
    }

    @Override
    public ExtinctionCurve withWarning(String key, String message) {
        return new ExtinctionCurve(model(), law, ebv, tag(), warningsWith(key, message));
    }
}
