package io.synphot.core.lang;

import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spectrum.SpectralElement;
import io.synphot.core.spectrum.Spectrum;
import java.util.List;

/** Value attached to a syntax tree node by the interpreter. */
public sealed interface Value permits Value.Numeric, Value.Text, Value.Source, Value.Element, Value.Arguments {

    static Value of(Spectrum spectrum) {
        if (spectrum instanceof SourceSpectrum source) {
            return new Source(source);
        }
        if (spectrum instanceof SpectralElement element) {
            return new Element(element);
        }
        throw new IllegalArgumentException("Unsupported spectrum type: " + spectrum.getClass().getName());
    }

    record Numeric(double value) implements Value {}

    /** An identifier: keyword, unit name, file reference. */
    record Text(String text) implements Value {}

    record Source(SourceSpectrum spectrum) implements Value {}

    record Element(SpectralElement element) implements Value {}

    /** Flattened function arguments. */
    record Arguments(List<Value> values) implements Value {
        public Arguments {
            values = List.copyOf(values);
        }
    }
}
