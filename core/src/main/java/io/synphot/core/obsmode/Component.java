package io.synphot.core.obsmode;

import io.synphot.core.spectrum.SpectralElement;

/**
 * A loaded optical component.
 *
 * @param file       throughput file reference, or {@code clear}
 * @param throughput the throughput, {@code null} for a clear component
 */
public record Component(String file, SpectralElement throughput) {

    public static Component clear() {
        return new Component(ComponentTable.CLEAR, null);
    }

    public boolean isEmpty() {
        return throughput == null;
    }
}
