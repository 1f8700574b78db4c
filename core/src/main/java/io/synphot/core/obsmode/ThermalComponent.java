package io.synphot.core.obsmode;

import io.synphot.core.spectrum.SpectralElement;
import io.synphot.core.spectrum.ThermalElement;

/**
 * A component as seen by thermal calculations: its optical throughput plus its emissivity.
 * Either part is {@code null} when the corresponding file is {@code clear}.
 */
public record ThermalComponent(
        String throughputFile, String thermalFile, SpectralElement throughput, ThermalElement emissivity) {

    public boolean isEmpty() {
        return throughput == null && emissivity == null;
    }
}
