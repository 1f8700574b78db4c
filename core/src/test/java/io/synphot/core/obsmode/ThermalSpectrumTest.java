package io.synphot.core.obsmode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.withinPercentage;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spectrum.SpectralElement;
import io.synphot.core.spectrum.ThermalElement;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ThermalSpectrumTest {

    private static final double[] VEGA = {3000.0, 8000.0};

    private static ThermalComponent component(double throughput, double[] grid, double temperature) {
        double[] values = new double[grid.length];
        Arrays.fill(values, 0.1);
        SpectralElement optical =
                SpectralElement.tabulated(new double[] {1000.0, 20000.0}, new double[] {throughput, throughput});
        ThermalElement emissivity =
                new ThermalElement(SpectralElement.tabulated(grid, values).model(), temperature, 1.0);
        return new ThermalComponent("opt.csv", "th.csv", optical, emissivity);
    }

    private final ThermalComponent primary = component(0.5, new double[] {1000, 4000, 5000, 6000, 20000}, 280.0);
    private final ThermalComponent secondary = component(0.2, new double[] {2000, 4500, 5000, 5500, 15000}, 900.0);

    @Test
    void wavelengthsAreNarrowedByTheDownstreamComponentsAndVega() {
        double[] w = ThermalSpectrum.waveIntersection(
                "acs,wfc1", List.of(primary, secondary), ThermalSpectrum.DEFAULT_WAVESET, VEGA);

        assertThat(w).containsExactly(4000, 4500, 5000, 5500, 6000);
    }

    @Test
    void eachComponentTransmitsUpstreamEmissionAndAddsItsOwn() {
        SourceSpectrum sp = ThermalSpectrum.compute(
                "acs,wfc1", List.of(primary, secondary), ThermalSpectrum.DEFAULT_WAVESET, VEGA);

        double upstream = primary.emissivity().thermalSource().evaluate(5000);
        double own = secondary.emissivity().thermalSource().evaluate(5000);

        assertThat(sp.evaluate(5000)).isCloseTo(upstream * 0.2 + own, withinPercentage(1e-9));
        assertThat(sp.tag()).isEqualTo("acs,wfc1 ThermalSpectrum");
    }

    @Test
    void clearThroughputPassesEmissionUnchanged() {
        ThermalComponent bare = new ThermalComponent("clear", "th.csv", null, secondary.emissivity());

        SourceSpectrum sp =
                ThermalSpectrum.compute("acs,wfc1", List.of(primary, bare), ThermalSpectrum.DEFAULT_WAVESET, VEGA);

        double expected = primary.emissivity().thermalSource().evaluate(5000)
                + secondary.emissivity().thermalSource().evaluate(5000);
        assertThat(sp.evaluate(5000)).isCloseTo(expected, withinPercentage(1e-9));
    }

    @Test
    void noEmittingComponent() {
        ThermalComponent optical = new ThermalComponent("opt.csv", "clear", primary.throughput(), null);

        assertThatThrownBy(() ->
                        ThermalSpectrum.compute("acs,wfc1", List.of(optical), ThermalSpectrum.DEFAULT_WAVESET, VEGA))
                .isInstanceOf(SpectrumException.class)
                .hasMessage("No thermal support provided for acs,wfc1");
    }

    @Test
    void disjointVegaRange() {
        assertThatThrownBy(() -> ThermalSpectrum.compute(
                        "acs,wfc1",
                        List.of(primary, secondary),
                        ThermalSpectrum.DEFAULT_WAVESET,
                        new double[] {100.0, 200.0}))
                .isInstanceOf(SpectrumException.class)
                .hasMessage("Thermal wavelengths of acs,wfc1 do not intersect the default and Vega ranges");
    }
}
