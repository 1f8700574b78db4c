package io.synphot.core.spectrum;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.table.DataTable;
import java.util.Map;

/**
 * Emissivity curve of a thermal component, with the temperature it radiates at.
 *
 * <p>
 * Thermal tables carry the temperature in the {@code DEFT} header keyword (K) and an optional
 * beam filling factor in {@code BEAMFILL} (1 when absent).
 */
public final class ThermalElement extends SpectralElement {

    /** Default emissivity column of thermal component files. */
    public static final String EMISSIVITY = "EMISSIVITY";

    /** Steradians per square arcsecond. */
    public static final double SR_PER_ARCSEC2 = Math.pow(Math.PI / (180.0 * 3600.0), 2);

    private final double temperature;
    private final double beamFill;

    private ThermalElement(SpectralModel model, String tag, Map<String, String> warnings, double temperature,
            double beamFill) {
        super(model, tag, warnings);
        if (!(temperature > 0)) {
            throw new SpectrumException("Thermal temperature must be positive, got " + temperature, tag);
        }
        this.temperature = temperature;
        this.beamFill = beamFill;
    }

    public ThermalElement(SpectralModel model, double temperature, double beamFill) {
        this(model, null, Map.of(), temperature, beamFill);
    }

    /** Wraps an already loaded emissivity curve with the temperature keywords of its table. */
    public static ThermalElement fromTable(DataTable table, SpectralElement emissivity) {
        String deft = table.keyword("DEFT");
        if (deft == null) {
            throw new SpectrumException(table.source() + " has no DEFT keyword", table.source());
        }
        String beam = table.keyword("BEAMFILL");
        return new ThermalElement(
                emissivity.model(),
                table.source(),
                emissivity.warnings(),
                number(deft, "DEFT", table),
                beam == null ? 1.0 : number(beam, "BEAMFILL", table));
    }

    private static double number(String value, String keyword, DataTable table) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new SpectrumException(
                    keyword + " keyword of " + table.source() + " is not numeric: '" + value + "'", e, table.source());
        }
    }

    public double temperature() {
        return temperature;
    }

    public double beamFill() {
        return beamFill;
    }

    /**
     * Radiated spectrum in PHOTLAM per square arcsecond: blackbody radiance at
     * {@link #temperature()} times beam filling factor times emissivity.
     */
    public SourceSpectrum thermalSource() {
        SpectralModel radiance = new SpectralModel.Scaled(
                new SpectralModel.BlackBody(temperature), SR_PER_ARCSEC2 * beamFill / SpectralModel.BlackBody.NORM);
        return new SourceSpectrum(new SpectralModel.Product(radiance, model()))
                .withTag("thermal(" + (tag() != null ? tag() : temperature) + ")");
    }

    @Override
    public ThermalElement withTag(String tag) {
        return new ThermalElement(model(), tag, warnings(), temperature, beamFill);
    }

    @Override
    public ThermalElement withWarning(String key, String message) {
        return new ThermalElement(model(), tag(), warningsWith(key, message), temperature, beamFill);
    }
}
