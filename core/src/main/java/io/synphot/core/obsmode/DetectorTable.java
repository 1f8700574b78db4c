package io.synphot.core.obsmode;

import io.synphot.core.table.DataTable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Detector pixel scales: {@code OBSMODE} (instrument and detector, e.g. {@code acs,wfc1}) to
 * {@code SCALE} in arcseconds per pixel. The first row for a mode wins.
 */
public final class DetectorTable {

    private final String name;
    private final Map<String, Double> scales;

    private DetectorTable(String name, Map<String, Double> scales) {
        this.name = name;
        this.scales = scales;
    }

    public static DetectorTable fromTable(DataTable table) {
        Map<String, Double> scales = new LinkedHashMap<>();
        List<String> modes = table.strings("OBSMODE");
        double[] values = table.doubles("SCALE");
        for (int i = 0; i < modes.size(); i++) {
            scales.putIfAbsent(modes.get(i).toLowerCase(Locale.ROOT).replaceAll("\\s+", ""), values[i]);
        }
        return new DetectorTable(table.source(), scales);
    }

    public String name() {
        return name;
    }

    /** Pixel scale for the first two keywords of {@code obsmode}, in arcsec. */
    public Optional<Double> pixelScale(String obsmode) {
        String[] parts = obsmode.toLowerCase(Locale.ROOT).replaceAll("\\s+", "").split(",");
        String key = parts.length > 1 ? parts[0] + "," + parts[1] : parts[0];
        return Optional.ofNullable(scales.get(key));
    }
}
