package io.synphot.core.obsmode;

import io.synphot.core.error.AmbiguousObsmodeException;
import io.synphot.core.error.SpectrumException;
import io.synphot.core.table.DataTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Wavelength catalog: maps observation modes to the detector wavelength set ("binset") used
 * for count-rate calculations.
 *
 * <p>
 * The table has {@code OBSMODE} and {@code FILENAME} columns. A {@code FILENAME} is either a
 * waveset file reference or a parameter string {@code (start,stop[,dw1[,dw2]])} describing a
 * grid whose step grows linearly from {@code dw1} to {@code dw2}.
 */
public final class WaveCatalog {

    /** Number of steps between start and stop when a parameter string gives no step. */
    static final double DEFAULT_STEPS = 1999.0;

    private final String name;
    private final Map<String, String> lookup;
    private final Map<Set<String>, String> setLookup;

    private WaveCatalog(String name, Map<String, String> lookup, Map<Set<String>, String> setLookup) {
        this.name = name;
        this.lookup = lookup;
        this.setLookup = setLookup;
    }

    public static WaveCatalog fromTable(DataTable table) {
        Map<String, String> lookup = new LinkedHashMap<>();
        Map<Set<String>, String> setLookup = new LinkedHashMap<>();
        List<String> modes = table.strings("OBSMODE");
        List<String> files = table.strings("FILENAME");
        for (int i = 0; i < modes.size(); i++) {
            String mode = normalize(modes.get(i));
            lookup.put(mode, files.get(i));
            setLookup.put(keywordSet(mode), mode);
        }
        return new WaveCatalog(table.source(), lookup, setLookup);
    }

    public String name() {
        return name;
    }

    /**
     * Binset entry for a mode. An exact match wins; otherwise the catalog mode with the most
     * keywords among those whose keywords are all in {@code obsmode}.
     *
     * @return the file reference or parameter string, empty if no catalog mode matches
     * @throws AmbiguousObsmodeException if the most complete matches tie
     */
    public Optional<String> entryFor(String obsmode) {
        String mode = normalize(obsmode);
        String exact = lookup.get(mode);
        if (exact != null) {
            return Optional.of(exact);
        }
        Set<String> requested = keywordSet(mode);
        List<Set<String>> candidates = new ArrayList<>();
        for (Set<String> keys : setLookup.keySet()) {
            if (requested.containsAll(keys)) {
                candidates.add(keys);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        candidates.sort(Comparator.comparingInt(Set::size));
        Set<String> best = candidates.get(candidates.size() - 1);
        if (candidates.size() > 1 && candidates.get(candidates.size() - 2).size() == best.size()) {
            throw new AmbiguousObsmodeException(
                    requested + " matches several entries of " + name + "; candidates: " + candidates, obsmode);
        }
        return Optional.of(lookup.get(setLookup.get(best)));
    }

    /** {@code true} for a {@code (start,stop,...)} parameter string. */
    public static boolean isParameterString(String entry) {
        return entry.startsWith("(");
    }

    /**
     * Wavelengths of a parameter string: {@code (start,stop[,dw1[,dw2]])}. Without steps the
     * range is cut into {@link #DEFAULT_STEPS} equal steps; with one step the grid is uniform.
     */
    public static double[] wavesetFromParameters(String entry) {
        String trimmed = entry.trim();
        if (!trimmed.startsWith("(") || !trimmed.endsWith(")")) {
            throw new SpectrumException("Malformed waveset parameters: " + entry, entry);
        }
        String[] parts = trimmed.substring(1, trimmed.length() - 1).split(",");
        if (parts.length < 2) {
            throw new SpectrumException("Waveset parameters need a start and a stop: " + entry, entry);
        }
        double[] c = new double[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                c[i] = Double.parseDouble(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            throw new SpectrumException("Malformed waveset parameters: " + entry, e, entry);
        }
        double start = c[0];
        double stop = c[1];
        if (!(stop > start)) {
            throw new SpectrumException("Waveset stop must exceed start: " + entry, entry);
        }
        double firstStep = c.length > 2 ? c[2] : (stop - start) / DEFAULT_STEPS;
        double lastStep = c.length > 3 ? c[3] : firstStep;

        int n = (int) (2.0 * (stop - start) / (firstStep + lastStep)) + 1;
        double a = (lastStep * lastStep - firstStep * firstStep) * 0.25 / (stop - start);
        double[] wavelengths = new double[n];
        for (int i = 0; i < n; i++) {
            wavelengths[i] = (a * i + firstStep) * i + start;
        }
        return wavelengths;
    }

    private static String normalize(String obsmode) {
        return obsmode.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
    }

    private static Set<String> keywordSet(String mode) {
        Set<String> keys = new LinkedHashSet<>(Arrays.asList(mode.split(",")));
        keys.remove("");
        return keys;
    }
}
