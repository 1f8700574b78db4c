package io.synphot.core.catalog;

import io.synphot.core.engine.MemoCache;
import io.synphot.core.error.ParameterOutOfBoundsException;
import io.synphot.core.error.SpectrumException;
import io.synphot.core.error.TableReadException;
import io.synphot.core.model.CatalogIndexEntry;
import io.synphot.core.model.CatalogParameter;
import io.synphot.core.spectrum.Formats;
import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spi.TableReader;
import io.synphot.core.table.DataTable;
import io.synphot.core.table.PathResolver;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trilinear interpolation in a stellar atmosphere grid.
 *
 * <p>
 * The grid index is bisected on temperature, then metallicity, then gravity. Each bisection
 * keeps the entries at the nearest grid value at or above the target and those at the nearest
 * value at or below it, so a target on a grid value selects that value on both sides. The eight
 * corner spectra are blended along gravity, then metallicity, then temperature.
 *
 * <p>
 * Index tables ({@value #INDEX_FILE}, columns {@code INDEX} = {@code "teff,metallicity,logg"}
 * and {@code FILENAME} = {@code "dir/file.csv[column]"}) are cached per resolved file name.
 */
public final class CatalogInterpolator {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogInterpolator.class);

    public static final String INDEX_FILE = "catalog.csv";

    private final PathResolver resolver;
    private final TableReader reader;
    private final MemoCache<String, CatalogIndex> cache;

    public CatalogInterpolator(PathResolver resolver, TableReader reader, MemoCache<String, CatalogIndex> cache) {
        this.resolver = resolver;
        this.reader = reader;
        this.cache = cache;
    }

    /**
     * Interpolated spectrum at the given grid point.
     *
     * @param gridName {@code ck04models}, {@code k93models} or {@code phoenix}
     * @throws ParameterOutOfBoundsException if a parameter is outside the grid or a corner
     *                                       spectrum has no valid flux
     */
    public SourceSpectrum gridToSpectrum(String gridName, double tEff, double metallicity, double logG) {
        CatalogGrid grid = CatalogGrid.fromName(gridName)
                .orElseThrow(() -> new SpectrumException(gridName + " is not a supported catalog grid.", gridName));
        CatalogIndex index = catalogIndex(grid);

        Bracket t = bracket(index.entries(), CatalogParameter.T_EFF, tEff, grid);
        Bracket mUpper = bracket(t.upper(), CatalogParameter.METALLICITY, metallicity, grid);
        Bracket mLower = bracket(t.lower(), CatalogParameter.METALLICITY, metallicity, grid);

        Map<CatalogIndexEntry, SourceSpectrum> corners = new HashMap<>();
        SourceSpectrum upperUpper =
                blendGravity(bracket(mUpper.upper(), CatalogParameter.LOG_G, logG, grid), logG, index, corners);
        SourceSpectrum upperLower =
                blendGravity(bracket(mUpper.lower(), CatalogParameter.LOG_G, logG, grid), logG, index, corners);
        SourceSpectrum lowerUpper =
                blendGravity(bracket(mLower.upper(), CatalogParameter.LOG_G, logG, grid), logG, index, corners);
        SourceSpectrum lowerLower =
                blendGravity(bracket(mLower.lower(), CatalogParameter.LOG_G, logG, grid), logG, index, corners);

        SourceSpectrum upperT = blend(upperUpper, mUpper.upperValue(), upperLower, mUpper.lowerValue(), metallicity);
        SourceSpectrum lowerT = blend(lowerUpper, mLower.upperValue(), lowerLower, mLower.lowerValue(), metallicity);
        SourceSpectrum result = blend(upperT, t.upperValue(), lowerT, t.lowerValue(), tEff);

        String tag = String.format(
                "%s(T_eff=%s,metallicity=%s,log_g=%s)",
                grid.gridName(), Formats.compact(tEff), Formats.compact(metallicity), Formats.compact(logG));
        LOG.debug("Interpolated {} from {} grid files", tag, corners.size());
        return result.withTag(tag);
    }

    /** Index of a grid, read once and cached. */
    public CatalogIndex catalogIndex(CatalogGrid grid) {
        String directory = resolver.resolve(grid.directory());
        String file = Path.of(directory).resolve(INDEX_FILE).toString();
        return cache.get(file, f -> readIndex(grid, directory, f));
    }

    private CatalogIndex readIndex(CatalogGrid grid, String directory, String file) {
        DataTable table = reader.read(file);
        List<String> indices = table.strings("INDEX");
        List<String> files = table.strings("FILENAME");
        List<CatalogIndexEntry> entries = new ArrayList<>(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            String[] parts = indices.get(i).split(",");
            if (parts.length != 3) {
                throw new TableReadException(
                        String.format("INDEX row %d of %s must hold three values: '%s'", i + 1, file, indices.get(i)),
                        file);
            }
            try {
                entries.add(new CatalogIndexEntry(
                        Double.parseDouble(parts[0].trim()),
                        Double.parseDouble(parts[1].trim()),
                        Double.parseDouble(parts[2].trim()),
                        files.get(i)));
            } catch (NumberFormatException e) {
                throw new TableReadException(
                        String.format("INDEX row %d of %s is not numeric: '%s'", i + 1, file, indices.get(i)), e, file);
            }
        }
        return new CatalogIndex(grid, directory, entries);
    }

    /**
     * Splits entries around {@code target} on one parameter. The upper list holds the entries at
     * the smallest value {@code >= target}, the lower list those at the largest value
     * {@code <= target}.
     */
    static Bracket bracket(List<CatalogIndexEntry> entries, CatalogParameter parameter, double target, CatalogGrid grid) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double upper = Double.POSITIVE_INFINITY;
        double lower = Double.NEGATIVE_INFINITY;
        for (CatalogIndexEntry entry : entries) {
            double v = entry.parameter(parameter);
            min = Math.min(min, v);
            max = Math.max(max, v);
            if (v >= target) {
                upper = Math.min(upper, v);
            }
            if (v <= target) {
                lower = Math.max(lower, v);
            }
        }
        String gridName = grid.gridName();
        if (upper == Double.POSITIVE_INFINITY) {
            throw new ParameterOutOfBoundsException(
                    String.format("Parameter '%s' exceeds data. Max allowed=%s, entered=%s.",
                            parameter.label(), max, target),
                    gridName);
        }
        if (lower == Double.NEGATIVE_INFINITY) {
            throw new ParameterOutOfBoundsException(
                    String.format("Parameter '%s' exceeds data. Min allowed=%s, entered=%s.",
                            parameter.label(), min, target),
                    gridName);
        }

        List<CatalogIndexEntry> upperList = new ArrayList<>();
        List<CatalogIndexEntry> lowerList = new ArrayList<>();
        for (CatalogIndexEntry entry : entries) {
            double v = entry.parameter(parameter);
            if (v >= target && v <= upper) {
                upperList.add(entry);
            }
            if (v >= lower && v <= target) {
                lowerList.add(entry);
            }
        }
        return new Bracket(upperList, lowerList, upper, lower);
    }

    private SourceSpectrum blendGravity(
            Bracket gravity, double logG, CatalogIndex index, Map<CatalogIndexEntry, SourceSpectrum> corners) {
        SourceSpectrum upper = corner(gravity.upper().get(0), index, corners);
        SourceSpectrum lower = corner(gravity.lower().get(0), index, corners);
        return blend(upper, gravity.upperValue(), lower, gravity.lowerValue(), logG);
    }

    /** {@code a·upper + (1−a)·lower}, {@code a = (target − lower)/(upper − lower)}. */
    static SourceSpectrum blend(
            SourceSpectrum upper, double upperValue, SourceSpectrum lower, double lowerValue, double target) {
        if (upperValue == lowerValue) {
            return upper;
        }
        double a = (target - lowerValue) / (upperValue - lowerValue);
        return upper.times(a).plus(lower.times(1.0 - a));
    }

    private SourceSpectrum corner(
            CatalogIndexEntry entry, CatalogIndex index, Map<CatalogIndexEntry, SourceSpectrum> corners) {
        SourceSpectrum loaded = corners.get(entry);
        if (loaded != null) {
            return loaded;
        }

        String reference = entry.fileReference();
        int bracket = reference.indexOf('[');
        String file = bracket < 0 ? reference : reference.substring(0, bracket);
        String column = bracket < 0 || !reference.endsWith("]")
                ? SourceSpectrum.FLUX
                : reference.substring(bracket + 1, reference.length() - 1);

        DataTable table = reader.read(Path.of(index.directory()).resolve(file).toString());
        SourceSpectrum spectrum = SourceSpectrum.fromTable(table, column);
        double total = spectrum.integrate();
        if (!(total > 0.0) || !Double.isFinite(total)) {
            throw new ParameterOutOfBoundsException(
                    "Parameter '" + entry + "' has no valid data.", index.grid().gridName());
        }
        corners.put(entry, spectrum);
        return spectrum;
    }

    /** Result of one bisection. */
    record Bracket(List<CatalogIndexEntry> upper, List<CatalogIndexEntry> lower, double upperValue, double lowerValue) {}
}
