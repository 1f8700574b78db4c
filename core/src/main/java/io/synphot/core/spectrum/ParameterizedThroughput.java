package io.synphot.core.spectrum;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.table.DataTable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Throughput of a parameterized component (for example an MJD-dependent detector or a ramp
 * filter), interpolated between table columns named {@code PREFIX#value}.
 *
 * <p>
 * Header keywords: {@code PARAMS = WAVELENGTH} shifts the bracketing curves to the requested
 * wavelength before blending them; {@code EXTRAP = T} allows linear extrapolation beyond the
 * outermost columns. Without extrapolation an out-of-range value falls back to the
 * {@code THROUGHPUT} column and the result carries the {@value #DEFAULT_THROUGHPUT_WARNING}
 * warning.
 */
public final class ParameterizedThroughput {

    public static final String DEFAULT_THROUGHPUT_WARNING = "DefaultThroughput";

    private static final Logger LOG = LoggerFactory.getLogger(ParameterizedThroughput.class);

    private ParameterizedThroughput() {}

    /**
     * Interpolates the throughput for {@code value}.
     *
     * @param table        component table with {@code WAVELENGTH} and {@code prefix...} columns
     * @param columnPrefix column prefix including the trailing {@code #}, case-insensitive
     * @param value        parameter value to interpolate at
     */
    public static SpectralElement interpolate(DataTable table, String columnPrefix, double value) {
        String prefix = columnPrefix.toUpperCase(Locale.ROOT);
        List<Column> columns = new ArrayList<>();
        for (String name : table.columnNames()) {
            String upper = name.toUpperCase(Locale.ROOT);
            if (upper.startsWith(prefix)) {
                try {
                    columns.add(new Column(name, Double.parseDouble(upper.substring(prefix.length()))));
                } catch (NumberFormatException e) {
                    throw new SpectrumException(
                            "Column " + name + " of " + table.source() + " has no numeric parameter",
                            e,
                            table.source());
                }
            }
        }
        if (columns.isEmpty()) {
            throw new SpectrumException(
                    table.source() + " has no columns for parameter " + columnPrefix, table.source());
        }
        columns.sort(Comparator.comparingDouble(Column::parameter));

        double[] wavelengths = table.doubles(Spectrum.WAVELENGTH);
        String tag = table.source() + "#" + Formats.compact(value);

        for (Column column : columns) {
            if (column.parameter() == value) {
                return element(wavelengths, table.doubles(column.name()), tag, Map.of());
            }
        }

        Column first = columns.get(0);
        Column last = columns.get(columns.size() - 1);
        if (value > first.parameter() && value < last.parameter()) {
            int upper = 1;
            while (columns.get(upper).parameter() < value) {
                upper++;
            }
            Column lo = columns.get(upper - 1);
            Column hi = columns.get(upper);
            boolean shift = "WAVELENGTH".equalsIgnoreCase(trimmed(table.keyword("PARAMS")));
            return element(
                    wavelengths,
                    blend(wavelengths, table.doubles(lo.name()), lo.parameter(),
                            table.doubles(hi.name()), hi.parameter(), value, shift),
                    tag,
                    Map.of());
        }

        if (isTrue(table.keyword("EXTRAP"))) {
            if (columns.size() < 2) {
                throw new SpectrumException(
                        "Cannot extrapolate " + table.source() + ": only one parameter column", table.source());
            }
            Column a = value < first.parameter() ? first : columns.get(columns.size() - 2);
            Column b = value < first.parameter() ? columns.get(1) : last;
            return element(
                    wavelengths,
                    extrapolate(table.doubles(a.name()), a.parameter(), table.doubles(b.name()), b.parameter(), value),
                    tag,
                    Map.of());
        }

        if (table.hasColumn(SpectralElement.THROUGHPUT)) {
            String message = String.format(
                    "Parameter value %s is outside the columns of %s; using default THROUGHPUT",
                    Formats.compact(value), table.source());
            LOG.warn(message);
            return element(
                    wavelengths,
                    table.doubles(SpectralElement.THROUGHPUT),
                    tag,
                    Map.of(DEFAULT_THROUGHPUT_WARNING, message));
        }
        throw new SpectrumException(
                String.format(
                        "Parameter value %s is outside the range of %s and there is no default THROUGHPUT",
                        Formats.compact(value), table.source()),
                table.source());
    }

    private static double[] blend(
            double[] wavelengths,
            double[] lower,
            double lowerPar,
            double[] upper,
            double upperPar,
            double value,
            boolean shift) {
        if (shift) {
            lower = shifted(wavelengths, lower, value - lowerPar);
            upper = shifted(wavelengths, upper, value - upperPar);
        }
        double fraction = (value - lowerPar) / (upperPar - lowerPar);
        double[] out = new double[wavelengths.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = lower[i] + fraction * (upper[i] - lower[i]);
        }
        return out;
    }

    /** Curve moved by {@code delta} Å, resampled on the original grid with clamped ends. */
    private static double[] shifted(double[] wavelengths, double[] values, double delta) {
        double[] moved = new double[wavelengths.length];
        for (int i = 0; i < moved.length; i++) {
            moved[i] = wavelengths[i] + delta;
        }
        double[] out = new double[wavelengths.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Sampling.interpClamped(wavelengths[i], moved, values);
        }
        return out;
    }

    private static double[] extrapolate(double[] a, double parA, double[] b, double parB, double value) {
        double[] out = new double[a.length];
        for (int i = 0; i < out.length; i++) {
            double slope = (b[i] - a[i]) / (parB - parA);
            out[i] = a[i] + slope * (value - parA);
        }
        return out;
    }

    private static SpectralElement element(
            double[] wavelengths, double[] throughput, String tag, Map<String, String> warnings) {
        return new SpectralElement(new SpectralModel.Empirical(wavelengths, throughput), tag, warnings);
    }

    private static boolean isTrue(String flag) {
        String value = trimmed(flag);
        return "T".equalsIgnoreCase(value) || "TRUE".equalsIgnoreCase(value);
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    private record Column(String name, double parameter) {}
}
