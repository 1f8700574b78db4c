package io.synphot.core.engine;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.spectrum.ParameterizedThroughput;
import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spectrum.SpectralElement;
import io.synphot.core.spectrum.Spectrum;
import io.synphot.core.spectrum.ThermalElement;
import io.synphot.core.spi.TableReader;
import io.synphot.core.table.DataTable;
import io.synphot.core.table.PathResolver;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns file references into spectra.
 *
 * <p>
 * A reference is a path, optionally with a {@code $VAR/} or {@code dir$} prefix, optionally
 * followed by a column selector: {@code file.csv[FLUX2]} reads column {@code FLUX2},
 * {@code file.csv[mjd#]} marks a parameterized throughput table.
 */
public final class SpectrumLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SpectrumLoader.class);

    private static final Pattern SELECTOR = Pattern.compile("^(.*)\\[([^\\[\\]]+)]$");

    private final PathResolver resolver;
    private final TableReader reader;

    public SpectrumLoader(PathResolver resolver, TableReader reader) {
        this.resolver = resolver;
        this.reader = reader;
    }

    /**
     * Source spectrum when the table has a flux column, spectral element when it has a
     * throughput column.
     */
    public Spectrum load(String reference) {
        Reference ref = Reference.parse(reference);
        DataTable table = read(ref);
        if (ref.column() != null) {
            return table.hasColumn(SourceSpectrum.FLUX)
                    ? SourceSpectrum.fromTable(table, ref.column())
                    : SpectralElement.fromTable(table, ref.column());
        }
        if (table.hasColumn(SourceSpectrum.FLUX)) {
            return SourceSpectrum.fromTable(table, SourceSpectrum.FLUX);
        }
        if (table.hasColumn(SpectralElement.THROUGHPUT)) {
            return SpectralElement.fromTable(table, SpectralElement.THROUGHPUT);
        }
        throw new SpectrumException(
                table.source() + " has neither a FLUX nor a THROUGHPUT column", table.source());
    }

    public SourceSpectrum loadSource(String reference) {
        Reference ref = Reference.parse(reference);
        return SourceSpectrum.fromTable(read(ref), ref.columnOr(SourceSpectrum.FLUX));
    }

    public SpectralElement loadElement(String reference) {
        Reference ref = Reference.parse(reference);
        return SpectralElement.fromTable(read(ref), ref.columnOr(SpectralElement.THROUGHPUT));
    }

    /**
     * Throughput of a component file. A {@code [key#]} file is interpolated at
     * {@code interpolationValue}; without a value its {@code THROUGHPUT} column is used.
     */
    public SpectralElement loadThroughput(String reference, Double interpolationValue) {
        Reference ref = Reference.parse(reference);
        return loadCurve(ref, read(ref), interpolationValue, SpectralElement.THROUGHPUT);
    }

    /**
     * Emissivity of a thermal component file, read like {@link #loadThroughput}, with the
     * temperature from the table's {@code DEFT} keyword.
     */
    public ThermalElement loadEmissivity(String reference, Double interpolationValue) {
        Reference ref = Reference.parse(reference);
        DataTable table = read(ref);
        return ThermalElement.fromTable(table, loadCurve(ref, table, interpolationValue, ThermalElement.EMISSIVITY));
    }

    private SpectralElement loadCurve(Reference ref, DataTable table, Double interpolationValue, String defaultColumn) {
        if (ref.isParameterized()) {
            if (interpolationValue != null) {
                return ParameterizedThroughput.interpolate(table, ref.column(), interpolationValue);
            }
            LOG.debug("No value for parameterized {}; using {}", ref.file(), defaultColumn);
            return SpectralElement.fromTable(table, defaultColumn);
        }
        return SpectralElement.fromTable(table, ref.columnOr(defaultColumn));
    }

    private DataTable read(Reference ref) {
        return reader.read(resolver.resolve(ref.file()));
    }

    /** A file reference split into file and optional column selector. */
    record Reference(String file, String column) {

        static Reference parse(String reference) {
            Matcher m = SELECTOR.matcher(reference.trim());
            if (m.matches()) {
                return new Reference(m.group(1), m.group(2).trim());
            }
            return new Reference(reference.trim(), null);
        }

        boolean isParameterized() {
            return column != null && column.endsWith("#");
        }

        String columnOr(String fallback) {
            return column == null || isParameterized() ? fallback : column;
        }
    }
}
