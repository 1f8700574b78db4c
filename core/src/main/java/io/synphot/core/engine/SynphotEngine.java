package io.synphot.core.engine;

import io.synphot.core.catalog.CatalogInterpolator;
import io.synphot.core.error.AmbiguousObsmodeException;
import io.synphot.core.error.SpectrumException;
import io.synphot.core.lang.AstNode;
import io.synphot.core.lang.Interpreter;
import io.synphot.core.lang.Parser;
import io.synphot.core.model.GraphValidationReport;
import io.synphot.core.model.SynphotSettings;
import io.synphot.core.obsmode.Component;
import io.synphot.core.obsmode.ComponentSource;
import io.synphot.core.obsmode.ComponentTable;
import io.synphot.core.obsmode.DetectorTable;
import io.synphot.core.obsmode.GraphTable;
import io.synphot.core.obsmode.ObservationMode;
import io.synphot.core.obsmode.ObservationSpectralElement;
import io.synphot.core.obsmode.ThermalComponent;
import io.synphot.core.obsmode.ThermalSpectrum;
import io.synphot.core.obsmode.WaveCatalog;
import io.synphot.core.spectrum.ExtinctionCurve;
import io.synphot.core.spectrum.ReddeningLaw;
import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spectrum.SpectralElement;
import io.synphot.core.spectrum.Spectrum;
import io.synphot.core.spectrum.ThermalElement;
import io.synphot.core.spi.SpectralResources;
import io.synphot.core.spi.TableReader;
import io.synphot.core.table.CsvTableReader;
import io.synphot.core.table.PathResolver;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for synthetic photometry: evaluates expressions, resolves observation modes and
 * interpolates catalog grids against one data root.
 *
 * <p>
 * Thread-safe. Tables, components, catalog indices, reddening laws and the Vega spectrum are
 * loaded once per engine and kept in its {@link CacheContext} until {@link #resetCaches()}.
 * The graph, component and thermal tables are looked up by glob; the file that sorts last wins.
 */
public final class SynphotEngine implements SpectralResources {

    private static final Logger LOG = LoggerFactory.getLogger(SynphotEngine.class);

    private final SynphotSettings settings;
    private final PathResolver resolver;
    private final TableReader reader;
    private final SpectrumLoader loader;
    private final CacheContext caches = new CacheContext();
    private final CatalogInterpolator catalog;
    private final ComponentSource componentSource = new CachedComponentSource();

    public SynphotEngine(SynphotSettings settings) {
        this(settings, new CsvTableReader(), System::getenv);
    }

    /**
     * @param envLookup environment lookup for {@code $VAR/file} references
     */
    public SynphotEngine(SynphotSettings settings, TableReader reader, Function<String, String> envLookup) {
        this.settings = settings;
        this.reader = reader;
        this.resolver = new PathResolver(settings.rootDir(), settings.shortcuts(), envLookup);
        this.loader = new SpectrumLoader(resolver, reader);
        this.catalog = new CatalogInterpolator(resolver, reader, caches.catalogIndices());
        LOG.debug("Synphot engine created: root={}, graph={}, comp={}",
                settings.rootDir(), settings.graphTable(), settings.compTable());
    }

    /**
     * Evaluates a synphot expression such as {@code rn(bb(5000),band(v),17,vegamag)}.
     *
     * @throws io.synphot.core.error.SynphotException on any failure; subclasses name the cause
     */
    public Spectrum parseSpec(String expression) {
        AstNode tree = Parser.parse(expression);
        return new Interpreter(this, expression).interpret(tree);
    }

    public GraphTable graphTable() {
        String file = resolver.latest(settings.graphTable());
        return caches.graphTables().get(file, f -> GraphTable.fromTable(reader.read(f)));
    }

    public ComponentTable componentTable() {
        String file = resolver.latest(settings.compTable());
        return caches.componentTables().get(file, f -> ComponentTable.fromTable(reader.read(f)));
    }

    public ComponentTable thermalTable() {
        String file = resolver.latest(settings.thermTable());
        return caches.thermalTables().get(file, f -> ComponentTable.fromTable(reader.read(f)));
    }

    /**
     * Resolves an observation mode against the current graph and component tables, with its
     * binset from the wave catalog and its pixel scale from the detector table when those
     * tables exist.
     */
    public ObservationMode observationMode(String obsmode) {
        ObservationMode mode =
                ObservationMode.resolve(obsmode, graphTable(), componentTable(), componentSource, settings.area());
        String entry = binsetEntry(mode.obsmode());
        double[] binset = entry == null ? null : caches.binsets().get(entry, this::loadBinset);
        Double pixelScale = detectorTable().flatMap(t -> t.pixelScale(mode.obsmode())).orElse(null);
        return mode.withDetectorData(entry, binset, pixelScale);
    }

    /** The wave catalog, or empty when the configured file does not exist. */
    public Optional<WaveCatalog> waveCatalog() {
        return existingTable(settings.wavecatFile())
                .map(file -> caches.waveCatalogs().get(file, f -> WaveCatalog.fromTable(reader.read(f))));
    }

    /** The detector pixel scale table, or empty when the configured file does not exist. */
    public Optional<DetectorTable> detectorTable() {
        return existingTable(settings.detectorFile())
                .map(file -> caches.detectorTables().get(file, f -> DetectorTable.fromTable(reader.read(f))));
    }

    @Override
    public ObservationSpectralElement band(String obsmode) {
        return observationMode(obsmode).throughput();
    }

    /** Optical and thermal components of an observation mode. */
    public List<ThermalComponent> thermalComponents(String obsmode) {
        return observationMode(obsmode).thermalComponents(componentTable(), thermalTable(), componentSource);
    }

    /**
     * Thermal emission of an observation mode in PHOTLAM per square arcsecond.
     *
     * @throws io.synphot.core.error.SpectrumException if the mode has no thermal components
     */
    public SourceSpectrum thermalSpectrum(String obsmode) {
        return thermalSpectrum(observationMode(obsmode));
    }

    /**
     * Thermal background count rate in counts/s/pixel, over the mode's primary area.
     *
     * @throws io.synphot.core.error.SpectrumException if the pixel scale is unknown or the mode
     *     has no thermal components
     */
    public double thermback(String obsmode) {
        ObservationMode mode = observationMode(obsmode);
        return thermback(mode, mode.primaryArea());
    }

    /** Thermal background count rate in counts/s/pixel over {@code area} cm². */
    public double thermback(String obsmode, double area) {
        return thermback(observationMode(obsmode), area);
    }

    private double thermback(ObservationMode mode, double area) {
        double scale = mode.pixelScale()
                .orElseThrow(() -> new SpectrumException(
                        "Undefined pixel scale for " + mode.obsmode() + ".", mode.obsmode()));
        return thermalSpectrum(mode).integrate() * scale * scale * area;
    }

    private SourceSpectrum thermalSpectrum(ObservationMode mode) {
        List<ThermalComponent> components = mode.thermalComponents(componentTable(), thermalTable(), componentSource);
        return ThermalSpectrum.compute(mode.obsmode(), components, ThermalSpectrum.DEFAULT_WAVESET, vega().waveset());
    }

    /** Reachability and loop report for the current graph table. */
    public GraphValidationReport validateGraph() {
        return graphTable().validate();
    }

    @Override
    public Spectrum load(String reference) {
        return loader.load(reference);
    }

    @Override
    public SourceSpectrum loadSource(String reference) {
        return loader.loadSource(reference);
    }

    @Override
    public SpectralElement loadElement(String reference) {
        return loader.loadElement(reference);
    }

    @Override
    public SourceSpectrum catalogSpectrum(String grid, double tEff, double metallicity, double logG) {
        return catalog.gridToSpectrum(grid, tEff, metallicity, logG);
    }

    @Override
    public ExtinctionCurve extinction(String law, double ebv) {
        String file = Path.of(resolver.resolve(settings.extinctionDir())).resolve(law + ".csv").toString();
        ReddeningLaw reddening = caches.reddeningLaws().get(file, f -> ReddeningLaw.fromTable(law, reader.read(f)));
        return reddening.extinctionCurve(ebv);
    }

    @Override
    public SourceSpectrum vega() {
        return caches.vega().get(settings.vegaFile(), loader::loadSource);
    }

    @Override
    public double area() {
        return settings.area();
    }

    public SynphotSettings settings() {
        return settings;
    }

    public CatalogInterpolator catalog() {
        return catalog;
    }

    public CacheContext caches() {
        return caches;
    }

    /** Drops every cached table and spectrum; the next call reloads from disk. */
    public void resetCaches() {
        caches.clearAll();
        LOG.info("Synphot caches cleared");
    }

    private String binsetEntry(String obsmode) {
        Optional<WaveCatalog> catalog = waveCatalog();
        if (catalog.isEmpty()) {
            return null;
        }
        try {
            return catalog.get().entryFor(obsmode).orElse(null);
        } catch (AmbiguousObsmodeException e) {
            LOG.warn("No binset for {}: {}", obsmode, e.getMessage());
            return null;
        }
    }

    private double[] loadBinset(String entry) {
        if (WaveCatalog.isParameterString(entry)) {
            return WaveCatalog.wavesetFromParameters(entry);
        }
        return reader.read(resolver.resolve(entry)).doubles(Spectrum.WAVELENGTH);
    }

    private Optional<String> existingTable(String reference) {
        String file = resolver.latest(reference);
        if (!Files.isRegularFile(Path.of(file))) {
            LOG.debug("Optional table {} not found at {}", reference, file);
            return Optional.empty();
        }
        return Optional.of(file);
    }

    private final class CachedComponentSource implements ComponentSource {

        @Override
        public Component component(String file, Double interpolationValue) {
            if (ComponentTable.CLEAR.equals(file)) {
                return Component.clear();
            }
            return caches.components()
                    .get(new ComponentKey(file, interpolationValue),
                            k -> new Component(file, loader.loadThroughput(file, interpolationValue)));
        }

        @Override
        public ThermalComponent thermalComponent(String throughputFile, String thermalFile, Double interpolationValue) {
            boolean opticalClear = ComponentTable.CLEAR.equals(throughputFile);
            boolean thermalClear = ComponentTable.CLEAR.equals(thermalFile);
            if (opticalClear && thermalClear) {
                return new ThermalComponent(throughputFile, thermalFile, null, null);
            }
            return caches.thermalComponents()
                    .get(new CacheContext.ThermalKey(throughputFile, thermalFile, interpolationValue), k -> {
                        SpectralElement throughput =
                                opticalClear ? null : loader.loadThroughput(throughputFile, interpolationValue);
                        ThermalElement emissivity =
                                thermalClear ? null : loader.loadEmissivity(thermalFile, interpolationValue);
                        return new ThermalComponent(throughputFile, thermalFile, throughput, emissivity);
                    });
        }
    }
}
