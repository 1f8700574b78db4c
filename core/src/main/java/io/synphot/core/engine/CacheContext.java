package io.synphot.core.engine;

import io.synphot.core.catalog.CatalogIndex;
import io.synphot.core.obsmode.Component;
import io.synphot.core.obsmode.ComponentTable;
import io.synphot.core.obsmode.DetectorTable;
import io.synphot.core.obsmode.GraphTable;
import io.synphot.core.obsmode.ThermalComponent;
import io.synphot.core.obsmode.WaveCatalog;
import io.synphot.core.spectrum.ReddeningLaw;
import io.synphot.core.spectrum.SourceSpectrum;
import java.util.List;

/**
 * All process-wide caches of one engine. Tables are keyed by resolved file name, components by
 * {@link ComponentKey}. Passing a context explicitly keeps engines with different data roots
 * apart.
 */
public final class CacheContext {

    private final MemoCache<String, GraphTable> graphTables = new MemoCache<>("graphTables");
    private final MemoCache<String, ComponentTable> componentTables = new MemoCache<>("componentTables");
    private final MemoCache<String, ComponentTable> thermalTables = new MemoCache<>("thermalTables");
    private final MemoCache<ComponentKey, Component> components = new MemoCache<>("components");
    private final MemoCache<ThermalKey, ThermalComponent> thermalComponents = new MemoCache<>("thermalComponents");
    private final MemoCache<String, CatalogIndex> catalogIndices = new MemoCache<>("catalogIndices");
    private final MemoCache<String, ReddeningLaw> reddeningLaws = new MemoCache<>("reddeningLaws");
    private final MemoCache<String, SourceSpectrum> vega = new MemoCache<>("vega");
    private final MemoCache<String, WaveCatalog> waveCatalogs = new MemoCache<>("waveCatalogs");
    private final MemoCache<String, double[]> binsets = new MemoCache<>("binsets");
    private final MemoCache<String, DetectorTable> detectorTables = new MemoCache<>("detectorTables");

    public MemoCache<String, GraphTable> graphTables() {
        return graphTables;
    }

    public MemoCache<String, ComponentTable> componentTables() {
        return componentTables;
    }

    public MemoCache<String, ComponentTable> thermalTables() {
        return thermalTables;
    }

    public MemoCache<ComponentKey, Component> components() {
        return components;
    }

    public MemoCache<ThermalKey, ThermalComponent> thermalComponents() {
        return thermalComponents;
    }

    public MemoCache<String, CatalogIndex> catalogIndices() {
        return catalogIndices;
    }

    public MemoCache<String, ReddeningLaw> reddeningLaws() {
        return reddeningLaws;
    }

    public MemoCache<String, SourceSpectrum> vega() {
        return vega;
    }

    public MemoCache<String, WaveCatalog> waveCatalogs() {
        return waveCatalogs;
    }

    /** Binsets by wave catalog entry; callers must not modify the arrays. */
    public MemoCache<String, double[]> binsets() {
        return binsets;
    }

    public MemoCache<String, DetectorTable> detectorTables() {
        return detectorTables;
    }

    /** Empties every cache. */
    public void clearAll() {
        all().forEach(MemoCache::clear);
    }

    List<MemoCache<?, ?>> all() {
        return List.of(
                graphTables,
                componentTables,
                thermalTables,
                components,
                thermalComponents,
                catalogIndices,
                reddeningLaws,
                vega,
                waveCatalogs,
                binsets,
                detectorTables);
    }

    /** Key of a thermal component: optical file, thermal file, interpolation value. */
    public record ThermalKey(String throughputFile, String thermalFile, Double interpolationValue) {}
}
