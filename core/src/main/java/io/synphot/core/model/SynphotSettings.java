package io.synphot.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Engine settings: where the reference data lives and which tables to use.
 *
 * <p>
 * Table references may use path shortcuts ({@code mtab$...}) and globs; a glob resolves to the
 * matching file that sorts last, so {@code mtab$*_tmg.csv} picks the newest graph table.
 *
 * @param rootDir       data root directory ({@code crrefer$})
 * @param graphTable    graph table reference
 * @param compTable     optical component table reference
 * @param thermTable    thermal component table reference
 * @param area          telescope collecting area in cm², used when the graph table has no
 *                      {@code PRIMAREA} keyword and for count-based renormalization
 * @param vegaFile      Vega spectrum reference, used for {@code vegamag}
 * @param extinctionDir directory reference holding reddening-law tables
 * @param wavecatFile   wave catalog reference (detector wavelength sets); optional on disk
 * @param detectorFile  detector pixel scale table reference; optional on disk
 * @param shortcuts     path shortcut name → directory relative to {@code rootDir}
 */
public record SynphotSettings(
        String rootDir,
        String graphTable,
        String compTable,
        String thermTable,
        double area,
        String vegaFile,
        String extinctionDir,
        String wavecatFile,
        String detectorFile,
        Map<String, String> shortcuts) {

    public static final double DEFAULT_AREA = 45238.93416;

    public SynphotSettings {
        Objects.requireNonNull(rootDir, "rootDir");
        Objects.requireNonNull(graphTable, "graphTable");
        Objects.requireNonNull(compTable, "compTable");
        Objects.requireNonNull(thermTable, "thermTable");
        Objects.requireNonNull(vegaFile, "vegaFile");
        Objects.requireNonNull(extinctionDir, "extinctionDir");
        Objects.requireNonNull(wavecatFile, "wavecatFile");
        Objects.requireNonNull(detectorFile, "detectorFile");
        if (!(area > 0)) {
            throw new IllegalArgumentException("area must be positive, got " + area);
        }
        shortcuts = Map.copyOf(shortcuts);
    }

    /** Shortcut table used when none is configured. */
    public static Map<String, String> defaultShortcuts() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("crcalspec", "calspec");
        defaults.put("crgridck04", "grid/ck04models");
        defaults.put("crgridk93", "grid/k93models");
        defaults.put("crgridphoenix", "grid/phoenix");
        defaults.put("mtab", "mtab");
        defaults.put("crextinction", "extinction");
        return defaults;
    }

    public static SynphotSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .rootDir(rootDir)
                .graphTable(graphTable)
                .compTable(compTable)
                .thermTable(thermTable)
                .area(area)
                .vegaFile(vegaFile)
                .extinctionDir(extinctionDir)
                .wavecatFile(wavecatFile)
                .detectorFile(detectorFile)
                .shortcuts(shortcuts);
    }

    /** Builder with the stock defaults filled in. */
    public static final class Builder {
        private String rootDir = ".";
        private String graphTable = "mtab$*_tmg.csv";
        private String compTable = "mtab$*_tmc.csv";
        private String thermTable = "mtab$*_tmt.csv";
        private double area = DEFAULT_AREA;
        private String vegaFile = "crcalspec$alpha_lyr_stis_010.csv";
        private String extinctionDir = "crextinction$";
        private String wavecatFile = "mtab$wavecat.csv";
        private String detectorFile = "mtab$detectors.csv";
        private final Map<String, String> shortcuts = defaultShortcuts();

        private Builder() {}

        public Builder rootDir(String rootDir) {
            this.rootDir = rootDir;
            return this;
        }

        public Builder graphTable(String graphTable) {
            this.graphTable = graphTable;
            return this;
        }

        public Builder compTable(String compTable) {
            this.compTable = compTable;
            return this;
        }

        public Builder thermTable(String thermTable) {
            this.thermTable = thermTable;
            return this;
        }

        public Builder area(double area) {
            this.area = area;
            return this;
        }

        public Builder vegaFile(String vegaFile) {
            this.vegaFile = vegaFile;
            return this;
        }

        public Builder extinctionDir(String extinctionDir) {
            this.extinctionDir = extinctionDir;
            return this;
        }

        public Builder wavecatFile(String wavecatFile) {
            this.wavecatFile = wavecatFile;
            return this;
        }

        public Builder detectorFile(String detectorFile) {
            this.detectorFile = detectorFile;
            return this;
        }

        /** Adds or replaces shortcuts; defaults not named here are kept. */
        public Builder shortcuts(Map<String, String> shortcuts) {
            this.shortcuts.putAll(shortcuts);
            return this;
        }

        public Builder shortcut(String name, String directory) {
            this.shortcuts.put(name, directory);
            return this;
        }

        public SynphotSettings build() {
            return new SynphotSettings(
                    rootDir,
                    graphTable,
                    compTable,
                    thermTable,
                    area,
                    vegaFile,
                    extinctionDir,
                    wavecatFile,
                    detectorFile,
                    shortcuts);
        }
    }
}
