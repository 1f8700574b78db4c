package io.synphot.core.obsmode;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.model.ResolvedModePath;
import io.synphot.core.spectrum.SpectralElement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An observation mode resolved against a graph table and a component table: the traversal
 * result, the component files it names and the loaded non-clear components.
 *
 * <p>
 * Components whose file reference ends in {@code [key#]} are interpolated at the value the
 * traversal recorded for that component (for example {@code mjd#54000} on the node that chose
 * it). A mode may also carry a detector wavelength set ("binset") from the wave catalog and a
 * detector pixel scale.
 */
public final class ObservationMode {

    private static final Pattern PARAMETER_KEY = Pattern.compile("\\[(\\w+)#]$");

    private final ModeKeywords keywords;
    private final ResolvedModePath path;
    private final List<String> throughputFiles;
    private final List<Component> components;
    private final double primaryArea;
    private final String componentTable;
    private final String binsetName;
    private final double[] binset;
    private final Double pixelScale;

    private ObservationMode(
            ModeKeywords keywords,
            ResolvedModePath path,
            List<String> throughputFiles,
            List<Component> components,
            double primaryArea,
            String componentTable,
            String binsetName,
            double[] binset,
            Double pixelScale) {
        this.keywords = keywords;
        this.path = path;
        this.throughputFiles = List.copyOf(throughputFiles);
        this.components = List.copyOf(components);
        this.primaryArea = primaryArea;
        this.componentTable = componentTable;
        this.binsetName = binsetName;
        this.binset = binset == null ? null : binset.clone();
        this.pixelScale = pixelScale;
    }

    /**
     * Resolves a mode.
     *
     * @param defaultArea collecting area used when the graph table has no {@code PRIMAREA}
     */
    public static ObservationMode resolve(
            String obsmode, GraphTable graph, ComponentTable optical, ComponentSource source, double defaultArea) {
        ModeKeywords keywords = ModeKeywords.parse(obsmode);
        ResolvedModePath path = graph.traverse(keywords);
        List<String> files = optical.filenames(path.optical());

        List<Component> components = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            String file = files.get(i);
            Component component = source.component(file, interpolationValue(file, path.optical().get(i), path));
            if (!component.isEmpty()) {
                components.add(component);
            }
        }
        double area = graph.primaryArea().orElse(defaultArea);
        return new ObservationMode(keywords, path, files, components, area, optical.name(), null, null, null);
    }

    /**
     * Copy of this mode with its detector data.
     *
     * @param binsetName wave catalog entry the binset came from, or {@code null}
     * @param binset     detector wavelengths, or {@code null} when the catalog has none
     * @param pixelScale arcsec per pixel, or {@code null} when unknown
     */
    public ObservationMode withDetectorData(String binsetName, double[] binset, Double pixelScale) {
        return new ObservationMode(
                keywords, path, throughputFiles, components, primaryArea, componentTable, binsetName, binset,
                pixelScale);
    }

    /** Parameter key of a {@code file[key#]} reference, or {@code null}. */
    static String parameterKey(String file) {
        Matcher m = PARAMETER_KEY.matcher(file);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : null;
    }

    private static Double interpolationValue(String file, String componentName, ResolvedModePath path) {
        return parameterKey(file) == null ? null : path.parameter(componentName);
    }

    /** Normalized mode string. */
    public String obsmode() {
        return keywords.obsmode();
    }

    public ModeKeywords keywords() {
        return keywords;
    }

    public ResolvedModePath path() {
        return path;
    }

    /** Component file references in traversal order, {@code clear} entries included. */
    public List<String> throughputFiles() {
        return throughputFiles;
    }

    /** Loaded components, clear ones excluded. */
    public List<Component> components() {
        return components;
    }

    public double primaryArea() {
        return primaryArea;
    }

    /**
     * Product of all component throughputs.
     *
     * @throws SpectrumException if every component is clear
     */
    public ObservationSpectralElement throughput() {
        if (components.isEmpty()) {
            throw new SpectrumException(obsmode() + " has no throughput.", obsmode());
        }
        SpectralElement product = components.get(0).throughput();
        Map<String, String> warnings = new LinkedHashMap<>(product.warnings());
        for (Component component : components.subList(1, components.size())) {
            product = product.times(component.throughput());
            warnings.putAll(component.throughput().warnings());
        }
        return new ObservationSpectralElement(product.model(), obsmode(), warnings, this);
    }

    /**
     * Thermal view of the mode: for every traversal step that names a component, its optical
     * file paired with its thermal file from {@code thermalTable}.
     *
     * @throws SpectrumException if no step has a thermal component
     */
    public List<ThermalComponent> thermalComponents(
            ComponentTable optical, ComponentTable thermalTable, ComponentSource source) {
        List<String> opticalNames = new ArrayList<>();
        List<String> opticalFiles = new ArrayList<>();
        List<String> thermalFiles = new ArrayList<>();
        for (ResolvedModePath.Step step : path.steps()) {
            if (step.opticalComponent() == null && step.thermalComponent() == null) {
                continue;
            }
            opticalNames.add(step.opticalComponent());
            opticalFiles.add(optical.filename(step.opticalComponent()));
            thermalFiles.add(thermalTable.filename(step.thermalComponent()));
        }
        if (thermalFiles.stream().allMatch(ComponentTable.CLEAR::equals)) {
            throw new SpectrumException("No thermal support provided for " + obsmode(), obsmode());
        }

        List<ThermalComponent> result = new ArrayList<>();
        for (int i = 0; i < opticalFiles.size(); i++) {
            String file = opticalFiles.get(i);
            ThermalComponent component = source.thermalComponent(
                    file, thermalFiles.get(i), interpolationValue(file, opticalNames.get(i), path));
            if (!component.isEmpty()) {
                result.add(component);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /** Listing of the non-clear throughput files, like IRAF {@code showfiles}. */
    public String showFiles() {
        StringBuilder sb = new StringBuilder("#Throughput table names:");
        for (String file : throughputFiles) {
            if (!ComponentTable.CLEAR.equals(file)) {
                sb.append('\n').append(file);
            }
        }
        return sb.toString();
    }

    public String componentTable() {
        return componentTable;
    }

    /** Wave catalog entry (file reference or parameter string) of the binset, if any. */
    public Optional<String> binsetName() {
        return Optional.ofNullable(binsetName);
    }

    /** Detector wavelengths, or {@code null} when the wave catalog has no entry for this mode. */
    public double[] binset() {
        return binset == null ? null : binset.clone();
    }

    /** Detector pixel scale in arcsec per pixel. */
    public Optional<Double> pixelScale() {
        return Optional.ofNullable(pixelScale);
    }

    @Override
    public String toString() {
        return obsmode();
    }
}
