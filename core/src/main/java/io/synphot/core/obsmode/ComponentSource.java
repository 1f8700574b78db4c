package io.synphot.core.obsmode;

/** Supplies (usually cached) components by file reference. */
public interface ComponentSource {

    /**
     * @param file               throughput file reference, possibly {@code file[key#]} or
     *                           {@code clear}
     * @param interpolationValue value for a parameterized file, or {@code null}
     */
    Component component(String file, Double interpolationValue);

    ThermalComponent thermalComponent(String throughputFile, String thermalFile, Double interpolationValue);
}
