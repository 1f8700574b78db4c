package io.synphot.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of walking a graph table for one observation mode.
 *
 * @param obsmode    the normalized mode string (lower case, no blanks)
 * @param optical    optical component names in traversal order
 * @param thermal    thermal component names in traversal order
 * @param parameters component name → interpolation value, from {@code name#value} keywords
 * @param steps      per-node optical/thermal pairs, including steps that contribute neither
 * @param graphTable the graph table the path was resolved against
 */
public record ResolvedModePath(
        String obsmode,
        List<String> optical,
        List<String> thermal,
        Map<String, Double> parameters,
        List<Step> steps,
        String graphTable) {

    public ResolvedModePath {
        optical = List.copyOf(optical);
        thermal = List.copyOf(thermal);
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        steps = List.copyOf(steps);
    }

    /** Interpolation value for a component, or {@code null} if the mode supplied none. */
    public Double parameter(String component) {
        return parameters.get(component);
    }

    /**
     * One traversed node: the optical and thermal component names it contributed. Either may
     * be {@code null}.
     */
    public record Step(String opticalComponent, String thermalComponent) {}
}
