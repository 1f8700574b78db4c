package io.synphot.core.engine;

/**
 * Cache key of a loaded component: its file reference and, for parameterized files, the value
 * it was interpolated at.
 */
public record ComponentKey(String file, Double interpolationValue) {

    public static ComponentKey of(String file) {
        return new ComponentKey(file, null);
    }
}
