package io.synphot.core.spectrum;

import io.synphot.core.error.SpectrumException;

/**
 * Pixel arithmetic over a detector wavelength set ("binset"). Bin centers are the binset
 * wavelengths; bin edges lie halfway between neighbouring centers, and the outer edges are
 * mirrored about the first and last center.
 *
 * <p>
 * Positions are measured as fractional edge indices: edge {@code i} is at index {@code i}, and
 * wavelengths between two edges interpolate linearly.
 */
public final class Binning {

    /** How a range that does not start or end on a bin edge is treated. */
    public enum Mode {
        /** Edges snap to the nearest bin edge. */
        ROUND,
        /** Only whole pixels inside the range count. */
        MIN,
        /** Partially covered pixels count in full. */
        MAX,
        /** No snapping; results may be fractional. */
        NONE
    }

    private Binning() {}

    /** Bin edges of ascending bin centers; one more edge than centers. */
    public static double[] binEdges(double[] centers) {
        if (centers.length < 2) {
            throw new SpectrumException("A binset needs at least two wavelengths, got " + centers.length);
        }
        double[] edges = new double[centers.length + 1];
        for (int i = 1; i < centers.length; i++) {
            edges[i] = (centers[i - 1] + centers[i]) / 2.0;
        }
        edges[0] = 2.0 * centers[0] - edges[1];
        edges[centers.length] = 2.0 * centers[centers.length - 1] - edges[centers.length - 1];
        return edges;
    }

    /**
     * Wavelength range covered by {@code npix} pixels centered on {@code cenwave}.
     *
     * @return {@code {lower, upper}}
     * @throws SpectrumException if {@code cenwave} or the resulting range falls outside the binset
     */
    public static double[] waveRange(double[] centers, double cenwave, int npix, Mode mode) {
        if (npix < 0) {
            throw new SpectrumException("Number of pixels must not be negative, got " + npix);
        }
        double[] edges = binEdges(centers);
        if (cenwave < edges[0] || cenwave > edges[edges.length - 1]) {
            throw new SpectrumException(String.format(
                    "Central wavelength %s is not within binset (min=%s, max=%s).",
                    cenwave, edges[0], edges[edges.length - 1]));
        }
        double center = edgeIndex(edges, cenwave);
        double lower = center - npix / 2.0;
        double upper = center + npix / 2.0;
        switch (mode) {
            case ROUND:
                lower = Math.rint(lower);
                upper = lower + npix;
                break;
            case MIN:
                lower = Math.ceil(lower);
                upper = Math.floor(upper);
                break;
            case MAX:
                lower = Math.floor(lower);
                upper = Math.ceil(upper);
                break;
            default:
                break;
        }
        if (lower < 0 || upper > edges.length - 1) {
            throw new SpectrumException(String.format(
                    "%d pixels around %s exceed the binset (min=%s, max=%s).",
                    npix, cenwave, edges[0], edges[edges.length - 1]));
        }
        return new double[] {wavelengthAt(edges, lower), wavelengthAt(edges, upper)};
    }

    /**
     * Number of pixels between {@code lower} and {@code upper}.
     *
     * @throws SpectrumException if the range falls outside the binset
     */
    public static double pixelRange(double[] centers, double lower, double upper, Mode mode) {
        double[] edges = binEdges(centers);
        if (lower > upper) {
            double swap = lower;
            lower = upper;
            upper = swap;
        }
        if (lower < edges[0] || upper > edges[edges.length - 1]) {
            throw new SpectrumException(String.format(
                    "Wavelength range (%s, %s) is out of bounds of the binset (min=%s, max=%s).",
                    lower, upper, edges[0], edges[edges.length - 1]));
        }
        double from = edgeIndex(edges, lower);
        double to = edgeIndex(edges, upper);
        switch (mode) {
            case ROUND:
                return Math.rint(to) - Math.rint(from);
            case MIN:
                return Math.max(0.0, Math.floor(to) - Math.ceil(from));
            case MAX:
                return Math.ceil(to) - Math.floor(from);
            default:
                return to - from;
        }
    }

    private static double edgeIndex(double[] edges, double wavelength) {
        double[] indices = new double[edges.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        return Sampling.interpClamped(wavelength, edges, indices);
    }

    private static double wavelengthAt(double[] edges, double index) {
        int lo = (int) Math.floor(index);
        if (lo >= edges.length - 1) {
            return edges[edges.length - 1];
        }
        return edges[lo] + (index - lo) * (edges[lo + 1] - edges[lo]);
    }
}
