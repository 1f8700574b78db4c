package io.synphot.core.spectrum;

import java.util.Arrays;

/** Numeric helpers over sampled wavelength sets. */
public final class Sampling {

    private Sampling() {}

    /**
     * Linear interpolation of {@code (xp, fp)} at {@code x}; {@code xp} ascending. Outside the
     * table the {@code left}/{@code right} fill values are returned.
     */
    public static double interp(double x, double[] xp, double[] fp, double left, double right) {
        int n = xp.length;
        if (n == 0 || x < xp[0]) {
            return left;
        }
        if (x > xp[n - 1]) {
            return right;
        }
        int hi = Arrays.binarySearch(xp, x);
        if (hi >= 0) {
            return fp[hi];
        }
        hi = -hi - 1;
        int lo = hi - 1;
        double t = (x - xp[lo]) / (xp[hi] - xp[lo]);
        return fp[lo] + t * (fp[hi] - fp[lo]);
    }

    /** Interpolation that holds the end values outside the table. */
    public static double interpClamped(double x, double[] xp, double[] fp) {
        return interp(x, xp, fp, fp[0], fp[fp.length - 1]);
    }

    /** Trapezoid-rule integral of {@code y} over {@code x}. */
    public static double trapezoid(double[] x, double[] y) {
        double sum = 0.0;
        for (int i = 0; i + 1 < x.length; i++) {
            sum += (x[i + 1] - x[i]) * (y[i] + y[i + 1]) / 2.0;
        }
        return sum;
    }

    /**
     * Sorted union of two wavelength sets with duplicates removed. A {@code null} set means
     * "undefined" and yields the other set.
     */
    public static double[] merge(double[] a, double[] b) {
        if (a == null) {
            return b == null ? null : b.clone();
        }
        if (b == null) {
            return a.clone();
        }
        double[] all = new double[a.length + b.length];
        System.arraycopy(a, 0, all, 0, a.length);
        System.arraycopy(b, 0, all, a.length, b.length);
        Arrays.sort(all);
        return Arrays.stream(all).distinct().toArray();
    }

    /** {@code num} points evenly spaced in log10 between {@code start} and {@code stop}. */
    public static double[] logspace(double start, double stop, int num) {
        double lo = Math.log10(start);
        double hi = Math.log10(stop);
        double[] out = new double[num];
        for (int i = 0; i < num; i++) {
            out[i] = Math.pow(10.0, lo + (hi - lo) * i / (num - 1));
        }
        return out;
    }

    /** {@code num} points evenly spaced between {@code start} and {@code stop}, inclusive. */
    public static double[] linspace(double start, double stop, int num) {
        double[] out = new double[num];
        for (int i = 0; i < num; i++) {
            out[i] = start + (stop - start) * i / (num - 1);
        }
        return out;
    }
}
