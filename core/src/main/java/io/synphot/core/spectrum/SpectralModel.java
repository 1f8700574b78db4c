package io.synphot.core.spectrum;

import java.util.Arrays;

/**
 * A function of wavelength (Å) plus the wavelength set on which it is naturally sampled.
 *
 * <p>
 * Sealed hierarchy: analytic models, a tabulated model, and combinators. A {@code null}
 * {@link #waveset()} means the model is defined everywhere and has no preferred sampling.
 */
public sealed interface SpectralModel
        permits SpectralModel.Constant,
                SpectralModel.BlackBody,
                SpectralModel.PowerLaw,
                SpectralModel.Box,
                SpectralModel.Gaussian,
                SpectralModel.Empirical,
                SpectralModel.Product,
                SpectralModel.Sum,
                SpectralModel.Scaled,
                SpectralModel.Redshifted {

    double evaluate(double wavelength);

    double[] waveset();

    /** Same value at every wavelength. */
    record Constant(double value) implements SpectralModel {
        @Override
        public double evaluate(double wavelength) {
            return value;
        }

        @Override
        public double[] waveset() {
            return null;
        }
    }

    /**
     * Blackbody photon flux in PHOTLAM for a star of one solar radius at 1 kpc. Sampled on a
     * log grid spanning a decade either side of the Wien peak.
     */
    record BlackBody(double temperature) implements SpectralModel {
        private static final double H_CGS = 6.62607015e-27;
        private static final double C_CGS = 2.99792458e10;
        private static final double K_CGS = 1.380649e-16;
        private static final double WIEN = 2.897771955e7;
        private static final double SOLAR_RADIUS_CM = 6.957e10;
        private static final double KPC_CM = 3.0856775814913673e21;
        /** π (R☉ / 1 kpc)². */
        static final double NORM = Math.PI * Math.pow(SOLAR_RADIUS_CM / KPC_CM, 2);

        public BlackBody {
            if (!(temperature > 0)) {
                throw new IllegalArgumentException("Blackbody temperature must be positive, got " + temperature);
            }
        }

        @Override
        public double evaluate(double wavelength) {
            if (wavelength <= 0) {
                return 0.0;
            }
            double lambdaCm = wavelength * 1e-8;
            double x = H_CGS * C_CGS / (lambdaCm * K_CGS * temperature);
            // photons s^-1 cm^-2 cm^-1 sr^-1, then per Angstrom
            double radiance = 2.0 * C_CGS / Math.pow(lambdaCm, 4) / Math.expm1(x) * 1e-8;
            return NORM * radiance;
        }

        @Override
        public double[] waveset() {
            double peak = WIEN / temperature;
            return Sampling.logspace(peak / 10.0, peak * 10.0, 1000);
        }
    }

    /**
     * {@code amplitude * (λ / reference)^exponent} in {@code unit}, converted to PHOTLAM. For AB
     * and ST magnitudes the law applies to the underlying linear flux. Exponent zero gives a
     * constant flux density in any unit.
     */
    record PowerLaw(double amplitude, double reference, double exponent, FluxUnit unit) implements SpectralModel {
        public PowerLaw {
            if (!unit.isDensity()) {
                throw new IllegalArgumentException(unit + " is not a flux density");
            }
        }

        @Override
        public double evaluate(double wavelength) {
            double flux = unit.toLinear(amplitude) * Math.pow(wavelength / reference, exponent);
            return unit.linearUnit().toPhotlam(flux, wavelength);
        }

        @Override
        public double[] waveset() {
            return null;
        }
    }

    /** Unit throughput on {@code [center - width/2, center + width/2]}, zero elsewhere. */
    record Box(double center, double width) implements SpectralModel {
        static final double STEP = 0.01;

        public Box {
            if (!(width > 0)) {
                throw new IllegalArgumentException("Box width must be positive, got " + width);
            }
        }

        @Override
        public double evaluate(double wavelength) {
            double half = width / 2.0;
            return wavelength >= center - half && wavelength <= center + half ? 1.0 : 0.0;
        }

        @Override
        public double[] waveset() {
            double lo = center - width / 2.0;
            double hi = center + width / 2.0;
            return new double[] {lo - STEP, lo, hi, hi + STEP};
        }
    }

    /** Gaussian line with the given integral (PHOTLAM Å), sampled over ±5σ. */
    record Gaussian(double mean, double fwhm, double integral) implements SpectralModel {
        private static final double FWHM_TO_SIGMA = 1.0 / (2.0 * Math.sqrt(2.0 * Math.log(2.0)));

        public Gaussian {
            if (!(fwhm > 0)) {
                throw new IllegalArgumentException("Line FWHM must be positive, got " + fwhm);
            }
        }

        double sigma() {
            return fwhm * FWHM_TO_SIGMA;
        }

        @Override
        public double evaluate(double wavelength) {
            double sigma = sigma();
            double d = (wavelength - mean) / sigma;
            return integral / (sigma * Math.sqrt(2.0 * Math.PI)) * Math.exp(-0.5 * d * d);
        }

        @Override
        public double[] waveset() {
            double sigma = sigma();
            return Sampling.linspace(mean - 5.0 * sigma, mean + 5.0 * sigma, 101);
        }
    }

    /** Tabulated values, linearly interpolated, zero outside the table. */
    record Empirical(double[] wavelengths, double[] values) implements SpectralModel {
        public Empirical {
            if (wavelengths.length != values.length) {
                throw new IllegalArgumentException(
                        "Wavelength and value arrays differ in length: " + wavelengths.length + " vs " + values.length);
            }
            if (wavelengths.length == 0) {
                throw new IllegalArgumentException("Tabulated model needs at least one point");
            }
            for (int i = 1; i < wavelengths.length; i++) {
                if (!(wavelengths[i] > wavelengths[i - 1])) {
                    throw new IllegalArgumentException("Wavelengths must be strictly increasing at index " + i);
                }
            }
            wavelengths = wavelengths.clone();
            values = values.clone();
        }

        @Override
        public double evaluate(double wavelength) {
            return Sampling.interp(wavelength, wavelengths, values, 0.0, 0.0);
        }

        @Override
        public double[] waveset() {
            return wavelengths.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Empirical other
                    && Arrays.equals(wavelengths, other.wavelengths)
                    && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(wavelengths) + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "Empirical[" + wavelengths.length + " points]";
        }
    }

    record Product(SpectralModel left, SpectralModel right) implements SpectralModel {
        @Override
        public double evaluate(double wavelength) {
            return left.evaluate(wavelength) * right.evaluate(wavelength);
        }

        @Override
        public double[] waveset() {
            return Sampling.merge(left.waveset(), right.waveset());
        }
    }

    record Sum(SpectralModel left, SpectralModel right) implements SpectralModel {
        @Override
        public double evaluate(double wavelength) {
            return left.evaluate(wavelength) + right.evaluate(wavelength);
        }

        @Override
        public double[] waveset() {
            return Sampling.merge(left.waveset(), right.waveset());
        }
    }

    record Scaled(SpectralModel model, double factor) implements SpectralModel {
        @Override
        public double evaluate(double wavelength) {
            return factor * model.evaluate(wavelength);
        }

        @Override
        public double[] waveset() {
            return model.waveset();
        }
    }

    /** Wavelength stretched by {@code 1 + z}; flux values are not rescaled. */
    record Redshifted(SpectralModel model, double z) implements SpectralModel {
        @Override
        public double evaluate(double wavelength) {
            return model.evaluate(wavelength / (1.0 + z));
        }

        @Override
        public double[] waveset() {
            double[] rest = model.waveset();
            if (rest == null) {
                return null;
            }
            double[] shifted = new double[rest.length];
            for (int i = 0; i < rest.length; i++) {
                shifted[i] = rest[i] * (1.0 + z);
            }
            return shifted;
        }
    }
}
