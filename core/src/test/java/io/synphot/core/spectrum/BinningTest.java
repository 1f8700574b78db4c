package io.synphot.core.spectrum;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.synphot.core.error.SpectrumException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BinningTest {

    /** Edges at 5, 15, 25, 35, 45, 55. */
    private static final double[] CENTERS = {10, 20, 30, 40, 50};

    @Test
    void edgesLieBetweenCentersAndMirrorAtTheEnds() {
        assertThat(Binning.binEdges(CENTERS)).containsExactly(5, 15, 25, 35, 45, 55);
    }

    @Test
    void aSingleWavelengthIsNotABinset() {
        assertThatThrownBy(() -> Binning.binEdges(new double[] {10}))
                .isInstanceOf(SpectrumException.class)
                .hasMessage("A binset needs at least two wavelengths, got 1");
    }

    @Nested
    @DisplayName("waveRange")
    class WaveRange {

        @ParameterizedTest(name = "{0}")
        @CsvSource({
            "ROUND, 30, 3, 15, 45",
            "NONE,  30, 2, 20, 40",
            "MIN,   30, 2, 25, 35",
            "MAX,   30, 2, 15, 45"
        })
        void snapsToEdgesByMode(Binning.Mode mode, double cenwave, int npix, double lower, double upper) {
            assertThat(Binning.waveRange(CENTERS, cenwave, npix, mode)).containsExactly(lower, upper);
        }

        @Test
        void centralWavelengthOutsideTheBinset() {
            assertThatThrownBy(() -> Binning.waveRange(CENTERS, 60, 2, Binning.Mode.ROUND))
                    .isInstanceOf(SpectrumException.class)
                    .hasMessage("Central wavelength 60.0 is not within binset (min=5.0, max=55.0).");
        }

        @Test
        void tooManyPixels() {
            assertThatThrownBy(() -> Binning.waveRange(CENTERS, 30, 10, Binning.Mode.NONE))
                    .isInstanceOf(SpectrumException.class)
                    .hasMessage("10 pixels around 30.0 exceed the binset (min=5.0, max=55.0).");
        }
    }

    @Nested
    @DisplayName("pixelRange")
    class PixelRange {

        @ParameterizedTest(name = "{0}")
        @CsvSource({"ROUND, 2", "NONE, 2", "MIN, 1", "MAX, 3"})
        void countsPixelsByMode(Binning.Mode mode, double expected) {
            assertThat(Binning.pixelRange(CENTERS, 20, 40, mode)).isEqualTo(expected);
        }

        @Test
        void boundsMayBeGivenInEitherOrder() {
            assertThat(Binning.pixelRange(CENTERS, 40, 20, Binning.Mode.NONE)).isEqualTo(2.0);
        }

        @Test
        void rangeOutsideTheBinset() {
            assertThatThrownBy(() -> Binning.pixelRange(CENTERS, 0, 40, Binning.Mode.ROUND))
                    .isInstanceOf(SpectrumException.class)
                    .hasMessage("Wavelength range (0.0, 40.0) is out of bounds of the binset (min=5.0, max=55.0).");
        }
    }
}
