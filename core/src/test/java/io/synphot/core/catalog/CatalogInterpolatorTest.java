package io.synphot.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.synphot.core.engine.MemoCache;
import io.synphot.core.error.ErrorKind;
import io.synphot.core.error.ParameterOutOfBoundsException;
import io.synphot.core.error.SpectrumException;
import io.synphot.core.error.TableReadException;
import io.synphot.core.model.CatalogIndexEntry;
import io.synphot.core.model.CatalogParameter;
import io.synphot.core.model.SynphotSettings;
import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spi.TableReader;
import io.synphot.core.table.CsvTableReader;
import io.synphot.core.table.PathResolver;
import io.synphot.core.testkit.DataFixtures;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CatalogInterpolatorTest {

    @TempDir
    Path root;

    private TableReader reader;
    private MemoCache<String, CatalogIndex> cache;
    private CatalogInterpolator interpolator;

    @BeforeEach
    void setUp() {
        DataFixtures.catalogGrid(root);
        reader = spy(new CsvTableReader());
        cache = new MemoCache<>("catalogIndices");
        PathResolver resolver =
                new PathResolver(root.toString(), SynphotSettings.defaultShortcuts(), name -> null);
        interpolator = new CatalogInterpolator(resolver, reader, cache);
    }

    @Nested
    @DisplayName("interpolation")
    class Interpolation {

        @ParameterizedTest
        @CsvSource({"5000, 0.0, 5.0", "6000, -1.0, 4.0", "5000, -1.0, 4.0", "6000, 0.0, 5.0"})
        void gridPointsReturnTheirOwnSpectrum(double t, double m, double g) {
            SourceSpectrum sp = interpolator.gridToSpectrum("ck04models", t, m, g);

            assertThat(sp.evaluate(5000)).isCloseTo(DataFixtures.gridFlux(t, m, g), within(1e-9));
        }

        @Test
        void midpointIsTrilinear() {
            SourceSpectrum sp = interpolator.gridToSpectrum("ck04models", 5500, -0.5, 4.5);

            assertThat(sp.evaluate(4000)).isCloseTo(DataFixtures.gridFlux(5500, -0.5, 4.5), within(1e-9));
            assertThat(sp.tag()).isEqualTo("ck04models(T_eff=5500,metallicity=-0.5,log_g=4.5)");
        }

        @Test
        void nearbyTemperaturesGiveNearbyFlux() {
            double here = interpolator.gridToSpectrum("ck04models", 5500, -0.5, 4.5).evaluate(5000);
            double next = interpolator.gridToSpectrum("ck04models", 5500.001, -0.5, 4.5).evaluate(5000);

            assertThat(Math.abs(next - here) / here).isLessThan(1e-5);
        }

        @Test
        void unevenWeights() {
            SourceSpectrum sp = interpolator.gridToSpectrum("ck04", 5250, -0.2, 4.9);

            assertThat(sp.evaluate(6000)).isCloseTo(DataFixtures.gridFlux(5250, -0.2, 4.9), within(1e-9));
        }

        @Test
        void cornerWithoutFluxIsOutOfBounds() {
            assertThatThrownBy(() -> interpolator.gridToSpectrum("ck04models", 4500, 0.0, 4.5))
                    .isInstanceOf(ParameterOutOfBoundsException.class)
                    .hasMessageStartingWith("Parameter '[4000.0, ")
                    .hasMessageEndingWith("' has no valid data.")
                    .satisfies(e -> assertThat(((ParameterOutOfBoundsException) e).source()).isEqualTo("ck04models"));
        }
    }

    @Nested
    @DisplayName("bounds")
    class Bounds {

        @Test
        void aboveTheGrid() {
            assertThatThrownBy(() -> interpolator.gridToSpectrum("ck04models", 7000, 0.0, 4.5))
                    .isInstanceOf(ParameterOutOfBoundsException.class)
                    .hasMessage("Parameter 'T_eff' exceeds data. Max allowed=6000.0, entered=7000.0.")
                    .satisfies(e -> assertThat(((ParameterOutOfBoundsException) e).kind())
                            .isEqualTo(ErrorKind.PARAMETER_OUT_OF_BOUNDS));
        }

        @Test
        void belowTheGrid() {
            assertThatThrownBy(() -> interpolator.gridToSpectrum("ck04models", 3000, 0.0, 4.5))
                    .isInstanceOf(ParameterOutOfBoundsException.class)
                    .hasMessage("Parameter 'T_eff' exceeds data. Min allowed=4000.0, entered=3000.0.");
        }

        @Test
        void gravityIsCheckedWithinTheBracket() {
            assertThatThrownBy(() -> interpolator.gridToSpectrum("ck04models", 5000, 0.0, 5.5))
                    .isInstanceOf(ParameterOutOfBoundsException.class)
                    .hasMessage("Parameter 'log_g' exceeds data. Max allowed=5.0, entered=5.5.");
        }

        @Test
        void unknownGrid() {
            assertThatThrownBy(() -> interpolator.gridToSpectrum("atlas9", 5000, 0.0, 4.5))
                    .isInstanceOf(SpectrumException.class)
                    .hasMessage("atlas9 is not a supported catalog grid.");
        }

        @Test
        void missingIndex() {
            assertThatThrownBy(() -> interpolator.gridToSpectrum("k93models", 5000, 0.0, 4.5))
                    .isInstanceOf(TableReadException.class)
                    .hasMessageStartingWith("Table not found: ");
        }
    }

    @Test
    void bracketKeepsBothSidesOfTheTarget() {
        List<CatalogIndexEntry> entries = List.of(
                new CatalogIndexEntry(4000, 0, 4, "a"),
                new CatalogIndexEntry(5000, 0, 4, "b"),
                new CatalogIndexEntry(5000, 0, 5, "c"),
                new CatalogIndexEntry(6000, 0, 4, "d"));

        CatalogInterpolator.Bracket between =
                CatalogInterpolator.bracket(entries, CatalogParameter.T_EFF, 4500, CatalogGrid.CK04MODELS);
        CatalogInterpolator.Bracket on =
                CatalogInterpolator.bracket(entries, CatalogParameter.T_EFF, 5000, CatalogGrid.CK04MODELS);

        assertThat(between.upper()).extracting(CatalogIndexEntry::fileReference).containsExactly("b", "c");
        assertThat(between.lower()).extracting(CatalogIndexEntry::fileReference).containsExactly("a");
        assertThat(on.upperValue()).isEqualTo(5000.0);
        assertThat(on.lowerValue()).isEqualTo(5000.0);
        assertThat(on.upper()).isEqualTo(on.lower());
    }

    @Test
    void indexIsReadOnce() {
        interpolator.gridToSpectrum("ck04models", 5500, -0.5, 4.5);
        interpolator.gridToSpectrum("ck04models", 5000, 0.0, 4.0);

        verify(reader, times(1)).read(endsWith(CatalogInterpolator.INDEX_FILE));
        assertThat(cache.size()).isEqualTo(1);
        CatalogIndex index = interpolator.catalogIndex(CatalogGrid.CK04MODELS);
        assertThat(index.entries()).hasSize(12);
        assertThat(index.entries().get(0))
                .isEqualTo(new CatalogIndexEntry(4000, -1.0, 4.0, "ck4000/ck4000_m10.csv[g40]"));
    }

    @Test
    void malformedIndexRow() {
        DataFixtures.write(root, "grid/k93models/catalog.csv", "INDEX,FILENAME\n\"5000,0.0\",k.csv[g40]\n");

        assertThatThrownBy(() -> interpolator.gridToSpectrum("k93models", 5000, 0.0, 4.0))
                .isInstanceOf(TableReadException.class)
                .hasMessageContaining("must hold three values: '5000,0.0'");
    }

    @Test
    void gridNamesAndAliases() {
        assertThat(CatalogGrid.fromName("ck04")).contains(CatalogGrid.CK04MODELS);
        assertThat(CatalogGrid.fromName("k93models")).contains(CatalogGrid.K93MODELS);
        assertThat(CatalogGrid.fromName("phoenix")).contains(CatalogGrid.PHOENIX);
        assertThat(CatalogGrid.fromName("PHOENIX")).isEmpty();
    }
}
