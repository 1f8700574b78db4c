package io.synphot.core.obsmode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.synphot.core.error.AmbiguousObsmodeException;
import io.synphot.core.error.SpectrumException;
import io.synphot.core.table.DataTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WaveCatalogTest {

    private static WaveCatalog catalog(String... rows) {
        List<String[]> cells = new ArrayList<>();
        for (String row : rows) {
            cells.add(row.split(";", -1));
        }
        return WaveCatalog.fromTable(new DataTable("wavecat.csv", Map.of(), List.of("OBSMODE", "FILENAME"), cells));
    }

    @Nested
    @DisplayName("entryFor")
    class EntryFor {

        private final WaveCatalog catalog = catalog(
                "acs,hrc;(1000,11000,5)",
                "acs;crwave$acs.csv",
                "stis,ccd,g430l;(2900,5700,2.7)");

        @Test
        void exactMatch() {
            assertThat(catalog.entryFor("acs,hrc")).contains("(1000,11000,5)");
            assertThat(catalog.entryFor("ACS, HRC")).contains("(1000,11000,5)");
        }

        @Test
        void mostCompleteSubsetWins() {
            assertThat(catalog.entryFor("acs,hrc,f555w")).contains("(1000,11000,5)");
            assertThat(catalog.entryFor("acs,wfc1,f555w")).contains("crwave$acs.csv");
        }

        @Test
        void keywordOrderDoesNotMatterForSubsetMatches() {
            assertThat(catalog.entryFor("f555w,hrc,acs")).contains("(1000,11000,5)");
        }

        @Test
        void noMatch() {
            assertThat(catalog.entryFor("wfc3,ir")).isEmpty();
            assertThat(catalog.entryFor("stis,ccd")).isEmpty();
        }

        @Test
        void equallyCompleteMatchesAreAmbiguous() {
            WaveCatalog tied = catalog("acs,hrc;(1000,11000,5)", "acs,f555w;(4000,7000,5)");

            assertThatThrownBy(() -> tied.entryFor("acs,hrc,f555w"))
                    .isInstanceOf(AmbiguousObsmodeException.class)
                    .hasMessageContaining("matches several entries of wavecat.csv");
        }
    }

    @Nested
    @DisplayName("parameter strings")
    class ParameterStrings {

        @Test
        void uniformStep() {
            double[] w = WaveCatalog.wavesetFromParameters("(3000,8000,10)");

            assertThat(w).hasSize(501);
            assertThat(w[0]).isEqualTo(3000.0);
            assertThat(w[1] - w[0]).isCloseTo(10.0, within(1e-9));
            assertThat(w[500]).isCloseTo(8000.0, within(1e-9));
        }

        @Test
        void stepGrowsLinearlyBetweenTheTwoSteps() {
            double[] w = WaveCatalog.wavesetFromParameters("(1000,2000,10,30)");

            assertThat(w).hasSize(51);
            assertThat(w[1] - w[0]).isCloseTo(10.2, within(1e-9));
            assertThat(w[50] - w[49]).isCloseTo(29.8, within(1e-9));
            assertThat(w[50]).isCloseTo(2000.0, within(1e-9));
        }

        @Test
        void withoutAStepTheRangeIsCutIntoEqualSteps() {
            double[] w = WaveCatalog.wavesetFromParameters("(1000,2000)");

            assertThat(w[0]).isEqualTo(1000.0);
            assertThat(w[1] - w[0]).isCloseTo(1000.0 / WaveCatalog.DEFAULT_STEPS, within(1e-9));
            assertThat(w[w.length - 1]).isLessThanOrEqualTo(2000.0 + 1e-9);
        }

        @Test
        void onlyParenthesizedEntriesAreParameterStrings() {
            assertThat(WaveCatalog.isParameterString("(1000,2000)")).isTrue();
            assertThat(WaveCatalog.isParameterString("crwave$acs.csv")).isFalse();
        }

        @Test
        void missingStop() {
            assertThatThrownBy(() -> WaveCatalog.wavesetFromParameters("(1000)"))
                    .isInstanceOf(SpectrumException.class)
                    .hasMessage("Waveset parameters need a start and a stop: (1000)");
        }

        @Test
        void nonNumericParameters() {
            assertThatThrownBy(() -> WaveCatalog.wavesetFromParameters("(a,b)"))
                    .isInstanceOf(SpectrumException.class)
                    .hasMessage("Malformed waveset parameters: (a,b)");
        }
    }
}
