package io.synphot.core.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.synphot.core.error.ErrorKind;
import io.synphot.core.error.TableReadException;
import io.synphot.core.testkit.DataFixtures;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvTableReaderTest {

    private final CsvTableReader reader = new CsvTableReader();

    @TempDir
    Path dir;

    @Test
    void readsHeaderKeywordsAndRows() {
        Path file = DataFixtures.write(dir, "vega.csv", """
                # Vega, STIS
                # FLUXUNIT = flam
                # extrap = T
                WAVELENGTH, FLUX
                3000, 1.5e-9

                4000, 2.5e-9
                """);

        DataTable table = reader.read(file.toString());

        assertThat(table.source()).isEqualTo(file.toString());
        assertThat(table.keyword("fluxunit")).isEqualTo("flam");
        assertThat(table.keyword("EXTRAP")).isEqualTo("T");
        assertThat(table.keywords()).hasSize(2);
        assertThat(table.columnNames()).containsExactly("WAVELENGTH", "FLUX");
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.doubles("flux")).containsExactly(1.5e-9, 2.5e-9);
    }

    @Test
    void quotedCellsMayHoldCommas() {
        Path file = DataFixtures.write(dir, "catalog.csv", """
                INDEX,FILENAME
                "5000,0.0,4.5",ck5000/ck5000.csv[g45]
                """);

        DataTable table = reader.read(file.toString());

        assertThat(table.strings("INDEX")).containsExactly("5000,0.0,4.5");
        assertThat(table.strings("FILENAME")).containsExactly("ck5000/ck5000.csv[g45]");
    }

    @Test
    void emptyTrailingCellsReadAsEmptyStrings() {
        Path file = DataFixtures.write(dir, "tmc.csv", """
                TIME,COMPNAME,FILENAME,COMMENT
                0,ota,ota.csv,
                """);

        assertThat(reader.read(file.toString()).value(0, "COMMENT")).isEmpty();
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void missingFile() {
            String missing = dir.resolve("nope.csv").toString();

            assertThatThrownBy(() -> reader.read(missing))
                    .isInstanceOf(TableReadException.class)
                    .hasMessage("Table not found: " + missing)
                    .satisfies(e -> assertThat(((TableReadException) e).kind()).isEqualTo(ErrorKind.DATA));
        }

        @Test
        void keywordsOnly() {
            Path file = DataFixtures.write(dir, "empty.csv", "# FLUXUNIT = flam\n");

            assertThatThrownBy(() -> reader.read(file.toString()))
                    .isInstanceOf(TableReadException.class)
                    .hasMessageStartingWith("Table has no header row");
        }

        @Test
        void nonNumericCell() {
            Path file = DataFixtures.write(dir, "bad.csv", "WAVELENGTH,FLUX\n3000,abc\n");
            DataTable table = reader.read(file.toString());

            assertThatThrownBy(() -> table.doubles("FLUX"))
                    .isInstanceOf(TableReadException.class)
                    .hasMessage("Column FLUX row 1 of " + file + " is not numeric: 'abc'");
        }

        @Test
        void unknownColumn() {
            Path file = DataFixtures.write(dir, "t.csv", "WAVELENGTH,FLUX\n3000,1\n");
            DataTable table = reader.read(file.toString());

            assertThatThrownBy(() -> table.doubles("THROUGHPUT"))
                    .isInstanceOf(TableReadException.class)
                    .hasMessageContaining("has no column 'THROUGHPUT'");
        }
    }
}
