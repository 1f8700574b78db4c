package io.synphot.core.obsmode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.synphot.core.error.ComponentNotFoundException;
import io.synphot.core.error.ErrorKind;
import io.synphot.core.table.DataTable;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ComponentTableTest {

    private final ComponentTable table = ComponentTable.fromTable(new DataTable(
            "tmc.csv",
            Map.of(),
            List.of("TIME", "COMPNAME", "FILENAME"),
            Arrays.asList(
                    new String[] {"0", "ACS_F555W", "crcomp$f555w_1.csv"},
                    new String[] {"1", "acs_f555w", "crcomp$f555w_2.csv"},
                    new String[] {"0", "ccd", "crcomp$ccd.csv[mjd#]"})));

    @Test
    void namesAreCaseInsensitiveAndFirstRowWins() {
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.contains("acs_f555w")).isTrue();
        assertThat(table.filename("Acs_F555w")).isEqualTo("crcomp$f555w_1.csv");
    }

    @Test
    void clearAndNullMapToClear() {
        assertThat(table.filename(null)).isEqualTo(ComponentTable.CLEAR);
        assertThat(table.filename("CLEAR")).isEqualTo(ComponentTable.CLEAR);
        assertThat(table.filenames(Arrays.asList("ccd", null)))
                .containsExactly("crcomp$ccd.csv[mjd#]", "clear");
    }

    @Test
    void unknownComponent() {
        assertThatThrownBy(() -> table.filename("wfc3"))
                .isInstanceOf(ComponentNotFoundException.class)
                .hasMessage("Cannot find wfc3 in tmc.csv.")
                .satisfies(e -> assertThat(((ComponentNotFoundException) e).kind())
                        .isEqualTo(ErrorKind.TABLE_INTEGRITY));
    }
}
