package io.synphot.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Environment variable overlay on {@link ConfigLoader}. Env vars take precedence over YAML
 * values; empty or whitespace-only values count as unset.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = ConfigLoaderTest.fixture("full-config.yaml");
        envVars.clear();
    }

    @Nested
    @DisplayName("String overrides")
    class StringOverrides {

        @Test
        @DisplayName("PYSYN_CDBS overrides data.root")
        void rootDir_overriddenByEnvVar() {
            envVars.put("PYSYN_CDBS", "  /opt/cdbs ");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).settings().rootDir()).isEqualTo("/opt/cdbs");
        }

        @Test
        @DisplayName("Table variables override the table references")
        void tables_overriddenByEnvVars() {
            envVars.put("SYNPHOT_GRAPHTABLE", "mtab$new_tmg.csv");
            envVars.put("SYNPHOT_COMPTABLE", "mtab$new_tmc.csv");
            envVars.put("SYNPHOT_THERMTABLE", "mtab$new_tmt.csv");
            envVars.put("SYNPHOT_VEGA_FILE", "crcalspec$vega.csv");
            envVars.put("SYNPHOT_WAVECAT", "mtab$new_wavecat.csv");
            envVars.put("SYNPHOT_DETECTORS", "mtab$new_detectors.csv");

            var settings = ConfigLoader.load(fullConfigPath, envLookup()).settings();

            assertThat(settings.graphTable()).isEqualTo("mtab$new_tmg.csv");
            assertThat(settings.compTable()).isEqualTo("mtab$new_tmc.csv");
            assertThat(settings.thermTable()).isEqualTo("mtab$new_tmt.csv");
            assertThat(settings.vegaFile()).isEqualTo("crcalspec$vega.csv");
            assertThat(settings.wavecatFile()).isEqualTo("mtab$new_wavecat.csv");
            assertThat(settings.detectorFile()).isEqualTo("mtab$new_detectors.csv");
        }

        @Test
        @DisplayName("LOG_FORMAT and LOG_LEVEL override logging")
        void logging_overriddenByEnvVars() {
            envVars.put("LOG_FORMAT", "text");
            envVars.put("LOG_LEVEL", "WARN");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }
    }

    @Nested
    @DisplayName("Numeric overrides")
    class NumericOverrides {

        @Test
        void area_overriddenByEnvVar() {
            envVars.put("SYNPHOT_AREA", "2500");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).settings().area()).isEqualTo(2500.0);
        }

        @Test
        void nonNumericArea_rejected() {
            envVars.put("SYNPHOT_AREA", "big");

            assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("SYNPHOT_AREA must be a number, got 'big'");
        }
    }

    @Nested
    @DisplayName("Unset semantics")
    class UnsetSemantics {

        @Test
        @DisplayName("Blank values keep the YAML value")
        void blankValues_ignored() {
            envVars.put("PYSYN_CDBS", "   ");
            envVars.put("SYNPHOT_AREA", "");
            envVars.put("LOG_LEVEL", "\t");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.settings().rootDir()).isEqualTo("/data/cdbs");
            assertThat(config.settings().area()).isEqualTo(1000.5);
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }
    }
}
