package io.synphot.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.synphot.core.model.SynphotSettings;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Layout:
 *
 * <pre>
 * data:
 *   root: /data/cdbs
 *   graph-table: mtab$*_tmg.csv
 *   comp-table: mtab$*_tmc.csv
 *   therm-table: mtab$*_tmt.csv
 *   vega-file: crcalspec$alpha_lyr_stis_010.csv
 *   extinction-dir: crextinction$
 *   wavecat-file: mtab$wavecat.csv
 *   detector-file: mtab$detectors.csv
 *   shortcuts:
 *     crcalspec: calspec
 * telescope:
 *   area: 45238.93416
 * logging:
 *   format: text
 *   level: INFO
 *   loggers:
 *     io.synphot.core.engine: DEBUG
 * </pre>
 *
 * <p>
 * Missing keys keep the defaults of {@link SynphotSettings.Builder}. Environment variables take
 * precedence over YAML values. A variable is "set" only if it is defined and non-blank after
 * trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "synphot.yaml";

    private ConfigLoader() {
        // utility class
    }

    /** Loads the configuration, overlaying {@link System#getenv}. */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, overlaying variables from {@code envLookup}.
     *
     * @param envLookup environment lookup; {@code null} means undefined
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds a bad value
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments; {@value #DEFAULT_CONFIG_FILE}
     * in the working directory when {@code --config} is absent.
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        SynphotSettings.Builder builder = SynphotSettings.builder();

        JsonNode data = root.path("data");
        if (data.has("root")) builder.rootDir(data.get("root").asText());
        if (data.has("graph-table")) builder.graphTable(data.get("graph-table").asText());
        if (data.has("comp-table")) builder.compTable(data.get("comp-table").asText());
        if (data.has("therm-table")) builder.thermTable(data.get("therm-table").asText());
        if (data.has("vega-file")) builder.vegaFile(data.get("vega-file").asText());
        if (data.has("extinction-dir")) builder.extinctionDir(data.get("extinction-dir").asText());
        if (data.has("wavecat-file")) builder.wavecatFile(data.get("wavecat-file").asText());
        if (data.has("detector-file")) builder.detectorFile(data.get("detector-file").asText());

        JsonNode shortcuts = data.path("shortcuts");
        for (Iterator<Map.Entry<String, JsonNode>> it = shortcuts.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            builder.shortcut(entry.getKey(), entry.getValue().asText());
        }

        JsonNode telescope = root.path("telescope");
        if (telescope.has("area")) builder.area(doubleValue(telescope.get("area"), "telescope.area"));

        JsonNode logging = root.path("logging");
        String format = textOrDefault(logging, "format", CliConfig.DEFAULT_LOGGING_FORMAT);
        String level = textOrDefault(logging, "level", CliConfig.DEFAULT_LOGGING_LEVEL);
        Map<String, String> loggerLevels = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = logging.path("loggers").fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!entry.getValue().isValueNode()) {
                throw new ConfigLoadException("logging.loggers." + entry.getKey() + " must be a level name");
            }
            loggerLevels.put(entry.getKey(), entry.getValue().asText());
        }

        // --- Environment variable overlay ---
        envString(envLookup, "PYSYN_CDBS", builder::rootDir);
        envString(envLookup, "SYNPHOT_GRAPHTABLE", builder::graphTable);
        envString(envLookup, "SYNPHOT_COMPTABLE", builder::compTable);
        envString(envLookup, "SYNPHOT_THERMTABLE", builder::thermTable);
        envString(envLookup, "SYNPHOT_VEGA_FILE", builder::vegaFile);
        envString(envLookup, "SYNPHOT_WAVECAT", builder::wavecatFile);
        envString(envLookup, "SYNPHOT_DETECTORS", builder::detectorFile);
        envDouble(envLookup, "SYNPHOT_AREA", builder::area);

        return new CliConfig(
                builder.build(),
                envStringOrDefault(envLookup, "LOG_FORMAT", format),
                envStringOrDefault(envLookup, "LOG_LEVEL", level),
                loggerLevels);
    }

    private static double doubleValue(JsonNode node, String field) {
        if (!node.isNumber()) {
            throw new ConfigLoadException(field + " must be a number, got '" + node.asText() + "'");
        }
        return node.asDouble();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envDouble(Function<String, String> envLookup, String envVar, DoubleConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Double.parseDouble(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be a number, got '" + value + "'", e);
            }
        }
    }

    private static String envStringOrDefault(Function<String, String> envLookup, String envVar, String yamlDefault) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlDefault;
    }

    // --- YAML helpers ---

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }
}
