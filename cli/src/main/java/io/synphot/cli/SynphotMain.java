package io.synphot.cli;

import io.synphot.cli.config.CliConfig;
import io.synphot.cli.config.ConfigLoader;
import io.synphot.core.engine.SynphotEngine;
import io.synphot.core.model.GraphValidationReport;
import io.synphot.core.obsmode.ObservationMode;
import io.synphot.core.spectrum.Spectrum;
import io.synphot.core.table.CsvTableReader;
import java.io.PrintStream;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <pre>
 * synphot [--config synphot.yaml] --expr "rn(bb(5000),box(5500,100),17,abmag)"
 * synphot [--config synphot.yaml] --obsmode acs,wfc1,f555w
 * synphot [--config synphot.yaml] --validate
 * </pre>
 *
 * On failure the error is logged and the process exits with status 1.
 */
public final class SynphotMain {

    private static final Logger LOG = LoggerFactory.getLogger(SynphotMain.class);

    private SynphotMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            CliConfig config = ConfigLoader.load(ConfigLoader.resolveConfigPath(args));
            LogbackConfigurator.configure(config);
            run(args, config, new SynphotEngine(config.settings()), System.out);
        } catch (Exception e) {
            LOG.error("synphot failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /** Loads the configuration with {@code envLookup} and runs one command. */
    static void run(String[] args, Function<String, String> envLookup, PrintStream out) {
        CliConfig config = ConfigLoader.load(ConfigLoader.resolveConfigPath(args), envLookup);
        run(args, config, new SynphotEngine(config.settings(), new CsvTableReader(), envLookup), out);
    }

    static void run(String[] args, CliConfig config, SynphotEngine engine, PrintStream out) {
        String expression = option(args, "--expr");
        String obsmode = option(args, "--obsmode");
        boolean validate = flag(args, "--validate");
        int commands = (expression != null ? 1 : 0) + (obsmode != null ? 1 : 0) + (validate ? 1 : 0);
        if (commands != 1) {
            throw new IllegalArgumentException("Exactly one of --expr, --obsmode or --validate is required");
        }
        LOG.debug("Data root {}", config.settings().rootDir());

        if (expression != null) {
            Spectrum spectrum = engine.parseSpec(expression);
            out.println(spectrum.tag());
            for (Map.Entry<String, String> warning : spectrum.warnings().entrySet()) {
                out.println("warning " + warning.getKey() + ": " + warning.getValue());
            }
            if (spectrum.waveset() == null) {
                out.println("integral undefined");
            } else {
                out.println("integral " + spectrum.integrate());
            }
        } else if (obsmode != null) {
            ObservationMode mode = engine.observationMode(obsmode);
            out.println(mode.showFiles());
            out.println("pivot " + mode.throughput().pivotWavelength());
        } else {
            GraphValidationReport report = engine.validateGraph();
            if (report.isValid()) {
                out.println(report.graphTable() + " is valid");
            } else {
                report.messages().forEach(out::println);
            }
        }
    }

    private static String option(String[] args, String name) {
        for (int i = 0; i < args.length; i++) {
            if (name.equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException(name + " requires an argument");
                }
                return args[i + 1];
            }
        }
        return null;
    }

    private static boolean flag(String[] args, String name) {
        for (String arg : args) {
            if (name.equals(arg)) {
                return true;
            }
        }
        return false;
    }
}
