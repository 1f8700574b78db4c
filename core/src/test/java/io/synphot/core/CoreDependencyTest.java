package io.synphot.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * The core module stays free of command-line and configuration libraries: the engine takes its
 * settings as a record and logs through the SLF4J API only.
 */
class CoreDependencyTest {

    /** Artifacts that belong to the command-line module, never to core. */
    private static final List<String> FORBIDDEN = List.of(
            "jackson-dataformat-yaml",
            "snakeyaml",
            "synphot-cli");

    @Test
    void coreClasspathContainsNoCliDependencies() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();

        for (String forbidden : FORBIDDEN) {
            assertThat(classpath)
                    .as("Core classpath must not contain: %s", forbidden)
                    .doesNotContain(forbidden);
        }
    }
}
