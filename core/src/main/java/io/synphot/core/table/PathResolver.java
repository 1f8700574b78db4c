package io.synphot.core.table;

import io.synphot.core.error.SpectrumException;
import io.synphot.core.error.TableReadException;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns data-file references into file paths. Two reference forms are understood:
 *
 * <ul>
 * <li>{@code $VAR/file}: {@code VAR} is an environment variable holding a directory.
 * <li>{@code dir$file}: {@code dir} is a path shortcut (case-insensitive). {@code crrefer}
 * names the data root directory; the others are looked up in the configured shortcut map,
 * whose values are relative to the root directory.
 * </ul>
 *
 * References without a {@code $} are returned unchanged.
 */
public final class PathResolver {

    /** Shortcut that always names the data root directory. */
    public static final String ROOT_SHORTCUT = "crrefer";

    private static final Pattern ENV_REFERENCE = Pattern.compile("^\\$(\\w*)/?(.*)$");

    private final String rootDir;
    private final Map<String, String> shortcuts;
    private final Function<String, String> envLookup;

    public PathResolver(String rootDir, Map<String, String> shortcuts, Function<String, String> envLookup) {
        this.rootDir = rootDir;
        Map<String, String> normalized = new HashMap<>();
        shortcuts.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        this.shortcuts = Collections.unmodifiableMap(normalized);
        this.envLookup = envLookup;
    }

    /**
     * Resolves a reference to a file path.
     *
     * @param reference file reference, possibly using a shortcut or environment variable
     * @return the file path
     * @throws SpectrumException if the environment variable or shortcut is undefined
     */
    public String resolve(String reference) {
        if (reference.indexOf('$') < 0) {
            return reference;
        }

        String directory;
        String file;
        if (reference.startsWith("$")) {
            Matcher m = ENV_REFERENCE.matcher(reference);
            if (!m.matches()) {
                throw new SpectrumException("Malformed file reference: " + reference, reference);
            }
            directory = envLookup.apply(m.group(1));
            if (directory == null || directory.isBlank()) {
                throw new SpectrumException("Environment variable " + m.group(1) + " is undefined", reference);
            }
            file = m.group(2);
        } else {
            int sep = reference.indexOf('$');
            directory = shortcutDirectory(reference.substring(0, sep), reference);
            file = reference.substring(sep + 1);
        }

        Path base = Path.of(directory);
        return (file.isEmpty() ? base : base.resolve(file)).normalize().toString();
    }

    /**
     * Resolves a reference whose file part may be a glob (for example {@code mtab$*_tmg.csv}) to
     * the matching file that sorts last. References without glob characters are only resolved.
     *
     * @throws TableReadException if nothing matches
     */
    public String latest(String reference) {
        String resolved = resolve(reference);
        if (resolved.indexOf('*') < 0 && resolved.indexOf('?') < 0) {
            return resolved;
        }
        Path template = Path.of(resolved);
        Path dir = template.getParent() != null ? template.getParent() : Path.of(".");
        String glob = template.getFileName().toString();

        List<String> matches = new ArrayList<>();
        if (Files.isDirectory(dir)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
                for (Path p : stream) {
                    matches.add(p.getFileName().toString());
                }
            } catch (IOException e) {
                throw new TableReadException("Failed to list " + dir, e, resolved);
            }
        }
        if (matches.isEmpty()) {
            throw new TableReadException("No files found for " + reference, resolved);
        }
        Collections.sort(matches);
        return dir.resolve(matches.get(matches.size() - 1)).toString();
    }

    public String rootDir() {
        return rootDir;
    }

    private String shortcutDirectory(String shortcut, String reference) {
        String key = shortcut.toLowerCase(Locale.ROOT);
        if (ROOT_SHORTCUT.equals(key)) {
            return rootDir;
        }
        String relative = shortcuts.get(key);
        if (relative == null) {
            throw new SpectrumException("Path shortcut '" + shortcut + "' is not defined", reference);
        }
        return Path.of(rootDir).resolve(relative).toString();
    }
}
