package io.synphot.core.obsmode;

import io.synphot.core.error.ComponentNotFoundException;
import io.synphot.core.table.DataTable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Component name → throughput file reference, read from the {@code COMPNAME} and
 * {@code FILENAME} columns. Names are case-insensitive; when a name is listed more than once the
 * first row wins. Used for both optical and thermal component tables.
 */
public final class ComponentTable {

    private static final Logger LOG = LoggerFactory.getLogger(ComponentTable.class);

    /** Name and file reference of a component that transmits everything. */
    public static final String CLEAR = "clear";

    private final String name;
    private final Map<String, String> files;

    private ComponentTable(String name, Map<String, String> files) {
        this.name = name;
        this.files = Collections.unmodifiableMap(files);
    }

    public static ComponentTable fromTable(DataTable table) {
        List<String> compnames = table.strings("COMPNAME");
        List<String> filenames = table.strings("FILENAME");
        Map<String, String> files = new LinkedHashMap<>();
        for (int i = 0; i < compnames.size(); i++) {
            String compname = compnames.get(i).toLowerCase(Locale.ROOT);
            if (files.putIfAbsent(compname, filenames.get(i)) != null) {
                LOG.debug("Duplicate component {} in {}; keeping the first row", compname, table.source());
            }
        }
        LOG.debug("Loaded component table {} ({} components)", table.source(), files.size());
        return new ComponentTable(table.source(), files);
    }

    public String name() {
        return name;
    }

    public boolean contains(String component) {
        return files.containsKey(component.toLowerCase(Locale.ROOT));
    }

    /**
     * File reference for a component. {@code null} and {@code clear} map to {@link #CLEAR}.
     *
     * @throws ComponentNotFoundException if the table has no such component
     */
    public String filename(String component) {
        if (component == null || component.isBlank() || CLEAR.equalsIgnoreCase(component)) {
            return CLEAR;
        }
        String file = files.get(component.toLowerCase(Locale.ROOT));
        if (file == null) {
            throw new ComponentNotFoundException(component, name);
        }
        return file;
    }

    public List<String> filenames(List<String> components) {
        List<String> result = new ArrayList<>(components.size());
        for (String component : components) {
            result.add(filename(component));
        }
        return result;
    }

    public int size() {
        return files.size();
    }
}
