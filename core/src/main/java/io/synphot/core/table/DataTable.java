package io.synphot.core.table;

import io.synphot.core.error.TableReadException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * In-memory table: named columns of string cells plus header keywords. Column and keyword
 * lookups are case-insensitive. Numeric accessors parse on demand and report the offending cell.
 *
 * <p>
 * Immutable once constructed.
 */
public final class DataTable {

    private final String source;
    private final Map<String, String> keywords;
    private final List<String> columnNames;
    private final Map<String, Integer> columnIndex;
    private final List<String[]> rows;

    public DataTable(String source, Map<String, String> keywords, List<String> columnNames, List<String[]> rows) {
        this.source = source;
        Map<String, String> kw = new LinkedHashMap<>();
        keywords.forEach((k, v) -> kw.put(k.toUpperCase(Locale.ROOT), v));
        this.keywords = Collections.unmodifiableMap(kw);
        this.columnNames = List.copyOf(columnNames);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columnNames.size(); i++) {
            index.putIfAbsent(columnNames.get(i).toUpperCase(Locale.ROOT), i);
        }
        this.columnIndex = index;
        List<String[]> copy = new ArrayList<>(rows.size());
        for (String[] row : rows) {
            copy.add(row.clone());
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /** The file this table was read from. */
    public String source() {
        return source;
    }

    public int rowCount() {
        return rows.size();
    }

    /** Column names in file order, as written in the header. */
    public List<String> columnNames() {
        return columnNames;
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column.toUpperCase(Locale.ROOT));
    }

    /** Header keyword value, or {@code null} if the keyword is absent. */
    public String keyword(String name) {
        return keywords.get(name.toUpperCase(Locale.ROOT));
    }

    public Map<String, String> keywords() {
        return keywords;
    }

    /** Cell value, trimmed; missing trailing cells read as the empty string. */
    public String value(int row, String column) {
        int col = requireColumn(column);
        String[] cells = rows.get(row);
        return col < cells.length && cells[col] != null ? cells[col].trim() : "";
    }

    public List<String> strings(String column) {
        requireColumn(column);
        List<String> values = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            values.add(value(i, column));
        }
        return values;
    }

    public double[] doubles(String column) {
        requireColumn(column);
        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            String cell = value(i, column);
            try {
                values[i] = Double.parseDouble(cell);
            } catch (NumberFormatException e) {
                throw new TableReadException(
                        String.format("Column %s row %d of %s is not numeric: '%s'", column, i + 1, source, cell),
                        e,
                        source);
            }
        }
        return values;
    }

    public int[] ints(String column) {
        requireColumn(column);
        int[] values = new int[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            String cell = value(i, column);
            try {
                values[i] = Integer.parseInt(cell);
            } catch (NumberFormatException e) {
                throw new TableReadException(
                        String.format("Column %s row %d of %s is not an integer: '%s'", column, i + 1, source, cell),
                        e,
                        source);
            }
        }
        return values;
    }

    private int requireColumn(String column) {
        Integer index = columnIndex.get(column.toUpperCase(Locale.ROOT));
        if (index == null) {
            throw new TableReadException(
                    "Table " + source + " has no column '" + column + "' (columns: " + columnNames + ")", source);
        }
        return index;
    }
}
