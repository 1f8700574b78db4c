package io.synphot.core.table;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.synphot.core.error.TableReadException;
import io.synphot.core.spi.TableReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TableReader} for CSV files with a header row, parsed with Jackson's CSV data format.
 *
 * <p>
 * Leading lines of the form {@code # KEY = value} are header keywords (for example
 * {@code PRIMAREA}, {@code FLUXUNIT}, {@code EXTRAP}); other leading {@code #} lines are
 * comments. Cell values are trimmed and blank lines are skipped.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class CsvTableReader implements TableReader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvTableReader.class);

    private static final Pattern KEYWORD_LINE = Pattern.compile("^#\\s*([A-Za-z_][\\w-]*)\\s*=\\s*(.*)$");

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    @Override
    public DataTable read(String file) {
        Path path = Path.of(file);
        if (!Files.isRegularFile(path)) {
            throw new TableReadException("Table not found: " + file, file);
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TableReadException("Failed to read table: " + file, e, file);
        }

        Map<String, String> keywords = new LinkedHashMap<>();
        int first = 0;
        while (first < lines.size()) {
            String line = lines.get(first).trim();
            if (!line.isEmpty() && !line.startsWith("#")) {
                break;
            }
            Matcher keyword = KEYWORD_LINE.matcher(line);
            if (keyword.matches()) {
                keywords.put(keyword.group(1), keyword.group(2).trim());
            }
            first++;
        }
        String body = String.join("\n", lines.subList(first, lines.size()));

        List<String[]> records;
        try (MappingIterator<String[]> it = CSV_MAPPER.readerFor(String[].class).readValues(body)) {
            records = it.readAll();
        } catch (IOException e) {
            throw new TableReadException("Failed to parse CSV table: " + file, e, file);
        }
        if (records.isEmpty()) {
            throw new TableReadException("Table has no header row: " + file, file);
        }

        List<String> header = Arrays.stream(records.get(0)).map(String::trim).toList();
        List<String[]> rows = records.subList(1, records.size());
        LOG.debug("Read table {} ({} columns, {} rows, keywords={})", file, header.size(), rows.size(), keywords);
        return new DataTable(file, keywords, header, rows);
    }
}
