package io.synphot.core.spi;

import io.synphot.core.table.DataTable;

/**
 * Reads a tabular data file (graph table, component table, catalog index, spectrum) into a
 * {@link DataTable}. Implementations are stateless and may be shared; the engine caches what it
 * needs on top of this seam.
 */
public interface TableReader {

    /**
     * Reads the table stored at the given resolved file path.
     *
     * @param file resolved file path (no path shortcuts)
     * @return the parsed table
     * @throws io.synphot.core.error.TableReadException if the file is missing or malformed
     */
    DataTable read(String file);
}
