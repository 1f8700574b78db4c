package io.synphot.core.catalog;

import io.synphot.core.model.CatalogIndexEntry;
import java.util.List;

/**
 * A grid's index table with the directory its spectrum files are relative to.
 */
public record CatalogIndex(CatalogGrid grid, String directory, List<CatalogIndexEntry> entries) {

    public CatalogIndex {
        entries = List.copyOf(entries);
    }
}
