package io.synphot.core.catalog;

import java.util.Optional;

/** Stellar atmosphere grids and the directory shortcut each lives under. */
public enum CatalogGrid {
    /** Castelli &amp; Kurucz (2004). */
    CK04MODELS("ck04models", "ck04", "crgridck04$"),
    /** Kurucz (1993). */
    K93MODELS("k93models", "k93", "crgridk93$"),
    /** Allard et al. (2009). */
    PHOENIX("phoenix", null, "crgridphoenix$");

    private final String gridName;
    private final String alias;
    private final String directory;

    CatalogGrid(String gridName, String alias, String directory) {
        this.gridName = gridName;
        this.alias = alias;
        this.directory = directory;
    }

    public String gridName() {
        return gridName;
    }

    /** Directory reference, resolved through the path shortcuts. */
    public String directory() {
        return directory;
    }

    public static Optional<CatalogGrid> fromName(String name) {
        for (CatalogGrid grid : values()) {
            if (grid.gridName.equals(name) || name.equals(grid.alias)) {
                return Optional.of(grid);
            }
        }
        return Optional.empty();
    }
}
