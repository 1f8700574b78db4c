package io.synphot.core.model;

/**
 * One row of a catalog grid index: a grid point and the spectrum file reference holding it.
 * The reference has the form {@code path/file.csv[column]}.
 */
public record CatalogIndexEntry(double tEff, double metallicity, double logG, String fileReference) {

    public double parameter(CatalogParameter parameter) {
        return switch (parameter) {
            case T_EFF -> tEff;
            case METALLICITY -> metallicity;
            case LOG_G -> logG;
        };
    }

    @Override
    public String toString() {
        return "[" + tEff + ", " + metallicity + ", " + logG + ", " + fileReference + "]";
    }
}
