package io.synphot.core.model;

/** The three physical axes of a catalog grid, in index-column order. */
public enum CatalogParameter {
    T_EFF("T_eff"),
    METALLICITY("metallicity"),
    LOG_G("log_g");

    private final String label;

    CatalogParameter(String label) {
        this.label = label;
    }

    /** Name used in messages and spectrum tags. */
    public String label() {
        return label;
    }
}
