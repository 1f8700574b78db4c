package io.synphot.core.error;

/** Thrown when a resolved component name is absent from a component table. */
public final class ComponentNotFoundException extends SynphotException {

    private static final long serialVersionUID = 1L;

    private final String component;

    public ComponentNotFoundException(String component, String table) {
        super("Cannot find " + component + " in " + table + ".", ErrorKind.TABLE_INTEGRITY, table);
        this.component = component;
    }

    /** The component name that could not be found. */
    public String component() {
        return component;
    }
}
