package io.synphot.core.error;

/** Classification of every failure the engine can raise. */
public enum ErrorKind {
    /** Lexical or grammatical failure, unknown function or unit name. */
    PARSE,
    /** More than one mode keyword matched at a single graph-table node. */
    AMBIGUOUS_MODE,
    /** Traversal reached a node with no successor for the given keywords. */
    INCOMPLETE_MODE,
    /** Traversal completed but some keyword was never consumed. */
    UNUSED_KEYWORD,
    /** Graph or component table is inconsistent (missing component, loop). */
    TABLE_INTEGRITY,
    /** Catalog parameter outside the grid, or a grid cell without valid flux. */
    PARAMETER_OUT_OF_BOUNDS,
    /** Spectrum and passband do not overlap at all. */
    DISJOINT_OVERLAP,
    /** Unreadable or malformed data file, or an invalid spectrum operation. */
    DATA
}
