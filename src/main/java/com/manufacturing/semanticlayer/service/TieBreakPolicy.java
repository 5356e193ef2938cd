package com.manufacturing.semanticlayer.service;

/**
 * How the concept resolver settles equal elevation scores once the table-alias
 * comparison is exhausted.
 */
public enum TieBreakPolicy {
    /** Fall back to the concept name; resolution always yields a winner. */
    LEXICOGRAPHIC,
    /** Report the remaining tie as ambiguous. */
    STRICT
}
