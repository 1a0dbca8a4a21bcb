package com.starscape.mediavault.features.library.domain;

/**
 * How freshly extracted metadata is combined with what a row already holds.
 */
public enum MergePolicy {
    /** Keep stored values; only fill fields that are still empty. */
    FILL_MISSING,
    /** Take extracted values; keep stored values only where nothing was extracted. */
    REPLACE
}
