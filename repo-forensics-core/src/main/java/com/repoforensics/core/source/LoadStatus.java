package com.repoforensics.core.source;

/**
 * Outcome of loading one source.
 */
public enum LoadStatus {
    /** The file was read; individual rows may still have been skipped. */
    LOADED,

    /** The file does not exist. */
    MISSING,

    /** The file exists but could not be read or parsed as a whole. */
    FAILED
}
