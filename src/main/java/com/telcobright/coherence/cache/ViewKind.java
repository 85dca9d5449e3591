package com.telcobright.coherence.cache;

/**
 * Tag of a {@link ViewKey}.
 */
public enum ViewKind {
    LIST,
    COUNT,
    COUNT_BY_STATUS,
    DETAIL,
    SEARCH,
    CUSTOM
}
