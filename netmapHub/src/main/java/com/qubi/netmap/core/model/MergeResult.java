package com.qubi.netmap.core.model;

public enum MergeResult {
    CREATED,
    UPDATED,
    /** Record without id or address; nothing was stored. */
    IGNORED
}
