package com.qubi.netmap.core.model;

public enum EdgeStatus {
    ACTIVE,
    INACTIVE
}
