package com.qubi.netmap.core.model;

public record Position(
        double x,
        double y
) {}
