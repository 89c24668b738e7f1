package com.qubi.netmap.core.model;

public record FilteredStats(
        int visible,
        int total,
        int online,
        int offline,
        int connections    // edges con ambos extremos visibles
) {}
