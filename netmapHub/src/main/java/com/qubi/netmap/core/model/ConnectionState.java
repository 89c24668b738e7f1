package com.qubi.netmap.core.model;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Attempt cap reached; only a manual reconnect leaves this state. */
    RETRIES_EXHAUSTED
}
