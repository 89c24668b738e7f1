package com.qubi.netmap.core.spi;

import java.io.Closeable;
import java.io.IOException;

/**
 * Long-lived push connection carrying one JSON envelope per line.
 */
public interface PushChannel extends Closeable {

    /** Blocks until connected or fails; lines are then delivered on the channel's own thread. */
    void connect(StreamListener listener) throws IOException;

    void send(String line) throws IOException;

    boolean isOpen();

    interface StreamListener {
        void onLine(String line);
        /** Connection lost; {@code cause} is null on an orderly end of stream. */
        void onClosed(Throwable cause);
    }
}
