package com.qubi.netmap.core.spi;

import java.io.Closeable;
import java.io.IOException;

/**
 * Full-state pull, returning the raw snapshot body.
 */
public interface SnapshotSource extends Closeable {
    String fetch() throws IOException;
}
