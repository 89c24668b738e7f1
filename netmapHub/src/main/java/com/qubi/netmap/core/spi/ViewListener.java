package com.qubi.netmap.core.spi;

import com.qubi.netmap.core.model.TopologyView;

@FunctionalInterface
public interface ViewListener {
    void onView(TopologyView view);
}
