package com.qubi.netmap;

import com.qubi.netmap.config.AppConfig;
import com.qubi.netmap.core.layout.Bounds;
import com.qubi.netmap.core.layout.Jitter;
import com.qubi.netmap.core.layout.LayoutEngine;
import com.qubi.netmap.core.layout.LayoutStrategy;
import com.qubi.netmap.core.model.TopologyView;
import com.qubi.netmap.core.normalize.EventRoutes;
import com.qubi.netmap.core.runtime.NormalizerRegistry;
import com.qubi.netmap.core.runtime.TopologyService;
import com.qubi.netmap.core.runtime.TransportAdapter;
import com.qubi.netmap.core.runtime.TransportSettings;
import com.qubi.netmap.core.spi.PushChannel;
import com.qubi.netmap.core.spi.SnapshotSource;
import com.qubi.netmap.core.spi.ViewListener;
import com.qubi.netmap.core.topology.TopologyInferencer;
import com.qubi.netmap.plugins.http.HttpSnapshotSource;
import com.qubi.netmap.plugins.stream.LineStreamChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * One live topology for one consumer session. Owns every component; nothing is shared
 * between sessions. Close it when the session ends.
 */
public final class NetmapSession implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(NetmapSession.class);

    private final TopologyService service;
    private final TransportAdapter transport;
    private final PushChannel channel;

    NetmapSession(TopologyService service, TransportAdapter transport, PushChannel channel) {
        this.service = service;
        this.transport = transport;
        this.channel = channel;
    }

    /** Session from the bundled defaults plus NETMAP_* environment overrides. */
    public static NetmapSession open() {
        return open(AppConfig.fromEnvironment());
    }

    /** Builds and starts a session. Invalid configuration fails here, before any I/O. */
    public static NetmapSession open(AppConfig cfg) {
        LayoutStrategy strategy = LayoutStrategy.fromString(cfg.layout.strategy);
        Bounds bounds = new Bounds(cfg.layout.width, cfg.layout.height, cfg.layout.padding);
        TransportSettings settings = new TransportSettings(
                cfg.push.reconnectAttempts,
                Duration.ofMillis(cfg.push.baseBackoffMs),
                Duration.ofMillis(cfg.push.maxBackoffMs),
                Duration.ofMillis(cfg.pull.intervalMs));

        PushChannel channel = cfg.push.endpoint == null || cfg.push.endpoint.isBlank()
                ? null
                : LineStreamChannel.forEndpoint(cfg.push.endpoint, cfg.push.connectTimeoutMs);
        SnapshotSource source = cfg.pull.url == null || cfg.pull.url.isBlank()
                ? null
                : new HttpSnapshotSource(URI.create(cfg.pull.url), cfg.pull.timeoutMs, cfg.pull.authorization);

        TopologyService service = new TopologyService(
                new TopologyInferencer(cfg.topology.meshLimit, cfg.topology.backboneLinks),
                new LayoutEngine(new Jitter(cfg.layout.seed)),
                strategy, bounds);
        NormalizerRegistry registry = NormalizerRegistry.withDefaults(EventRoutes.defaults());
        TransportAdapter transport = new TransportAdapter(channel, source, registry, service, settings);

        NetmapSession session = new NetmapSession(service, transport, channel);
        transport.start();
        log.info("[session] opened (push={}, pull={}, layout={})",
                channel != null ? cfg.push.endpoint : "off",
                source != null ? cfg.pull.url : "off", strategy);
        return session;
    }

    public TopologyView view() {
        return service.view();
    }

    public AutoCloseable subscribe(ViewListener listener) {
        return service.subscribe(listener);
    }

    public CompletableFuture<TopologyView> setLayoutStrategy(LayoutStrategy strategy) {
        return service.setLayoutStrategy(strategy);
    }

    /** @return false when a pull was already running and this request was skipped */
    public boolean forceResync() {
        return transport.forceResync();
    }

    public void reconnect() {
        transport.reconnect();
    }

    @Override
    public void close() {
        transport.close();
        if (channel instanceof LineStreamChannel lsc) lsc.shutdown();
        service.close();
        log.info("[session] closed");
    }
}
