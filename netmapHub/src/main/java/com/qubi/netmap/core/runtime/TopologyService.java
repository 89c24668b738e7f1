package com.qubi.netmap.core.runtime;

import com.qubi.netmap.core.layout.Bounds;
import com.qubi.netmap.core.layout.LayoutEngine;
import com.qubi.netmap.core.layout.LayoutStrategy;
import com.qubi.netmap.core.model.ConnectionState;
import com.qubi.netmap.core.model.Device;
import com.qubi.netmap.core.model.DeviceEvent;
import com.qubi.netmap.core.model.Edge;
import com.qubi.netmap.core.model.TopologyView;
import com.qubi.netmap.core.spi.ViewListener;
import com.qubi.netmap.core.store.DeviceStore;
import com.qubi.netmap.core.topology.TopologyInferencer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single owner of the {@link DeviceStore}. Every mutation runs on one dedicated thread (the
 * mutation queue), so merges apply one at a time. After each change the edge set and layout
 * are recomputed from an immutable device snapshot, and a new {@link TopologyView} is
 * published to the listeners.
 */
public class TopologyService implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(TopologyService.class);

    private final DeviceStore store = new DeviceStore();
    private final TopologyInferencer inferencer;
    private final LayoutEngine layout;
    private final Bounds bounds;
    private final List<ViewListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService mutations = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "netmap-mutations");
        t.setDaemon(true);
        return t;
    });

    // sólo se escriben desde el hilo de mutaciones
    private LayoutStrategy strategy;
    private List<Edge> edges = List.of();
    private ConnectionState connectionState = ConnectionState.DISCONNECTED;
    private boolean pullFailing;

    private volatile TopologyView current;
    private volatile boolean closed;

    public TopologyService(TopologyInferencer inferencer, LayoutEngine layout,
                           LayoutStrategy strategy, Bounds bounds) {
        this.inferencer = inferencer;
        this.layout = layout;
        this.strategy = strategy;
        this.bounds = bounds;
        this.current = TopologyView.empty(strategy);
    }

    /** Latest published snapshot; never null. */
    public TopologyView view() {
        return current;
    }

    /**
     * Registers a listener for every subsequent view.
     *
     * @return handle that unregisters the listener when closed
     */
    public AutoCloseable subscribe(ViewListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Applies one decoded event. Null events are ignored. */
    public CompletableFuture<TopologyView> submit(DeviceEvent event) {
        if (event == null) return CompletableFuture.completedFuture(current);
        return enqueue(() -> {
            long before = store.version();
            apply(event);
            if (store.version() != before) recompute();
            return current;
        });
    }

    public CompletableFuture<TopologyView> setLayoutStrategy(LayoutStrategy next) {
        return enqueue(() -> {
            if (next != null && next != strategy) {
                strategy = next;
                recompute();
            }
            return current;
        });
    }

    public CompletableFuture<TopologyView> updateConnectionState(ConnectionState state) {
        return enqueue(() -> {
            if (state != connectionState) {
                connectionState = state;
                publish(current.withConnectionState(state));
            }
            return current;
        });
    }

    public CompletableFuture<TopologyView> updatePullFailing(boolean failing) {
        return enqueue(() -> {
            if (failing != pullFailing) {
                pullFailing = failing;
                publish(current.withPullFailing(failing));
            }
            return current;
        });
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops the mutation queue; later submissions are ignored. Queued mutations are dropped
     * and their futures complete with the last published view.
     */
    @Override
    public void close() {
        closed = true;
        List<Runnable> dropped = mutations.shutdownNow();
        listeners.clear();
        for (Runnable r : dropped) {
            if (r instanceof Mutation m) m.discard();
        }
        if (!dropped.isEmpty()) log.debug("[close] dropped {} queued mutations", dropped.size());
        try {
            mutations.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ===== mutation thread =====

    private void apply(DeviceEvent event) {
        if (event instanceof DeviceEvent.Sighted s) {
            store.merge(s.device());
        } else if (event instanceof DeviceEvent.Removed r) {
            if (!store.remove(r.id())) log.debug("[remove] unknown device {}", r.id());
        } else if (event instanceof DeviceEvent.Snapshot snap) {
            store.replaceSnapshot(snap.devices());
            log.debug("[snapshot] merged {} devices, store size {}", snap.devices().size(), store.size());
        } else if (event instanceof DeviceEvent.Metrics m) {
            if (!store.recordMetrics(m.deviceId(), m.metrics(), m.lastSeen())) {
                log.debug("[metrics] unknown device {}", m.deviceId());
            }
        }
    }

    private void recompute() {
        List<Device> snapshot = store.devices();
        edges = inferencer.infer(snapshot);
        List<Device> placed = layout.position(snapshot, edges, strategy, bounds);
        publish(new TopologyView(placed, edges, store.counters(edges), connectionState,
                pullFailing, strategy, store.version(), Instant.now()));
    }

    private void publish(TopologyView view) {
        current = view;
        for (ViewListener l : listeners) {
            try {
                l.onView(view);
            } catch (RuntimeException ex) {
                log.warn("[listener] {} failed: {}", l, ex.toString());
            }
        }
    }

    private CompletableFuture<TopologyView> enqueue(Supplier<TopologyView> task) {
        if (closed) return CompletableFuture.completedFuture(current);
        Mutation m = new Mutation(task);
        try {
            mutations.execute(m);
        } catch (RejectedExecutionException e) {
            m.discard();
        }
        return m.result;
    }

    /** Queue entry that always finishes its future: applied, failed or discarded. */
    private final class Mutation implements Runnable {
        private final Supplier<TopologyView> task;
        private final CompletableFuture<TopologyView> result = new CompletableFuture<>();

        Mutation(Supplier<TopologyView> task) {
            this.task = task;
        }

        @Override
        public void run() {
            if (closed) {
                discard();
                return;
            }
            try {
                result.complete(task.get());
            } catch (RuntimeException ex) {
                // el store ya pudo haber cambiado; la vista publicada queda atrasada
                log.warn("[mutation] failed, view not recomputed: {}", ex.toString(), ex);
                result.completeExceptionally(ex);
            }
        }

        void discard() {
            result.complete(current);
        }
    }
}
