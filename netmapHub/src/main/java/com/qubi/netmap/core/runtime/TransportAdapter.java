package com.qubi.netmap.core.runtime;

import com.qubi.netmap.core.model.ConnectionState;
import com.qubi.netmap.core.model.DeviceEvent;
import com.qubi.netmap.core.model.JsonSupport;
import com.qubi.netmap.core.spi.PushChannel;
import com.qubi.netmap.core.spi.SnapshotSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the push connection and the periodic pull, and feeds both into the
 * {@link TopologyService}.
 *
 * <p>Connection lifecycle: DISCONNECTED → CONNECTING → CONNECTED, and back to DISCONNECTED on
 * error or close. Reconnects use exponential backoff. After
 * {@link TransportSettings#reconnectAttempts()} consecutive failures the adapter stops in
 * RETRIES_EXHAUSTED until {@link #reconnect()} is called.
 *
 * <p>Connection attempts run on their own thread, so a slow connect never delays the pull.
 * The pull runs on its own timer whatever the connection state. A tick is skipped while a
 * previous pull is still in flight. No exception leaves this class: failures become state
 * changes and log lines.
 *
 * <p>Either side may be absent: a null channel means pull only, a null source means push only.
 */
public class TransportAdapter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(TransportAdapter.class);

    static final String REQUEST_INITIAL_DATA = "requestInitialData";

    private final PushChannel channel;
    private final SnapshotSource source;
    private final NormalizerRegistry registry;
    private final TopologyService service;
    private final TransportSettings settings;

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "netmap-transport");
        t.setDaemon(true);
        return t;
    });
    // connect puede bloquear; no debe frenar los ticks del pull
    private final ScheduledExecutorService connector = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "netmap-connect");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService pulls = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "netmap-pull");
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean pullInFlight = new AtomicBoolean();
    private final AtomicInteger failedAttempts = new AtomicInteger();
    private final AtomicLong epoch = new AtomicLong();   // descarta cierres de conexiones viejas
    private final AtomicLong skippedPulls = new AtomicLong();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean started;
    private volatile boolean closed;
    private ScheduledFuture<?> pullTask;
    private ScheduledFuture<?> retryTask;

    public TransportAdapter(PushChannel channel, SnapshotSource source, NormalizerRegistry registry,
                            TopologyService service, TransportSettings settings) {
        this.channel = channel;
        this.source = source;
        this.registry = registry;
        this.service = service;
        this.settings = settings;
    }

    public synchronized void start() {
        if (started || closed) return;
        started = true;
        if (source != null) {
            long interval = settings.pullInterval().toMillis();
            pullTask = timer.scheduleAtFixedRate(() -> pullNow("timer"), 0, interval, TimeUnit.MILLISECONDS);
        }
        if (channel != null) submitToConnector(this::connectOnce);
    }

    /** Manual reconnect: resets the attempt counter, also out of RETRIES_EXHAUSTED. */
    public void reconnect() {
        if (channel == null) return;
        submitToConnector(() -> {
            if (retryTask != null) retryTask.cancel(false);
            failedAttempts.set(0);
            epoch.incrementAndGet();
            closeChannelQuietly();
            connectOnce();
        });
    }

    /**
     * Immediate pull outside the timer.
     *
     * @return false when skipped because another pull is in flight or the adapter is closed
     */
    public boolean forceResync() {
        return pullNow("manual");
    }

    public ConnectionState state() {
        return state;
    }

    public int failedAttempts() {
        return failedAttempts.get();
    }

    public long skippedPulls() {
        return skippedPulls.get();
    }

    /** Cancels timers and in-flight work; results that arrive afterwards are discarded. */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
        }
        if (pullTask != null) pullTask.cancel(true);
        timer.shutdownNow();
        pulls.shutdownNow();
        epoch.incrementAndGet();
        // aborta un connect en curso antes de cortar su hilo
        closeChannelQuietly();
        connector.shutdownNow();
        if (source != null) {
            try {
                source.close();
            } catch (IOException e) {
                log.debug("[close] snapshot source: {}", e.toString());
            }
        }
        state = ConnectionState.DISCONNECTED;
        log.info("[close] transport stopped (failedAttempts={} skippedPulls={})",
                failedAttempts.get(), skippedPulls.get());
    }

    // ===== push connection (connector thread) =====

    private void connectOnce() {
        if (closed) return;
        long myEpoch = epoch.incrementAndGet();
        setState(ConnectionState.CONNECTING);
        try {
            channel.connect(new StreamHandler(myEpoch));
        } catch (IOException | RuntimeException e) {
            log.warn("[connect] attempt failed: {}", e.toString());
            onDisconnected(myEpoch, e);
            return;
        }
        if (closed) {
            closeChannelQuietly();
            return;
        }
        failedAttempts.set(0);
        setState(ConnectionState.CONNECTED);
        try {
            channel.send(JsonSupport.toJson(Map.of("event", REQUEST_INITIAL_DATA)));
        } catch (IOException e) {
            log.warn("[connect] could not request initial data: {}", e.toString());
        }
        pullNow("connect");
    }

    private void onDisconnected(long fromEpoch, Throwable cause) {
        if (closed || fromEpoch != epoch.get()) return;
        setState(ConnectionState.DISCONNECTED);
        int attempt = failedAttempts.incrementAndGet();
        if (attempt > settings.reconnectAttempts()) {
            log.warn("[connect] giving up after {} attempts; manual reconnect required", attempt - 1);
            setState(ConnectionState.RETRIES_EXHAUSTED);
            return;
        }
        long delay = settings.backoffMillis(attempt);
        log.info("[connect] retry {}/{} in {} ms ({})", attempt, settings.reconnectAttempts(), delay,
                cause == null ? "closed" : cause.toString());
        try {
            retryTask = connector.schedule(this::connectOnce, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[connect] retry not scheduled, transport closed");
        }
    }

    private void setState(ConnectionState next) {
        if (closed || state == next) return;
        state = next;
        log.info("[state] {}", next);
        service.updateConnectionState(next);
    }

    private void submitToConnector(Runnable r) {
        if (closed) return;
        try {
            connector.execute(r);
        } catch (RejectedExecutionException e) {
            log.debug("[connect] rejected, transport closed");
        }
    }

    private void closeChannelQuietly() {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[close] channel: {}", e.toString());
        }
    }

    private final class StreamHandler implements PushChannel.StreamListener {
        private final long connEpoch;

        StreamHandler(long connEpoch) {
            this.connEpoch = connEpoch;
        }

        @Override
        public void onLine(String line) {
            if (closed || connEpoch != epoch.get()) return;
            DeviceEvent event = registry.decodeLine(line);
            if (event != null) service.submit(event);
        }

        @Override
        public void onClosed(Throwable cause) {
            submitToConnector(() -> onDisconnected(connEpoch, cause));
        }
    }

    // ===== pull =====

    private boolean pullNow(String reason) {
        if (closed || source == null) return false;
        if (!pullInFlight.compareAndSet(false, true)) {
            skippedPulls.incrementAndGet();
            log.debug("[pull] {} tick skipped, previous pull still running", reason);
            return false;
        }
        try {
            pulls.execute(() -> runPull(reason));
            return true;
        } catch (RejectedExecutionException e) {
            pullInFlight.set(false);
            return false;
        }
    }

    private void runPull(String reason) {
        try {
            String body = source.fetch();
            if (closed) {
                log.debug("[pull] result discarded, transport closed");
                return;
            }
            DeviceEvent snapshot = registry.decodeSnapshot(body);
            if (snapshot == null) {
                log.warn("[pull] {} returned an unreadable snapshot", reason);
                service.updatePullFailing(true);
                return;
            }
            service.submit(snapshot);
            service.updatePullFailing(false);
        } catch (IOException | RuntimeException e) {
            if (!closed) {
                log.warn("[pull] {} failed: {}", reason, e.toString());
                service.updatePullFailing(true);
            }
        } finally {
            pullInFlight.set(false);
        }
    }
}
