package com.qubi.netmap.core.runtime;

import com.qubi.netmap.core.layout.Bounds;
import com.qubi.netmap.core.layout.LayoutEngine;
import com.qubi.netmap.core.layout.LayoutStrategy;
import com.qubi.netmap.core.model.ConnectionState;
import com.qubi.netmap.core.normalize.EventRoutes;
import com.qubi.netmap.core.spi.PushChannel;
import com.qubi.netmap.core.spi.SnapshotSource;
import com.qubi.netmap.core.topology.TopologyInferencer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class TransportAdapterTest {

    private static final String SNAPSHOT =
            "{\"devices\":[{\"id\":\"r\",\"ip\":\"10.0.0.1\",\"type\":\"router\",\"status\":\"online\"},"
                    + "{\"id\":\"w\",\"ip\":\"10.0.0.20\",\"status\":\"online\"}]}";

    private TopologyService service;
    private NormalizerRegistry registry;
    private TransportAdapter adapter;

    @BeforeEach
    void setUp() {
        service = new TopologyService(new TopologyInferencer(), new LayoutEngine(),
                LayoutStrategy.GRID, Bounds.DEFAULT);
        registry = NormalizerRegistry.withDefaults(EventRoutes.defaults());
    }

    @AfterEach
    void tearDown() {
        if (adapter != null) adapter.close();
        service.close();
    }

    private TransportAdapter newAdapter(PushChannel channel, SnapshotSource source, int attempts) {
        return newAdapter(channel, source, attempts, Duration.ofHours(1));
    }

    private TransportAdapter newAdapter(PushChannel channel, SnapshotSource source, int attempts,
                                        Duration pullInterval) {
        adapter = new TransportAdapter(channel, source, registry, service, new TransportSettings(
                attempts, Duration.ofMillis(10), Duration.ofMillis(40), pullInterval));
        return adapter;
    }

    @Test
    void backoffDoublesUpToTheCeiling() {
        TransportSettings s = TransportSettings.DEFAULTS;
        assertEquals(1000, s.backoffMillis(1));
        assertEquals(2000, s.backoffMillis(2));
        assertEquals(16000, s.backoffMillis(5));
        assertEquals(30000, s.backoffMillis(6));
        assertEquals(30000, s.backoffMillis(500));
    }

    @Test
    void givesUpAfterAttemptCapUntilManualReconnect() throws Exception {
        FakeChannel channel = new FakeChannel();
        channel.refuse = true;
        newAdapter(channel, null, 3).start();

        await(() -> adapter.state() == ConnectionState.RETRIES_EXHAUSTED);
        assertEquals(4, channel.connects.get(), "intento inicial + 3 reintentos");
        await(() -> service.view().connectionState() == ConnectionState.RETRIES_EXHAUSTED);

        Thread.sleep(150);
        assertEquals(4, channel.connects.get(), "no sigue reintentando solo");

        channel.refuse = false;
        adapter.reconnect();
        await(() -> adapter.state() == ConnectionState.CONNECTED);
        assertEquals(0, adapter.failedAttempts());
        await(() -> service.view().connectionState() == ConnectionState.CONNECTED);
    }

    @Test
    void connectRequestsInitialDataAndPulls() throws Exception {
        FakeChannel channel = new FakeChannel();
        FakeSource source = new FakeSource(SNAPSHOT);
        newAdapter(channel, source, 5).start();

        await(() -> adapter.state() == ConnectionState.CONNECTED);
        await(() -> channel.sent.contains("{\"event\":\"requestInitialData\"}"));
        await(() -> service.view().devices().size() == 2);
        assertEquals(1, service.view().edges().size());
        assertFalse(service.view().pullFailing());
    }

    @Test
    void streamLinesReachTheTopology() throws Exception {
        FakeChannel channel = new FakeChannel();
        newAdapter(channel, null, 5).start();
        await(() -> adapter.state() == ConnectionState.CONNECTED);

        channel.emit("{\"event\":\"deviceFound\",\"data\":{\"device\":{\"id\":\"a\",\"ip\":\"10.0.1.5\"}}}");
        channel.emit("garbage");
        channel.emit("{\"event\":\"discovery.deviceFound\",\"data\":{\"ip\":\"10.0.1.6\"}}");
        await(() -> service.view().devices().size() == 2);

        channel.emit("{\"event\":\"deviceRemoved\",\"data\":{\"id\":\"a\"}}");
        await(() -> service.view().devices().size() == 1);
    }

    @Test
    void lostConnectionIsRetried() throws Exception {
        FakeChannel channel = new FakeChannel();
        newAdapter(channel, null, 5).start();
        await(() -> adapter.state() == ConnectionState.CONNECTED);

        channel.drop(new IOException("reset"));
        await(() -> channel.connects.get() == 2);
        await(() -> adapter.state() == ConnectionState.CONNECTED);
        assertEquals(0, adapter.failedAttempts());
    }

    @Test
    void overlappingPullIsSkipped() throws Exception {
        FakeSource source = new FakeSource(SNAPSHOT);
        source.gate = new CountDownLatch(1);
        newAdapter(null, source, 5).start();

        assertTrue(source.started.await(2, TimeUnit.SECONDS), "el primer pull no arrancó");
        assertFalse(adapter.forceResync());
        assertTrue(adapter.skippedPulls() >= 1);

        source.gate.countDown();
        await(() -> service.view().devices().size() == 2);
        await(() -> adapter.forceResync());
        await(() -> source.fetches.get() == 2);
    }

    @Test
    void pullFailureIsFlaggedThenCleared() throws Exception {
        FakeSource source = new FakeSource(SNAPSHOT);
        source.fail = true;
        newAdapter(null, source, 5).start();

        await(() -> service.view().pullFailing());
        assertEquals(ConnectionState.DISCONNECTED, service.view().connectionState());

        source.fail = false;
        await(() -> adapter.forceResync());
        await(() -> !service.view().pullFailing());
        assertEquals(2, service.view().devices().size());
    }

    @Test
    void unreadableSnapshotCountsAsFailure() throws Exception {
        newAdapter(null, new FakeSource("<html>502</html>"), 5).start();
        await(() -> service.view().pullFailing());
        assertTrue(service.view().devices().isEmpty());
    }

    @Test
    void closeDiscardsInFlightResults() throws Exception {
        FakeSource source = new FakeSource(SNAPSHOT);
        source.gate = new CountDownLatch(1);
        FakeChannel channel = new FakeChannel();
        newAdapter(channel, source, 5).start();
        assertTrue(source.started.await(2, TimeUnit.SECONDS));

        adapter.close();
        source.gate.countDown();
        Thread.sleep(200);

        assertTrue(service.view().devices().isEmpty(), "resultado aplicado después de close");
        assertTrue(source.closed);
        assertFalse(adapter.forceResync());
    }

    @Test
    void slowConnectDoesNotHoldBackPulls() throws Exception {
        StallingChannel channel = new StallingChannel();
        FakeSource source = new FakeSource(SNAPSHOT);
        newAdapter(channel, source, 5, Duration.ofMillis(20)).start();

        assertTrue(channel.entered.await(2, TimeUnit.SECONDS), "connect no arrancó");
        await(() -> source.fetches.get() >= 3);
        assertEquals(ConnectionState.CONNECTING, adapter.state());
        await(() -> service.view().devices().size() == 2);
    }

    @Test
    void closeAbortsPendingConnect() throws Exception {
        StallingChannel channel = new StallingChannel();
        newAdapter(channel, null, 5).start();
        assertTrue(channel.entered.await(2, TimeUnit.SECONDS), "connect no arrancó");

        long t0 = System.nanoTime();
        adapter.close();
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0) < 1000, "close esperó al connect");
        await(() -> channel.aborted);
        assertEquals(1, channel.connects.get());
        assertEquals(ConnectionState.DISCONNECTED, adapter.state());
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("condición no alcanzada a tiempo");
            Thread.sleep(10);
        }
    }

    static class FakeChannel implements PushChannel {
        final AtomicInteger connects = new AtomicInteger();
        final List<String> sent = new CopyOnWriteArrayList<>();
        volatile boolean refuse;
        volatile StreamListener listener;
        volatile boolean open;

        @Override
        public void connect(StreamListener l) throws IOException {
            connects.incrementAndGet();
            if (refuse) throw new IOException("connection refused");
            listener = l;
            open = true;
        }

        @Override
        public void send(String line) {
            sent.add(line);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }

        void emit(String line) {
            listener.onLine(line);
        }

        void drop(Throwable cause) {
            open = false;
            listener.onClosed(cause);
        }
    }

    /** Connect that hangs until the channel is closed, like a SYN lost on the way. */
    static class StallingChannel implements PushChannel {
        final AtomicInteger connects = new AtomicInteger();
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch released = new CountDownLatch(1);
        volatile boolean aborted;

        @Override
        public void connect(StreamListener l) throws IOException {
            connects.incrementAndGet();
            entered.countDown();
            try {
                released.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            aborted = true;
            throw new IOException("connect aborted");
        }

        @Override
        public void send(String line) throws IOException {
            throw new IOException("not connected");
        }

        @Override
        public boolean isOpen() {
            return false;
        }

        @Override
        public void close() {
            released.countDown();
        }
    }

    static class FakeSource implements SnapshotSource {
        final String body;
        final AtomicInteger fetches = new AtomicInteger();
        final CountDownLatch started = new CountDownLatch(1);
        volatile CountDownLatch gate;
        volatile boolean fail;
        volatile boolean closed;

        FakeSource(String body) {
            this.body = body;
        }

        @Override
        public String fetch() throws IOException {
            fetches.incrementAndGet();
            started.countDown();
            CountDownLatch g = gate;
            if (g != null) {
                // respuesta tardía: llega aunque interrumpan el hilo
                boolean interrupted = false;
                while (g.getCount() > 0) {
                    try {
                        g.await();
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
                if (interrupted) Thread.currentThread().interrupt();
            }
            if (fail) throw new IOException("HTTP 503");
            return body;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
