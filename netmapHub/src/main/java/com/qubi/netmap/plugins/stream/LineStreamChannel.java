package com.qubi.netmap.plugins.stream;

import com.qubi.netmap.core.spi.PushChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Push channel over a plain TCP socket: newline-delimited JSON envelopes in both directions.
 * Endpoint form is {@code tcp://host:port}.
 */
public class LineStreamChannel implements PushChannel {
    private static final Logger log = LoggerFactory.getLogger(LineStreamChannel.class);

    private final String host;
    private final int port;
    private final int connectTimeoutMs;
    private final ExecutorService reader = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "netmap-stream-reader");
        t.setDaemon(true);
        return t;
    });

    private final Object writeLock = new Object();
    private final Object connectLock = new Object();
    // publicado antes del connect para que close() pueda abortarlo
    private volatile Socket socket;

    public LineStreamChannel(String host, int port, int connectTimeoutMs) {
        this.host = host;
        this.port = port;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public static LineStreamChannel forEndpoint(String endpoint, int connectTimeoutMs) {
        URI uri;
        try {
            uri = URI.create(endpoint);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid push endpoint: " + endpoint, e);
        }
        if (!"tcp".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null || uri.getPort() < 0) {
            throw new IllegalArgumentException("Push endpoint must look like tcp://host:port, got " + endpoint);
        }
        return new LineStreamChannel(uri.getHost(), uri.getPort(), connectTimeoutMs);
    }

    /** Blocks while connecting; a concurrent {@link #close()} aborts the attempt with an IOException. */
    @Override
    public void connect(StreamListener listener) throws IOException {
        synchronized (connectLock) {
            closeSocket();
            Socket s = new Socket();
            socket = s;
            try {
                s.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            } catch (IOException e) {
                s.close();
                if (socket == s) socket = null;
                throw e;
            }
            if (socket != s || s.isClosed()) {
                s.close();
                throw new IOException("stream closed while connecting to " + host + ":" + port);
            }
            startReading(s, listener);
        }
    }

    private void startReading(Socket s, StreamListener listener) {
        log.info("[stream] connected to {}:{}", host, port);
        reader.submit(() -> receiveLoop(s, listener));
    }

    @Override
    public void send(String line) throws IOException {
        Socket s = socket;
        if (s == null || s.isClosed()) throw new IOException("stream not connected");
        OutputStream out = s.getOutputStream();
        synchronized (writeLock) {
            out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        }
    }

    @Override
    public boolean isOpen() {
        Socket s = socket;
        return s != null && s.isConnected() && !s.isClosed();
    }

    @Override
    public void close() throws IOException {
        closeSocket();
    }

    /** Releases the reader thread too; the channel cannot be reconnected afterwards. */
    public void shutdown() {
        try {
            close();
        } catch (IOException e) {
            log.debug("[stream] close: {}", e.toString());
        }
        reader.shutdownNow();
    }

    private void closeSocket() throws IOException {
        Socket s = socket;
        socket = null;
        if (s != null && !s.isClosed()) s.close();
    }

    private void receiveLoop(Socket s, StreamListener listener) {
        Throwable cause = null;
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                String body = line.trim();
                if (body.isEmpty()) continue;
                try {
                    listener.onLine(body);
                } catch (RuntimeException e) {
                    log.warn("[stream] listener failed on line: {}", e.toString());
                }
            }
        } catch (IOException e) {
            // cierre local: no es un error
            if (!s.isClosed()) cause = e;
        }
        log.info("[stream] connection to {}:{} ended{}", host, port, cause == null ? "" : ": " + cause);
        listener.onClosed(cause);
    }
}
