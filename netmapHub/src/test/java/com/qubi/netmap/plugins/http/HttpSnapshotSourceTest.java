package com.qubi.netmap.plugins.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpSnapshotSourceTest {

    private static final String BODY = "{\"devices\":[{\"id\":\"a\",\"ip\":\"10.0.0.1\"}]}";

    private HttpServer server;
    private final AtomicReference<String> seenAuth = new AtomicReference<>();
    private String base;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/api/devices", ex -> {
            seenAuth.set(ex.getRequestHeaders().getFirst("Authorization"));
            respond(ex, 200, BODY);
        });
        server.createContext("/broken", ex -> respond(ex, 503, "down"));
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void fetchesBodyWithAuthorization() throws Exception {
        try (HttpSnapshotSource source = new HttpSnapshotSource(URI.create(base + "/api/devices"), 2000, "Bearer t0k")) {
            assertEquals(BODY, source.fetch());
            assertEquals("Bearer t0k", seenAuth.get());
        }
    }

    @Test
    void noAuthorizationHeaderWhenNotConfigured() throws Exception {
        try (HttpSnapshotSource source = new HttpSnapshotSource(URI.create(base + "/api/devices"), 2000, null)) {
            source.fetch();
            assertNull(seenAuth.get());
        }
    }

    @Test
    void non2xxIsAnIOException() throws Exception {
        try (HttpSnapshotSource source = new HttpSnapshotSource(URI.create(base + "/broken"), 2000, null)) {
            IOException ex = assertThrows(IOException.class, source::fetch);
            assertTrue(ex.getMessage().contains("503"));
        }
    }
}
