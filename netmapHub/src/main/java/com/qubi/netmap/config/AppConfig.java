package com.qubi.netmap.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    public PushConfig push = new PushConfig();
    public PullConfig pull = new PullConfig();
    public LayoutConfig layout = new LayoutConfig();
    public TopologyConfig topology = new TopologyConfig();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PushConfig {
        /** tcp://host:port; sin endpoint sólo corre el pull. */
        public String endpoint;
        public int connectTimeoutMs = 5000;
        /** Reintentos seguidos antes de RETRIES_EXHAUSTED. */
        public int reconnectAttempts = 5;
        public long baseBackoffMs = 1000;
        public long maxBackoffMs = 30000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PullConfig {
        public String url;
        public long intervalMs = 30000;
        public int timeoutMs = 10000;
        /** Valor literal del header Authorization (ej. "Bearer ..."). */
        public String authorization;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LayoutConfig {
        public String strategy = "hierarchical";   // hierarchical|circular|grid|clustered
        public double width = 1000;
        public double height = 700;
        public double padding = 40;
        public long seed = 0x5EEDL;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TopologyConfig {
        public int meshLimit = 4;
        public boolean backboneLinks = false;
    }

    public static AppConfig load(InputStream in) {
        try (InputStream is = in) {
            if (is == null) throw new IOException("configuration not found");
            ObjectMapper om = new ObjectMapper(new YAMLFactory());
            AppConfig cfg = om.readValue(is, AppConfig.class);
            return cfg == null ? new AppConfig() : cfg.fillMissing();
        } catch (IOException e) {
            throw new IllegalStateException("Error loading configuration", e);
        }
    }

    public static AppConfig load(Path file) {
        try {
            return load(Files.newInputStream(file));
        } catch (IOException e) {
            throw new IllegalStateException("Error loading configuration", e);
        }
    }

    /** Bundled netmap.yml. */
    public static AppConfig defaults() {
        return load(AppConfig.class.getResourceAsStream("/netmap.yml"));
    }

    /** Bundled netmap.yml with the process environment applied on top. */
    public static AppConfig fromEnvironment() {
        return defaults().applyEnvironment(System.getenv());
    }

    /**
     * Overrides from NETMAP_* variables. Numbers that do not parse fail like a bad file.
     */
    public AppConfig applyEnvironment(Map<String, String> env) {
        String v;
        if ((v = env.get("NETMAP_PUSH_ENDPOINT")) != null) push.endpoint = v.isBlank() ? null : v.trim();
        if ((v = env.get("NETMAP_PULL_URL")) != null) pull.url = v.isBlank() ? null : v.trim();
        if ((v = env.get("NETMAP_PULL_AUTHORIZATION")) != null) pull.authorization = v;
        try {
            if ((v = env.get("NETMAP_PULL_INTERVAL_MS")) != null) pull.intervalMs = Long.parseLong(v.trim());
            if ((v = env.get("NETMAP_RECONNECT_ATTEMPTS")) != null) push.reconnectAttempts = Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Error loading configuration", e);
        }
        return this;
    }

    // secciones vacías en el YAML llegan como null
    private AppConfig fillMissing() {
        if (push == null) push = new PushConfig();
        if (pull == null) pull = new PullConfig();
        if (layout == null) layout = new LayoutConfig();
        if (topology == null) topology = new TopologyConfig();
        return this;
    }
}
