package com.qubi.netmap.plugins.http;

import com.qubi.netmap.core.spi.SnapshotSource;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Pulls the full device list with a GET on a fixed URL.
 * Any non-2xx answer is reported as an {@link IOException}.
 */
public class HttpSnapshotSource implements SnapshotSource {

    private final URI url;
    private final String authorization;
    private final CloseableHttpClient client;

    /**
     * @param authorization value of the Authorization header, or {@code null} if not required
     */
    public HttpSnapshotSource(URI url, int timeoutMs, String authorization) {
        this.url = url;
        this.authorization = authorization;
        RequestConfig rc = RequestConfig.custom()
                .setConnectTimeout(timeoutMs)
                .setConnectionRequestTimeout(timeoutMs)
                .setSocketTimeout(timeoutMs)
                .build();
        this.client = HttpClients.custom().setDefaultRequestConfig(rc).build();
    }

    @Override
    public String fetch() throws IOException {
        HttpGet request = new HttpGet(url);
        request.setHeader("Accept", "application/json");
        if (authorization != null && !authorization.isBlank()) {
            request.setHeader("Authorization", authorization);
        }
        try (CloseableHttpResponse rsp = client.execute(request)) {
            int code = rsp.getStatusLine().getStatusCode();
            HttpEntity ent = rsp.getEntity();
            String body = ent == null ? "" : EntityUtils.toString(ent, StandardCharsets.UTF_8);
            if (code < 200 || code >= 300) {
                throw new IOException("GET " + url + " returned " + code);
            }
            return body;
        }
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
