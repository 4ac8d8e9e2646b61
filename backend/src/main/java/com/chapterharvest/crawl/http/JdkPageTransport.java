package com.chapterharvest.crawl.http;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.Authenticator;
import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * JDK transport. Direct and HTTP-proxy routes go through one cached {@link HttpClient} per route;
 * SOCKS routes use {@link HttpURLConnection}, which the JDK client cannot tunnel through.
 */
@Component
public class JdkPageTransport implements PageTransport {
    private static final String DIRECT_ROUTE = "direct";
    static final int MAX_CACHED_CLIENTS = 32;

    private final CrawlerProperties properties;
    private final ExecutorService httpExecutor;
    private final Object clientsLock = new Object();
    // Access-ordered; evicted clients release their selector thread once unreachable.
    private final Map<String, HttpClient> clients = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, HttpClient> eldest) {
            return size() > MAX_CACHED_CLIENTS;
        }
    };

    public JdkPageTransport(CrawlerProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.httpExecutor = httpExecutor;
    }

    @Override
    public HttpFetchResult get(String url, String proxyUrl, Map<String, String> headers, Duration timeout) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, proxyUrl, startedAt, "invalid_url", "URL missing host or malformed");
        }
        ProxyEndpoint endpoint = null;
        if (proxyUrl != null) {
            endpoint = ProxyEndpoint.parse(proxyUrl);
            if (endpoint == null) {
                return errorResult(url, proxyUrl, startedAt, "invalid_proxy", "Proxy URL missing host or port");
            }
        }
        if (endpoint != null && endpoint.socks()) {
            return getViaSocks(url, uri, proxyUrl, endpoint, headers, timeout, startedAt);
        }
        try {
            HttpClient client = clientFor(proxyUrl, endpoint);
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .GET();
            headers.forEach(builder::header);
            HttpResponse<byte[]> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                proxyUrl,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, proxyUrl, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, proxyUrl, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, proxyUrl, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, proxyUrl, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult getViaSocks(
        String url,
        URI uri,
        String proxyUrl,
        ProxyEndpoint endpoint,
        Map<String, String> headers,
        Duration timeout,
        Instant startedAt
    ) {
        HttpURLConnection connection = null;
        try {
            Proxy proxy = new Proxy(Proxy.Type.SOCKS, InetSocketAddress.createUnresolved(endpoint.host(), endpoint.port()));
            connection = (HttpURLConnection) uri.toURL().openConnection(proxy);
            int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
            connection.setConnectTimeout(timeoutMs);
            connection.setReadTimeout(timeoutMs);
            connection.setInstanceFollowRedirects(true);
            headers.forEach(connection::setRequestProperty);
            int status = connection.getResponseCode();
            String body;
            try (InputStream in = status >= 400 ? connection.getErrorStream() : connection.getInputStream()) {
                body = in == null ? "" : new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            return new HttpFetchResult(
                url,
                connection.getURL().toURI(),
                status,
                body,
                connection.getContentType(),
                proxyUrl,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (SocketTimeoutException e) {
            return errorResult(url, proxyUrl, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, proxyUrl, startedAt, "io_error", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, proxyUrl, startedAt, "http_error", e.getMessage());
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private HttpClient clientFor(String proxyUrl, ProxyEndpoint endpoint) {
        String key = proxyUrl == null ? DIRECT_ROUTE : proxyUrl;
        synchronized (clientsLock) {
            HttpClient client = clients.get(key);
            if (client == null) {
                client = buildClient(endpoint);
                clients.put(key, client);
            }
            return client;
        }
    }

    int cachedClientCount() {
        synchronized (clientsLock) {
            return clients.size();
        }
    }

    private HttpClient buildClient(ProxyEndpoint endpoint) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor);
        if (endpoint != null) {
            builder.proxy(ProxySelector.of(new InetSocketAddress(endpoint.host(), endpoint.port())));
            if (endpoint.username() != null) {
                builder.authenticator(new Authenticator() {
                    @Override
                    protected PasswordAuthentication getPasswordAuthentication() {
                        if (getRequestorType() != RequestorType.PROXY) {
                            return null;
                        }
                        String password = endpoint.password() == null ? "" : endpoint.password();
                        return new PasswordAuthentication(endpoint.username(), password.toCharArray());
                    }
                });
            }
        }
        return builder.build();
    }

    private HttpFetchResult errorResult(String url, String proxyUrl, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            proxyUrl,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    record ProxyEndpoint(String scheme, String host, int port, String username, String password) {
        static ProxyEndpoint parse(String proxyUrl) {
            try {
                URI uri = new URI(proxyUrl.trim());
                if (uri.getHost() == null) {
                    return null;
                }
                String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
                int port = uri.getPort();
                if (port <= 0) {
                    port = scheme.startsWith("socks") ? 1080 : 80;
                }
                String username = null;
                String password = null;
                String userInfo = uri.getUserInfo();
                if (userInfo != null && !userInfo.isBlank()) {
                    int colon = userInfo.indexOf(':');
                    username = colon < 0 ? userInfo : userInfo.substring(0, colon);
                    password = colon < 0 ? null : userInfo.substring(colon + 1);
                }
                return new ProxyEndpoint(scheme, uri.getHost(), port, username, password);
            } catch (URISyntaxException e) {
                return null;
            }
        }

        boolean socks() {
            return scheme.startsWith("socks");
        }
    }
}
