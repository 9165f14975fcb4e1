package com.distributedsystems.archon.client;

import com.distributedsystems.archon.exe.ArchonConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * HTTP JSON client for the optional remote coordinator. Every call resolves the host first and
 * refuses to connect when any resolved address is not publicly routable.
 */
@Slf4j
@Component
public class CoordinatorClient {

    private static final int MAX_ERROR_BODY = 200;

    private final ArchonConfig config;
    private final HostResolver resolver;
    private final HttpClient httpClient;
    private final URI baseUri;

    @Autowired
    public CoordinatorClient(ArchonConfig config, HostResolver resolver) {
        this.config = config;
        this.resolver = resolver;
        this.baseUri = parseGatewayUrl(config.getGatewayUrl()).orElse(null);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    /**
     * Accepts only absolute {@code http}/{@code https} URLs with a host.
     */
    public static Optional<URI> parseGatewayUrl(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("https") && !scheme.equals("http")) return Optional.empty();
            if (uri.getHost() == null || uri.getHost().isBlank()) return Optional.empty();
            return Optional.of(uri);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    public boolean isConfigured() {
        return baseUri != null;
    }

    /**
     * POSTs {@code jsonBody} to {@code resourcePath} under the gateway URL.
     *
     * @return the HTTP status of a 2xx reply
     * @throws DeliveryException on guard rejection, DNS failure, I/O error, timeout or non-2xx
     */
    public int post(String resourcePath, String jsonBody) throws DeliveryException {
        if (baseUri == null) {
            throw new DeliveryException("coordinator URL not configured");
        }
        URI target = resolve(resourcePath);
        assertRoutable(target.getHost());

        HttpRequest.Builder request = HttpRequest.newBuilder(target)
                .timeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8));
        if (config.hasGatewayToken()) {
            request.header("Authorization", "Bearer " + config.getGatewayToken());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("request to " + target.getHost() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("interrupted while calling coordinator", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new DeliveryException("coordinator returned HTTP " + status + bodyHint(response.body()));
        }
        log.debug("POST {} -> {}", target.getPath(), status);
        return status;
    }

    private URI resolve(String resourcePath) throws DeliveryException {
        String base = baseUri.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String path = resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
        try {
            return new URI(base + path);
        } catch (URISyntaxException e) {
            throw new DeliveryException("invalid resource path " + resourcePath, e);
        }
    }

    private void assertRoutable(String host) throws DeliveryException {
        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException e) {
            throw new DeliveryException("DNS resolution failed for " + host, e);
        }
        if (addresses == null || addresses.length == 0) {
            throw new DeliveryException("DNS resolution returned no addresses for " + host);
        }
        for (InetAddress address : addresses) {
            if (NetworkGuard.isNonRoutable(address)) {
                throw new DeliveryException("refusing non-routable address " + address.getHostAddress()
                        + " for " + host);
            }
        }
    }

    private static String bodyHint(String body) {
        if (body == null || body.isBlank()) return "";
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_ERROR_BODY ? trimmed.substring(0, MAX_ERROR_BODY) : trimmed);
    }
}
