package com.distributedsystems.archon.client;

import com.distributedsystems.archon.exe.ArchonConfig;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinatorClientTest {

    private static final byte[] PUBLIC_ADDRESS = {93, (byte) 184, (byte) 216, 34};

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private final List<String> paths = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", exchange -> {
            paths.add(exchange.getRequestURI().getRawPath());
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            authHeaders.add(auth == null ? "" : auth);
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] reply = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private String localUrl() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    private static ArchonConfig config(String url, String token) {
        return new ArchonConfig("", url, true, token, 50_000, 1_000, "", "", 2_000,
                new ArchonConfig.Outbox(8, 30_000, 3_600_000, 0.2, 5, 300_000, 50, 30_000, false),
                new ArchonConfig.Retention(5_000, 50_000, 90, 3_600_000));
    }

    /** Pretends every host resolves to a public address so the loopback test server is reachable. */
    private static HostResolver pretendPublic() {
        return host -> new InetAddress[]{InetAddress.getByAddress(host, PUBLIC_ADDRESS)};
    }

    @Nested
    class Delivery {

        @Test
        void postsJsonWithBearerToken() throws Exception {
            CoordinatorClient client = new CoordinatorClient(config(localUrl(), "s3cret"), pretendPublic());

            int code = client.post("/api/v1/polls", "{\"poll_id\":\"p1\"}");

            assertThat(code).isEqualTo(200);
            assertThat(paths).containsExactly("/api/v1/polls");
            assertThat(authHeaders).containsExactly("Bearer s3cret");
            assertThat(bodies).containsExactly("{\"poll_id\":\"p1\"}");
        }

        @Test
        void omitsAuthorizationWithoutToken() throws Exception {
            CoordinatorClient client = new CoordinatorClient(config(localUrl() + "/", ""), pretendPublic());

            client.post("/api/v1/did/generate", "{}");

            assertThat(paths).containsExactly("/api/v1/did/generate");
            assertThat(authHeaders).containsExactly("");
        }

        @Test
        void nonSuccessStatusIsAFailure() {
            status.set(503);
            CoordinatorClient client = new CoordinatorClient(config(localUrl(), ""), pretendPublic());

            assertThatThrownBy(() -> client.post("/api/v1/polls", "{}"))
                    .isInstanceOf(DeliveryException.class)
                    .hasMessageContaining("HTTP 503");
        }
    }

    @Nested
    class Guard {

        @Test
        void loopbackTargetIsNeverContacted() {
            CoordinatorClient client = new CoordinatorClient(config(localUrl(), ""), HostResolver.system());

            assertThatThrownBy(() -> client.post("/api/v1/polls", "{}"))
                    .isInstanceOf(DeliveryException.class)
                    .hasMessageContaining("non-routable");
            assertThat(paths).isEmpty();
        }

        @Test
        void anyPrivateAddressInTheAnswerIsRejected() {
            HostResolver mixed = host -> new InetAddress[]{
                    InetAddress.getByAddress(host, PUBLIC_ADDRESS),
                    InetAddress.getByAddress(host, new byte[]{10, 0, 0, 7})};
            CoordinatorClient client = new CoordinatorClient(config(localUrl(), ""), mixed);

            assertThatThrownBy(() -> client.post("/api/v1/polls", "{}"))
                    .isInstanceOf(DeliveryException.class)
                    .hasMessageContaining("10.0.0.7");
            assertThat(paths).isEmpty();
        }

        @Test
        void dnsFailureFailsClosed() {
            HostResolver broken = host -> {
                throw new UnknownHostException(host);
            };
            CoordinatorClient client = new CoordinatorClient(config("https://coordinator.invalid", ""), broken);

            assertThatThrownBy(() -> client.post("/api/v1/polls", "{}"))
                    .isInstanceOf(DeliveryException.class)
                    .hasMessageContaining("DNS resolution failed");
        }
    }

    @Test
    void gatewayUrlParsing() {
        assertThat(CoordinatorClient.parseGatewayUrl("https://archon.technology")).isPresent();
        assertThat(CoordinatorClient.parseGatewayUrl("http://10.0.0.1:8080/base")).isPresent();
        assertThat(CoordinatorClient.parseGatewayUrl("ftp://archon.technology")).isEmpty();
        assertThat(CoordinatorClient.parseGatewayUrl("archon.technology")).isEmpty();
        assertThat(CoordinatorClient.parseGatewayUrl("https://")).isEmpty();
        assertThat(CoordinatorClient.parseGatewayUrl("  ")).isEmpty();
        assertThat(CoordinatorClient.parseGatewayUrl(null)).isEmpty();
    }

    @Test
    void unconfiguredClientRefusesToSend() {
        CoordinatorClient client = new CoordinatorClient(config("not a url", ""), pretendPublic());

        assertThat(client.isConfigured()).isFalse();
        assertThatThrownBy(() -> client.post("/api/v1/polls", "{}"))
                .isInstanceOf(DeliveryException.class);
    }
}
