package com.distributedsystems.archon.client;

import com.distributedsystems.archon.exe.ArchonConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpChannelBalanceClientTest {

    private HttpServer server;
    private final AtomicReference<String> reply = new AtomicReference<>("{}");
    private final AtomicInteger status = new AtomicInteger(200);

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/v1/listfunds", exchange -> {
            byte[] body = reply.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private HttpChannelBalanceClient client(String ledgerUrl) {
        ArchonConfig config = new ArchonConfig("", "https://archon.technology", false, "", 50_000, 1_000,
                ledgerUrl, "", 2_000,
                new ArchonConfig.Outbox(8, 30_000, 3_600_000, 0.2, 5, 300_000, 50, 30_000, false),
                new ArchonConfig.Retention(5_000, 50_000, 90, 3_600_000));
        return new HttpChannelBalanceClient(config, new ObjectMapper());
    }

    private String ledgerUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/listfunds";
    }

    @Test
    void sumsOurSideOfEveryChannel() throws Exception {
        reply.set("{\"outputs\":[],\"channels\":[{\"our_amount_msat\":40000000},"
                + "{\"our_amount_msat\":\"25000500msat\"},{\"peer_id\":\"x\"}]}");

        assertThat(client(ledgerUrl()).totalBondedSats("02" + "ab".repeat(32))).isEqualTo(65_000L);
    }

    @Test
    void missingLedgerEndpointFailsClosed() {
        assertThatThrownBy(() -> client("").totalBondedSats("k"))
                .isInstanceOf(ChannelBalanceClient.BalanceQueryException.class);
    }

    @Test
    void httpErrorFailsClosed() {
        status.set(500);
        assertThatThrownBy(() -> client(ledgerUrl()).totalBondedSats("k"))
                .isInstanceOf(ChannelBalanceClient.BalanceQueryException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void malformedReplyFailsClosed() {
        reply.set("{\"channels\":[{\"our_amount_msat\":\"lots\"}]}");
        assertThatThrownBy(() -> client(ledgerUrl()).totalBondedSats("k"))
                .isInstanceOf(ChannelBalanceClient.BalanceQueryException.class);

        reply.set("not json");
        assertThatThrownBy(() -> client(ledgerUrl()).totalBondedSats("k"))
                .isInstanceOf(ChannelBalanceClient.BalanceQueryException.class);

        reply.set("{\"outputs\":[]}");
        assertThatThrownBy(() -> client(ledgerUrl()).totalBondedSats("k"))
                .isInstanceOf(ChannelBalanceClient.BalanceQueryException.class);
    }

    @Test
    void unreachableLedgerFailsClosed() {
        assertThatThrownBy(() -> client("http://127.0.0.1:1/v1/listfunds").totalBondedSats("k"))
                .isInstanceOf(ChannelBalanceClient.BalanceQueryException.class);
    }
}
