package com.distributedsystems.archon.client;

import com.distributedsystems.archon.exe.ArchonConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Queries a listfunds-shaped endpoint and sums {@code channels[].our_amount_msat}. Amounts may
 * be numbers or strings with an {@code msat} suffix.
 */
@Slf4j
@Component
public class HttpChannelBalanceClient implements ChannelBalanceClient {

    private final ArchonConfig config;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public HttpChannelBalanceClient(ArchonConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .build();
    }

    @Override
    public long totalBondedSats(String nodePubkey) throws BalanceQueryException {
        String url = config.getLedgerUrl();
        if (url.isEmpty()) {
            throw new BalanceQueryException("no ledger endpoint configured");
        }
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString("{}"))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new BalanceQueryException("invalid ledger URL", e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BalanceQueryException("listfunds failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BalanceQueryException("interrupted during listfunds", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new BalanceQueryException("listfunds returned HTTP " + response.statusCode());
        }
        return sumChannels(response.body());
    }

    long sumChannels(String body) throws BalanceQueryException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new BalanceQueryException("listfunds reply is not JSON", e);
        }
        JsonNode channels = root == null ? null : root.get("channels");
        if (channels == null || !channels.isArray()) {
            throw new BalanceQueryException("listfunds reply has no channels array");
        }
        long totalMsat = 0L;
        for (JsonNode channel : channels) {
            totalMsat = Math.addExact(totalMsat, msat(channel.get("our_amount_msat")));
        }
        log.debug("Ledger reports {} msat across {} channels", totalMsat, channels.size());
        return totalMsat / 1000L;
    }

    private static long msat(JsonNode node) throws BalanceQueryException {
        if (node == null || node.isNull()) return 0L;
        if (node.canConvertToLong()) {
            long value = node.asLong();
            if (value < 0) throw new BalanceQueryException("negative channel amount");
            return value;
        }
        String text = node.asText("").trim();
        if (text.endsWith("msat")) {
            text = text.substring(0, text.length() - 4);
        }
        try {
            long value = Long.parseLong(text);
            if (value < 0) throw new BalanceQueryException("negative channel amount");
            return value;
        } catch (NumberFormatException e) {
            throw new BalanceQueryException("unparseable channel amount '" + node.asText() + "'", e);
        }
    }
}
