package com.distributedsystems.archon.util;

import com.distributedsystems.archon.model.BindingKind;
import com.distributedsystems.archon.model.Choice;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Byte encodings that get signed. Compact JSON with keys sorted at every level, UTF-8, and a
 * {@code "v"} field naming the encoding version.
 */
public final class CanonicalPayloads {

    public static final int VERSION = 1;

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CanonicalPayloads() {
    }

    public static String attestation(String did, BindingKind kind, String externalKey,
                                     String nodePubkey, long timestamp) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("v", VERSION);
        body.put("did", did);
        body.put("kind", kind.wireName());
        body.put("external_key", externalKey);
        body.put("node_pubkey", nodePubkey);
        body.put("timestamp", timestamp);
        return write(body);
    }

    public static String ballot(String pollId, String voterPubkey, Choice choice, String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("v", VERSION);
        body.put("poll_id", pollId);
        body.put("voter", voterPubkey);
        body.put("choice", choice.wireValue());
        body.put("reason", reason == null ? "" : reason);
        return write(body);
    }

    public static String json(Map<String, ?> value) {
        return write(value == null ? Map.of() : value);
    }

    public static byte[] utf8(String canonical) {
        return canonical.getBytes(StandardCharsets.UTF_8);
    }

    private static String write(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }
}
