package com.distributedsystems.archon.util;

import com.distributedsystems.archon.error.ArchonException;
import com.distributedsystems.archon.error.ErrorKind;
import com.distributedsystems.archon.model.BindingKind;
import com.distributedsystems.archon.model.Choice;
import com.distributedsystems.archon.model.PollType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class ValidatorImpl implements IValidator {

    @Override
    public String nodeKey(String raw) {
        String key = CryptoUtil.normalizeHex(raw);
        if (!CryptoUtil.isCompressedPubkey(key)) {
            throw ArchonException.of(ErrorKind.INVALID_KEY_FORMAT,
                    "invalid node public key (expected 66-char compressed secp256k1 pubkey)");
        }
        return key;
    }

    @Override
    public String externalKey(BindingKind kind, String raw) {
        String key = CryptoUtil.normalizeHex(raw);
        if (!kind.accepts(key)) {
            throw ArchonException.of(ErrorKind.INVALID_EXTERNAL_KEY_FORMAT,
                    "invalid " + kind.wireName() + " key (expected " + kind.formatDescription() + ")");
        }
        return key;
    }

    @Override
    public BindingKind bindingKind(String raw) {
        return BindingKind.parse(raw).orElseThrow(() -> ArchonException.of(ErrorKind.UNKNOWN_BINDING_KIND,
                "unknown binding kind '" + raw + "' (valid: " + wireNames(BindingKind.values()) + ")"));
    }

    @Override
    public String did(String raw) {
        String did = raw == null ? "" : raw.trim();
        if (!DidCodec.isWellFormed(did)) {
            throw ArchonException.of(ErrorKind.INVALID_DID, "invalid did format");
        }
        return did;
    }

    @Override
    public PollType pollType(String raw) {
        return PollType.parse(raw).orElseThrow(() -> ArchonException.of(ErrorKind.INVALID_POLL_TYPE,
                "invalid poll_type (valid: " + wireNames(PollType.values()) + ")"));
    }

    @Override
    public String title(String raw) {
        String title = raw == null ? "" : raw.trim();
        if (title.isEmpty()) {
            throw ArchonException.of(ErrorKind.INVALID_TITLE, "title is required");
        }
        if (title.length() > MAX_POLL_TITLE_LEN) {
            throw ArchonException.of(ErrorKind.METADATA_TOO_LARGE,
                    "title too long (max " + MAX_POLL_TITLE_LEN + " chars)");
        }
        return title;
    }

    @Override
    public List<String> options(List<?> raw) {
        if (raw == null || raw.size() < MIN_OPTIONS || raw.size() > MAX_OPTIONS) {
            throw ArchonException.of(ErrorKind.INVALID_OPTION_COUNT,
                    "expected " + MIN_OPTIONS + "-" + MAX_OPTIONS + " options, got " + (raw == null ? 0 : raw.size()));
        }
        List<String> cleaned = new ArrayList<>(raw.size());
        Set<String> folded = new HashSet<>();
        for (Object item : raw) {
            if (!(item instanceof String text)) {
                throw ArchonException.of(ErrorKind.INVALID_OPTIONS, "options must be strings");
            }
            String value = text.trim();
            if (value.isEmpty() || value.length() > MAX_OPTION_LEN) {
                throw ArchonException.of(ErrorKind.INVALID_OPTIONS,
                        "each option must be 1-" + MAX_OPTION_LEN + " chars");
            }
            if (Choice.SPOIL_MARKER.equals(value.toLowerCase(Locale.ROOT))) {
                throw ArchonException.of(ErrorKind.INVALID_OPTIONS, "'spoil' is reserved for spoiled ballots");
            }
            if (!folded.add(value.toLowerCase(Locale.ROOT))) {
                throw ArchonException.of(ErrorKind.INVALID_OPTIONS, "duplicate option '" + value + "'");
            }
            cleaned.add(value);
        }
        return List.copyOf(cleaned);
    }

    @Override
    public long deadline(long deadline, long nowSeconds) {
        if (deadline <= nowSeconds) {
            throw ArchonException.of(ErrorKind.INVALID_DEADLINE,
                    "invalid deadline (must be a future unix timestamp)");
        }
        return deadline;
    }

    @Override
    public String metadata(Map<String, ?> raw) {
        String json;
        try {
            json = CanonicalPayloads.json(raw);
        } catch (IllegalArgumentException e) {
            throw new ArchonException(ErrorKind.INVALID_REQUEST, "metadata must be JSON-serializable", e);
        }
        if (json.getBytes(StandardCharsets.UTF_8).length > MAX_METADATA_JSON_LEN) {
            throw ArchonException.of(ErrorKind.METADATA_TOO_LARGE,
                    "metadata too large (max " + MAX_METADATA_JSON_LEN + " bytes)");
        }
        return json;
    }

    @Override
    public String reason(String raw) {
        String reason = raw == null ? "" : raw.trim();
        if (reason.length() > MAX_REASON_LEN) {
            throw ArchonException.of(ErrorKind.REASON_TOO_LONG,
                    "reason too long (max " + MAX_REASON_LEN + " chars)");
        }
        return reason;
    }

    @Override
    public int voteLimit(Integer raw) {
        if (raw == null) return DEFAULT_VOTE_LIMIT;
        if (raw <= 0) {
            throw ArchonException.of(ErrorKind.INVALID_LIMIT, "limit must be positive");
        }
        return Math.min(raw, MAX_VOTE_LIMIT);
    }

    private static String wireNames(Enum<?>[] values) {
        return Arrays.stream(values)
                .map(v -> v.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
    }
}
