package com.distributedsystems.archon.util;

import com.distributedsystems.archon.model.BindingKind;
import com.distributedsystems.archon.model.PollType;

import java.util.List;
import java.util.Map;

/**
 * Request-shape checks. Every method either returns the normalized value or throws an
 * {@link com.distributedsystems.archon.error.ArchonException} of a validation kind.
 */
public interface IValidator {

    int MAX_POLL_TITLE_LEN = 200;
    int MAX_OPTION_LEN = 64;
    int MIN_OPTIONS = 2;
    int MAX_OPTIONS = 10;
    int MAX_METADATA_JSON_LEN = 8_192;
    int MAX_REASON_LEN = 500;
    int DEFAULT_VOTE_LIMIT = 50;
    int MAX_VOTE_LIMIT = 500;

    String nodeKey(String raw);

    String externalKey(BindingKind kind, String raw);

    BindingKind bindingKind(String raw);

    String did(String raw);

    PollType pollType(String raw);

    String title(String raw);

    List<String> options(List<?> raw);

    long deadline(long deadline, long nowSeconds);

    String metadata(Map<String, ?> raw);

    String reason(String raw);

    int voteLimit(Integer raw);
}
