package com.distributedsystems.archon.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable error identifiers returned to RPC callers. Names are part of the wire contract.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    INVALID_KEY_FORMAT(Category.VALIDATION),
    UNKNOWN_BINDING_KIND(Category.VALIDATION),
    INVALID_EXTERNAL_KEY_FORMAT(Category.VALIDATION),
    INVALID_DID(Category.VALIDATION),
    INVALID_TIER(Category.VALIDATION),
    INVALID_POLL_TYPE(Category.VALIDATION),
    INVALID_TITLE(Category.VALIDATION),
    INVALID_OPTION_COUNT(Category.VALIDATION),
    INVALID_OPTIONS(Category.VALIDATION),
    INVALID_DEADLINE(Category.VALIDATION),
    METADATA_TOO_LARGE(Category.VALIDATION),
    REASON_TOO_LONG(Category.VALIDATION),
    INVALID_CHOICE(Category.VALIDATION),
    INVALID_SIGNATURE(Category.VALIDATION),
    INVALID_LIMIT(Category.VALIDATION),
    INVALID_REQUEST(Category.VALIDATION),

    DID_NOT_OWNED(Category.AUTHORIZATION),
    INSUFFICIENT_TIER(Category.AUTHORIZATION),
    INSUFFICIENT_BOND(Category.AUTHORIZATION),

    IDENTITY_NOT_FOUND(Category.NOT_FOUND),
    POLL_NOT_FOUND(Category.NOT_FOUND),

    DUPLICATE_VOTE(Category.CONFLICT),
    POLL_CLOSED(Category.CONFLICT),

    SIGNER_UNAVAILABLE(Category.EXTERNAL),
    BOND_VERIFICATION_FAILED(Category.EXTERNAL),

    STORE_UNAVAILABLE(Category.INTERNAL);

    private final Category category;

    public enum Category {
        VALIDATION,
        AUTHORIZATION,
        NOT_FOUND,
        CONFLICT,
        EXTERNAL,
        INTERNAL
    }
}
