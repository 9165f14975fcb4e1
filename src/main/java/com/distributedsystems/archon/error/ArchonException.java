package com.distributedsystems.archon.error;

import lombok.Getter;

/**
 * A rejected request. Carries a stable {@link ErrorKind}; nothing thrown as this type is
 * ever partially applied to the store.
 */
@Getter
public class ArchonException extends RuntimeException {

    private final ErrorKind kind;

    public ArchonException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ArchonException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ArchonException of(ErrorKind kind, String message) {
        return new ArchonException(kind, message);
    }
}
