package com.misrhr.exception;

import lombok.Getter;

/**
 * Thrown when an argument fails a precondition. Raised before any output is allocated,
 * so a caller never sees a partially filled grid.
 */
@Getter
public class MisrHrException extends IllegalArgumentException {

    private final ErrorKind kind;

    public MisrHrException(ErrorKind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }
}
