package com.example.licitacoes.server.client;

import lombok.Getter;

/**
 * PNCP could not be reached or answered with a non-2xx status. Transient; callers may retry.
 */
@Getter
public class SourceUnavailableException extends RuntimeException {

    /** HTTP status, or 0 when no response was received. */
    private final int status;
    private final int attempts;

    public SourceUnavailableException(int status, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.attempts = attempts;
    }

    public SourceUnavailableException withAttempts(int attempts) {
        return new SourceUnavailableException(status, attempts, getMessage(), getCause());
    }
}
