package com.example.licitacoes.server.sync;

import com.example.licitacoes.server.config.LicitacoesProperties;

import java.time.Duration;

/**
 * Exponential backoff between fetch attempts: {@code initial * multiplier^(attempt-1)}, capped at
 * {@code max}.
 */
public record BackoffPolicy(int maxAttempts, Duration initial, double multiplier, Duration max) {

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        }
    }

    public static BackoffPolicy from(LicitacoesProperties.Sync sync) {
        return new BackoffPolicy(sync.getMaxAttempts(), sync.getInitialBackoff(),
                sync.getBackoffMultiplier(), sync.getMaxBackoff());
    }

    /** Delay to wait after the given failed attempt (1-based). */
    public Duration delayAfter(int attempt) {
        double millis = initial.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, (double) max.toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }
}
