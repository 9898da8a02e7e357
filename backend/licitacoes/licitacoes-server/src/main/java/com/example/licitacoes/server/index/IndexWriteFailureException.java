package com.example.licitacoes.server.index;

import lombok.Getter;

import java.util.Set;

/**
 * Some documents of a bulk request were not acknowledged. {@code failedIds} are the internal ids
 * to resubmit; the rest of the batch is indexed.
 */
@Getter
public class IndexWriteFailureException extends RuntimeException {

    private final Set<Long> failedIds;

    public IndexWriteFailureException(Set<Long> failedIds, String message, Throwable cause) {
        super(message, cause);
        this.failedIds = Set.copyOf(failedIds);
    }
}
