package com.example.licitacoes.server.normalize;

import lombok.Getter;

/**
 * A single PNCP record could not be turned into a Licitacao. Never fatal to a page.
 */
@Getter
public class NormalizationException extends RuntimeException {

    private final String externalId;
    private final String field;
    private final String rawValue;

    public NormalizationException(String externalId, String field, String rawValue, String reason) {
        super(reason);
        this.externalId = externalId;
        this.field = field;
        this.rawValue = rawValue;
    }

    public NormalizationException(String externalId, String field, String rawValue, String reason, Throwable cause) {
        super(reason, cause);
        this.externalId = externalId;
        this.field = field;
        this.rawValue = rawValue;
    }
}
