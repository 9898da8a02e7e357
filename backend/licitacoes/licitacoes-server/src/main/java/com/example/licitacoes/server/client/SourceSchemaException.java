package com.example.licitacoes.server.client;

/**
 * PNCP answered 2xx with a body that is not the expected page envelope.
 */
public class SourceSchemaException extends RuntimeException {

    public SourceSchemaException(String message) {
        super(message);
    }

    public SourceSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
