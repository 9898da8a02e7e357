package com.example.licitacoes.server.search;

/**
 * The search engine could not answer. Rendered as HTTP 503.
 */
public class SearchUnavailableException extends RuntimeException {

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
