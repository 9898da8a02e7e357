package com.example.licitacoes.server.sync;

import lombok.Getter;

/**
 * A run for the same modality is already executing.
 */
@Getter
public class SyncInProgressException extends RuntimeException {

    private final int codigoModalidade;

    public SyncInProgressException(int codigoModalidade) {
        super("A sync run for modalidade " + codigoModalidade + " is already in progress");
        this.codigoModalidade = codigoModalidade;
    }
}
