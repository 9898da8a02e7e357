package com.example.licitacoes.server.service;

public class LicitacaoNotFoundException extends RuntimeException {

    public LicitacaoNotFoundException(Long internalId) {
        super("Licitacao " + internalId + " not found");
    }
}
