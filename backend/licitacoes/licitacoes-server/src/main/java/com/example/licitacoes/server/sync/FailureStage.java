package com.example.licitacoes.server.sync;

/** Pipeline step at which a run was aborted. */
public enum FailureStage {
    FETCH,
    STORE,
    INDEX
}
