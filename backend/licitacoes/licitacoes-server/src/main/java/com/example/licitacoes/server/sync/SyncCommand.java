package com.example.licitacoes.server.sync;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Parameters of one sync run.
 *
 * @param tamanhoPagina null to use the configured default
 */
public record SyncCommand(
        LocalDate dataInicial,
        LocalDate dataFinal,
        int codigoModalidade,
        Integer tamanhoPagina) {

    public SyncCommand {
        Objects.requireNonNull(dataInicial, "dataInicial is required");
        Objects.requireNonNull(dataFinal, "dataFinal is required");
        if (dataInicial.isAfter(dataFinal)) {
            throw new IllegalArgumentException(
                    "dataInicial " + dataInicial + " is after dataFinal " + dataFinal);
        }
        if (codigoModalidade < 1) {
            throw new IllegalArgumentException("codigoModalidade must be positive, got " + codigoModalidade);
        }
        if (tamanhoPagina != null && tamanhoPagina < 1) {
            throw new IllegalArgumentException("tamanhoPagina must be >= 1, got " + tamanhoPagina);
        }
    }
}
