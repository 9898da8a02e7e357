package com.example.licitacoes.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/** Request DTO for triggering a synchronous PNCP sync run. */
public record SyncRequest(
    @Schema(description = "First publication date, yyyyMMdd", example = "20250501", required = true)
        String dataInicial,
    @Schema(description = "Last publication date, yyyyMMdd", example = "20250601", required = true)
        String dataFinal,
    @Schema(description = "PNCP modalidade de contratação code", example = "6", required = true)
        Integer codigoModalidadeContratacao,
    @Schema(
            description = "Records per PNCP page. Clamped to the portal maximum.",
            example = "50",
            required = false)
        Integer tamanhoPagina) {}
