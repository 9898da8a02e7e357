package com.example.licitacoes.api.model;

import com.fasterxml.jackson.annotation.JsonRawValue;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Licitação DTO - full procurement notice as held by the system of record. This is a pure data
 * transfer object without any database or index annotations.
 *
 * <p>{@code internalId} and {@code syncedAt} are null until the record has been stored. {@code
 * rawPayload} is the untouched JSON received from PNCP.
 */
public record Licitacao(
    Long internalId,
    String externalId,
    String objetoCompra,
    String informacaoComplementar,
    String orgao,
    String orgaoCnpj,
    String modalidade,
    Integer codigoModalidade,
    String uf,
    String municipio,
    BigDecimal valorEstimado,
    LocalDateTime dataAberturaProposta,
    LocalDateTime dataEncerramentoProposta,
    LocalDateTime dataPublicacao,
    String situacao,
    Integer anoCompra,
    Integer sequencialCompra,
    @JsonRawValue String rawPayload,
    LocalDateTime syncedAt) {}
