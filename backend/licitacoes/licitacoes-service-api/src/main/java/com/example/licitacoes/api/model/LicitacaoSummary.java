package com.example.licitacoes.api.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** Canonical fields returned for each search hit. */
public record LicitacaoSummary(
    Long internalId,
    String externalId,
    String objetoCompra,
    String orgao,
    String modalidade,
    String uf,
    String municipio,
    BigDecimal valorEstimado,
    LocalDateTime dataAberturaProposta,
    LocalDateTime dataPublicacao,
    String situacao) {}
