package com.example.licitacoes.api.dto;

import java.util.List;

/** Aggregate statistics over every indexed licitação. */
public record LicitacaoStats(
    long totalLicitacoes,
    double valorTotal,
    Double valorMedio,
    Double valorMax,
    Double valorMin,
    List<AggregationBucket> porSituacao,
    List<AggregationBucket> porMes) {}
