package com.example.licitacoes.api.dto;

/** One bucket of a terms or histogram aggregation. */
public record AggregationBucket(String key, long count) {}
