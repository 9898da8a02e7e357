package com.example.licitacoes.api.dto;

/**
 * Statistics over {@code valorEstimado}. {@code min}, {@code max} and {@code avg} are null when no
 * document carries a value.
 */
public record ValueStats(long count, double sum, Double avg, Double min, Double max) {}
