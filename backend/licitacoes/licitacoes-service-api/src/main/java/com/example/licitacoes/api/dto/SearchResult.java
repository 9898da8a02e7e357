package com.example.licitacoes.api.dto;

import com.example.licitacoes.api.model.LicitacaoSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.Map;

/** Response DTO for a paginated licitação search. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResult(
    @Schema(description = "Total number of matching documents", example = "42") long total,
    @Schema(description = "1-based page number", example = "1") int page,
    @Schema(description = "Page size actually applied", example = "10") int size,
    @Schema(description = "Number of pages for the given size", example = "5") int pages,
    List<LicitacaoSummary> items,
    @Schema(description = "Requested bucket aggregations keyed by name") Map<String, List<AggregationBucket>> aggregations,
    @Schema(description = "Statistics over valorEstimado, when requested") ValueStats valorEstimado) {}
