package com.example.licitacoes.server.search;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Caller-facing search parameters. Every field except {@code aggregations} is optional; page and
 * size are normalised by {@link LicitacaoQueryBuilder}.
 */
public record SearchCriteria(
        String q,
        String modalidade,
        String uf,
        String situacao,
        BigDecimal valorMin,
        BigDecimal valorMax,
        LocalDateTime dataAberturaMin,
        LocalDateTime dataAberturaMax,
        Integer page,
        Integer size,
        Set<AggregationType> aggregations) {

    public SearchCriteria {
        aggregations = aggregations == null || aggregations.isEmpty()
                ? EnumSet.noneOf(AggregationType.class)
                : EnumSet.copyOf(aggregations);
        if (valorMin != null && valorMax != null && valorMin.compareTo(valorMax) > 0) {
            throw new IllegalArgumentException("valor_min " + valorMin + " is greater than valor_max " + valorMax);
        }
        if (dataAberturaMin != null && dataAberturaMax != null && dataAberturaMin.isAfter(dataAberturaMax)) {
            throw new IllegalArgumentException(
                    "data_abertura_min " + dataAberturaMin + " is after data_abertura_max " + dataAberturaMax);
        }
    }

    /** Match-all criteria that only computes the given aggregations. */
    public static SearchCriteria aggregationsOnly(Set<AggregationType> aggregations) {
        return new SearchCriteria(null, null, null, null, null, null, null, null, null, null, aggregations);
    }

    public boolean hasText() {
        return q != null && !q.isBlank();
    }
}
