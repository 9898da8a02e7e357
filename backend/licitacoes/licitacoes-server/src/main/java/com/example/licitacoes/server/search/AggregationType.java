package com.example.licitacoes.server.search;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Named aggregations a search request may ask for. The name is what callers send and what the
 * response is keyed by.
 */
public enum AggregationType {
    MODALIDADES("modalidades"),
    UFS("ufs"),
    SITUACOES("por_situacao"),
    POR_MES("por_mes"),
    VALOR("valor_estimado");

    private final String responseName;

    AggregationType(String responseName) {
        this.responseName = responseName;
    }

    public String responseName() {
        return responseName;
    }

    public static AggregationType fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.responseName.equals(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown aggregation '" + name + "'"));
    }

    public static Set<AggregationType> parse(Iterable<String> names) {
        Set<AggregationType> types = EnumSet.noneOf(AggregationType.class);
        if (names != null) {
            for (String name : names) {
                if (name != null && !name.isBlank()) {
                    types.add(fromName(name));
                }
            }
        }
        return types;
    }
}
