package com.example.licitacoes.server.index;

import lombok.Getter;

import java.util.List;

/**
 * The live index mapping disagrees with the mapping this service writes. Needs an operator; the
 * index is never migrated automatically.
 */
@Getter
public class IndexSchemaConflictException extends RuntimeException {

    private final String indexName;
    private final List<String> conflicts;

    public IndexSchemaConflictException(String indexName, List<String> conflicts) {
        super("Index '" + indexName + "' has an incompatible mapping: " + String.join("; ", conflicts));
        this.indexName = indexName;
        this.conflicts = List.copyOf(conflicts);
    }
}
