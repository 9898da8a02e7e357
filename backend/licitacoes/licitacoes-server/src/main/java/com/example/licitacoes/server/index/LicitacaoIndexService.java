package com.example.licitacoes.server.index;

import com.example.licitacoes.server.model.LicitacaoEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.elasticsearch.BulkFailureException;
import org.springframework.data.elasticsearch.client.elc.NativeQuery;
import org.springframework.data.elasticsearch.core.ElasticsearchOperations;
import org.springframework.data.elasticsearch.core.IndexOperations;
import org.springframework.data.elasticsearch.core.SearchHits;
import org.springframework.data.elasticsearch.core.cluster.ClusterHealth;
import org.springframework.data.elasticsearch.core.document.Document;
import org.springframework.data.elasticsearch.core.query.IndexQuery;
import org.springframework.data.elasticsearch.core.query.IndexQueryBuilder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sole reader and writer of the {@code licitacoes} index.
 * <p>
 * Responsible for:
 * <ul>
 *   <li>creating the index with the Portuguese analyzer and refusing to touch an incompatible one</li>
 *   <li>bulk upserts keyed by the database identity</li>
 *   <li>executing queries produced by the query builder</li>
 *   <li>reporting cluster reachability</li>
 * </ul>
 */
@Service
public class LicitacaoIndexService {

    private static final Logger log = LoggerFactory.getLogger(LicitacaoIndexService.class);
    private final ElasticsearchOperations operations;

    public LicitacaoIndexService(ElasticsearchOperations operations) {
        this.operations = operations;
    }

    /**
     * Creates the index if it does not exist.
     *
     * @return true if the index was created by this call
     * @throws IndexSchemaConflictException if an existing index maps a field differently
     */
    public boolean createIndex() {
        IndexOperations indexOps = operations.indexOps(LicitacaoEntity.class);
        Document expected = indexOps.createMapping(LicitacaoEntity.class);

        if (indexOps.exists()) {
            List<String> conflicts = findConflicts(expected, indexOps.getMapping());
            if (!conflicts.isEmpty()) {
                log.error("Index '{}' mapping conflicts: {}", LicitacaoEntity.INDEX_NAME, conflicts);
                throw new IndexSchemaConflictException(LicitacaoEntity.INDEX_NAME, conflicts);
            }
            log.info("Index '{}' already exists with a compatible mapping", LicitacaoEntity.INDEX_NAME);
            return false;
        }

        boolean created = indexOps.createWithMapping();
        log.info("Index '{}' created={}", LicitacaoEntity.INDEX_NAME, created);
        return created;
    }

    public void indexDocument(LicitacaoEntity entity) {
        indexBatch(List.of(entity));
    }

    /**
     * Upserts the batch in one bulk request. Documents are keyed by internalId, so resubmitting
     * is idempotent.
     *
     * @throws IndexWriteFailureException listing the ids that were not acknowledged
     */
    public void indexBatch(List<LicitacaoEntity> entities) {
        if (entities.isEmpty()) {
            return;
        }
        List<IndexQuery> queries = entities.stream()
                .map(entity -> new IndexQueryBuilder()
                        .withId(String.valueOf(Objects.requireNonNull(entity.getInternalId(),
                                "entity must be stored before it is indexed")))
                        .withObject(entity)
                        .build())
                .collect(Collectors.toList());

        try {
            operations.bulkIndex(queries, LicitacaoEntity.class);
            log.debug("Indexed {} documents", queries.size());
        } catch (BulkFailureException e) {
            Set<Long> failed = e.getFailedDocuments().keySet().stream()
                    .map(Long::valueOf)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            log.warn("Bulk index rejected {} of {} documents", failed.size(), queries.size());
            throw new IndexWriteFailureException(failed,
                    "Bulk index rejected " + failed.size() + " of " + queries.size() + " documents", e);
        } catch (RuntimeException e) {
            Set<Long> all = entities.stream()
                    .map(LicitacaoEntity::getInternalId)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            log.warn("Bulk index of {} documents failed: {}", all.size(), e.getMessage());
            throw new IndexWriteFailureException(all, "Bulk index failed: " + e.getMessage(), e);
        }
    }

    public SearchHits<LicitacaoEntity> search(NativeQuery query) {
        return operations.search(query, LicitacaoEntity.class);
    }

    public LicitacaoEntity get(Long internalId) {
        return operations.get(String.valueOf(internalId), LicitacaoEntity.class);
    }

    public IndexHealth healthCheck() {
        try {
            ClusterHealth health = operations.cluster().health();
            return new IndexHealth(true, health.getStatus());
        } catch (RuntimeException e) {
            log.warn("Elasticsearch health check failed: {}", e.getMessage());
            return IndexHealth.unreachable();
        }
    }

    /**
     * Compares the field types (and analyzers) this service writes with a live mapping. Fields
     * present only in the live mapping are ignored.
     */
    static List<String> findConflicts(Map<String, Object> expected, Map<String, Object> live) {
        Map<?, ?> expectedProps = properties(expected);
        Map<?, ?> liveProps = properties(live);
        List<String> conflicts = new ArrayList<>();

        for (Map.Entry<?, ?> entry : expectedProps.entrySet()) {
            String field = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            Object actual = liveProps.get(field);
            if (!(actual instanceof Map)) {
                conflicts.add(field + ": missing");
                continue;
            }
            compareAttribute(conflicts, field, "type", (Map<?, ?>) entry.getValue(), (Map<?, ?>) actual);
            compareAttribute(conflicts, field, "analyzer", (Map<?, ?>) entry.getValue(), (Map<?, ?>) actual);
        }
        return conflicts;
    }

    private static void compareAttribute(List<String> conflicts, String field, String attribute,
                                         Map<?, ?> want, Map<?, ?> have) {
        Object expectedValue = want.get(attribute);
        if (expectedValue != null && !expectedValue.equals(have.get(attribute))) {
            conflicts.add(field + ": " + attribute + " " + have.get(attribute) + " != " + expectedValue);
        }
    }

    private static Map<?, ?> properties(Map<String, Object> mapping) {
        if (mapping == null) {
            return Map.of();
        }
        Object properties = mapping.get("properties");
        return properties instanceof Map ? (Map<?, ?>) properties : Map.of();
    }
}
