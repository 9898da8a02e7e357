package com.example.licitacoes.server.search;

import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOptions;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.aggregations.Aggregate;
import co.elastic.clients.elasticsearch._types.aggregations.Aggregation;
import co.elastic.clients.elasticsearch._types.aggregations.CalendarInterval;
import co.elastic.clients.elasticsearch._types.aggregations.DateHistogramBucket;
import co.elastic.clients.elasticsearch._types.aggregations.StatsAggregate;
import co.elastic.clients.elasticsearch._types.aggregations.StringTermsBucket;
import co.elastic.clients.elasticsearch._types.query_dsl.Operator;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import com.example.licitacoes.api.dto.AggregationBucket;
import com.example.licitacoes.api.dto.SearchResult;
import com.example.licitacoes.api.dto.ValueStats;
import com.example.licitacoes.api.model.LicitacaoSummary;
import com.example.licitacoes.server.config.LicitacoesProperties;
import com.example.licitacoes.server.mapper.LicitacaoMapper;
import com.example.licitacoes.server.model.LicitacaoEntity;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchAggregation;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchAggregations;
import org.springframework.data.elasticsearch.client.elc.NativeQuery;
import org.springframework.data.elasticsearch.client.elc.NativeQueryBuilder;
import org.springframework.data.elasticsearch.core.AggregationsContainer;
import org.springframework.data.elasticsearch.core.SearchHit;
import org.springframework.data.elasticsearch.core.SearchHits;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates {@link SearchCriteria} into an Elasticsearch query and engine responses back into
 * {@link SearchResult}. Holds no state besides configuration.
 */
@Component
public class LicitacaoQueryBuilder {

    static final List<String> TEXT_FIELDS = List.of("objetoCompra^3", "informacaoComplementar^2", "orgao", "municipio");
    static final String SORT_FIELD = "dataAberturaProposta";
    static final int TERMS_SIZE = 100;
    private static final DateTimeFormatter INDEX_DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    private final int defaultPageSize;
    private final int maxPageSize;
    private final int maxResultWindow;

    public LicitacaoQueryBuilder(LicitacoesProperties properties) {
        LicitacoesProperties.Search search = properties.getSearch();
        this.defaultPageSize = search.getDefaultPageSize();
        this.maxPageSize = search.getMaxPageSize();
        this.maxResultWindow = search.getMaxResultWindow();
    }

    public NativeQuery build(SearchCriteria criteria) {
        PageSpec pageSpec = pageSpec(criteria);
        NativeQueryBuilder builder = NativeQuery.builder()
                .withQuery(buildQuery(criteria))
                .withSort(sortFor(criteria))
                .withTrackTotalHits(true);

        if (pageSpec.beyondWindow(maxResultWindow)) {
            // ES rejects from + size past the result window; only the total is needed
            builder.withPageable(Pageable.unpaged()).withMaxResults(0);
        } else {
            builder.withPageable(PageRequest.of(pageSpec.page() - 1, pageSpec.size()));
        }

        for (AggregationType type : criteria.aggregations()) {
            builder.withAggregation(type.responseName(), aggregationFor(type));
        }
        return builder.build();
    }

    /** Same filters and aggregations as {@link #build} but no hits returned. */
    public NativeQuery buildAggregationsOnly(SearchCriteria criteria) {
        NativeQueryBuilder builder = NativeQuery.builder()
                .withQuery(buildQuery(criteria))
                .withPageable(Pageable.unpaged())
                .withMaxResults(0)
                .withTrackTotalHits(true);
        for (AggregationType type : criteria.aggregations()) {
            builder.withAggregation(type.responseName(), aggregationFor(type));
        }
        return builder.build();
    }

    public SearchResult toResult(SearchHits<LicitacaoEntity> hits, SearchCriteria criteria) {
        PageSpec pageSpec = pageSpec(criteria);
        long total = hits.getTotalHits();
        List<LicitacaoSummary> items = pageSpec.beyondWindow(maxResultWindow)
                ? List.of()
                : hits.getSearchHits().stream()
                        .map(SearchHit::getContent)
                        .map(LicitacaoMapper::toSummary)
                        .collect(Collectors.toList());
        int pages = (int) ((total + pageSpec.size() - 1) / pageSpec.size());

        Map<String, Aggregate> aggregates = aggregatesOf(hits);
        Map<String, List<AggregationBucket>> buckets = null;
        ValueStats valueStats = null;
        for (AggregationType type : criteria.aggregations()) {
            if (type == AggregationType.VALOR) {
                valueStats = toValueStats(aggregates.get(type.responseName()));
            } else {
                if (buckets == null) {
                    buckets = new LinkedHashMap<>();
                }
                buckets.put(type.responseName(), toBuckets(aggregates.get(type.responseName())));
            }
        }
        return new SearchResult(total, pageSpec.page(), pageSpec.size(), pages, items, buckets, valueStats);
    }

    Query buildQuery(SearchCriteria criteria) {
        Query must = criteria.hasText()
                ? Query.of(q -> q.multiMatch(m -> m
                        .query(criteria.q().trim())
                        .fields(TEXT_FIELDS)
                        .type(TextQueryType.BestFields)
                        .operator(Operator.And)
                        .fuzziness("AUTO")))
                : Query.of(q -> q.matchAll(m -> m));

        List<Query> filters = new ArrayList<>();
        addTerm(filters, "modalidade", criteria.modalidade());
        addTerm(filters, "uf", criteria.uf() == null ? null : criteria.uf().trim().toUpperCase(Locale.ROOT));
        addTerm(filters, "situacao", criteria.situacao());
        if (criteria.valorMin() != null || criteria.valorMax() != null) {
            BigDecimal min = criteria.valorMin();
            BigDecimal max = criteria.valorMax();
            filters.add(Query.of(q -> q.range(r -> r.number(n -> {
                n.field("valorEstimado");
                if (min != null) {
                    n.gte(min.doubleValue());
                }
                if (max != null) {
                    n.lte(max.doubleValue());
                }
                return n;
            }))));
        }
        if (criteria.dataAberturaMin() != null || criteria.dataAberturaMax() != null) {
            LocalDateTime min = criteria.dataAberturaMin();
            LocalDateTime max = criteria.dataAberturaMax();
            filters.add(Query.of(q -> q.range(r -> r.date(d -> {
                d.field(SORT_FIELD);
                if (min != null) {
                    d.gte(min.format(INDEX_DATE_TIME));
                }
                if (max != null) {
                    d.lte(max.format(INDEX_DATE_TIME));
                }
                return d;
            }))));
        }

        return Query.of(q -> q.bool(b -> b.must(must).filter(filters)));
    }

    List<SortOptions> sortFor(SearchCriteria criteria) {
        SortOptions byDate = SortOptions.of(s -> s.field(f -> f.field(SORT_FIELD).order(SortOrder.Desc)));
        if (criteria.hasText()) {
            return List.of(SortOptions.of(s -> s.score(sc -> sc.order(SortOrder.Desc))), byDate);
        }
        return List.of(byDate);
    }

    PageSpec pageSpec(SearchCriteria criteria) {
        int page = criteria.page() == null || criteria.page() < 1 ? 1 : criteria.page();
        int size = criteria.size() == null || criteria.size() < 1 ? defaultPageSize : criteria.size();
        return new PageSpec(page, Math.min(size, maxPageSize));
    }

    static Aggregation aggregationFor(AggregationType type) {
        switch (type) {
            case MODALIDADES:
                return Aggregation.of(a -> a.terms(t -> t.field("modalidade").size(TERMS_SIZE)));
            case UFS:
                return Aggregation.of(a -> a.terms(t -> t.field("uf").size(TERMS_SIZE)));
            case SITUACOES:
                return Aggregation.of(a -> a.terms(t -> t.field("situacao").size(TERMS_SIZE)));
            case POR_MES:
                return Aggregation.of(a -> a.dateHistogram(h -> h
                        .field("dataPublicacao")
                        .calendarInterval(CalendarInterval.Month)
                        .format("yyyy-MM")
                        .minDocCount(1)));
            case VALOR:
                return Aggregation.of(a -> a.stats(s -> s.field("valorEstimado")));
            default:
                throw new IllegalArgumentException("Unsupported aggregation " + type);
        }
    }

    static Map<String, Aggregate> aggregatesOf(SearchHits<?> hits) {
        AggregationsContainer<?> container = hits.getAggregations();
        if (!(container instanceof ElasticsearchAggregations)) {
            return Map.of();
        }
        Map<String, Aggregate> aggregates = new LinkedHashMap<>();
        for (Map.Entry<String, ElasticsearchAggregation> entry
                : ((ElasticsearchAggregations) container).aggregationsAsMap().entrySet()) {
            aggregates.put(entry.getKey(), entry.getValue().aggregation().getAggregate());
        }
        return aggregates;
    }

    /** Flattens a terms or date histogram aggregate; anything else yields no buckets. */
    static List<AggregationBucket> toBuckets(Aggregate aggregate) {
        if (aggregate == null) {
            return List.of();
        }
        if (aggregate.isSterms()) {
            List<AggregationBucket> buckets = new ArrayList<>();
            for (StringTermsBucket bucket : aggregate.sterms().buckets().array()) {
                buckets.add(new AggregationBucket(keyOf(bucket.key()), bucket.docCount()));
            }
            return buckets;
        }
        if (aggregate.isDateHistogram()) {
            List<AggregationBucket> buckets = new ArrayList<>();
            for (DateHistogramBucket bucket : aggregate.dateHistogram().buckets().array()) {
                String key = bucket.keyAsString() != null ? bucket.keyAsString() : String.valueOf(bucket.key());
                buckets.add(new AggregationBucket(key, bucket.docCount()));
            }
            return buckets;
        }
        return List.of();
    }

    static ValueStats toValueStats(Aggregate aggregate) {
        if (aggregate == null || !aggregate.isStats()) {
            return new ValueStats(0, 0.0, null, null, null);
        }
        StatsAggregate stats = aggregate.stats();
        if (stats.count() == 0) {
            return new ValueStats(0, 0.0, null, null, null);
        }
        return new ValueStats(stats.count(), stats.sum(), finite(stats.avg()), finite(stats.min()), finite(stats.max()));
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static String keyOf(FieldValue key) {
        return key.isString() ? key.stringValue() : String.valueOf(key._get());
    }

    private static void addTerm(List<Query> filters, String field, String value) {
        if (value != null && !value.isBlank()) {
            String term = value.trim();
            filters.add(Query.of(q -> q.term(t -> t.field(field).value(term))));
        }
    }

    /** Normalised 1-based page and clamped size. */
    record PageSpec(int page, int size) {

        long offset() {
            return (long) (page - 1) * size;
        }

        boolean beyondWindow(int maxResultWindow) {
            return offset() + size > maxResultWindow;
        }
    }
}
