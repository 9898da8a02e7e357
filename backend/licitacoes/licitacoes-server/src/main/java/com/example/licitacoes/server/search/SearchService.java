package com.example.licitacoes.server.search;

import com.example.licitacoes.api.dto.AggregationBucket;
import com.example.licitacoes.api.dto.LicitacaoStats;
import com.example.licitacoes.api.dto.SearchResult;
import com.example.licitacoes.api.dto.ValueStats;
import com.example.licitacoes.server.index.LicitacaoIndexService;
import com.example.licitacoes.server.model.LicitacaoEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.elasticsearch.client.elc.NativeQuery;
import org.springframework.data.elasticsearch.core.SearchHits;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Read side of the index: full searches and the fixed aggregate views behind /modalidades, /ufs
 * and /stats.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);
    private final LicitacaoQueryBuilder queryBuilder;
    private final LicitacaoIndexService indexService;

    public SearchService(LicitacaoQueryBuilder queryBuilder, LicitacaoIndexService indexService) {
        this.queryBuilder = queryBuilder;
        this.indexService = indexService;
    }

    public SearchResult search(SearchCriteria criteria) {
        log.debug("Searching licitacoes: {}", criteria);
        SearchHits<LicitacaoEntity> hits = execute(queryBuilder.build(criteria));
        SearchResult result = queryBuilder.toResult(hits, criteria);
        log.debug("Search matched {} documents, returning {}", result.total(), result.items().size());
        return result;
    }

    public List<AggregationBucket> modalidades() {
        return buckets(AggregationType.MODALIDADES);
    }

    public List<AggregationBucket> ufs() {
        return buckets(AggregationType.UFS);
    }

    public LicitacaoStats stats() {
        SearchCriteria criteria = SearchCriteria.aggregationsOnly(
                EnumSet.of(AggregationType.VALOR, AggregationType.SITUACOES, AggregationType.POR_MES));
        SearchHits<LicitacaoEntity> hits = execute(queryBuilder.buildAggregationsOnly(criteria));
        SearchResult result = queryBuilder.toResult(hits, criteria);
        ValueStats valor = result.valorEstimado();
        return new LicitacaoStats(
                result.total(),
                valor.sum(),
                valor.avg(),
                valor.max(),
                valor.min(),
                result.aggregations().get(AggregationType.SITUACOES.responseName()),
                result.aggregations().get(AggregationType.POR_MES.responseName()));
    }

    private List<AggregationBucket> buckets(AggregationType type) {
        SearchCriteria criteria = SearchCriteria.aggregationsOnly(Set.of(type));
        SearchHits<LicitacaoEntity> hits = execute(queryBuilder.buildAggregationsOnly(criteria));
        return queryBuilder.toResult(hits, criteria).aggregations().get(type.responseName());
    }

    private SearchHits<LicitacaoEntity> execute(NativeQuery query) {
        try {
            return indexService.search(query);
        } catch (DataAccessException e) {
            log.error("Search engine unavailable: {}", e.getMessage());
            throw new SearchUnavailableException("search unavailable", e);
        }
    }
}
