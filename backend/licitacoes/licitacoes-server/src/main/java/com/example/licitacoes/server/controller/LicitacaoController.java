package com.example.licitacoes.server.controller;

import com.example.licitacoes.api.dto.AggregationBucket;
import com.example.licitacoes.api.dto.LicitacaoStats;
import com.example.licitacoes.api.dto.SearchResult;
import com.example.licitacoes.api.model.Licitacao;
import com.example.licitacoes.server.search.AggregationType;
import com.example.licitacoes.server.search.SearchCriteria;
import com.example.licitacoes.server.search.SearchService;
import com.example.licitacoes.server.service.LicitacaoService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@RestController
@RequestMapping(value = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Licitações", description = "Search and statistics over synchronised PNCP notices")
public class LicitacaoController {

    private static final Logger log = LoggerFactory.getLogger(LicitacaoController.class);
    private final SearchService searchService;
    private final LicitacaoService licitacaoService;

    public LicitacaoController(SearchService searchService, LicitacaoService licitacaoService) {
        this.searchService = searchService;
        this.licitacaoService = licitacaoService;
    }

    @Operation(
            summary = "Search licitações",
            description = "Free text over objeto, informação complementar, órgão and município combined with "
                    + "exact filters. Without q, results are ordered by opening date, newest first."
    )
    @GetMapping("/licitacoes")
    public SearchResult search(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String modalidade,
            @RequestParam(required = false) String uf,
            @RequestParam(required = false) String situacao,
            @RequestParam(name = "valor_min", required = false) BigDecimal valorMin,
            @RequestParam(name = "valor_max", required = false) BigDecimal valorMax,
            @RequestParam(name = "data_abertura_min", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dataAberturaMin,
            @RequestParam(name = "data_abertura_max", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dataAberturaMax,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size,
            @Parameter(description = "Aggregations to compute: modalidades, ufs, por_situacao, por_mes, valor_estimado")
            @RequestParam(name = "aggs", required = false) List<String> aggs) {

        SearchCriteria criteria = new SearchCriteria(
                q, modalidade, uf, situacao, valorMin, valorMax,
                dataAberturaMin == null ? null : dataAberturaMin.atStartOfDay(),
                dataAberturaMax == null ? null : dataAberturaMax.atTime(LocalTime.MAX.withNano(0)),
                page, size, AggregationType.parse(aggs));
        log.info("Search q='{}' modalidade={} uf={} page={} size={}", q, modalidade, uf, page, size);
        return searchService.search(criteria);
    }

    @Operation(summary = "Get a licitação by internal id", description = "Served from the database, including the raw PNCP payload.")
    @GetMapping("/licitacoes/{internalId}")
    public Licitacao getById(@PathVariable Long internalId) {
        return licitacaoService.getById(internalId);
    }

    @Operation(summary = "Distinct modalidades with document counts")
    @GetMapping("/modalidades")
    public List<AggregationBucket> modalidades() {
        return searchService.modalidades();
    }

    @Operation(summary = "Distinct UFs with document counts")
    @GetMapping("/ufs")
    public List<AggregationBucket> ufs() {
        return searchService.ufs();
    }

    @Operation(summary = "Aggregate statistics", description = "Totals and value statistics, counts by situação and by publication month.")
    @GetMapping("/stats")
    public LicitacaoStats stats() {
        return searchService.stats();
    }
}
