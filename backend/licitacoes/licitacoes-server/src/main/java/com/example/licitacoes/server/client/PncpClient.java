package com.example.licitacoes.server.client;

import com.example.licitacoes.server.config.LicitacoesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the PNCP consultation API ({@code /v1/contratacoes/publicacao}).
 * <p>
 * One HTTP request per call; retrying is left to the caller. The page size is clamped to the
 * portal maximum here because PNCP rejects larger values as a malformed request.
 */
@Component
public class PncpClient {

    private static final Logger log = LoggerFactory.getLogger(PncpClient.class);
    static final String PUBLICACAO_PATH = "/v1/contratacoes/publicacao";
    public static final DateTimeFormatter PNCP_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final RestClient restClient;
    private final ObjectReader reader;
    private final int maxPageSize;

    public PncpClient(@Qualifier("pncpRestClient") RestClient restClient,
                      ObjectMapper objectMapper,
                      LicitacoesProperties properties) {
        this.restClient = restClient;
        this.reader = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.maxPageSize = properties.getPncp().getMaxPageSize();
        log.info("PncpClient initialized (maxPageSize={})", maxPageSize);
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    /**
     * Fetches one page of notices published between the two dates (inclusive) for a modality.
     *
     * @throws SourceUnavailableException on I/O failure or a non-2xx status
     * @throws SourceSchemaException when the body is not a PNCP page envelope
     */
    public PncpPage fetchPage(LocalDate dataInicial, LocalDate dataFinal, int codigoModalidade,
                              int pagina, int tamanhoPagina) {
        if (dataInicial == null || dataFinal == null) {
            throw new IllegalArgumentException("dataInicial and dataFinal are required");
        }
        if (dataInicial.isAfter(dataFinal)) {
            throw new IllegalArgumentException(
                    "dataInicial " + dataInicial + " is after dataFinal " + dataFinal);
        }
        if (pagina < 1) {
            throw new IllegalArgumentException("pagina must be >= 1, got " + pagina);
        }
        if (tamanhoPagina < 1) {
            throw new IllegalArgumentException("tamanhoPagina must be >= 1, got " + tamanhoPagina);
        }
        int pageSize = Math.min(tamanhoPagina, maxPageSize);
        if (pageSize != tamanhoPagina) {
            log.debug("Clamping tamanhoPagina from {} to {}", tamanhoPagina, pageSize);
        }

        String inicial = dataInicial.format(PNCP_DATE);
        String fim = dataFinal.format(PNCP_DATE);
        log.debug("GET {} dataInicial={} dataFinal={} modalidade={} pagina={} tamanhoPagina={}",
                PUBLICACAO_PATH, inicial, fim, codigoModalidade, pagina, pageSize);

        ResponseEntity<String> response;
        try {
            response = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path(PUBLICACAO_PATH)
                            .queryParam("dataInicial", inicial)
                            .queryParam("dataFinal", fim)
                            .queryParam("codigoModalidadeContratacao", codigoModalidade)
                            .queryParam("pagina", pagina)
                            .queryParam("tamanhoPagina", pageSize)
                            .build())
                    .retrieve()
                    .toEntity(String.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("PNCP answered {} for modalidade={} pagina={}", status, codigoModalidade, pagina);
            throw new SourceUnavailableException(status, 1,
                    "PNCP answered HTTP " + status + " for pagina " + pagina, e);
        } catch (ResourceAccessException e) {
            log.warn("PNCP unreachable for modalidade={} pagina={}: {}", codigoModalidade, pagina, e.getMessage());
            throw new SourceUnavailableException(0, 1, "PNCP unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new SourceUnavailableException(0, 1, "PNCP request failed: " + e.getMessage(), e);
        }

        if (response.getStatusCode().isSameCodeAs(HttpStatus.NO_CONTENT)) {
            log.debug("PNCP returned no content for modalidade={} pagina={}", codigoModalidade, pagina);
            return PncpPage.empty(pagina);
        }
        return parsePage(response.getBody(), pagina);
    }

    PncpPage parsePage(String body, int pagina) {
        if (body == null || body.isBlank()) {
            return PncpPage.empty(pagina);
        }
        JsonNode root;
        try {
            root = reader.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceSchemaException("PNCP page " + pagina + " is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SourceSchemaException("PNCP page " + pagina + " is not a JSON object");
        }

        JsonNode data = root.has("data") ? root.get("data") : root.get("content");
        if (data == null || !data.isArray()) {
            throw new SourceSchemaException("PNCP page " + pagina + " has no 'data' array");
        }

        List<RawRecord> records = new ArrayList<>(data.size());
        for (JsonNode element : data) {
            records.add(RawRecord.fromJson(element));
        }

        long totalRecords = root.path("totalRegistros").asLong(records.size());
        int totalPages = root.path("totalPaginas").asInt(0);
        int pageNumber = root.path("numeroPagina").asInt(pagina);
        boolean hasNext;
        if (root.hasNonNull("paginasRestantes")) {
            hasNext = root.get("paginasRestantes").asInt(0) > 0;
        } else {
            hasNext = pageNumber < totalPages;
        }

        log.debug("PNCP page {}/{}: {} records, totalRegistros={}", pageNumber, totalPages, records.size(), totalRecords);
        return new PncpPage(List.copyOf(records), hasNext, totalRecords, totalPages, pageNumber);
    }
}
