package com.example.licitacoes.server.controller;

import com.example.licitacoes.api.dto.SyncRequest;
import com.example.licitacoes.api.dto.SyncResponse;
import com.example.licitacoes.server.config.LicitacoesProperties;
import com.example.licitacoes.server.sync.SyncCommand;
import com.example.licitacoes.server.sync.SyncOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

@RestController
@RequestMapping(value = "/api/v1/sync", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Sync", description = "Manual PNCP synchronisation")
public class SyncController {

    private static final Logger log = LoggerFactory.getLogger(SyncController.class);
    private final SyncOrchestrator orchestrator;
    private final int reindexBatchSize;

    public SyncController(SyncOrchestrator orchestrator, LicitacoesProperties properties) {
        this.orchestrator = orchestrator;
        this.reindexBatchSize = properties.getSync().getReindexBatchSize();
    }

    @Operation(
            summary = "Run a sync for one modalidade",
            description = "Fetches PNCP pages for the window, stores and indexes them, and returns when the run ends. "
                    + "Answers 409 if a run for the same modalidade is in progress."
    )
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public SyncResponse sync(@RequestBody SyncRequest request) {
        if (request.codigoModalidadeContratacao() == null) {
            throw new IllegalArgumentException("codigoModalidadeContratacao is required");
        }
        SyncCommand command = new SyncCommand(
                parseDate("dataInicial", request.dataInicial()),
                parseDate("dataFinal", request.dataFinal()),
                request.codigoModalidadeContratacao(),
                request.tamanhoPagina());
        log.info("Manual sync requested: {}", command);
        return orchestrator.run(command).toResponse();
    }

    @Operation(summary = "Index rows whose search copy is missing or stale")
    @PostMapping("/reindex")
    public Map<String, Integer> reindex(@RequestParam(name = "batchSize", required = false) Integer batchSize) {
        int reindexed = orchestrator.reindexPending(batchSize != null ? batchSize : reindexBatchSize);
        return Map.of("reindexed", reindexed);
    }

    private static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required (yyyyMMdd)");
        }
        try {
            return LocalDate.parse(value.trim(), DateTimeFormatter.BASIC_ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(field + " must be yyyyMMdd, got '" + value + "'", e);
        }
    }
}
