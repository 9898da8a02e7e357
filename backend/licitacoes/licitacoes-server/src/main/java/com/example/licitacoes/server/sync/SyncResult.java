package com.example.licitacoes.server.sync;

import com.example.licitacoes.api.dto.SyncResponse;
import com.example.licitacoes.api.dto.SyncResponse.PageFailure;
import com.example.licitacoes.api.dto.SyncResponse.RunFailure;
import com.example.licitacoes.api.dto.SyncResponse.SkippedRecord;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Outcome of {@link SyncOrchestrator#run}.
 *
 * @param quantidade records stored and indexed during the run
 * @param failure null unless the run was aborted
 */
public record SyncResult(
        SyncStatus status,
        int codigoModalidade,
        LocalDate windowStart,
        LocalDate windowEnd,
        int pagesProcessed,
        int quantidade,
        List<SkippedRecord> skippedRecords,
        List<PageFailure> pageFailures,
        RunFailure failure,
        LocalDate watermark) {

    public SyncResult {
        skippedRecords = List.copyOf(skippedRecords);
        pageFailures = List.copyOf(pageFailures);
    }

    public int skipped() {
        return skippedRecords.size();
    }

    public SyncResponse toResponse() {
        return new SyncResponse(
                status.name(),
                codigoModalidade,
                pagesProcessed,
                quantidade,
                skipped(),
                skippedRecords,
                pageFailures,
                failure,
                watermark == null ? null : watermark.format(DateTimeFormatter.BASIC_ISO_DATE));
    }
}
