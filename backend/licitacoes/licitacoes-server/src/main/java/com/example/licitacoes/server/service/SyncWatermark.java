package com.example.licitacoes.server.service;

import java.time.LocalDate;

/**
 * Snapshot of a modality's sync progress.
 *
 * @param watermark last dataFinal fully synchronised, null before the first complete run
 */
public record SyncWatermark(
        int codigoModalidade,
        LocalDate watermark,
        LocalDate checkpointWindowStart,
        LocalDate checkpointWindowEnd,
        Integer checkpointNextPage) {

    public static SyncWatermark none(int codigoModalidade) {
        return new SyncWatermark(codigoModalidade, null, null, null, null);
    }

    /** First page to fetch for the window: the checkpoint's next page if it was left on this exact window, else 1. */
    public int resumePage(LocalDate windowStart, LocalDate windowEnd) {
        if (checkpointNextPage != null
                && windowStart.equals(checkpointWindowStart)
                && windowEnd.equals(checkpointWindowEnd)) {
            return Math.max(1, checkpointNextPage);
        }
        return 1;
    }
}
