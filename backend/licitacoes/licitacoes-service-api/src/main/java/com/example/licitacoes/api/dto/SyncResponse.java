package com.example.licitacoes.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Outcome of a sync run.
 *
 * @param status COMPLETED, COMPLETED_WITH_ERRORS, UP_TO_DATE, CANCELLED or ABORTED
 * @param quantidade records stored and indexed
 * @param skipped records rejected by normalization
 * @param watermark watermark for the modality after the run, yyyyMMdd
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResponse(
    String status,
    int codigoModalidadeContratacao,
    int pagesProcessed,
    int quantidade,
    int skipped,
    List<SkippedRecord> skippedRecords,
    List<PageFailure> pageFailures,
    RunFailure failure,
    String watermark) {

  /** A record that failed normalization. */
  public record SkippedRecord(String externalId, String field, String rawValue, String reason) {}

  /** A page that could not be read. */
  public record PageFailure(int page, String reason) {}

  /** The fatal error that stopped the run. */
  public record RunFailure(String stage, int page, String message) {}
}
