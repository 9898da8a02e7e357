package com.example.licitacoes.server.sync;

import com.example.licitacoes.api.dto.SyncResponse.PageFailure;
import com.example.licitacoes.api.dto.SyncResponse.RunFailure;
import com.example.licitacoes.api.dto.SyncResponse.SkippedRecord;
import com.example.licitacoes.api.model.Licitacao;
import com.example.licitacoes.server.client.PncpClient;
import com.example.licitacoes.server.client.PncpPage;
import com.example.licitacoes.server.client.RawRecord;
import com.example.licitacoes.server.client.SourceSchemaException;
import com.example.licitacoes.server.client.SourceUnavailableException;
import com.example.licitacoes.server.config.LicitacoesProperties;
import com.example.licitacoes.server.index.IndexWriteFailureException;
import com.example.licitacoes.server.index.LicitacaoIndexService;
import com.example.licitacoes.server.model.LicitacaoEntity;
import com.example.licitacoes.server.normalize.NormalizationException;
import com.example.licitacoes.server.normalize.RecordNormalizer;
import com.example.licitacoes.server.service.LicitacaoStoreService;
import com.example.licitacoes.server.service.SyncWatermark;
import com.example.licitacoes.server.service.SyncWatermarkService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Drives one sync run per call: fetch PNCP pages in order, normalize, upsert, index, then move
 * the per-modality checkpoint and watermark.
 * <p>
 * A page counts as done only once its rows are stored and indexed, and only then is the
 * checkpoint written. After an unreadable page the checkpoint stays on that page for the rest of
 * the run. Runs for the same modality are mutually exclusive.
 */
@Service
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final PncpClient pncpClient;
    private final RecordNormalizer normalizer;
    private final LicitacaoStoreService storeService;
    private final LicitacaoIndexService indexService;
    private final SyncWatermarkService watermarkService;
    private final BackoffPolicy backoff;
    private final int indexMaxAttempts;
    private final int defaultPageSize;
    private final ConcurrentMap<Integer, ReentrantLock> locks = new ConcurrentHashMap<>();

    public SyncOrchestrator(PncpClient pncpClient,
                            RecordNormalizer normalizer,
                            LicitacaoStoreService storeService,
                            LicitacaoIndexService indexService,
                            SyncWatermarkService watermarkService,
                            LicitacoesProperties properties) {
        this.pncpClient = pncpClient;
        this.normalizer = normalizer;
        this.storeService = storeService;
        this.indexService = indexService;
        this.watermarkService = watermarkService;
        this.backoff = BackoffPolicy.from(properties.getSync());
        this.indexMaxAttempts = Math.max(1, properties.getSync().getIndexMaxAttempts());
        this.defaultPageSize = properties.getPncp().getDefaultPageSize();
        log.info("SyncOrchestrator initialized (maxAttempts={}, initialBackoff={}, indexMaxAttempts={})",
                backoff.maxAttempts(), backoff.initial(), indexMaxAttempts);
    }

    public SyncResult run(SyncCommand command) {
        return run(command, () -> false);
    }

    /**
     * Runs a sync for the command's modality.
     *
     * @param stopRequested polled between pages; when true the run ends {@link SyncStatus#CANCELLED}
     * @throws SyncInProgressException if a run for the same modality is executing
     */
    public SyncResult run(SyncCommand command, BooleanSupplier stopRequested) {
        int modalidade = command.codigoModalidade();
        ReentrantLock lock = locks.computeIfAbsent(modalidade, key -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.info("Rejecting sync for modalidade {}: another run holds the lock", modalidade);
            throw new SyncInProgressException(modalidade);
        }
        try {
            return execute(command, stopRequested);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning(int codigoModalidade) {
        ReentrantLock lock = locks.get(codigoModalidade);
        return lock != null && lock.isLocked();
    }

    private SyncResult execute(SyncCommand command, BooleanSupplier stopRequested) {
        int modalidade = command.codigoModalidade();
        SyncWatermark state = watermarkService.current(modalidade);

        LocalDate windowStart = command.dataInicial();
        if (state.watermark() != null && state.watermark().isAfter(windowStart)) {
            windowStart = state.watermark();
        }
        LocalDate windowEnd = command.dataFinal();
        RunProgress progress = new RunProgress(modalidade, windowStart, windowEnd, state.watermark());

        if (windowStart.isAfter(windowEnd)) {
            log.info("Modalidade {} already synchronised up to {}, nothing to fetch", modalidade, state.watermark());
            return progress.finish(SyncStatus.UP_TO_DATE);
        }

        int pageSize = command.tamanhoPagina() != null ? command.tamanhoPagina() : defaultPageSize;
        int page = state.resumePage(windowStart, windowEnd);
        if (page > 1) {
            log.info("Resuming modalidade {} window {}..{} at page {}", modalidade, windowStart, windowEnd, page);
        } else {
            log.info("Starting sync of modalidade {} window {}..{}", modalidade, windowStart, windowEnd);
        }

        int knownTotalPages = 0;
        while (true) {
            if (stopRequested.getAsBoolean()) {
                log.info("Stop requested, ending sync of modalidade {} before page {}", modalidade, page);
                return progress.finish(SyncStatus.CANCELLED);
            }

            PncpPage result;
            try {
                result = fetchWithRetry(windowStart, windowEnd, modalidade, page, pageSize);
            } catch (SourceUnavailableException e) {
                log.error("Aborting sync of modalidade {} at page {} after {} attempts: {}",
                        modalidade, page, e.getAttempts(), e.getMessage());
                return progress.abort(FailureStage.FETCH, page,
                        e.getMessage() + " (attempts=" + e.getAttempts() + ")");
            } catch (SourceSchemaException e) {
                log.warn("Page {} of modalidade {} is unreadable: {}", page, modalidade, e.getMessage());
                if (progress.pageFailures.isEmpty()) {
                    // a resumed run must start at the first page that was not ingested
                    try {
                        watermarkService.checkpoint(modalidade, windowStart, windowEnd, page);
                    } catch (DataAccessException storeFailure) {
                        log.error("Aborting sync of modalidade {} at page {}: checkpoint failed",
                                modalidade, page, storeFailure);
                        return progress.abort(FailureStage.STORE, page,
                                storeFailure.getMostSpecificCause().getMessage());
                    }
                }
                progress.pageFailures.add(new PageFailure(page, e.getMessage()));
                if (page < knownTotalPages) {
                    page++;
                    continue;
                }
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Sync of modalidade {} interrupted while backing off before page {}", modalidade, page);
                return progress.finish(SyncStatus.CANCELLED);
            }

            knownTotalPages = Math.max(knownTotalPages, result.totalPages());
            if (result.isEmpty()) {
                break;
            }

            try {
                progress.quantidade += processPage(result, progress);
                progress.pagesProcessed++;
                if (progress.pageFailures.isEmpty()) {
                    watermarkService.checkpoint(modalidade, windowStart, windowEnd, page + 1);
                }
            } catch (IndexWriteFailureException e) {
                log.error("Aborting sync of modalidade {} at page {}: {} documents could not be indexed",
                        modalidade, page, e.getFailedIds().size());
                return progress.abort(FailureStage.INDEX, page, e.getMessage());
            } catch (DataAccessException e) {
                log.error("Aborting sync of modalidade {} at page {}: store failed", modalidade, page, e);
                return progress.abort(FailureStage.STORE, page, e.getMostSpecificCause().getMessage());
            }

            if (!result.hasNextPage()) {
                break;
            }
            page++;
        }

        if (!progress.pageFailures.isEmpty()) {
            // the window must be read again from page 1 next time
            watermarkService.clearCheckpoint(modalidade);
            log.warn("Sync of modalidade {} finished with {} unreadable pages; watermark stays at {}",
                    modalidade, progress.pageFailures.size(), progress.watermark);
            return progress.finish(SyncStatus.COMPLETED_WITH_ERRORS);
        }

        progress.watermark = watermarkService.advance(modalidade, windowEnd);
        log.info("Sync of modalidade {} completed: pages={}, quantidade={}, skipped={}",
                modalidade, progress.pagesProcessed, progress.quantidade, progress.skippedRecords.size());
        return progress.finish(SyncStatus.COMPLETED);
    }

    private PncpPage fetchWithRetry(LocalDate dataInicial, LocalDate dataFinal, int modalidade,
                                    int page, int pageSize) throws InterruptedException {
        for (int attempt = 1; ; attempt++) {
            try {
                return pncpClient.fetchPage(dataInicial, dataFinal, modalidade, page, pageSize);
            } catch (SourceUnavailableException e) {
                if (attempt >= backoff.maxAttempts()) {
                    throw e.withAttempts(attempt);
                }
                Duration delay = backoff.delayAfter(attempt);
                log.warn("Fetch of page {} failed (attempt {}/{}, status {}), retrying in {} ms",
                        page, attempt, backoff.maxAttempts(), e.getStatus(), delay.toMillis());
                if (!delay.isZero()) {
                    Thread.sleep(delay.toMillis());
                }
            }
        }
    }

    /** @return number of rows stored and indexed for this page */
    private int processPage(PncpPage page, RunProgress progress) {
        List<Licitacao> valid = new ArrayList<>(page.records().size());
        for (RawRecord raw : page.records()) {
            try {
                valid.add(normalizer.normalize(raw));
            } catch (NormalizationException e) {
                log.warn("Skipping record {}: {} (field={}, value={})",
                        e.getExternalId(), e.getMessage(), e.getField(), e.getRawValue());
                progress.skippedRecords.add(
                        new SkippedRecord(e.getExternalId(), e.getField(), e.getRawValue(), e.getMessage()));
            }
        }
        if (valid.isEmpty()) {
            return 0;
        }

        List<LicitacaoEntity> stored = storeService.upsertBatch(valid);
        indexWithRetry(stored);
        storeService.markIndexed(stored.stream().map(LicitacaoEntity::getInternalId).collect(Collectors.toList()));
        log.debug("Page {}: {} stored and indexed, {} skipped so far",
                page.pageNumber(), stored.size(), progress.skippedRecords.size());
        return stored.size();
    }

    /** Resubmits only the rejected documents, up to indexMaxAttempts bulk requests. */
    private void indexWithRetry(List<LicitacaoEntity> entities) {
        List<LicitacaoEntity> pending = entities;
        for (int attempt = 1; ; attempt++) {
            try {
                indexService.indexBatch(pending);
                return;
            } catch (IndexWriteFailureException e) {
                if (attempt >= indexMaxAttempts) {
                    throw e;
                }
                Set<Long> failed = e.getFailedIds();
                List<LicitacaoEntity> retry = pending.stream()
                        .filter(entity -> failed.contains(entity.getInternalId()))
                        .collect(Collectors.toList());
                if (!retry.isEmpty()) {
                    pending = retry;
                }
                log.warn("Index attempt {}/{} rejected {} documents, resubmitting {}",
                        attempt, indexMaxAttempts, failed.size(), pending.size());
            }
        }
    }

    /**
     * Indexes rows whose index copy is missing or older than the stored row, in batches.
     *
     * @return number of rows brought up to date
     */
    public int reindexPending(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        log.info("Reindexing stale rows ({} pending)", storeService.countPendingIndex());
        int total = 0;
        while (true) {
            List<LicitacaoEntity> batch = storeService.findPendingIndex(batchSize);
            if (batch.isEmpty()) {
                break;
            }
            List<Long> ids = batch.stream().map(LicitacaoEntity::getInternalId).collect(Collectors.toList());
            try {
                indexService.indexBatch(batch);
            } catch (IndexWriteFailureException e) {
                List<Long> indexed = ids.stream()
                        .filter(id -> !e.getFailedIds().contains(id))
                        .collect(Collectors.toList());
                storeService.markIndexed(indexed);
                total += indexed.size();
                log.warn("Reindex stopped: {} documents rejected, {} reindexed in total",
                        e.getFailedIds().size(), total);
                return total;
            }
            storeService.markIndexed(ids);
            total += ids.size();
            log.debug("Reindexed batch of {} ({} so far)", ids.size(), total);
            if (batch.size() < batchSize) {
                break;
            }
        }
        log.info("Reindex completed: {} documents", total);
        return total;
    }

    private static final class RunProgress {
        private final int codigoModalidade;
        private final LocalDate windowStart;
        private final LocalDate windowEnd;
        private final List<SkippedRecord> skippedRecords = new ArrayList<>();
        private final List<PageFailure> pageFailures = new ArrayList<>();
        private LocalDate watermark;
        private int pagesProcessed;
        private int quantidade;

        private RunProgress(int codigoModalidade, LocalDate windowStart, LocalDate windowEnd, LocalDate watermark) {
            this.codigoModalidade = codigoModalidade;
            this.windowStart = windowStart;
            this.windowEnd = windowEnd;
            this.watermark = watermark;
        }

        private SyncResult finish(SyncStatus status) {
            return build(status, null);
        }

        private SyncResult abort(FailureStage stage, int page, String message) {
            return build(SyncStatus.ABORTED, new RunFailure(stage.name(), page, message));
        }

        private SyncResult build(SyncStatus status, RunFailure failure) {
            return new SyncResult(status, codigoModalidade, windowStart, windowEnd, pagesProcessed,
                    quantidade, skippedRecords, pageFailures, failure, watermark);
        }
    }
}
