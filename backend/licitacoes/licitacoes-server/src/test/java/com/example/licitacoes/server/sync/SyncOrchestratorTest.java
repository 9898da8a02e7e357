package com.example.licitacoes.server.sync;

import com.example.licitacoes.api.model.Licitacao;
import com.example.licitacoes.server.client.PncpClient;
import com.example.licitacoes.server.client.PncpPage;
import com.example.licitacoes.server.client.RawRecord;
import com.example.licitacoes.server.client.SourceSchemaException;
import com.example.licitacoes.server.client.SourceUnavailableException;
import com.example.licitacoes.server.config.LicitacoesProperties;
import com.example.licitacoes.server.index.IndexWriteFailureException;
import com.example.licitacoes.server.index.LicitacaoIndexService;
import com.example.licitacoes.server.mapper.LicitacaoMapper;
import com.example.licitacoes.server.model.LicitacaoEntity;
import com.example.licitacoes.server.normalize.RecordNormalizer;
import com.example.licitacoes.server.service.LicitacaoStoreService;
import com.example.licitacoes.server.service.SyncWatermark;
import com.example.licitacoes.server.service.SyncWatermarkService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Sync orchestrator")
class SyncOrchestratorTest {

    private static final LocalDate MAY_1 = LocalDate.of(2025, 5, 1);
    private static final LocalDate JUNE_1 = LocalDate.of(2025, 6, 1);
    private static final int PREGAO = 6;

    @Mock
    private PncpClient pncpClient;

    @Mock
    private LicitacaoStoreService storeService;

    @Mock
    private LicitacaoIndexService indexService;

    @Mock
    private SyncWatermarkService watermarkService;

    private SyncOrchestrator orchestrator;
    private final Map<String, Long> ids = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @BeforeEach
    void setUp() {
        LicitacoesProperties properties = new LicitacoesProperties();
        properties.getSync().setInitialBackoff(Duration.ZERO);
        properties.getSync().setMaxBackoff(Duration.ZERO);
        properties.getSync().setMaxAttempts(3);
        properties.getSync().setIndexMaxAttempts(3);
        orchestrator = new SyncOrchestrator(pncpClient, new RecordNormalizer(), storeService, indexService,
                watermarkService, properties);

        when(watermarkService.current(anyInt())).thenAnswer(invocation -> SyncWatermark.none(invocation.getArgument(0)));
        when(watermarkService.advance(anyInt(), any(LocalDate.class))).thenAnswer(invocation -> invocation.getArgument(1));
        when(storeService.upsertBatch(anyList())).thenAnswer(invocation -> {
            List<Licitacao> licitacoes = invocation.getArgument(0);
            return licitacoes.stream().map(this::stored).collect(Collectors.toList());
        });
    }

    private LicitacaoEntity stored(Licitacao licitacao) {
        LicitacaoEntity entity = LicitacaoMapper.toEntity(licitacao);
        entity.setInternalId(ids.computeIfAbsent(licitacao.externalId(), key -> sequence.incrementAndGet()));
        return entity;
    }

    private static RawRecord record(String numeroControle, String objeto) {
        return new RawRecord(RawRecord.SOURCE_PNCP, numeroControle, objeto, null, "Prefeitura de Campinas",
                "51885242000140", "6", "Pregão - Eletrônico", "SP", "Campinas", "1000.00",
                "2025-05-10T08:00:00", null, "2025-05-02T09:30:00", "Divulgada no PNCP", "2025", "1", "{}");
    }

    private static PncpPage page(int number, int totalPages, RawRecord... records) {
        return new PncpPage(Arrays.asList(records), number < totalPages, records.length, totalPages, number);
    }

    private static SyncCommand command() {
        return new SyncCommand(MAY_1, JUNE_1, PREGAO, 50);
    }

    @Test
    @DisplayName("stores and indexes valid records, skips the invalid one and advances the watermark")
    void syncsSinglePage() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 1,
                record("A-1", "Aquisição de medicamentos"),
                record("B-2", "  "),
                record("C-3", "Serviços de vigilância")));

        SyncResult result = orchestrator.run(command());

        assertThat(result.status()).isEqualTo(SyncStatus.COMPLETED);
        assertThat(result.quantidade()).isEqualTo(2);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.skippedRecords()).singleElement().satisfies(skipped -> {
            assertThat(skipped.externalId()).isEqualTo("B-2");
            assertThat(skipped.field()).isEqualTo("objetoCompra");
        });
        assertThat(result.watermark()).isEqualTo(JUNE_1);
        assertThat(result.toResponse().watermark()).isEqualTo("20250601");

        verify(indexService).indexBatch(anyList());
        verify(storeService).markIndexed(List.of(ids.get("A-1"), ids.get("C-3")));
        verify(watermarkService).checkpoint(PREGAO, MAY_1, JUNE_1, 2);
        verify(watermarkService).advance(PREGAO, JUNE_1);
    }

    @Test
    @DisplayName("walks pages in order until the portal reports no next page")
    void walksPages() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 2, record("A-1", "Objeto A")));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 2, 50)).thenReturn(page(2, 2, record("B-2", "Objeto B")));

        SyncResult result = orchestrator.run(command());

        assertThat(result.pagesProcessed()).isEqualTo(2);
        assertThat(result.quantidade()).isEqualTo(2);
        verify(watermarkService).checkpoint(PREGAO, MAY_1, JUNE_1, 2);
        verify(watermarkService).checkpoint(PREGAO, MAY_1, JUNE_1, 3);
        verify(pncpClient, never()).fetchPage(any(), any(), anyInt(), eq(3), anyInt());
    }

    @Test
    @DisplayName("retries an unavailable source with backoff and then succeeds")
    void retriesFetch() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50))
                .thenThrow(new SourceUnavailableException(503, 1, "HTTP 503", null))
                .thenThrow(new SourceUnavailableException(0, 1, "timeout", null))
                .thenReturn(page(1, 1, record("A-1", "Objeto A")));

        SyncResult result = orchestrator.run(command());

        assertThat(result.status()).isEqualTo(SyncStatus.COMPLETED);
        verify(pncpClient, times(3)).fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50);
    }

    @Test
    @DisplayName("aborts at the failing page after exhausting retries, keeping earlier pages and the old watermark")
    void abortsAfterRetries() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 3, record("A-1", "Objeto A")));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 2, 50))
                .thenThrow(new SourceUnavailableException(502, 1, "HTTP 502", null));

        SyncResult result = orchestrator.run(command());

        assertThat(result.status()).isEqualTo(SyncStatus.ABORTED);
        assertThat(result.failure().stage()).isEqualTo("FETCH");
        assertThat(result.failure().page()).isEqualTo(2);
        assertThat(result.failure().message()).contains("attempts=3");
        assertThat(result.quantidade()).isEqualTo(1);
        assertThat(result.watermark()).isNull();
        verify(pncpClient, times(3)).fetchPage(MAY_1, JUNE_1, PREGAO, 2, 50);
        verify(watermarkService).checkpoint(PREGAO, MAY_1, JUNE_1, 2);
        verify(watermarkService, never()).advance(anyInt(), any());
    }

    @Test
    @DisplayName("starts the window at the stored watermark when it is later than dataInicial")
    void windowFromWatermark() {
        LocalDate watermark = LocalDate.of(2025, 5, 20);
        when(watermarkService.current(PREGAO)).thenReturn(new SyncWatermark(PREGAO, watermark, null, null, null));
        when(pncpClient.fetchPage(watermark, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 1));

        SyncResult result = orchestrator.run(command());

        assertThat(result.windowStart()).isEqualTo(watermark);
        verify(pncpClient).fetchPage(watermark, JUNE_1, PREGAO, 1, 50);
    }

    @Test
    @DisplayName("does not fetch when the watermark already covers the window")
    void upToDate() {
        when(watermarkService.current(PREGAO))
                .thenReturn(new SyncWatermark(PREGAO, JUNE_1.plusDays(1), null, null, null));

        SyncResult result = orchestrator.run(command());

        assertThat(result.status()).isEqualTo(SyncStatus.UP_TO_DATE);
        assertThat(result.watermark()).isEqualTo(JUNE_1.plusDays(1));
        verify(pncpClient, never()).fetchPage(any(), any(), anyInt(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("resumes from the checkpoint left on the same window")
    void resumesFromCheckpoint() {
        when(watermarkService.current(PREGAO)).thenReturn(new SyncWatermark(PREGAO, null, MAY_1, JUNE_1, 3));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 3, 50)).thenReturn(page(3, 3, record("A-1", "Objeto A")));

        SyncResult result = orchestrator.run(command());

        assertThat(result.status()).isEqualTo(SyncStatus.COMPLETED);
        verify(pncpClient, never()).fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50);
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("resubmits only the documents the index rejected")
    void resubmitsFailedSubset() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 1,
                record("A-1", "Objeto A"), record("B-2", "Objeto B"), record("C-3", "Objeto C")));
        doThrow(new IndexWriteFailureException(Set.of(2L), "rejected", null))
                .doNothing()
                .when(indexService).indexBatch(anyList());
        ArgumentCaptor<List<LicitacaoEntity>> batches = ArgumentCaptor.forClass(List.class);

        SyncResult result = orchestrator.run(command());

        verify(indexService, times(2)).indexBatch(batches.capture());
        List<List<Long>> submitted = new ArrayList<>();
        for (List<LicitacaoEntity> batch : batches.getAllValues()) {
            submitted.add(batch.stream().map(LicitacaoEntity::getInternalId).collect(Collectors.toList()));
        }
        assertThat(submitted.get(0)).containsExactly(1L, 2L, 3L);
        assertThat(submitted.get(1)).containsExactly(2L);
        assertThat(result.status()).isEqualTo(SyncStatus.COMPLETED);
        assertThat(result.quantidade()).isEqualTo(3);
    }

    @Test
    @DisplayName("aborts with stage INDEX when the index keeps rejecting, without checkpointing the page")
    void abortsOnIndexFailure() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 1, record("A-1", "Objeto A")));
        doThrow(new IndexWriteFailureException(Set.of(1L), "rejected", null))
                .when(indexService).indexBatch(anyList());

        SyncResult result = orchestrator.run(command());

        assertThat(result.status()).isEqualTo(SyncStatus.ABORTED);
        assertThat(result.failure().stage()).isEqualTo("INDEX");
        verify(indexService, times(3)).indexBatch(anyList());
        verify(storeService, never()).markIndexed(anyList());
        verify(watermarkService, never()).checkpoint(anyInt(), any(), any(), anyInt());
        verify(watermarkService, never()).advance(anyInt(), any());
    }

    @Test
    @DisplayName("aborts with stage STORE when the database fails")
    void abortsOnStoreFailure() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 1, record("A-1", "Objeto A")));
        when(storeService.upsertBatch(anyList())).thenThrow(new DataAccessResourceFailureException("connection lost"));

        SyncResult result = orchestrator.run(command());

        assertThat(result.status()).isEqualTo(SyncStatus.ABORTED);
        assertThat(result.failure().stage()).isEqualTo("STORE");
        verify(indexService, never()).indexBatch(anyList());
    }

    @Test
    @DisplayName("records an unreadable page and keeps going, but leaves the watermark in place")
    void continuesAfterSchemaError() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 3, record("A-1", "Objeto A")));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 2, 50)).thenThrow(new SourceSchemaException("no data array"));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 3, 50)).thenReturn(page(3, 3, record("C-3", "Objeto C")));

        SyncResult result = orchestrator.run(command());

        assertThat(result.status()).isEqualTo(SyncStatus.COMPLETED_WITH_ERRORS);
        assertThat(result.pageFailures()).singleElement().satisfies(failure -> assertThat(failure.page()).isEqualTo(2));
        assertThat(result.quantidade()).isEqualTo(2);
        verify(watermarkService, never()).advance(anyInt(), any());
        verify(watermarkService, never()).checkpoint(PREGAO, MAY_1, JUNE_1, 4);
        verify(watermarkService).clearCheckpoint(PREGAO);
    }

    @Test
    @DisplayName("a run aborted after an unreadable page leaves the checkpoint on that page, so the next run reads it")
    void resumesAtUnreadablePage() {
        AtomicReference<SyncWatermark> stored = new AtomicReference<>(SyncWatermark.none(PREGAO));
        when(watermarkService.current(PREGAO)).thenAnswer(invocation -> stored.get());
        doAnswer(invocation -> {
            stored.set(new SyncWatermark(PREGAO, stored.get().watermark(), invocation.getArgument(1),
                    invocation.getArgument(2), invocation.getArgument(3)));
            return null;
        }).when(watermarkService).checkpoint(eq(PREGAO), any(), any(), anyInt());
        when(watermarkService.advance(eq(PREGAO), any(LocalDate.class))).thenAnswer(invocation -> {
            LocalDate dataFinal = invocation.getArgument(1);
            stored.set(new SyncWatermark(PREGAO, dataFinal, null, null, null));
            return dataFinal;
        });

        SourceUnavailableException unavailable = new SourceUnavailableException(503, 1, "HTTP 503", null);
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 5, record("A-1", "Objeto A")));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 2, 50))
                .thenThrow(new SourceSchemaException("no data array"))
                .thenReturn(page(2, 5, record("B-2", "Objeto B")));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 3, 50)).thenReturn(page(3, 5, record("C-3", "Objeto C")));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 4, 50))
                .thenThrow(unavailable, unavailable, unavailable)
                .thenReturn(page(4, 5, record("D-4", "Objeto D")));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 5, 50)).thenReturn(page(5, 5, record("E-5", "Objeto E")));

        SyncResult first = orchestrator.run(command());

        assertThat(first.status()).isEqualTo(SyncStatus.ABORTED);
        assertThat(first.failure().page()).isEqualTo(4);
        assertThat(first.pageFailures()).singleElement().satisfies(failure -> assertThat(failure.page()).isEqualTo(2));
        assertThat(stored.get().checkpointNextPage()).isEqualTo(2);
        assertThat(stored.get().watermark()).isNull();

        SyncResult second = orchestrator.run(command());

        assertThat(second.status()).isEqualTo(SyncStatus.COMPLETED);
        assertThat(second.pageFailures()).isEmpty();
        assertThat(second.quantidade()).isEqualTo(4);
        assertThat(second.watermark()).isEqualTo(JUNE_1);
        verify(pncpClient, times(2)).fetchPage(MAY_1, JUNE_1, PREGAO, 2, 50);
        verify(pncpClient, times(1)).fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50);
    }

    @Test
    @DisplayName("a stop request after an unreadable page keeps the checkpoint on that page")
    void stopAfterUnreadablePage() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 4, record("A-1", "Objeto A")));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 2, 50)).thenThrow(new SourceSchemaException("no data array"));
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 3, 50)).thenReturn(page(3, 4, record("C-3", "Objeto C")));
        AtomicInteger polls = new AtomicInteger();

        SyncResult result = orchestrator.run(command(), () -> polls.incrementAndGet() > 3);

        assertThat(result.status()).isEqualTo(SyncStatus.CANCELLED);
        assertThat(result.quantidade()).isEqualTo(2);
        verify(watermarkService, times(2)).checkpoint(PREGAO, MAY_1, JUNE_1, 2);
        verify(watermarkService, never()).checkpoint(PREGAO, MAY_1, JUNE_1, 4);
        verify(watermarkService, never()).advance(anyInt(), any());
    }

    @Test
    @DisplayName("a stop request ends the run between pages, after the current page is committed")
    void stopsBetweenPages() {
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenReturn(page(1, 2, record("A-1", "Objeto A")));
        AtomicInteger polls = new AtomicInteger();

        SyncResult result = orchestrator.run(command(), () -> polls.incrementAndGet() > 1);

        assertThat(result.status()).isEqualTo(SyncStatus.CANCELLED);
        assertThat(result.quantidade()).isEqualTo(1);
        verify(storeService).markIndexed(anyList());
        verify(watermarkService).checkpoint(PREGAO, MAY_1, JUNE_1, 2);
        verify(pncpClient, never()).fetchPage(MAY_1, JUNE_1, PREGAO, 2, 50);
        verify(watermarkService, never()).advance(anyInt(), any());
    }

    @Test
    @DisplayName("rejects an overlapping run for the same modality but not for another one")
    void mutualExclusionPerModality() throws Exception {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(pncpClient.fetchPage(MAY_1, JUNE_1, PREGAO, 1, 50)).thenAnswer(invocation -> {
            fetching.countDown();
            release.await(5, TimeUnit.SECONDS);
            return page(1, 1);
        });
        when(pncpClient.fetchPage(MAY_1, JUNE_1, 8, 1, 50)).thenReturn(page(1, 1));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SyncResult> first = executor.submit(() -> orchestrator.run(command()));
            assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(orchestrator.isRunning(PREGAO)).isTrue();
            assertThatThrownBy(() -> orchestrator.run(command()))
                    .isInstanceOf(SyncInProgressException.class);
            assertThat(orchestrator.run(new SyncCommand(MAY_1, JUNE_1, 8, 50)).status())
                    .isEqualTo(SyncStatus.COMPLETED);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).status()).isEqualTo(SyncStatus.COMPLETED);
        } finally {
            executor.shutdownNow();
        }
        assertThat(orchestrator.isRunning(PREGAO)).isFalse();
    }

    @Test
    @DisplayName("reindexes stale rows in batches and marks them indexed")
    void reindexesPendingRows() {
        LicitacaoEntity first = stored(new RecordNormalizer().normalize(record("A-1", "Objeto A")));
        LicitacaoEntity second = stored(new RecordNormalizer().normalize(record("B-2", "Objeto B")));
        LicitacaoEntity third = stored(new RecordNormalizer().normalize(record("C-3", "Objeto C")));
        when(storeService.findPendingIndex(2))
                .thenReturn(List.of(first, second))
                .thenReturn(List.of(third));
        doNothing().when(indexService).indexBatch(anyList());

        int reindexed = orchestrator.reindexPending(2);

        assertThat(reindexed).isEqualTo(3);
        verify(storeService).markIndexed(List.of(first.getInternalId(), second.getInternalId()));
        verify(storeService).markIndexed(List.of(third.getInternalId()));
    }

    @Test
    @DisplayName("rejects an inverted date range")
    void invalidCommand() {
        assertThatThrownBy(() -> new SyncCommand(JUNE_1, MAY_1, PREGAO, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
