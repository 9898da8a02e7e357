package com.example.licitacoes.server.service;

import com.example.licitacoes.server.model.SyncWatermarkEntity;
import com.example.licitacoes.server.repository.jpa.SyncWatermarkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Service
public class SyncWatermarkService {

    private static final Logger log = LoggerFactory.getLogger(SyncWatermarkService.class);
    private final SyncWatermarkRepository repository;
    private final Clock clock;

    public SyncWatermarkService(SyncWatermarkRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public SyncWatermark current(int codigoModalidade) {
        return repository.findById(codigoModalidade)
                .map(SyncWatermarkService::toSnapshot)
                .orElseGet(() -> SyncWatermark.none(codigoModalidade));
    }

    /** Records that every page before {@code nextPage} of the window is stored and indexed. */
    @Transactional
    public void checkpoint(int codigoModalidade, LocalDate windowStart, LocalDate windowEnd, int nextPage) {
        SyncWatermarkEntity entity = load(codigoModalidade);
        entity.setCheckpointWindowStart(windowStart);
        entity.setCheckpointWindowEnd(windowEnd);
        entity.setCheckpointNextPage(nextPage);
        entity.setUpdatedAt(LocalDateTime.now(clock));
        repository.save(entity);
    }

    /**
     * Moves the watermark forward to {@code dataFinal} and clears the checkpoint. Never moves it
     * backwards.
     *
     * @return the watermark after the update
     */
    @Transactional
    public LocalDate advance(int codigoModalidade, LocalDate dataFinal) {
        SyncWatermarkEntity entity = load(codigoModalidade);
        LocalDate previous = entity.getWatermark();
        if (previous == null || dataFinal.isAfter(previous)) {
            entity.setWatermark(dataFinal);
            log.info("Watermark for modalidade {} advanced from {} to {}", codigoModalidade, previous, dataFinal);
        } else {
            log.debug("Watermark for modalidade {} stays at {} (run ended {})", codigoModalidade, previous, dataFinal);
        }
        clear(entity);
        repository.save(entity);
        return entity.getWatermark();
    }

    @Transactional
    public void clearCheckpoint(int codigoModalidade) {
        repository.findById(codigoModalidade).ifPresent(entity -> {
            clear(entity);
            repository.save(entity);
        });
    }

    private void clear(SyncWatermarkEntity entity) {
        entity.setCheckpointWindowStart(null);
        entity.setCheckpointWindowEnd(null);
        entity.setCheckpointNextPage(null);
        entity.setUpdatedAt(LocalDateTime.now(clock));
    }

    private SyncWatermarkEntity load(int codigoModalidade) {
        return repository.findById(codigoModalidade)
                .orElseGet(() -> new SyncWatermarkEntity(codigoModalidade));
    }

    private static SyncWatermark toSnapshot(SyncWatermarkEntity entity) {
        return new SyncWatermark(
                entity.getCodigoModalidade(),
                entity.getWatermark(),
                entity.getCheckpointWindowStart(),
                entity.getCheckpointWindowEnd(),
                entity.getCheckpointNextPage());
    }
}
