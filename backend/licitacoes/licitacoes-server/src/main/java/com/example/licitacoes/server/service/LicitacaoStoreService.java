package com.example.licitacoes.server.service;

import com.example.licitacoes.api.model.Licitacao;
import com.example.licitacoes.server.mapper.LicitacaoMapper;
import com.example.licitacoes.server.model.LicitacaoEntity;
import com.example.licitacoes.server.repository.jpa.LicitacaoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * System-of-record writes. Rows are keyed by {@code externalId}; a stored row keeps its
 * internalId for life.
 */
@Service
public class LicitacaoStoreService {

    private static final Logger log = LoggerFactory.getLogger(LicitacaoStoreService.class);
    private final LicitacaoRepository licitacaoRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public LicitacaoStoreService(LicitacaoRepository licitacaoRepository,
                                 TransactionTemplate transactionTemplate,
                                 Clock clock) {
        this.licitacaoRepository = licitacaoRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Inserts or updates every record in one transaction and returns the stored rows, one per
     * distinct externalId. When the batch repeats an externalId the last occurrence wins.
     */
    public List<LicitacaoEntity> upsertBatch(List<Licitacao> licitacoes) {
        if (licitacoes.isEmpty()) {
            return List.of();
        }
        Map<String, Licitacao> byExternalId = new LinkedHashMap<>();
        for (Licitacao licitacao : licitacoes) {
            byExternalId.remove(licitacao.externalId());
            byExternalId.put(licitacao.externalId(), licitacao);
        }
        if (byExternalId.size() < licitacoes.size()) {
            log.debug("Collapsed {} records to {} distinct externalIds", licitacoes.size(), byExternalId.size());
        }

        try {
            return transactionTemplate.execute(status -> upsertInTransaction(byExternalId));
        } catch (DataIntegrityViolationException e) {
            // a concurrent writer inserted one of the keys first; the second pass sees its row
            log.warn("Unique key conflict while upserting {} records, retrying as update: {}",
                    byExternalId.size(), e.getMostSpecificCause().getMessage());
            return transactionTemplate.execute(status -> upsertInTransaction(byExternalId));
        }
    }

    private List<LicitacaoEntity> upsertInTransaction(Map<String, Licitacao> byExternalId) {
        Map<String, LicitacaoEntity> existing = licitacaoRepository.findAllByExternalIdIn(byExternalId.keySet())
                .stream()
                .collect(Collectors.toMap(LicitacaoEntity::getExternalId, Function.identity()));

        LocalDateTime now = LocalDateTime.now(clock);
        List<LicitacaoEntity> toSave = new ArrayList<>(byExternalId.size());
        int updated = 0;
        for (Licitacao licitacao : byExternalId.values()) {
            LicitacaoEntity entity = existing.get(licitacao.externalId());
            if (entity == null) {
                entity = LicitacaoMapper.toEntity(licitacao);
                entity.setInternalId(null);
            } else {
                LicitacaoMapper.copyInto(entity, licitacao);
                updated++;
            }
            entity.setSyncedAt(now);
            toSave.add(entity);
        }

        List<LicitacaoEntity> saved = licitacaoRepository.saveAllAndFlush(toSave);
        log.info("Upserted {} licitacoes ({} inserted, {} updated)", saved.size(), saved.size() - updated, updated);
        return saved;
    }

    /** Records that the index copy of these rows is current. */
    public void markIndexed(Collection<Long> internalIds) {
        if (internalIds.isEmpty()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Integer count = transactionTemplate.execute(status -> licitacaoRepository.markIndexed(internalIds, now));
        log.debug("Marked {} rows as indexed", count);
    }

    /** Rows whose index copy is missing or older than the stored row, oldest id first. */
    public List<LicitacaoEntity> findPendingIndex(int limit) {
        return licitacaoRepository.findPendingIndex(PageRequest.of(0, limit));
    }

    public long countPendingIndex() {
        return licitacaoRepository.countPendingIndex();
    }

    public Optional<LicitacaoEntity> findById(Long internalId) {
        return licitacaoRepository.findById(internalId);
    }
}
