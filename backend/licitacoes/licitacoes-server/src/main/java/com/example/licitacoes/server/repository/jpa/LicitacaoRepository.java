package com.example.licitacoes.server.repository.jpa;

import com.example.licitacoes.server.model.LicitacaoEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LicitacaoRepository extends JpaRepository<LicitacaoEntity, Long> {

    Optional<LicitacaoEntity> findByExternalId(String externalId);

    List<LicitacaoEntity> findAllByExternalIdIn(Collection<String> externalIds);

    @Query("SELECT l FROM LicitacaoEntity l WHERE l.indexedAt IS NULL OR l.indexedAt < l.syncedAt ORDER BY l.internalId")
    List<LicitacaoEntity> findPendingIndex(Pageable pageable);

    @Query("SELECT COUNT(l) FROM LicitacaoEntity l WHERE l.indexedAt IS NULL OR l.indexedAt < l.syncedAt")
    long countPendingIndex();

    @Modifying
    @Query("UPDATE LicitacaoEntity l SET l.indexedAt = :indexedAt WHERE l.internalId IN :ids")
    int markIndexed(Collection<Long> ids, LocalDateTime indexedAt);
}
