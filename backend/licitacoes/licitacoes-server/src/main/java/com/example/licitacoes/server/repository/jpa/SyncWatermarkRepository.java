package com.example.licitacoes.server.repository.jpa;

import com.example.licitacoes.server.model.SyncWatermarkEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncWatermarkRepository extends JpaRepository<SyncWatermarkEntity, Integer> {
}
