package com.example.licitacoes.server.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Per-modality sync progress. {@code watermark} is the last dataFinal fully synchronised; the
 * checkpoint columns record the next page of an unfinished window.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "sync_watermarks")
public class SyncWatermarkEntity {

    @Id
    private Integer codigoModalidade;

    private LocalDate watermark;

    private LocalDate checkpointWindowStart;

    private LocalDate checkpointWindowEnd;

    private Integer checkpointNextPage;

    private LocalDateTime updatedAt;

    public SyncWatermarkEntity(Integer codigoModalidade) {
        this.codigoModalidade = codigoModalidade;
    }
}
