package com.example.licitacoes.api.dto;

import java.time.LocalDateTime;

/** Reachability of the search index and the system of record. */
public record HealthStatus(
    boolean elasticsearchReachable,
    String clusterStatus,
    boolean databaseReachable,
    LocalDateTime timestamp) {}
