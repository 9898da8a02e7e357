package com.example.licitacoes.server.service;

import com.example.licitacoes.api.dto.HealthStatus;
import com.example.licitacoes.server.index.IndexHealth;
import com.example.licitacoes.server.index.LicitacaoIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class HealthService {

    private static final Logger log = LoggerFactory.getLogger(HealthService.class);
    private final LicitacaoIndexService indexService;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public HealthService(LicitacaoIndexService indexService, JdbcTemplate jdbcTemplate, Clock clock) {
        this.indexService = indexService;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public HealthStatus check() {
        IndexHealth index = indexService.healthCheck();
        return new HealthStatus(index.reachable(), index.clusterStatus(), databaseReachable(), LocalDateTime.now(clock));
    }

    private boolean databaseReachable() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
