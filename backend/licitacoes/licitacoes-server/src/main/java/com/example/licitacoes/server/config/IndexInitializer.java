package com.example.licitacoes.server.config;

import com.example.licitacoes.server.index.IndexSchemaConflictException;
import com.example.licitacoes.server.index.LicitacaoIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Creates the licitacoes index once the application is up. Startup fails when the live mapping
 * conflicts with ours or when the cluster cannot be reached, so no sync ever writes into an index
 * Elasticsearch created with a dynamic mapping.
 */
@Component
public class IndexInitializer {

    private static final Logger log = LoggerFactory.getLogger(IndexInitializer.class);
    private final LicitacaoIndexService indexService;
    private final boolean createOnStartup;

    public IndexInitializer(LicitacaoIndexService indexService, LicitacoesProperties properties) {
        this.indexService = indexService;
        this.createOnStartup = properties.getIndex().isCreateOnStartup();
    }

    @Order(0)
    @EventListener(ApplicationReadyEvent.class)
    public void createIndex() {
        if (!createOnStartup) {
            log.info("Index creation on startup disabled");
            return;
        }
        try {
            indexService.createIndex();
        } catch (IndexSchemaConflictException e) {
            log.error("Refusing to start: {}", e.getMessage());
            throw e;
        } catch (DataAccessException e) {
            log.error("Refusing to start, Elasticsearch unreachable: {}", e.getMessage());
            throw e;
        }
    }
}
