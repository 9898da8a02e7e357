package com.example.licitacoes.server.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application settings bound from {@code application.yml} under the {@code licitacoes.*} prefix.
 */
@Data
@ConfigurationProperties(prefix = "licitacoes")
public class LicitacoesProperties {

    private Pncp pncp = new Pncp();
    private Sync sync = new Sync();
    private Search search = new Search();
    private Index index = new Index();

    @Data
    public static class Pncp {
        private String baseUrl = "https://pncp.gov.br/api/consulta";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        /** Largest tamanhoPagina accepted by the portal. */
        private int maxPageSize = 50;
        private int defaultPageSize = 50;
        private String userAgent = "LicitacoesApp/1.0";
    }

    @Data
    public static class Sync {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofMinutes(1);
        private int indexMaxAttempts = 3;
        private int reindexBatchSize = 500;
        private Scheduler scheduler = new Scheduler();
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(30);
        private List<Integer> modalidades = new ArrayList<>(List.of(6, 8));
        /** First window for a modality that has no watermark yet. */
        private int initialLookbackDays = 30;
        private Duration shutdownTimeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Search {
        private int defaultPageSize = 10;
        private int maxPageSize = 100;
        /** Mirrors index.max_result_window. */
        private int maxResultWindow = 10_000;
    }

    @Data
    public static class Index {
        private boolean createOnStartup = true;
    }
}
