package com.example.licitacoes.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.time.Clock;

@Configuration
@EnableJpaRepositories(basePackages = "com.example.licitacoes.server.repository.jpa")
public class DatabaseConfig {

    /** Source of syncedAt / indexedAt timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
