package com.example.licitacoes.server.controller;

import com.example.licitacoes.api.dto.HealthStatus;
import com.example.licitacoes.server.service.HealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health", description = "Reachability of Elasticsearch and PostgreSQL")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @Operation(summary = "Health of the index and the database", description = "503 when either is unreachable.")
    @GetMapping(value = "/api/v1/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<HealthStatus> health() {
        HealthStatus status = healthService.check();
        HttpStatus httpStatus = status.elasticsearchReachable() && status.databaseReachable()
                ? HttpStatus.OK
                : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(status);
    }
}
