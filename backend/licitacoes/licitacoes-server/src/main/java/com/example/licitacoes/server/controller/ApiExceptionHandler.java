package com.example.licitacoes.server.controller;

import com.example.licitacoes.server.search.SearchUnavailableException;
import com.example.licitacoes.server.service.LicitacaoNotFoundException;
import com.example.licitacoes.server.sync.SyncInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to RFC 7807 responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail badRequest(IllegalArgumentException e) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", e.getMessage());
    }

    @ExceptionHandler(LicitacaoNotFoundException.class)
    public ProblemDetail notFound(LicitacaoNotFoundException e) {
        return problem(HttpStatus.NOT_FOUND, "Not found", e.getMessage());
    }

    @ExceptionHandler(SyncInProgressException.class)
    public ProblemDetail syncInProgress(SyncInProgressException e) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Sync in progress", e.getMessage());
        problem.setProperty("codigoModalidadeContratacao", e.getCodigoModalidade());
        return problem;
    }

    @ExceptionHandler(SearchUnavailableException.class)
    public ProblemDetail searchUnavailable(SearchUnavailableException e) {
        log.warn("Answering 503: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Search unavailable", e.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
