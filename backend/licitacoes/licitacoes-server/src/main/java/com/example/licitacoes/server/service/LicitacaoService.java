package com.example.licitacoes.server.service;

import com.example.licitacoes.api.model.Licitacao;
import com.example.licitacoes.server.mapper.LicitacaoMapper;
import com.example.licitacoes.server.repository.jpa.LicitacaoRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Single-record reads served from the system of record, which carries the raw payload the index
 * does not.
 */
@Service
public class LicitacaoService {

    private final LicitacaoRepository licitacaoRepository;

    public LicitacaoService(LicitacaoRepository licitacaoRepository) {
        this.licitacaoRepository = licitacaoRepository;
    }

    @Transactional(readOnly = true)
    public Licitacao getById(Long internalId) {
        return licitacaoRepository.findById(internalId)
                .map(LicitacaoMapper::toDto)
                .orElseThrow(() -> new LicitacaoNotFoundException(internalId));
    }
}
