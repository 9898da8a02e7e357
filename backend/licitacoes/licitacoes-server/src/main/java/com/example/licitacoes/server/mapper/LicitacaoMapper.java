package com.example.licitacoes.server.mapper;

import com.example.licitacoes.api.model.Licitacao;
import com.example.licitacoes.api.model.LicitacaoSummary;
import com.example.licitacoes.server.model.LicitacaoEntity;

/**
 * Mapper utility to convert between Licitacao DTOs and LicitacaoEntity.
 */
public class LicitacaoMapper {

    private LicitacaoMapper() {
        // Utility class
    }

    public static Licitacao toDto(LicitacaoEntity entity) {
        if (entity == null) {
            return null;
        }
        return new Licitacao(
                entity.getInternalId(),
                entity.getExternalId(),
                entity.getObjetoCompra(),
                entity.getInformacaoComplementar(),
                entity.getOrgao(),
                entity.getOrgaoCnpj(),
                entity.getModalidade(),
                entity.getCodigoModalidade(),
                entity.getUf(),
                entity.getMunicipio(),
                entity.getValorEstimado(),
                entity.getDataAberturaProposta(),
                entity.getDataEncerramentoProposta(),
                entity.getDataPublicacao(),
                entity.getSituacao(),
                entity.getAnoCompra(),
                entity.getSequencialCompra(),
                entity.getRawPayload(),
                entity.getSyncedAt()
        );
    }

    public static LicitacaoSummary toSummary(LicitacaoEntity entity) {
        if (entity == null) {
            return null;
        }
        return new LicitacaoSummary(
                entity.getInternalId(),
                entity.getExternalId(),
                entity.getObjetoCompra(),
                entity.getOrgao(),
                entity.getModalidade(),
                entity.getUf(),
                entity.getMunicipio(),
                entity.getValorEstimado(),
                entity.getDataAberturaProposta(),
                entity.getDataPublicacao(),
                entity.getSituacao()
        );
    }

    public static LicitacaoEntity toEntity(Licitacao dto) {
        if (dto == null) {
            return null;
        }
        LicitacaoEntity entity = new LicitacaoEntity();
        copyInto(entity, dto);
        if (dto.internalId() != null) {
            entity.setInternalId(dto.internalId());
        }
        return entity;
    }

    /**
     * Overwrites every source-owned field of {@code entity}. Identity, syncedAt and indexedAt are
     * left untouched.
     */
    public static void copyInto(LicitacaoEntity entity, Licitacao dto) {
        entity.setExternalId(dto.externalId());
        entity.setObjetoCompra(dto.objetoCompra());
        entity.setInformacaoComplementar(dto.informacaoComplementar());
        entity.setOrgao(dto.orgao());
        entity.setOrgaoCnpj(dto.orgaoCnpj());
        entity.setModalidade(dto.modalidade());
        entity.setCodigoModalidade(dto.codigoModalidade());
        entity.setUf(dto.uf());
        entity.setMunicipio(dto.municipio());
        entity.setValorEstimado(dto.valorEstimado());
        entity.setDataAberturaProposta(dto.dataAberturaProposta());
        entity.setDataEncerramentoProposta(dto.dataEncerramentoProposta());
        entity.setDataPublicacao(dto.dataPublicacao());
        entity.setSituacao(dto.situacao());
        entity.setAnoCompra(dto.anoCompra());
        entity.setSequencialCompra(dto.sequencialCompra());
        entity.setRawPayload(dto.rawPayload());
    }
}
