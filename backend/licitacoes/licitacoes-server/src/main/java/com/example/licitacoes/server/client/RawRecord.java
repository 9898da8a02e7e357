package com.example.licitacoes.server.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One element of a PNCP page, as received. Every field is optional and kept as text so the
 * normalizer decides what is valid; {@code rawJson} is the element exactly as PNCP sent it.
 *
 * @param source where the record came from, always {@code PNCP} for this client
 */
public record RawRecord(
        String source,
        String numeroControlePNCP,
        String objetoCompra,
        String informacaoComplementar,
        String orgaoRazaoSocial,
        String orgaoCnpj,
        String modalidadeId,
        String modalidadeNome,
        String ufSigla,
        String municipioNome,
        String valorTotalEstimado,
        String dataAberturaProposta,
        String dataEncerramentoProposta,
        String dataPublicacaoPncp,
        String situacaoCompraNome,
        String anoCompra,
        String sequencialCompra,
        String rawJson) {

    public static final String SOURCE_PNCP = "PNCP";

    public static RawRecord fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new RawRecord(SOURCE_PNCP, null, null, null, null, null, null, null, null, null,
                    null, null, null, null, null, null, null, node == null ? null : node.toString());
        }
        return new RawRecord(
                SOURCE_PNCP,
                text(node, "numeroControlePNCP"),
                text(node, "objetoCompra"),
                text(node, "informacaoComplementar"),
                text(node, "orgaoEntidade", "razaoSocial"),
                text(node, "orgaoEntidade", "cnpj"),
                text(node, "modalidadeId"),
                text(node, "modalidadeNome"),
                text(node, "unidadeOrgao", "ufSigla"),
                text(node, "unidadeOrgao", "municipioNome"),
                text(node, "valorTotalEstimado"),
                text(node, "dataAberturaProposta"),
                text(node, "dataEncerramentoProposta"),
                text(node, "dataPublicacaoPncp"),
                text(node, "situacaoCompraNome"),
                text(node, "anoCompra"),
                text(node, "sequencialCompra"),
                node.toString());
    }

    private static String text(JsonNode node, String... path) {
        JsonNode current = node;
        for (String segment : path) {
            current = current.get(segment);
            if (current == null || current.isNull()) {
                return null;
            }
        }
        if (current.isContainerNode()) {
            return current.toString();
        }
        return current.asText();
    }
}
