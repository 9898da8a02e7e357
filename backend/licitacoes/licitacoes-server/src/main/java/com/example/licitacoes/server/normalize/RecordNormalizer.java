package com.example.licitacoes.server.normalize;

import com.example.licitacoes.api.model.Licitacao;
import com.example.licitacoes.server.client.RawRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/**
 * Maps a {@link RawRecord} to the canonical {@link Licitacao}. Pure: no I/O, no clock.
 */
@Component
public class RecordNormalizer {

    static final String MODALIDADE_DEFAULT = "Não especificada";
    private static final ZoneId BRASILIA = ZoneId.of("America/Sao_Paulo");
    private static final DateTimeFormatter PNCP_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    public Licitacao normalize(RawRecord raw) {
        if (raw == null) {
            throw new NormalizationException(null, "record", null, "record is null");
        }
        String externalId = externalId(raw);
        if (externalId == null) {
            throw new NormalizationException(null, "numeroControlePNCP", raw.numeroControlePNCP(),
                    "missing numeroControlePNCP and no cnpj/ano/sequencial to derive it");
        }
        String objeto = trimToNull(raw.objetoCompra());
        if (objeto == null) {
            throw new NormalizationException(externalId, "objetoCompra", raw.objetoCompra(), "objetoCompra is required");
        }

        String modalidade = trimToNull(raw.modalidadeNome());
        String uf = trimToNull(raw.ufSigla());

        return new Licitacao(
                null,
                externalId,
                objeto,
                trimToNull(raw.informacaoComplementar()),
                trimToNull(raw.orgaoRazaoSocial()),
                trimToNull(raw.orgaoCnpj()),
                modalidade != null ? modalidade : MODALIDADE_DEFAULT,
                parseInteger(externalId, "modalidadeId", raw.modalidadeId()),
                uf != null ? uf.toUpperCase(Locale.ROOT) : null,
                trimToNull(raw.municipioNome()),
                parseDecimal(externalId, "valorTotalEstimado", raw.valorTotalEstimado()),
                parseDateTime(externalId, "dataAberturaProposta", raw.dataAberturaProposta()),
                parseDateTime(externalId, "dataEncerramentoProposta", raw.dataEncerramentoProposta()),
                parseDateTime(externalId, "dataPublicacaoPncp", raw.dataPublicacaoPncp()),
                trimToNull(raw.situacaoCompraNome()),
                parseInteger(externalId, "anoCompra", raw.anoCompra()),
                parseInteger(externalId, "sequencialCompra", raw.sequencialCompra()),
                raw.rawJson(),
                null
        );
    }

    private static String externalId(RawRecord raw) {
        String numeroControle = trimToNull(raw.numeroControlePNCP());
        if (numeroControle != null) {
            return numeroControle;
        }
        String cnpj = trimToNull(raw.orgaoCnpj());
        String ano = trimToNull(raw.anoCompra());
        String sequencial = trimToNull(raw.sequencialCompra());
        if (cnpj == null || ano == null || sequencial == null) {
            return null;
        }
        return cnpj + "-" + ano + "-" + sequencial;
    }

    static BigDecimal parseDecimal(String externalId, String field, String value) {
        String text = trimToNull(value);
        if (text == null) {
            return null;
        }
        String normalized = text.contains(",")
                ? text.replace(".", "").replace(',', '.')
                : text;
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            throw new NormalizationException(externalId, field, value, field + " is not a decimal", e);
        }
    }

    static Integer parseInteger(String externalId, String field, String value) {
        String text = trimToNull(value);
        if (text == null) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            throw new NormalizationException(externalId, field, value, field + " is not an integer", e);
        }
    }

    /**
     * Accepts ISO local date-time, ISO date-time with offset (converted to Brasília time) and
     * plain ISO dates (start of day).
     */
    static LocalDateTime parseDateTime(String externalId, String field, String value) {
        String text = trimToNull(value);
        if (text == null) {
            return null;
        }
        try {
            TemporalAccessor parsed = PNCP_DATE_TIME.parseBest(text,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).atZoneSameInstant(BRASILIA).toLocalDateTime();
            }
            if (parsed instanceof LocalDate) {
                return ((LocalDate) parsed).atStartOfDay();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            throw new NormalizationException(externalId, field, value, field + " is not an ISO date", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
