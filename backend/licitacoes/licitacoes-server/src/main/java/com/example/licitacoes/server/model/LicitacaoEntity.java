package com.example.licitacoes.server.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Transient;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;
import org.springframework.data.elasticsearch.annotations.InnerField;
import org.springframework.data.elasticsearch.annotations.MultiField;
import org.springframework.data.elasticsearch.annotations.Setting;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Licitação database entity - internal persistence model.
 * Used for both JPA (PostgreSQL) and Elasticsearch persistence; the index document id is the
 * database identity.
 * <p>
 * {@code rawPayload} and {@code indexedAt} live only in the database.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "licitacoes", uniqueConstraints = @UniqueConstraint(columnNames = "external_id"))
@Document(indexName = LicitacaoEntity.INDEX_NAME, createIndex = false)
@Setting(settingPath = "elasticsearch/licitacoes-settings.json")
public class LicitacaoEntity {

    public static final String INDEX_NAME = "licitacoes";
    public static final String TEXT_ANALYZER = "licitacao_pt";

    @Id
    @org.springframework.data.annotation.Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long internalId;

    @Column(nullable = false, length = 100)
    @Field(type = FieldType.Keyword)
    private String externalId;

    @Column(columnDefinition = "text")
    @MultiField(
            mainField = @Field(type = FieldType.Text, analyzer = TEXT_ANALYZER),
            otherFields = @InnerField(suffix = "keyword", type = FieldType.Keyword, ignoreAbove = 256))
    private String objetoCompra;

    @Column(columnDefinition = "text")
    @Field(type = FieldType.Text, analyzer = TEXT_ANALYZER)
    private String informacaoComplementar;

    @MultiField(
            mainField = @Field(type = FieldType.Text, analyzer = TEXT_ANALYZER),
            otherFields = @InnerField(suffix = "keyword", type = FieldType.Keyword, ignoreAbove = 256))
    private String orgao;

    @Column(length = 20)
    @Field(type = FieldType.Keyword)
    private String orgaoCnpj;

    @Column(length = 100)
    @Field(type = FieldType.Keyword)
    private String modalidade;

    @Field(type = FieldType.Integer)
    private Integer codigoModalidade;

    @Column(length = 2)
    @Field(type = FieldType.Keyword)
    private String uf;

    @Column(length = 100)
    @MultiField(
            mainField = @Field(type = FieldType.Text, analyzer = TEXT_ANALYZER),
            otherFields = @InnerField(suffix = "keyword", type = FieldType.Keyword, ignoreAbove = 256))
    private String municipio;

    @Column(precision = 19, scale = 4)
    @Field(type = FieldType.Double)
    private BigDecimal valorEstimado;

    @Field(type = FieldType.Date, format = {}, pattern = "uuuu-MM-dd'T'HH:mm:ss")
    private LocalDateTime dataAberturaProposta;

    @Field(type = FieldType.Date, format = {}, pattern = "uuuu-MM-dd'T'HH:mm:ss")
    private LocalDateTime dataEncerramentoProposta;

    @Field(type = FieldType.Date, format = {}, pattern = "uuuu-MM-dd'T'HH:mm:ss")
    private LocalDateTime dataPublicacao;

    @Column(length = 50)
    @Field(type = FieldType.Keyword)
    private String situacao;

    @Field(type = FieldType.Integer)
    private Integer anoCompra;

    @Field(type = FieldType.Integer)
    private Integer sequencialCompra;

    @Transient
    @Column(columnDefinition = "text")
    private String rawPayload;

    @Column(nullable = false)
    @Field(type = FieldType.Date, format = {}, pattern = "uuuu-MM-dd'T'HH:mm:ss")
    private LocalDateTime syncedAt;

    @Transient
    private LocalDateTime indexedAt;
}
