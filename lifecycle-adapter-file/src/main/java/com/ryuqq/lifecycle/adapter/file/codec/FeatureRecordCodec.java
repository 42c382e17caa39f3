package com.ryuqq.lifecycle.adapter.file.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.config.GateConfigProvider;
import com.ryuqq.lifecycle.core.exception.CorruptRecordException;
import com.ryuqq.lifecycle.core.exception.PersistenceException;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.track.TrackDispatcher;
import com.ryuqq.lifecycle.core.track.Tracks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * YAML codec for {@link FeatureRecord}.
 *
 * <p><strong>Format:</strong></p>
 * <ul>
 *   <li>snake_case keys, ISO-8601 instants</li>
 *   <li>enums by their lowercase wire names ({@code toString()})</li>
 *   <li>null fields omitted, unknown keys ignored on read</li>
 *   <li>{@code schema_version} always written; older trees are migrated by {@link SchemaMigrator} before binding</li>
 * </ul>
 *
 * <p>Track statuses of migrated records are re-derived from the migrated facts with the
 * product's {@link GateConfig}, so a legacy status never outlives the facts it claims.</p>
 *
 * <p>Instances are thread-safe once constructed.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class FeatureRecordCodec {

    private static final Logger log = LoggerFactory.getLogger(FeatureRecordCodec.class);

    private final YAMLMapper mapper;
    private final SchemaMigrator migrator;
    private final GateConfigProvider configs;

    public FeatureRecordCodec() {
        this(new SchemaMigrator());
    }

    public FeatureRecordCodec(SchemaMigrator migrator) {
        this(migrator, GateConfigProvider.fixed(GateConfig.defaults()));
    }

    public FeatureRecordCodec(SchemaMigrator migrator, GateConfigProvider configs) {
        if (migrator == null) {
            throw new IllegalArgumentException("migrator cannot be null");
        }
        if (configs == null) {
            throw new IllegalArgumentException("configs cannot be null");
        }
        this.migrator = migrator;
        this.configs = configs;
        this.mapper = createMapper();
    }

    /**
     * Mapper configured for the record file format.
     */
    static YAMLMapper createMapper() {
        return YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING)
            .enable(DeserializationFeature.READ_ENUMS_USING_TO_STRING)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();
    }

    /**
     * Serializes a record.
     *
     * @param record the record
     * @return YAML document
     * @throws PersistenceException if serialization fails
     */
    public String encode(FeatureRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize feature " + record.slug(), e);
        }
    }

    /**
     * Parses a record, migrating older schema versions in memory.
     *
     * @param source file name used in error messages
     * @param yaml YAML document
     * @return the record at the current schema version, with re-derived track statuses if it was migrated
     * @throws CorruptRecordException if the document is not a valid record
     * @throws com.ryuqq.lifecycle.core.exception.UnsupportedSchemaVersionException if the record is newer than this code
     */
    public FeatureRecord decode(String source, String yaml) {
        JsonNode tree;
        try {
            tree = mapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new CorruptRecordException(source, "Unparseable YAML: " + e.getOriginalMessage(), e);
        }
        if (!(tree instanceof ObjectNode root)) {
            throw new CorruptRecordException(source, "Record is not a YAML mapping", null);
        }

        ObjectNode current = migrator.migrate(root, source);
        FeatureRecord record;
        try {
            record = mapper.treeToValue(current, FeatureRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptRecordException(source, "Invalid record: " + rootMessage(e), e);
        }
        return current == root ? record : reconcileTracks(record);
    }

    private FeatureRecord reconcileTracks(FeatureRecord record) {
        Tracks tracks = record.tracks();
        Tracks reconciled = new TrackDispatcher(configs.forProduct(record.productId())).reconcile(tracks);
        if (reconciled == tracks) {
            return record;
        }
        log.info("Re-derived track statuses of migrated feature {}", record.slug());
        return record.withTracks(reconciled);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
