package com.ryuqq.lifecycle.adapter.file.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.lifecycle.core.exception.CorruptRecordException;
import com.ryuqq.lifecycle.core.exception.UnsupportedSchemaVersionException;
import com.ryuqq.lifecycle.core.model.ArtifactType;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Upgrades raw record trees to the current schema version before binding.
 *
 * <p>Migration works on the parsed YAML tree and never touches the file; the stored
 * form changes only when the migrated record is saved again.</p>
 *
 * <p><strong>Schema v1 → v2:</strong></p>
 * <ul>
 *   <li>{@code created} → {@code created_at}; top-level {@code created_by}, {@code brain_entity}
 *       and {@code master_sheet_row} move into the initialization entry metadata</li>
 *   <li>the {@code engine} block ({@code current_phase}, {@code phase_history}, {@code tracks})
 *       is lifted to the top level</li>
 *   <li>phase entries: {@code entered}/{@code completed} → {@code entered_at}/{@code exited_at},
 *       extra keys folded into {@code metadata}, missing exits closed at the next entry</li>
 *   <li>tracks: the shared {@code {status, current_version, file, artifacts, approvals}} shape
 *       becomes the per-track state object; the stored status is only a starting point, since
 *       {@link FeatureRecordCodec} re-derives every track status from the migrated facts</li>
 *   <li>decisions: {@code date} → {@code timestamp}, extra keys folded into {@code metadata}</li>
 *   <li>{@code aliases.known_aliases} → {@code aliases}</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    static final int LEGACY_VERSION = 1;
    static final String MIGRATED_BLOCK_REASON = "Blocked before schema migration";

    private static final Set<String> PHASE_ENTRY_KEYS = Set.of("phase", "entered", "completed");
    private static final Set<String> DECISION_KEYS = Set.of("date", "phase", "decision", "rationale", "decided_by");

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    /**
     * Reads the schema version of a raw record tree.
     *
     * @param root the parsed record
     * @param source file name used in error messages
     * @return the stored version, 1 if absent
     * @throws CorruptRecordException if the version is not a positive integer
     */
    public int schemaVersion(ObjectNode root, String source) {
        JsonNode version = root.get("schema_version");
        if (version == null || version.isNull()) {
            return LEGACY_VERSION;
        }
        if (!version.canConvertToInt() || !version.isIntegralNumber() || version.intValue() <= 0) {
            throw new CorruptRecordException(source, "schema_version must be a positive integer: " + version, null);
        }
        return version.intValue();
    }

    /**
     * Brings a raw record tree up to {@link FeatureRecord#CURRENT_SCHEMA_VERSION}.
     *
     * @param root the parsed record (not modified)
     * @param source file name used in log and error messages
     * @return the input tree if already current, otherwise a migrated copy
     * @throws UnsupportedSchemaVersionException if the record is newer than this code
     * @throws CorruptRecordException if a legacy record lacks required data
     */
    public ObjectNode migrate(ObjectNode root, String source) {
        int version = schemaVersion(root, source);
        if (version > FeatureRecord.CURRENT_SCHEMA_VERSION) {
            throw new UnsupportedSchemaVersionException(source, version, FeatureRecord.CURRENT_SCHEMA_VERSION);
        }
        if (version == FeatureRecord.CURRENT_SCHEMA_VERSION) {
            return root;
        }

        ObjectNode migrated = migrateV1(root.deepCopy(), source);
        log.info("Migrated {} from schema v{} to v{}", source, version, FeatureRecord.CURRENT_SCHEMA_VERSION);
        return migrated;
    }

    private ObjectNode migrateV1(ObjectNode v1, String source) {
        ObjectNode engine = v1.has("engine") && v1.get("engine").isObject()
            ? (ObjectNode) v1.remove("engine")
            : nodes.objectNode();

        String createdAt = timestamp(requireText(v1, "created", source), "created", source);
        v1.remove("created");
        v1.put("created_at", createdAt);

        String currentPhase = engine.path("current_phase").asText("initialization");
        v1.put("current_phase", currentPhase);

        ArrayNode history = migratePhaseHistory(engine.path("phase_history"), currentPhase, createdAt, source);
        ObjectNode initialization = (ObjectNode) history.get(0).get("metadata");
        moveIntoMetadata(v1, "created_by", initialization);
        moveIntoMetadata(v1, "brain_entity", initialization);
        moveIntoMetadata(v1, "master_sheet_row", initialization);
        v1.set("phase_history", history);

        v1.set("tracks", migrateTracks(engine.path("tracks"), createdAt, source));
        v1.set("artifacts", migrateArtifacts(v1.path("artifacts"), source));
        v1.set("decisions", migrateDecisions(v1.path("decisions"), source));
        v1.set("aliases", migrateAliases(v1.path("aliases")));

        v1.remove("context_file");
        v1.put("schema_version", FeatureRecord.CURRENT_SCHEMA_VERSION);
        return v1;
    }

    // ========== Phase history ==========

    private ArrayNode migratePhaseHistory(JsonNode legacy, String currentPhase, String createdAt, String source) {
        List<ObjectNode> entries = new ArrayList<>();
        if (legacy.isArray()) {
            for (JsonNode item : legacy) {
                if (!item.isObject()) {
                    throw new CorruptRecordException(source, "phase_history entry is not a mapping: " + item, null);
                }
                ObjectNode entry = nodes.objectNode();
                entry.put("phase", requireText(item, "phase", source));
                entry.put("entered_at", timestamp(requireText(item, "entered", source), "entered", source));
                if (item.hasNonNull("completed")) {
                    entry.put("exited_at", timestamp(item.get("completed").asText(), "completed", source));
                }
                entry.set("metadata", extraFields((ObjectNode) item, PHASE_ENTRY_KEYS, "metadata"));
                entries.add(entry);
            }
        }
        if (entries.isEmpty()) {
            ObjectNode entry = nodes.objectNode();
            entry.put("phase", currentPhase);
            entry.put("entered_at", createdAt);
            entry.set("metadata", nodes.objectNode());
            entries.add(entry);
        }

        // close earlier entries that were left open at the next entry's start
        for (int i = 0; i < entries.size() - 1; i++) {
            ObjectNode entry = entries.get(i);
            if (!entry.hasNonNull("exited_at")) {
                entry.put("exited_at", entries.get(i + 1).get("entered_at").asText());
            }
        }

        ArrayNode history = nodes.arrayNode();
        entries.forEach(history::add);
        return history;
    }

    // ========== Tracks ==========

    private ObjectNode migrateTracks(JsonNode legacy, String createdAt, String source) {
        ObjectNode tracks = nodes.objectNode();
        tracks.set("context", migrateContext(legacy.path("context")));
        tracks.set("design", migrateDesign(legacy.path("design")));
        tracks.set("business_case", migrateBusinessCase(legacy.path("business_case"), createdAt, source));
        tracks.set("engineering", migrateEngineering(legacy.path("engineering")));
        return tracks;
    }

    private ObjectNode migrateContext(JsonNode legacy) {
        String status = legacyStatus(legacy, Map.of(
            "pending_input", "in_progress",
            "pending_approval", "pending_challenge"));
        ObjectNode state = baseState(status);
        int version = legacy.path("current_version").asInt(0);
        state.put("version", Math.max(0, Math.min(3, version)));
        putIfText(state, "document_ref", legacy.path("file"));
        state.put("challenge_iterations", 0);
        state.set("sections", nodes.arrayNode());
        return state;
    }

    private ObjectNode migrateDesign(JsonNode legacy) {
        String status = legacyStatus(legacy, Map.of(
            "pending_input", "in_progress",
            "pending_approval", "in_progress"));
        ObjectNode state = baseState(status);
        state.put("version", legacy.path("current_version").asInt(0));
        JsonNode artifacts = legacy.path("artifacts");
        putIfText(state, "spec_ref", legacy.path("file"));
        putIfText(state, "figma_ref", artifacts.path("figma"));
        putIfText(state, "wireframes_ref", artifacts.path("wireframes"));
        return state;
    }

    private ObjectNode migrateBusinessCase(JsonNode legacy, String createdAt, String source) {
        String status = legacyStatus(legacy, Map.of(
            "pending_input", "in_progress",
            "complete", "approved"));
        ObjectNode state = baseState(status);
        state.put("version", legacy.path("current_version").asInt(0));
        state.put("submitted", "pending_approval".equals(status) || "approved".equals(status));
        state.put("round", 1);

        ArrayNode approvals = nodes.arrayNode();
        for (JsonNode item : legacy.path("approvals")) {
            String approver = item.path("approver").asText("");
            if (approver.isBlank()) {
                continue;
            }
            ObjectNode approval = nodes.objectNode();
            approval.put("approver", approver);
            approval.put("approved", item.path("approved").asBoolean(false));
            putIfText(approval, "comment", item.path("comment"));
            approval.put("round", 1);
            approval.put("recorded_at", item.hasNonNull("date")
                ? timestamp(item.get("date").asText(), "date", source) : createdAt);
            approvals.add(approval);
        }
        state.set("approvals", approvals);
        return state;
    }

    private ObjectNode migrateEngineering(JsonNode legacy) {
        String status = legacyStatus(legacy, Map.of(
            "pending_input", "in_progress",
            "pending_approval", "estimation_pending"));
        ObjectNode state = baseState(status);
        state.put("version", legacy.path("current_version").asInt(0));
        state.put("estimate_requested", "estimation_pending".equals(status));
        return state;
    }

    private String legacyStatus(JsonNode legacy, Map<String, String> renames) {
        String status = legacy.path("status").asText("not_started");
        return renames.getOrDefault(status, status);
    }

    private ObjectNode baseState(String status) {
        ObjectNode state = nodes.objectNode();
        state.put("status", status);
        state.set("metadata", nodes.objectNode());
        state.put("started", !"not_started".equals(status));
        if ("blocked".equals(status)) {
            state.put("blocked_reason", MIGRATED_BLOCK_REASON);
        }
        return state;
    }

    // ========== Artifacts, decisions, aliases ==========

    private ObjectNode migrateArtifacts(JsonNode legacy, String source) {
        ObjectNode artifacts = nodes.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = legacy.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNull() || field.getValue().asText().isBlank()) {
                continue;
            }
            try {
                ArtifactType type = ArtifactType.fromWireName(field.getKey());
                artifacts.put(type.toString(), field.getValue().asText().trim());
            } catch (IllegalArgumentException e) {
                log.warn("Dropping unknown artifact '{}' while migrating {}", field.getKey(), source);
            }
        }
        return artifacts;
    }

    private ArrayNode migrateDecisions(JsonNode legacy, String source) {
        ArrayNode decisions = nodes.arrayNode();
        for (JsonNode item : legacy) {
            if (!item.isObject()) {
                throw new CorruptRecordException(source, "decision is not a mapping: " + item, null);
            }
            ObjectNode decision = nodes.objectNode();
            decision.put("phase", requireText(item, "phase", source));
            decision.put("decision", requireText(item, "decision", source));
            decision.put("rationale", item.path("rationale").asText(""));
            decision.put("decided_by", requireText(item, "decided_by", source));
            decision.put("timestamp", timestamp(requireText(item, "date", source), "date", source));
            decision.set("metadata", extraFields((ObjectNode) item, DECISION_KEYS, "metadata"));
            decisions.add(decision);
        }
        return decisions;
    }

    private ArrayNode migrateAliases(JsonNode legacy) {
        ArrayNode aliases = nodes.arrayNode();
        JsonNode known = legacy.isArray() ? legacy : legacy.path("known_aliases");
        for (JsonNode alias : known) {
            if (alias.isTextual() && !alias.asText().isBlank()) {
                aliases.add(alias.asText());
            }
        }
        return aliases;
    }

    // ========== Helpers ==========

    private ObjectNode extraFields(ObjectNode item, Set<String> knownKeys, String nestedKey) {
        ObjectNode metadata = nodes.objectNode();
        if (item.get(nestedKey) instanceof ObjectNode nested) {
            metadata.setAll(nested);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!knownKeys.contains(field.getKey()) && !nestedKey.equals(field.getKey())) {
                metadata.set(field.getKey(), field.getValue());
            }
        }
        return metadata;
    }

    private void moveIntoMetadata(ObjectNode root, String key, ObjectNode metadata) {
        JsonNode value = root.remove(key);
        if (value != null && !value.isNull() && !metadata.has(key)) {
            metadata.set(key, value);
        }
    }

    private void putIfText(ObjectNode target, String key, JsonNode value) {
        if (value != null && value.isTextual() && !value.asText().isBlank()) {
            target.put(key, value.asText());
        }
    }

    private String requireText(JsonNode node, String key, String source) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new CorruptRecordException(source, "Legacy record is missing '" + key + "'", null);
        }
        return value.asText();
    }

    /**
     * Normalises a legacy timestamp to ISO-8601 UTC. Values without an offset are read as UTC.
     */
    static String timestamp(String value, String field, String source) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value.trim(),
                OffsetDateTime::from, LocalDateTime::from);
            Instant instant = parsed instanceof OffsetDateTime offset
                ? offset.toInstant()
                : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            return instant.toString();
        } catch (DateTimeException e) {
            throw new CorruptRecordException(source, "Unreadable timestamp in '" + field + "': " + value, e);
        }
    }
}
