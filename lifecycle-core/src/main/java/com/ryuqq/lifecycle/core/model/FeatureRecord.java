package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.statemachine.Phase;
import com.ryuqq.lifecycle.core.track.Tracks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 하나의 Feature 생명주기 전체 상태 (영속 엔티티).
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>phaseHistory는 비어 있지 않으며 마지막 항목의 Phase가 currentPhase</li>
 *   <li>마지막 항목만 열려 있을 수 있고, 각 항목의 enteredAt ≥ 직전 항목의 exitedAt</li>
 *   <li>phaseHistory, decisions는 추가만 가능 (기존 항목 수정/삭제 없음)</li>
 *   <li>aliases는 늘어나기만 함</li>
 * </ul>
 *
 * <p>모든 변경 메서드는 새 인스턴스를 반환합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param schemaVersion 레코드 스키마 버전
 * @param slug Feature 식별자
 * @param title 제목
 * @param productId 제품 ID
 * @param organization 조직 (null 허용)
 * @param createdAt 생성 시각
 * @param currentPhase 현재 Phase
 * @param phaseHistory Phase 이력
 * @param tracks 네 Track 상태
 * @param artifacts 산출물 참조
 * @param decisions 결정 기록 (감사 추적)
 * @param aliases 중복 탐지용 별칭
 */
public record FeatureRecord(
    int schemaVersion,
    String slug,
    String title,
    String productId,
    String organization,
    Instant createdAt,
    Phase currentPhase,
    List<PhaseEntry> phaseHistory,
    Tracks tracks,
    Map<ArtifactType, String> artifacts,
    List<Decision> decisions,
    Set<String> aliases
) {

    /**
     * 현재 레코드 스키마 버전.
     */
    public static final int CURRENT_SCHEMA_VERSION = 2;

    public FeatureRecord {
        if (schemaVersion <= 0) {
            throw new IllegalArgumentException("schemaVersion must be positive (current: " + schemaVersion + ")");
        }
        FeatureSlug.of(slug);
        ProductId.of(productId);
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (currentPhase == null) {
            throw new IllegalArgumentException("currentPhase cannot be null");
        }
        if (tracks == null) {
            throw new IllegalArgumentException("tracks cannot be null");
        }
        phaseHistory = phaseHistory == null ? List.of() : List.copyOf(phaseHistory);
        validateHistory(phaseHistory, currentPhase);

        Map<ArtifactType, String> artifactCopy = new EnumMap<>(ArtifactType.class);
        if (artifacts != null) {
            artifactCopy.putAll(artifacts);
        }
        artifacts = Collections.unmodifiableMap(artifactCopy);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        aliases = aliases == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
    }

    private static void validateHistory(List<PhaseEntry> history, Phase currentPhase) {
        if (history.isEmpty()) {
            throw new IllegalArgumentException("phaseHistory cannot be empty");
        }
        PhaseEntry last = history.get(history.size() - 1);
        if (last.phase() != currentPhase) {
            throw new IllegalArgumentException(
                "Last phase history entry (" + last.phase() + ") does not match currentPhase (" + currentPhase + ")");
        }
        for (int i = 1; i < history.size(); i++) {
            PhaseEntry previous = history.get(i - 1);
            PhaseEntry entry = history.get(i);
            if (previous.exitedAt() == null) {
                throw new IllegalArgumentException("Phase history entry " + (i - 1) + " (" + previous.phase() + ") is not closed");
            }
            if (entry.enteredAt().isBefore(previous.exitedAt())) {
                throw new IllegalArgumentException(
                    "Phase history entry " + i + " (" + entry.phase() + ") enters before the previous entry exits");
            }
        }
    }

    /**
     * 새 Feature 레코드 생성 (INITIALIZATION, 모든 Track NOT_STARTED).
     *
     * @param slug Feature 식별자
     * @param title 제목
     * @param productId 제품 ID
     * @param organization 조직 (null 허용)
     * @param createdAt 생성 시각
     * @param initialMetadata INITIALIZATION 항목 메타데이터 (null 허용)
     * @return 새 레코드
     */
    public static FeatureRecord create(FeatureSlug slug, String title, ProductId productId, String organization,
                                       Instant createdAt, Map<String, Object> initialMetadata) {
        if (slug == null) {
            throw new IllegalArgumentException("slug cannot be null");
        }
        if (productId == null) {
            throw new IllegalArgumentException("productId cannot be null");
        }
        return new FeatureRecord(
            CURRENT_SCHEMA_VERSION,
            slug.getValue(),
            title == null ? null : title.trim(),
            productId.getValue(),
            organization,
            createdAt,
            Phase.INITIALIZATION,
            List.of(PhaseEntry.open(Phase.INITIALIZATION, createdAt, initialMetadata)),
            Tracks.initial(),
            Map.of(),
            List.of(),
            Set.of());
    }

    /**
     * 현재 Phase의 이력 항목.
     *
     * @return 마지막 이력 항목
     */
    public PhaseEntry currentEntry() {
        return phaseHistory.get(phaseHistory.size() - 1);
    }

    /**
     * Phase와 이력 교체. {@link com.ryuqq.lifecycle.core.statemachine.PhaseStateMachine}만 사용합니다.
     */
    public FeatureRecord withPhase(Phase phase, List<PhaseEntry> history) {
        if (history == null || history.size() < phaseHistory.size()) {
            throw new IllegalArgumentException("phase history can only be appended");
        }
        return new FeatureRecord(schemaVersion, slug, title, productId, organization, createdAt,
            phase, history, tracks, artifacts, decisions, aliases);
    }

    public FeatureRecord withTracks(Tracks newTracks) {
        return new FeatureRecord(schemaVersion, slug, title, productId, organization, createdAt,
            currentPhase, phaseHistory, newTracks, artifacts, decisions, aliases);
    }

    /**
     * 산출물 추가 또는 교체.
     *
     * @param type 산출물 종류
     * @param ref 참조 문자열
     * @return 갱신된 레코드
     */
    public FeatureRecord withArtifact(ArtifactType type, String ref) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("ref cannot be null or blank");
        }
        Map<ArtifactType, String> copy = new EnumMap<>(ArtifactType.class);
        copy.putAll(artifacts);
        copy.put(type, ref.trim());
        return new FeatureRecord(schemaVersion, slug, title, productId, organization, createdAt,
            currentPhase, phaseHistory, tracks, copy, decisions, aliases);
    }

    public FeatureRecord appendDecision(Decision decision) {
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
        List<Decision> copy = new ArrayList<>(decisions);
        copy.add(decision);
        return new FeatureRecord(schemaVersion, slug, title, productId, organization, createdAt,
            currentPhase, phaseHistory, tracks, artifacts, copy, aliases);
    }

    /**
     * 별칭 추가. 제목과 같거나 이미 있는 별칭이면 입력 레코드 그대로 반환합니다.
     *
     * @param alias 별칭
     * @return 갱신된 레코드
     */
    public FeatureRecord withAlias(String alias) {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("alias cannot be null or blank");
        }
        String trimmed = alias.trim();
        if (trimmed.equals(title) || aliases.contains(trimmed)) {
            return this;
        }
        Set<String> copy = new LinkedHashSet<>(aliases);
        copy.add(trimmed);
        return new FeatureRecord(schemaVersion, slug, title, productId, organization, createdAt,
            currentPhase, phaseHistory, tracks, artifacts, decisions, copy);
    }
}
