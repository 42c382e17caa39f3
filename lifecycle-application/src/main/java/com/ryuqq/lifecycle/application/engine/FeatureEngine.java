package com.ryuqq.lifecycle.application.engine;

import com.ryuqq.lifecycle.core.gate.DecisionAction;
import com.ryuqq.lifecycle.core.gate.DecisionResult;
import com.ryuqq.lifecycle.core.model.ArtifactType;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.statemachine.Phase;
import com.ryuqq.lifecycle.core.track.TrackCommand;
import com.ryuqq.lifecycle.core.track.TrackState;
import com.ryuqq.lifecycle.core.track.TrackType;

import java.util.List;
import java.util.Map;

/**
 * Feature 생명주기 엔진 (외부 명령 계층이 호출하는 연산 집합).
 *
 * <p>모든 연산은 동기식이며 저장소에 대해 load → 변경 → save 한 번을 수행합니다.
 * 같은 slug에 대한 동시 호출은 조율되지 않으며 마지막 save가 남습니다.</p>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>검증 오류: FeatureNotFound, InvalidPhaseTransition, InvalidTrackTransition,
 *       UnknownApprover, InvalidPayload, TrackPrecondition</li>
 *   <li>정책 결과: GateNotReady (예외), 중복 후보 ({@link StartOutcome.DuplicateCandidates})</li>
 *   <li>저장소 오류: Persistence, CorruptRecord, UnsupportedSchemaVersion</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface FeatureEngine {

    /**
     * Feature 시작 (start_feature).
     *
     * @param request 시작 요청
     * @return 생성된 레코드 또는 중복 후보
     * @throws com.ryuqq.lifecycle.core.exception.FeatureAlreadyExistsException slug가 이미 존재하는 경우
     */
    StartOutcome startFeature(StartFeatureRequest request);

    /**
     * 읽기 전용 스냅샷과 게이트 요약 (check_feature).
     */
    FeatureSnapshot checkFeature(String slug);

    /**
     * Track 명령 적용 (advance_track).
     *
     * @return 변경된 Track 상태
     */
    TrackState<?> advanceTrack(String slug, TrackType track, TrackCommand command);

    /**
     * action 이름과 payload로 Track 명령 적용 (advance_track).
     *
     * @param track Track 이름 (context, design, business_case, engineering)
     * @param action action 이름
     * @param payload action 인자
     * @param actor 실행자
     * @return 변경된 Track 상태
     * @throws com.ryuqq.lifecycle.core.exception.InvalidPayloadException 알 수 없는 Track/action 또는 잘못된 payload
     */
    TrackState<?> advanceTrack(String slug, String track, String action, Map<String, ?> payload, String actor);

    /**
     * 산출물 첨부 (attach_artifact). Figma와 wireframes는 Design Track에도 반영됩니다.
     *
     * @return 변경된 산출물 맵
     */
    Map<ArtifactType, String> attachArtifact(String slug, ArtifactType type, String ref, String actor);

    /**
     * Decision Gate 검증 (validate_feature).
     */
    DecisionResult validateFeature(String slug);

    /**
     * 지정한 Phase 기준 검증 (validate_feature with phase).
     */
    DecisionResult validateFeature(String slug, Phase phase);

    /**
     * Decision Gate 승인/반려 (decision_gate).
     *
     * @param force true이면 NOT_READY여도 승인 (결정 메타데이터에 기록됨, 반려에는 무시)
     * @return 갱신된 레코드
     * @throws com.ryuqq.lifecycle.core.exception.GateNotReadyException 강제하지 않은 승인이 NOT_READY인 경우
     */
    FeatureRecord decisionGate(String slug, DecisionAction action, String reason, String actor, boolean force);

    /**
     * 운영자 Phase 전이. DECISION_GATE와 OUTPUT_GENERATION은 {@link #decisionGate}로만 진입합니다.
     */
    FeatureRecord advancePhase(String slug, Phase target, Map<String, Object> metadata);

    /**
     * ARCHIVED로 전이하고 결정을 기록.
     */
    FeatureRecord archive(String slug, String reason, String actor);

    /**
     * DEFERRED로 전이하고 결정을 기록.
     */
    FeatureRecord defer(String slug, String reason, String actor);

    /**
     * 별칭 추가 (중복, 제목과 같은 별칭은 무시).
     */
    FeatureRecord addAlias(String slug, String alias);

    /**
     * 제품의 Feature 목록 (slug 순).
     */
    List<FeatureRecord> listFeatures(String productId);

    /**
     * OUTPUT_GENERATION에서 산출물 생성 후 COMPLETE로 전이.
     *
     * @param documents Track 원문 (이름 → 내용)
     * @return 생성된 산출물 경로
     */
    List<String> generateOutputs(String slug, Map<String, String> documents);
}
