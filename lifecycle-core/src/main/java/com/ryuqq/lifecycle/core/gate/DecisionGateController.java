package com.ryuqq.lifecycle.core.gate;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.exception.GateNotReadyException;
import com.ryuqq.lifecycle.core.exception.InvalidPhaseTransitionException;
import com.ryuqq.lifecycle.core.model.Decision;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.statemachine.Phase;
import com.ryuqq.lifecycle.core.statemachine.PhaseStateMachine;
import com.ryuqq.lifecycle.core.track.TrackType;
import com.ryuqq.lifecycle.core.track.engineering.Dependency;
import com.ryuqq.lifecycle.core.track.engineering.EngineeringTrackState;
import com.ryuqq.lifecycle.core.track.engineering.Risk;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decision Gate 컨트롤러.
 *
 * <p>네 Track의 Gate 결과와 두 교차 검사를 모아 GO/NO-GO를 판단하고,
 * 결정을 감사 기록에 남긴 뒤 Phase를 전이합니다.</p>
 *
 * <p><strong>승인 흐름:</strong></p>
 * <ul>
 *   <li>PARALLEL_TRACKS → DECISION_GATE → OUTPUT_GENERATION (한 번에 두 전이)</li>
 *   <li>이미 DECISION_GATE 이면 OUTPUT_GENERATION 으로만 전이</li>
 *   <li>force 승인은 우회한 blocker를 결정 메타데이터에 남김</li>
 * </ul>
 *
 * <p><strong>반려 흐름:</strong> DECISION_GATE → PARALLEL_TRACKS, 이미 PARALLEL_TRACKS 이면 Phase 유지.
 * Track 상태는 변경하지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class DecisionGateController {

    public static final String DECISION_PHASE = "decision_gate";
    public static final String OUTCOME_GO = "GO";
    public static final String OUTCOME_NO_GO = "NO_GO";

    private final QualityGateEvaluator evaluator;

    public DecisionGateController(GateConfig config) {
        this(new QualityGateEvaluator(config));
    }

    public DecisionGateController(QualityGateEvaluator evaluator) {
        if (evaluator == null) {
            throw new IllegalArgumentException("evaluator cannot be null");
        }
        this.evaluator = evaluator;
    }

    /**
     * Decision Gate 기준 전체 검증.
     *
     * @param record 대상 레코드
     * @return 검증 결과
     */
    public DecisionResult validate(FeatureRecord record) {
        return validate(record, Phase.DECISION_GATE);
    }

    /**
     * 지정 Phase 기준 검증.
     *
     * <ul>
     *   <li>INITIALIZATION, SIGNAL_ANALYSIS: 평가 대상 없음 (READY)</li>
     *   <li>CONTEXT_DOC: Context Track만</li>
     *   <li>그 외: 네 Track과 교차 검사</li>
     * </ul>
     *
     * @param record 대상 레코드
     * @param phase 기준 Phase
     * @return 검증 결과
     */
    public DecisionResult validate(FeatureRecord record, Phase phase) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        return switch (phase) {
            case INITIALIZATION, SIGNAL_ANALYSIS -> DecisionResult.aggregate(List.of(), List.of());
            case CONTEXT_DOC -> DecisionResult.aggregate(List.of(evaluator.evaluate(record, TrackType.CONTEXT)), List.of());
            default -> DecisionResult.aggregate(evaluator.evaluateAll(record), crossChecks(record.tracks().engineering()));
        };
    }

    private static List<GateCheck> crossChecks(EngineeringTrackState engineering) {
        List<Dependency> blocking = engineering.blockingDependencies();
        List<Risk> unmitigated = engineering.unmitigatedHighImpactRisks();
        return List.of(
            GateCheck.of("no_blocking_dependencies", GateLevel.BLOCKING, blocking.isEmpty(),
                "blocking_dependencies=" + blocking.size(),
                "Blocking dependencies: " + blocking.stream().map(Dependency::name).collect(Collectors.joining(", "))),
            GateCheck.of("no_unmitigated_high_risks", GateLevel.BLOCKING, unmitigated.isEmpty(),
                "unmitigated_high_risks=" + unmitigated.size(),
                "Unmitigated high-impact risks: " + QualityGateEvaluator.riskIds(unmitigated)));
    }

    /**
     * GO 결정.
     *
     * @param record 대상 레코드
     * @param reason 결정 내용
     * @param actor 결정자
     * @param force NOT_READY 여도 승인할지 여부
     * @param at 결정 시각
     * @return OUTPUT_GENERATION 으로 전이된 레코드
     * @throws GateNotReadyException force가 false이고 NOT_READY인 경우
     * @throws InvalidPhaseTransitionException PARALLEL_TRACKS/DECISION_GATE 가 아닌 경우
     */
    public FeatureRecord approve(FeatureRecord record, String reason, String actor, boolean force, Instant at) {
        requireDecisionInputs(record, reason, actor, at);
        Phase phase = record.currentPhase();
        if (phase != Phase.PARALLEL_TRACKS && phase != Phase.DECISION_GATE) {
            throw new InvalidPhaseTransitionException(phase, Phase.OUTPUT_GENERATION,
                "Decision gate approval requires phase parallel_tracks or decision_gate (current: " + phase + ")");
        }

        DecisionResult result = validate(record);
        if (!result.ready() && !force) {
            throw new GateNotReadyException(record.slug(), result.blockers());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("outcome", OUTCOME_GO);
        metadata.put("forced", force);
        metadata.put("gate_status", result.status().name());
        String rationale = "All quality gates passed";
        if (!result.ready()) {
            metadata.put("bypassed_blockers", new ArrayList<>(result.blockers()));
            rationale = "Gate validation bypassed with " + result.blockers().size() + " open blocker(s)";
        }

        FeatureRecord decided = record.appendDecision(
            new Decision(DECISION_PHASE, reason.trim(), rationale, actor, at, metadata));
        FeatureRecord atGate = PhaseStateMachine.advance(decided, Phase.DECISION_GATE,
            Map.of("outcome", OUTCOME_GO), at);
        return PhaseStateMachine.advance(atGate, Phase.OUTPUT_GENERATION,
            Map.of("approved_by", actor, "forced", force), at);
    }

    /**
     * NO-GO 결정.
     *
     * @param record 대상 레코드
     * @param reason 결정 내용
     * @param actor 결정자
     * @param at 결정 시각
     * @return PARALLEL_TRACKS 의 레코드
     * @throws InvalidPhaseTransitionException PARALLEL_TRACKS/DECISION_GATE 가 아닌 경우
     */
    public FeatureRecord reject(FeatureRecord record, String reason, String actor, Instant at) {
        requireDecisionInputs(record, reason, actor, at);
        Phase phase = record.currentPhase();
        if (phase != Phase.PARALLEL_TRACKS && phase != Phase.DECISION_GATE) {
            throw new InvalidPhaseTransitionException(phase, Phase.PARALLEL_TRACKS,
                "Decision gate rejection requires phase parallel_tracks or decision_gate (current: " + phase + ")");
        }

        DecisionResult result = validate(record);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("outcome", OUTCOME_NO_GO);
        metadata.put("gate_status", result.status().name());
        metadata.put("open_blockers", new ArrayList<>(result.blockers()));

        FeatureRecord decided = record.appendDecision(
            new Decision(DECISION_PHASE, reason.trim(), "Rejected at decision gate", actor, at, metadata));
        return PhaseStateMachine.advance(decided, Phase.PARALLEL_TRACKS, Map.of("outcome", OUTCOME_NO_GO), at);
    }

    private static void requireDecisionInputs(FeatureRecord record, String reason, String actor, Instant at) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor cannot be null or blank");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
    }

    public QualityGateEvaluator getEvaluator() {
        return evaluator;
    }
}
