package com.ryuqq.lifecycle.core.statemachine;

/**
 * Feature의 최상위 생명주기 Phase.
 *
 * <p><strong>전이 다이어그램:</strong></p>
 * <pre>
 * INITIALIZATION
 *    │
 *    ▼
 * SIGNAL_ANALYSIS
 *    │
 *    ▼
 * CONTEXT_DOC
 *    │
 *    ▼
 * PARALLEL_TRACKS ◄──────┐
 *    │                   │ (reject)
 *    ▼                   │
 * DECISION_GATE ─────────┘
 *    │
 *    ▼ (approve)
 * OUTPUT_GENERATION
 *    │
 *    ▼
 * COMPLETE
 *
 * 비종료 Phase → ARCHIVED / DEFERRED (운영자 조작)
 * </pre>
 *
 * <p>{@link #toString()}은 저장 포맷에 쓰이는 소문자 이름을 반환합니다 (예: "parallel_tracks").</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum Phase {

    /**
     * 생성 직후.
     */
    INITIALIZATION("initialization"),

    /**
     * 시그널(고객/데이터) 분석.
     */
    SIGNAL_ANALYSIS("signal_analysis"),

    /**
     * Context 문서 작성.
     */
    CONTEXT_DOC("context_doc"),

    /**
     * 네 개 Track 병렬 진행.
     */
    PARALLEL_TRACKS("parallel_tracks"),

    /**
     * Go/No-Go 판단.
     */
    DECISION_GATE("decision_gate"),

    /**
     * 산출물 생성.
     */
    OUTPUT_GENERATION("output_generation"),

    /**
     * 완료 (종료).
     */
    COMPLETE("complete"),

    /**
     * 보관 (종료).
     */
    ARCHIVED("archived"),

    /**
     * 보류 (종료).
     */
    DEFERRED("deferred");

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 종료 Phase인지 확인.
     *
     * <p>종료 Phase에서는 어떤 Phase로도 전이할 수 없으며, 이력은 그대로 보존됩니다.</p>
     *
     * @return COMPLETE, ARCHIVED, DEFERRED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == ARCHIVED || this == DEFERRED;
    }

    /**
     * 저장 포맷 이름으로 Phase 조회.
     *
     * @param value 소문자 이름 또는 상수 이름 (대소문자 무시)
     * @return Phase
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static Phase fromWireName(String value) {
        if (value != null) {
            for (Phase phase : values()) {
                if (phase.wireName.equalsIgnoreCase(value) || phase.name().equalsIgnoreCase(value)) {
                    return phase;
                }
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
