package com.ryuqq.lifecycle.core.config;

import java.util.List;

/**
 * 제품별 품질 게이트 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>contextDraftThreshold: v1 최소 challenge 점수 (기본 0, 제한 없음)</li>
 *   <li>contextReviewThreshold: v2 최소 challenge 점수 (기본 60)</li>
 *   <li>contextApprovedThreshold: v3 최소 점수, COMPLETE 조건 (기본 85)</li>
 *   <li>contextMaxChallengeIterations: 버전당 challenge 최대 횟수 (기본 3)</li>
 *   <li>figmaRequired: Design COMPLETE에 Figma 필수 여부 (기본 true)</li>
 *   <li>requiredBcApprovers: Business Case 필수 승인자 (기본 없음, 누구든 1명 승인 시 충족)</li>
 *   <li>duplicateThreshold: 중복 탐지 Jaccard 임계값 (기본 0.6)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param contextDraftThreshold v1 임계값 (0~100)
 * @param contextReviewThreshold v2 임계값 (0~100)
 * @param contextApprovedThreshold v3 임계값 (0~100)
 * @param contextMaxChallengeIterations 버전당 challenge 최대 횟수 (1 이상)
 * @param figmaRequired Figma 필수 여부
 * @param requiredBcApprovers 필수 승인자 목록
 * @param duplicateThreshold 중복 임계값 (0 초과 1 이하)
 */
public record GateConfig(
    double contextDraftThreshold,
    double contextReviewThreshold,
    double contextApprovedThreshold,
    int contextMaxChallengeIterations,
    boolean figmaRequired,
    List<String> requiredBcApprovers,
    double duplicateThreshold
) {

    public static final double DEFAULT_DRAFT_THRESHOLD = 0.0;
    public static final double DEFAULT_REVIEW_THRESHOLD = 60.0;
    public static final double DEFAULT_APPROVED_THRESHOLD = 85.0;
    public static final int DEFAULT_MAX_CHALLENGE_ITERATIONS = 3;
    public static final double DEFAULT_DUPLICATE_THRESHOLD = 0.6;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GateConfig {
        requireScore(contextDraftThreshold, "contextDraftThreshold");
        requireScore(contextReviewThreshold, "contextReviewThreshold");
        requireScore(contextApprovedThreshold, "contextApprovedThreshold");
        if (contextDraftThreshold > contextReviewThreshold || contextReviewThreshold > contextApprovedThreshold) {
            throw new IllegalArgumentException(String.format(
                "Context thresholds must be non-decreasing (draft: %s, review: %s, approved: %s)",
                contextDraftThreshold, contextReviewThreshold, contextApprovedThreshold));
        }
        if (contextMaxChallengeIterations <= 0) {
            throw new IllegalArgumentException(
                "contextMaxChallengeIterations must be positive (current: " + contextMaxChallengeIterations + ")");
        }
        if (duplicateThreshold <= 0.0 || duplicateThreshold > 1.0) {
            throw new IllegalArgumentException(
                "duplicateThreshold must be in (0, 1] (current: " + duplicateThreshold + ")");
        }
        requiredBcApprovers = requiredBcApprovers == null ? List.of() : List.copyOf(requiredBcApprovers);
        for (String approver : requiredBcApprovers) {
            if (approver.isBlank()) {
                throw new IllegalArgumentException("requiredBcApprovers cannot contain blank names");
            }
        }
    }

    /**
     * 기본 설정.
     *
     * @return 기본값 GateConfig
     */
    public static GateConfig defaults() {
        return new GateConfig(
            DEFAULT_DRAFT_THRESHOLD,
            DEFAULT_REVIEW_THRESHOLD,
            DEFAULT_APPROVED_THRESHOLD,
            DEFAULT_MAX_CHALLENGE_ITERATIONS,
            true,
            List.of(),
            DEFAULT_DUPLICATE_THRESHOLD
        );
    }

    /**
     * Context 문서 버전별 최소 challenge 점수.
     *
     * @param version 문서 버전 (1~3)
     * @return 임계값
     * @throws IllegalArgumentException 버전이 1~3이 아닌 경우
     */
    public double thresholdForVersion(int version) {
        return switch (version) {
            case 1 -> contextDraftThreshold;
            case 2 -> contextReviewThreshold;
            case 3 -> contextApprovedThreshold;
            default -> throw new IllegalArgumentException("Context version must be between 1 and 3 (current: " + version + ")");
        };
    }

    /**
     * 버전별 임계값의 설정 키 이름 (보고서 evidence용).
     *
     * @param version 문서 버전 (1~3)
     * @return 설정 키
     */
    public static String thresholdKeyForVersion(int version) {
        return switch (version) {
            case 1 -> "context_draft_threshold";
            case 2 -> "context_review_threshold";
            case 3 -> "context_approved_threshold";
            default -> throw new IllegalArgumentException("Context version must be between 1 and 3 (current: " + version + ")");
        };
    }

    public GateConfig withContextDraftThreshold(double value) {
        return new GateConfig(value, contextReviewThreshold, contextApprovedThreshold,
            contextMaxChallengeIterations, figmaRequired, requiredBcApprovers, duplicateThreshold);
    }

    public GateConfig withContextReviewThreshold(double value) {
        return new GateConfig(contextDraftThreshold, value, contextApprovedThreshold,
            contextMaxChallengeIterations, figmaRequired, requiredBcApprovers, duplicateThreshold);
    }

    public GateConfig withContextApprovedThreshold(double value) {
        return new GateConfig(contextDraftThreshold, contextReviewThreshold, value,
            contextMaxChallengeIterations, figmaRequired, requiredBcApprovers, duplicateThreshold);
    }

    public GateConfig withContextMaxChallengeIterations(int value) {
        return new GateConfig(contextDraftThreshold, contextReviewThreshold, contextApprovedThreshold,
            value, figmaRequired, requiredBcApprovers, duplicateThreshold);
    }

    public GateConfig withFigmaRequired(boolean value) {
        return new GateConfig(contextDraftThreshold, contextReviewThreshold, contextApprovedThreshold,
            contextMaxChallengeIterations, value, requiredBcApprovers, duplicateThreshold);
    }

    public GateConfig withRequiredBcApprovers(List<String> value) {
        return new GateConfig(contextDraftThreshold, contextReviewThreshold, contextApprovedThreshold,
            contextMaxChallengeIterations, figmaRequired, value, duplicateThreshold);
    }

    public GateConfig withDuplicateThreshold(double value) {
        return new GateConfig(contextDraftThreshold, contextReviewThreshold, contextApprovedThreshold,
            contextMaxChallengeIterations, figmaRequired, requiredBcApprovers, value);
    }

    private static void requireScore(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(name + " must be between 0 and 100 (current: " + value + ")");
        }
    }
}
