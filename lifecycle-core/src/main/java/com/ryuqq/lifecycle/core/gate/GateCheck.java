package com.ryuqq.lifecycle.core.gate;

/**
 * 이름 있는 Gate 검사 한 건의 결과.
 *
 * @param name 검사 이름 (예: "eng_estimate_provided")
 * @param level 검사 수준
 * @param passed 통과 여부
 * @param evidence 판단 근거
 * @param message 실패 메시지 (통과 시 null)
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record GateCheck(
    String name,
    GateLevel level,
    boolean passed,
    String evidence,
    String message
) {

    public GateCheck {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        if (!passed && (message == null || message.isBlank())) {
            throw new IllegalArgumentException("message cannot be null or blank for a failed check: " + name);
        }
    }

    public static GateCheck pass(String name, GateLevel level, String evidence) {
        return new GateCheck(name, level, true, evidence, null);
    }

    public static GateCheck fail(String name, GateLevel level, String evidence, String message) {
        return new GateCheck(name, level, false, evidence, message);
    }

    /**
     * 검사 결과 생성.
     *
     * @param name 검사 이름
     * @param level 검사 수준
     * @param passed 통과 여부
     * @param evidence 판단 근거
     * @param failureMessage 실패 시 메시지
     * @return GateCheck
     */
    public static GateCheck of(String name, GateLevel level, boolean passed, String evidence, String failureMessage) {
        return passed ? pass(name, level, evidence) : fail(name, level, evidence, failureMessage);
    }

    /**
     * blocker 여부.
     *
     * @return 실패했고 수준이 BLOCKING/REQUIRED이면 true
     */
    public boolean isBlocker() {
        return !passed && level.blocksOnFailure();
    }
}
