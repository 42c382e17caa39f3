package com.ryuqq.lifecycle.core.exception;

import java.util.List;

/**
 * Decision Gate 승인 시 검증 결과가 NOT_READY.
 *
 * <p>정책 결과이며 실패 로그 대상이 아닙니다. 호출자는 blocker를 해소하거나
 * force 승인을 선택합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class GateNotReadyException extends LifecycleException {

    private final String slug;
    private final List<String> blockers;

    public GateNotReadyException(String slug, List<String> blockers) {
        super(ErrorCategory.POLICY, "GATE_NOT_READY",
            "Decision gate not ready for " + slug + ": " + String.join("; ", blockers));
        this.slug = slug;
        this.blockers = List.copyOf(blockers);
    }

    public String getSlug() {
        return slug;
    }

    /**
     * 미충족 항목 (Context, Design, Business Case, Engineering, Decision Gate 순).
     *
     * @return 정렬된 blocker 목록
     */
    public List<String> getBlockers() {
        return blockers;
    }
}
