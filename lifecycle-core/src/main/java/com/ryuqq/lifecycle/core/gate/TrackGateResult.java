package com.ryuqq.lifecycle.core.gate;

import com.ryuqq.lifecycle.core.track.TrackType;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 Track의 Gate 평가 결과.
 *
 * <p>BLOCKING/REQUIRED 검사가 모두 통과하면 PASS, 아니면 INCOMPLETE 입니다.</p>
 *
 * @param track 대상 Track
 * @param status 결과
 * @param checks 평가 순서대로의 검사 결과
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record TrackGateResult(TrackType track, GateStatus status, List<GateCheck> checks) {

    public TrackGateResult {
        if (track == null) {
            throw new IllegalArgumentException("track cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    /**
     * 검사 목록으로부터 결과 생성.
     *
     * @param track 대상 Track
     * @param checks 검사 결과
     * @return TrackGateResult
     */
    public static TrackGateResult of(TrackType track, List<GateCheck> checks) {
        boolean pass = checks.stream().noneMatch(GateCheck::isBlocker);
        return new TrackGateResult(track, pass ? GateStatus.PASS : GateStatus.INCOMPLETE, checks);
    }

    public boolean passed() {
        return status == GateStatus.PASS;
    }

    /**
     * 실패한 BLOCKING/REQUIRED 검사 메시지 ("[Track Label] message").
     *
     * @return blocker 목록 (검사 순서)
     */
    public List<String> blockers() {
        List<String> blockers = new ArrayList<>();
        for (GateCheck check : checks) {
            if (check.isBlocker()) {
                blockers.add("[" + track.getLabel() + "] " + check.message());
            }
        }
        return blockers;
    }

    /**
     * 실패한 ADVISORY 검사 메시지.
     *
     * @return 경고 목록
     */
    public List<String> warnings() {
        List<String> warnings = new ArrayList<>();
        for (GateCheck check : checks) {
            if (!check.passed() && !check.level().blocksOnFailure()) {
                warnings.add("[" + track.getLabel() + "] " + check.message());
            }
        }
        return warnings;
    }
}
