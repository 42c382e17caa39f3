package com.ryuqq.lifecycle.core.track;

import java.util.Map;

/**
 * Track 상태의 공통 뷰 (status, version, metadata).
 *
 * <p>status는 직접 설정되지 않고 항상 기록된 사실(fact)로부터 도출됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param <S> Track별 상태 enum
 */
public interface TrackState<S extends Enum<S> & TrackStatus> {

    /**
     * 도출된 현재 상태.
     *
     * @return 상태
     */
    S status();

    /**
     * Track 버전.
     *
     * <p>Context는 문서 버전(v1~v3), 나머지 Track은 반영된 변경 횟수입니다.</p>
     *
     * @return 버전
     */
    int version();

    /**
     * 부가 정보 (started_by, blocked_by 등).
     *
     * @return 불변 메타데이터
     */
    Map<String, String> metadata();

    /**
     * 시작 여부.
     *
     * @return start 또는 block이 기록되었으면 true
     */
    boolean started();

    /**
     * 차단 사유.
     *
     * @return 차단 사유 (차단되지 않았으면 null)
     */
    String blockedReason();
}
