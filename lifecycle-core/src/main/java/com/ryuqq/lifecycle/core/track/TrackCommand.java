package com.ryuqq.lifecycle.core.track;

/**
 * Track 변경 명령.
 *
 * <p>공통 명령({@link StartTrack}, {@link BlockTrack}, {@link UnblockTrack})과
 * Track별 sealed 명령 인터페이스가 이 타입을 확장합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface TrackCommand {

    /**
     * 명령 실행자.
     *
     * @return 실행자 이름
     */
    String actor();

    /**
     * 실행자 검증 헬퍼.
     *
     * @param actor 실행자
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor cannot be null or blank");
        }
    }

    /**
     * 필수 텍스트 검증 헬퍼.
     *
     * @param value 값
     * @param name 필드 이름
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
