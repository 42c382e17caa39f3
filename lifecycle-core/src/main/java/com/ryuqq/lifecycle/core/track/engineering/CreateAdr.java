package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * PROPOSED 상태의 ADR 생성.
 *
 * <p>supersedes를 지정하면 대상 ADR은 SUPERSEDED로 바뀝니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param title 제목
 * @param context 배경 (null 허용)
 * @param decision 결정 내용 (null 허용)
 * @param supersedes 대체할 ADR 번호 (null 허용)
 * @param actor 실행자
 */
public record CreateAdr(String title, String context, String decision, Integer supersedes, String actor)
    implements EngineeringCommand {

    public CreateAdr {
        TrackCommand.requireText(title, "title");
        if (supersedes != null && supersedes <= 0) {
            throw new IllegalArgumentException("supersedes must be positive (current: " + supersedes + ")");
        }
        TrackCommand.requireActor(actor);
    }
}
