package com.ryuqq.lifecycle.application.engine;

import com.ryuqq.lifecycle.core.alias.DuplicateCandidate;
import com.ryuqq.lifecycle.core.model.FeatureRecord;

import java.util.List;

/**
 * Feature 시작 결과.
 *
 * <p>중복 후보는 예외가 아니라 정상 결과입니다. 호출자는 후보를 확인한 뒤
 * {@link StartFeatureRequest#confirmed()}로 다시 요청하거나 기존 Feature에 별칭을 추가합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public sealed interface StartOutcome permits StartOutcome.Created, StartOutcome.DuplicateCandidates {

    /**
     * 새 Feature가 저장됨.
     *
     * @param record 저장된 레코드
     */
    record Created(FeatureRecord record) implements StartOutcome {

        public Created {
            if (record == null) {
                throw new IllegalArgumentException("record cannot be null");
            }
        }
    }

    /**
     * 같은 제품에 유사한 Feature가 있어 생성하지 않음.
     *
     * @param candidates 유사도 내림차순 후보
     */
    record DuplicateCandidates(List<DuplicateCandidate> candidates) implements StartOutcome {

        public DuplicateCandidates {
            if (candidates == null || candidates.isEmpty()) {
                throw new IllegalArgumentException("candidates cannot be null or empty");
            }
            candidates = List.copyOf(candidates);
        }
    }
}
