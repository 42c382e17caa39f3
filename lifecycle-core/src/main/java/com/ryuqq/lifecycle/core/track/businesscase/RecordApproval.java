package com.ryuqq.lifecycle.core.track.businesscase;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 승인자의 승인/반려 기록.
 *
 * <p>같은 라운드에서 같은 승인자가 다시 기록하면 마지막 기록으로 대체됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param approver 승인자 (실행자)
 * @param approved 승인 여부
 * @param comment 의견 (null 허용)
 */
public record RecordApproval(String approver, boolean approved, String comment) implements BusinessCaseCommand {

    public RecordApproval {
        TrackCommand.requireText(approver, "approver");
    }

    @Override
    public String actor() {
        return approver;
    }
}
