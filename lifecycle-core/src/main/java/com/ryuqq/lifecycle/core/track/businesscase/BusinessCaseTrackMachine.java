package com.ryuqq.lifecycle.core.track.businesscase;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.exception.UnknownApproverException;
import com.ryuqq.lifecycle.core.track.TrackCommand;
import com.ryuqq.lifecycle.core.track.TrackStateMachine;
import com.ryuqq.lifecycle.core.track.TrackTransitionTable;
import com.ryuqq.lifecycle.core.track.TrackType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.lifecycle.core.track.businesscase.BusinessCaseStatus.*;

/**
 * Business Case Track 상태 머신.
 *
 * <p><strong>상태 도출 규칙 (현재 라운드 기준, 우선순위 순):</strong></p>
 * <ol>
 *   <li>차단 사유 있음 → BLOCKED</li>
 *   <li>반려(approved=false) 1건 이상 → REJECTED</li>
 *   <li>필수 승인자 전원 승인 → APPROVED (필수 승인자 미설정 시 승인 1건)</li>
 *   <li>승인 요청됨 또는 승인 기록 있음 → PENDING_APPROVAL</li>
 *   <li>시작했거나 가정이 기록됨 → IN_PROGRESS</li>
 *   <li>그 외 → NOT_STARTED</li>
 * </ol>
 *
 * <p>승인 기록은 IN_PROGRESS 또는 PENDING_APPROVAL에서만 받습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class BusinessCaseTrackMachine extends TrackStateMachine<BusinessCaseStatus, BusinessCaseTrackState> {

    private static final TrackTransitionTable<BusinessCaseStatus> TABLE =
        TrackTransitionTable.builder(TrackType.BUSINESS_CASE, BusinessCaseStatus.class)
            .allow(NOT_STARTED, IN_PROGRESS, PENDING_APPROVAL, BLOCKED)
            .allow(IN_PROGRESS, PENDING_APPROVAL, APPROVED, REJECTED, BLOCKED)
            .allow(PENDING_APPROVAL, APPROVED, REJECTED, BLOCKED)
            .allow(REJECTED, IN_PROGRESS, BLOCKED)
            .allow(BLOCKED, IN_PROGRESS, PENDING_APPROVAL, APPROVED, REJECTED)
            .build();

    private final GateConfig config;

    public BusinessCaseTrackMachine(GateConfig config) {
        super(TrackType.BUSINESS_CASE, TABLE);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public static TrackTransitionTable<BusinessCaseStatus> transitionTable() {
        return TABLE;
    }

    @Override
    public BusinessCaseTrackState initialState() {
        return BusinessCaseTrackState.initial();
    }

    @Override
    protected BusinessCaseTrackState mutate(BusinessCaseTrackState current, TrackCommand command, Instant at) {
        if (command instanceof SetAssumptions assumptions) {
            return current.withAssumptions(
                assumptions.baselineMetrics() != null ? assumptions.baselineMetrics() : current.baselineMetrics(),
                assumptions.impactAssumptions() != null ? assumptions.impactAssumptions() : current.impactAssumptions(),
                assumptions.roiAnalysis() != null ? assumptions.roiAnalysis() : current.roiAnalysis());
        }
        if (command instanceof SubmitForApproval) {
            return submit(current);
        }
        if (command instanceof RecordApproval approval) {
            return recordApproval(current, approval, at);
        }
        if (command instanceof ReviseBusinessCase revise) {
            return revise(current, revise, at);
        }
        throw unsupported(command);
    }

    private BusinessCaseTrackState submit(BusinessCaseTrackState current) {
        if (current.status() == REJECTED) {
            throw precondition("Business case was rejected in round " + current.round() + "; revise before resubmitting");
        }
        if (current.baselineMetrics() == null || current.impactAssumptions() == null) {
            throw precondition("Baseline metrics and impact assumptions are required before submission");
        }
        return current.withSubmitted(true);
    }

    private BusinessCaseTrackState recordApproval(BusinessCaseTrackState current, RecordApproval command, Instant at) {
        List<String> required = config.requiredBcApprovers();
        if (!required.isEmpty() && !required.contains(command.approver())) {
            throw new UnknownApproverException(command.approver(), required);
        }
        if (current.status() == APPROVED) {
            throw precondition("Business case already approved in round " + current.round());
        }
        if (current.status() == REJECTED) {
            throw precondition("Business case was rejected in round " + current.round() + "; revise before recording approvals");
        }
        if (current.status() != IN_PROGRESS && current.status() != PENDING_APPROVAL) {
            throw precondition("Cannot record approval from status " + current.status());
        }

        List<Approval> approvals = new ArrayList<>();
        for (Approval existing : current.approvals()) {
            boolean replaced = existing.round() == current.round() && existing.approver().equals(command.approver());
            if (!replaced) {
                approvals.add(existing);
            }
        }
        approvals.add(new Approval(command.approver(), command.approved(), command.comment(), current.round(), at));
        return current.withApprovals(approvals);
    }

    private BusinessCaseTrackState revise(BusinessCaseTrackState current, ReviseBusinessCase revise, Instant at) {
        if (current.status() != REJECTED) {
            throw precondition("Only a rejected business case can be revised (current: " + current.status() + ")");
        }
        Map<String, String> metadata = withEntries(current.metadata(),
            "revised_by", revise.actor(), "revised_at", at.toString());
        if (revise.reason() != null) {
            metadata.put("revision_reason", revise.reason());
        }
        return current.nextRound(metadata);
    }

    /**
     * 현재 라운드에서 아직 승인하지 않은 필수 승인자.
     *
     * @param state 상태
     * @return 대기 중인 승인자 (설정 순서)
     */
    public List<String> pendingApprovers(BusinessCaseTrackState state) {
        Set<String> approvedBy = approvedBy(state);
        List<String> pending = new ArrayList<>();
        for (String approver : config.requiredBcApprovers()) {
            if (!approvedBy.contains(approver)) {
                pending.add(approver);
            }
        }
        return pending;
    }

    /**
     * 현재 라운드에서 반려한 승인자.
     *
     * @param state 상태
     * @return 반려자 (기록 순서)
     */
    public static List<String> rejectedBy(BusinessCaseTrackState state) {
        List<String> rejected = new ArrayList<>();
        for (Approval approval : state.currentRoundApprovals()) {
            if (!approval.approved()) {
                rejected.add(approval.approver());
            }
        }
        return rejected;
    }

    private static Set<String> approvedBy(BusinessCaseTrackState state) {
        Set<String> approved = new LinkedHashSet<>();
        for (Approval approval : state.currentRoundApprovals()) {
            if (approval.approved()) {
                approved.add(approval.approver());
            }
        }
        return approved;
    }

    /**
     * 현재 라운드 승인 완료 여부.
     *
     * @param state 상태
     * @return 필수 승인자 전원 승인(미설정 시 1건 이상 승인)이면 true
     */
    public boolean isApprovalComplete(BusinessCaseTrackState state) {
        Set<String> approved = approvedBy(state);
        List<String> required = config.requiredBcApprovers();
        if (required.isEmpty()) {
            return !approved.isEmpty();
        }
        return approved.containsAll(required);
    }

    @Override
    public BusinessCaseStatus deriveStatus(BusinessCaseTrackState state) {
        if (state.blockedReason() != null) {
            return BLOCKED;
        }
        if (!rejectedBy(state).isEmpty()) {
            return REJECTED;
        }
        if (isApprovalComplete(state)) {
            return APPROVED;
        }
        if (state.submitted() || !state.currentRoundApprovals().isEmpty()) {
            return PENDING_APPROVAL;
        }
        boolean hasFacts = state.baselineMetrics() != null
            || state.impactAssumptions() != null
            || state.roiAnalysis() != null
            || state.round() > 1;
        return state.started() || hasFacts ? IN_PROGRESS : NOT_STARTED;
    }

    @Override
    protected BusinessCaseTrackState withLifecycle(BusinessCaseTrackState state, boolean started, String blockedReason,
                                                   Map<String, String> metadata) {
        return state.withLifecycle(started, blockedReason, metadata);
    }

    @Override
    protected BusinessCaseTrackState withStatus(BusinessCaseTrackState state, BusinessCaseStatus status) {
        return state.withStatus(status, state.version());
    }

    @Override
    protected BusinessCaseTrackState settle(BusinessCaseTrackState previous, BusinessCaseTrackState mutated,
                                            BusinessCaseStatus status) {
        return mutated.withStatus(status, previous.version() + 1);
    }
}
