package com.ryuqq.lifecycle.core.gate;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.track.TrackState;
import com.ryuqq.lifecycle.core.track.TrackType;
import com.ryuqq.lifecycle.core.track.businesscase.BusinessCaseTrackMachine;
import com.ryuqq.lifecycle.core.track.businesscase.BusinessCaseTrackState;
import com.ryuqq.lifecycle.core.track.context.ContextSection;
import com.ryuqq.lifecycle.core.track.context.ContextTrackState;
import com.ryuqq.lifecycle.core.track.design.DesignTrackState;
import com.ryuqq.lifecycle.core.track.engineering.Adr;
import com.ryuqq.lifecycle.core.track.engineering.Component;
import com.ryuqq.lifecycle.core.track.engineering.EngineeringTrackState;
import com.ryuqq.lifecycle.core.track.engineering.Risk;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Track별 Quality Gate 평가기.
 *
 * <p>각 Track의 기록된 사실과 제품별 {@link GateConfig} 임계값으로 이름 있는 검사를
 * 정해진 순서대로 평가합니다. 평가는 읽기 전용이며 레코드를 변경하지 않습니다.</p>
 *
 * <p><strong>검사 순서:</strong></p>
 * <ul>
 *   <li>Context: track_not_blocked, context_submitted, context_challenge_score,
 *       context_approved_version, context_required_sections, context_stakeholders</li>
 *   <li>Design: track_not_blocked, design_spec_provided, figma_provided, figma_url_valid,
 *       wireframes_provided</li>
 *   <li>Business Case: track_not_blocked, bc_baseline_metrics, bc_impact_assumptions,
 *       bc_stakeholder_approval, bc_roi_analysis</li>
 *   <li>Engineering: track_not_blocked, eng_components_identified, eng_adrs_decided,
 *       eng_estimate_provided, eng_high_risks_mitigated</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class QualityGateEvaluator {

    static final Pattern FIGMA_URL = Pattern.compile("^https?://.*figma\\.com.*");

    private static final int FINAL_CONTEXT_VERSION = 3;

    private final GateConfig config;
    private final BusinessCaseTrackMachine businessCaseMachine;

    public QualityGateEvaluator(GateConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.businessCaseMachine = new BusinessCaseTrackMachine(config);
    }

    public GateConfig getConfig() {
        return config;
    }

    /**
     * 네 Track 모두 평가.
     *
     * @param record 대상 레코드
     * @return Context, Design, Business Case, Engineering 순 결과
     */
    public List<TrackGateResult> evaluateAll(FeatureRecord record) {
        List<TrackGateResult> results = new ArrayList<>();
        for (TrackType type : TrackType.values()) {
            results.add(evaluate(record, type));
        }
        return results;
    }

    /**
     * 한 Track 평가.
     *
     * @param record 대상 레코드
     * @param type 대상 Track
     * @return Track 결과
     */
    public TrackGateResult evaluate(FeatureRecord record, TrackType type) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        List<GateCheck> checks = new ArrayList<>();
        checks.add(notBlocked(record.tracks().state(type)));
        switch (type) {
            case CONTEXT -> contextChecks(record.tracks().context(), checks);
            case DESIGN -> designChecks(record.tracks().design(), checks);
            case BUSINESS_CASE -> businessCaseChecks(record.tracks().businessCase(), checks);
            case ENGINEERING -> engineeringChecks(record.tracks().engineering(), checks);
        }
        return TrackGateResult.of(type, checks);
    }

    private static GateCheck notBlocked(TrackState<?> state) {
        String reason = state.blockedReason();
        return GateCheck.of("track_not_blocked", GateLevel.BLOCKING, reason == null,
            "status=" + state.status(), "Track blocked: " + reason);
    }

    // ========== Context ==========

    private void contextChecks(ContextTrackState state, List<GateCheck> checks) {
        int version = state.version();
        boolean submitted = version > 0;
        checks.add(GateCheck.of("context_submitted", GateLevel.BLOCKING, submitted,
            "version=v" + version, "Context document not submitted"));

        if (!submitted) {
            checks.add(GateCheck.fail("context_challenge_score", GateLevel.BLOCKING,
                "version=v0", "Challenge score not recorded: no context version submitted"));
        } else {
            String key = GateConfig.thresholdKeyForVersion(version);
            double threshold = config.thresholdForVersion(version);
            Integer score = state.challengeScore();
            String evidence = "score=" + score + ", " + key + "=" + format(threshold);
            if (score == null) {
                checks.add(GateCheck.fail("context_challenge_score", GateLevel.BLOCKING, evidence,
                    "Challenge score not recorded for v" + version));
            } else {
                checks.add(GateCheck.of("context_challenge_score", GateLevel.BLOCKING, score >= threshold, evidence,
                    String.format("Challenge score %d below v%d threshold %s", score, version, format(threshold))));
            }
        }

        boolean approved = version == FINAL_CONTEXT_VERSION
            && state.challengeScore() != null
            && state.challengeScore() >= config.contextApprovedThreshold();
        checks.add(GateCheck.of("context_approved_version", GateLevel.REQUIRED, approved,
            "version=v" + version + ", context_approved_threshold=" + format(config.contextApprovedThreshold()),
            "Context not approved: v" + FINAL_CONTEXT_VERSION + " must score at least "
                + format(config.contextApprovedThreshold()) + " (current: v" + version + ")"));

        List<String> missing = new ArrayList<>();
        for (ContextSection section : ContextSection.values()) {
            if (section.isRequired() && !state.sections().contains(section)) {
                missing.add(section.toString());
            }
        }
        checks.add(GateCheck.of("context_required_sections", GateLevel.REQUIRED, missing.isEmpty(),
            "sections=" + state.sections(), "Missing required sections: " + String.join(", ", missing)));

        checks.add(GateCheck.of("context_stakeholders", GateLevel.ADVISORY,
            state.sections().contains(ContextSection.STAKEHOLDERS),
            "sections=" + state.sections(), "Stakeholders section not provided"));
    }

    // ========== Design ==========

    private void designChecks(DesignTrackState state, List<GateCheck> checks) {
        checks.add(GateCheck.of("design_spec_provided", GateLevel.REQUIRED, state.specRef() != null,
            "spec=" + state.specRef(), "Design spec not provided"));

        GateLevel figmaLevel = config.figmaRequired() ? GateLevel.REQUIRED : GateLevel.ADVISORY;
        checks.add(GateCheck.of("figma_provided", figmaLevel, state.figmaRef() != null,
            "figma=" + state.figmaRef() + ", figma_required=" + config.figmaRequired(), "Figma design not attached"));

        String figma = state.figmaRef();
        boolean validUrl = figma != null && FIGMA_URL.matcher(figma).matches();
        checks.add(GateCheck.of("figma_url_valid", GateLevel.ADVISORY, validUrl,
            "figma=" + figma,
            figma == null ? "Figma reference not provided" : "Figma reference is not a figma.com URL: " + figma));

        checks.add(GateCheck.of("wireframes_provided", GateLevel.ADVISORY, state.wireframesRef() != null,
            "wireframes=" + state.wireframesRef(), "Wireframes not provided"));
    }

    // ========== Business Case ==========

    private void businessCaseChecks(BusinessCaseTrackState state, List<GateCheck> checks) {
        checks.add(GateCheck.of("bc_baseline_metrics", GateLevel.REQUIRED, state.baselineMetrics() != null,
            "baseline_metrics=" + state.baselineMetrics(), "Baseline metrics not provided"));
        checks.add(GateCheck.of("bc_impact_assumptions", GateLevel.REQUIRED, state.impactAssumptions() != null,
            "impact_assumptions=" + state.impactAssumptions(), "Impact assumptions not provided"));

        List<String> rejectedBy = BusinessCaseTrackMachine.rejectedBy(state);
        List<String> pending = businessCaseMachine.pendingApprovers(state);
        String evidence = "round=" + state.round() + ", required=" + config.requiredBcApprovers()
            + ", approvals=" + state.currentRoundApprovals().size();
        GateCheck approval;
        if (!rejectedBy.isEmpty()) {
            approval = GateCheck.fail("bc_stakeholder_approval", GateLevel.BLOCKING, evidence,
                "Business case rejected by: " + String.join(", ", rejectedBy));
        } else if (businessCaseMachine.isApprovalComplete(state)) {
            approval = GateCheck.pass("bc_stakeholder_approval", GateLevel.BLOCKING, evidence);
        } else if (!state.submitted() && state.currentRoundApprovals().isEmpty()) {
            approval = GateCheck.fail("bc_stakeholder_approval", GateLevel.BLOCKING, evidence,
                "Business case not submitted for approval");
        } else if (pending.isEmpty()) {
            approval = GateCheck.fail("bc_stakeholder_approval", GateLevel.BLOCKING, evidence,
                "Awaiting approval");
        } else {
            approval = GateCheck.fail("bc_stakeholder_approval", GateLevel.BLOCKING, evidence,
                "Awaiting approval from: " + String.join(", ", pending));
        }
        checks.add(approval);

        checks.add(GateCheck.of("bc_roi_analysis", GateLevel.ADVISORY, state.roiAnalysis() != null,
            "roi_analysis=" + state.roiAnalysis(), "ROI analysis not provided"));
    }

    // ========== Engineering ==========

    private void engineeringChecks(EngineeringTrackState state, List<GateCheck> checks) {
        checks.add(GateCheck.of("eng_components_identified", GateLevel.REQUIRED, !state.components().isEmpty(),
            "components=" + state.components().stream().map(Component::name).collect(Collectors.toList()),
            "No components identified"));

        List<Adr> proposed = state.proposedAdrs();
        checks.add(GateCheck.of("eng_adrs_decided", GateLevel.BLOCKING, proposed.isEmpty(),
            "adrs=" + state.adrs().size() + ", proposed=" + proposed.size(),
            "ADRs awaiting decision: " + proposed.stream().map(Adr::label).collect(Collectors.joining(", "))));

        checks.add(GateCheck.of("eng_estimate_provided", GateLevel.REQUIRED, state.estimate() != null,
            state.estimate() == null ? "estimate=none" : "estimate=" + state.estimate().size() + "/" + state.estimate().confidence(),
            "Estimate not provided"));

        List<Risk> unmitigated = state.unmitigatedHighImpactRisks();
        checks.add(GateCheck.of("eng_high_risks_mitigated", GateLevel.BLOCKING, unmitigated.isEmpty(),
            "risks=" + state.risks().size() + ", unmitigated_high=" + unmitigated.size(),
            "High-impact risks without mitigation: " + riskIds(unmitigated)));
    }

    static String riskIds(List<Risk> risks) {
        return risks.stream().map(Risk::id).collect(Collectors.joining(", "));
    }

    private static String format(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
