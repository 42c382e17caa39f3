package com.ryuqq.lifecycle.core.gate;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.track.BlockTrack;
import com.ryuqq.lifecycle.core.track.TrackDispatcher;
import com.ryuqq.lifecycle.core.track.TrackType;
import com.ryuqq.lifecycle.core.track.Tracks;
import com.ryuqq.lifecycle.core.track.businesscase.RecordApproval;
import com.ryuqq.lifecycle.core.track.businesscase.SetAssumptions;
import com.ryuqq.lifecycle.core.track.businesscase.SubmitForApproval;
import com.ryuqq.lifecycle.core.track.context.ContextSection;
import com.ryuqq.lifecycle.core.track.context.SubmitContextVersion;
import com.ryuqq.lifecycle.core.track.design.AttachDesignSpec;
import com.ryuqq.lifecycle.core.track.design.AttachFigma;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * QualityGateEvaluator 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class QualityGateEvaluatorTest {

    private static final Instant AT = Instant.parse("2026-03-06T10:00:00Z");

    private final GateConfig config = GateConfig.defaults();
    private final QualityGateEvaluator evaluator = new QualityGateEvaluator(config);
    private final TrackDispatcher dispatcher = new TrackDispatcher(config);

    private static GateCheck check(TrackGateResult result, String name) {
        return result.checks().stream()
            .filter(c -> c.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("check not found: " + name));
    }

    // ========== Context ==========

    @Test
    void context_V2Scored72_PassesReviewThresholdButIsIncomplete() {
        // Given
        EnumSet<ContextSection> sections = EnumSet.allOf(ContextSection.class);
        Tracks tracks = dispatcher.apply(Tracks.initial(), TrackType.CONTEXT,
            new SubmitContextVersion(1, "docs/v1.md", 20, sections, "pm"), AT);
        tracks = dispatcher.apply(tracks, TrackType.CONTEXT,
            new SubmitContextVersion(2, "docs/v2.md", 72, sections, "pm"), AT);
        FeatureRecord record = GateTestRecords.inParallelTracks().withTracks(tracks);

        // When
        TrackGateResult result = evaluator.evaluate(record, TrackType.CONTEXT);

        // Then
        GateCheck score = check(result, "context_challenge_score");
        assertThat(score.passed()).isTrue();
        assertThat(score.evidence()).contains("context_review_threshold=60");
        assertThat(result.status()).isEqualTo(GateStatus.INCOMPLETE);
        assertThat(result.blockers()).containsExactly(
            "[Context] Context not approved: v3 must score at least 85 (current: v2)");
    }

    @Test
    void context_V3Scored80_FailsApprovedThreshold() {
        // Given
        EnumSet<ContextSection> sections = EnumSet.of(ContextSection.PROBLEM_STATEMENT, ContextSection.SCOPE);
        Tracks tracks = Tracks.initial();
        for (int version = 1; version <= 3; version++) {
            tracks = dispatcher.apply(tracks, TrackType.CONTEXT,
                new SubmitContextVersion(version, "docs/v" + version + ".md", version == 3 ? 80 : 70, sections, "pm"), AT);
        }
        FeatureRecord record = GateTestRecords.inParallelTracks().withTracks(tracks);

        // When
        TrackGateResult result = evaluator.evaluate(record, TrackType.CONTEXT);

        // Then
        assertThat(result.blockers()).containsExactly(
            "[Context] Challenge score 80 below v3 threshold 85",
            "[Context] Context not approved: v3 must score at least 85 (current: v3)",
            "[Context] Missing required sections: success_metrics");
        assertThat(result.warnings()).containsExactly("[Context] Stakeholders section not provided");
    }

    @Test
    void context_NotSubmitted_ReportsSubmissionFirst() {
        // When
        TrackGateResult result = evaluator.evaluate(GateTestRecords.inParallelTracks(), TrackType.CONTEXT);

        // Then
        assertThat(result.blockers()).first().isEqualTo("[Context] Context document not submitted");
        assertThat(result.checks()).extracting(GateCheck::name).containsExactly(
            "track_not_blocked", "context_submitted", "context_challenge_score",
            "context_approved_version", "context_required_sections", "context_stakeholders");
    }

    // ========== Design ==========

    @Test
    void design_InvalidFigmaUrl_IsAdvisoryOnly() {
        // Given
        Tracks tracks = dispatcher.apply(Tracks.initial(), TrackType.DESIGN, new AttachDesignSpec("docs/spec.md", "designer"), AT);
        tracks = dispatcher.apply(tracks, TrackType.DESIGN, new AttachFigma("figma-file-123", "designer"), AT);
        FeatureRecord record = GateTestRecords.inParallelTracks().withTracks(tracks);

        // When
        TrackGateResult result = evaluator.evaluate(record, TrackType.DESIGN);

        // Then
        assertThat(result.status()).isEqualTo(GateStatus.PASS);
        assertThat(check(result, "figma_url_valid").passed()).isFalse();
        assertThat(result.warnings()).contains("[Design] Figma reference is not a figma.com URL: figma-file-123");
    }

    @Test
    void design_FigmaOptional_MissingFigmaDoesNotBlock() {
        // Given
        QualityGateEvaluator optional = new QualityGateEvaluator(config.withFigmaRequired(false));
        Tracks tracks = dispatcher.apply(Tracks.initial(), TrackType.DESIGN, new AttachDesignSpec("docs/spec.md", "designer"), AT);
        FeatureRecord record = GateTestRecords.inParallelTracks().withTracks(tracks);

        // When
        TrackGateResult result = optional.evaluate(record, TrackType.DESIGN);

        // Then
        assertThat(check(result, "figma_provided").level()).isEqualTo(GateLevel.ADVISORY);
        assertThat(result.passed()).isTrue();
    }

    // ========== Business Case ==========

    @Test
    void businessCase_AwaitingSecondApprover_ListsPendingApprover() {
        // Given
        GateConfig approvers = config.withRequiredBcApprovers(List.of("Dave Manager", "Jack Approver"));
        TrackDispatcher bcDispatcher = new TrackDispatcher(approvers);
        Tracks tracks = bcDispatcher.apply(Tracks.initial(), TrackType.BUSINESS_CASE,
            new SetAssumptions("baseline", "impact", null, "pm"), AT);
        tracks = bcDispatcher.apply(tracks, TrackType.BUSINESS_CASE, new SubmitForApproval("pm"), AT);
        tracks = bcDispatcher.apply(tracks, TrackType.BUSINESS_CASE, new RecordApproval("Dave Manager", true, null), AT);
        FeatureRecord record = GateTestRecords.inParallelTracks().withTracks(tracks);

        // When
        TrackGateResult result = new QualityGateEvaluator(approvers).evaluate(record, TrackType.BUSINESS_CASE);

        // Then
        assertThat(result.blockers()).containsExactly("[Business Case] Awaiting approval from: Jack Approver");
        assertThat(result.warnings()).containsExactly("[Business Case] ROI analysis not provided");
    }

    @Test
    void businessCase_NotSubmitted() {
        TrackGateResult result = evaluator.evaluate(GateTestRecords.inParallelTracks(), TrackType.BUSINESS_CASE);

        assertThat(result.blockers()).containsExactly(
            "[Business Case] Baseline metrics not provided",
            "[Business Case] Impact assumptions not provided",
            "[Business Case] Business case not submitted for approval");
    }

    // ========== 공통 ==========

    @Test
    void blockedTrack_FailsBlockingCheck() {
        // Given
        FeatureRecord ready = GateTestRecords.ready(config);
        Tracks blocked = dispatcher.apply(ready.tracks(), TrackType.ENGINEERING, new BlockTrack("Vendor contract", "eng"), AT);

        // When
        TrackGateResult result = evaluator.evaluate(ready.withTracks(blocked), TrackType.ENGINEERING);

        // Then
        assertThat(result.blockers()).containsExactly("[Engineering] Track blocked: Vendor contract");
    }

    @Test
    void evaluateAll_ReadyRecord_AllPassInTrackOrder() {
        // When
        List<TrackGateResult> results = evaluator.evaluateAll(GateTestRecords.ready(config));

        // Then
        assertThat(results).extracting(TrackGateResult::track).containsExactly(
            TrackType.CONTEXT, TrackType.DESIGN, TrackType.BUSINESS_CASE, TrackType.ENGINEERING);
        assertThat(results).allMatch(TrackGateResult::passed);
    }
}
