package com.ryuqq.lifecycle.core.gate;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.model.FeatureSlug;
import com.ryuqq.lifecycle.core.model.ProductId;
import com.ryuqq.lifecycle.core.statemachine.Phase;
import com.ryuqq.lifecycle.core.statemachine.PhaseStateMachine;
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
import com.ryuqq.lifecycle.core.track.design.AttachWireframes;
import com.ryuqq.lifecycle.core.track.engineering.AddComponent;
import com.ryuqq.lifecycle.core.track.engineering.AddRisk;
import com.ryuqq.lifecycle.core.track.engineering.AdrStatus;
import com.ryuqq.lifecycle.core.track.engineering.CreateAdr;
import com.ryuqq.lifecycle.core.track.engineering.DecideAdr;
import com.ryuqq.lifecycle.core.track.engineering.EstimateConfidence;
import com.ryuqq.lifecycle.core.track.engineering.EstimateSize;
import com.ryuqq.lifecycle.core.track.engineering.RecordEstimate;
import com.ryuqq.lifecycle.core.track.engineering.RiskLevel;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Gate 테스트용 레코드 생성 헬퍼.
 */
final class GateTestRecords {

    static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private GateTestRecords() {
    }

    /**
     * PARALLEL_TRACKS 상태의 새 레코드.
     */
    static FeatureRecord inParallelTracks() {
        FeatureRecord record = FeatureRecord.create(FeatureSlug.of("mea-otp-checkout-recovery"), "OTP Checkout Recovery",
            ProductId.of("meal-kit"), null, T0, Map.of());
        record = PhaseStateMachine.advance(record, Phase.SIGNAL_ANALYSIS, null, T0.plusSeconds(60));
        record = PhaseStateMachine.advance(record, Phase.CONTEXT_DOC, null, T0.plusSeconds(120));
        return PhaseStateMachine.advance(record, Phase.PARALLEL_TRACKS, null, T0.plusSeconds(180));
    }

    /**
     * 추정치를 제외한 모든 Gate를 통과하는 레코드.
     */
    static FeatureRecord readyExceptEstimate(GateConfig config) {
        FeatureRecord record = inParallelTracks();
        TrackDispatcher dispatcher = new TrackDispatcher(config);
        Instant at = T0.plusSeconds(300);
        Tracks tracks = record.tracks();

        EnumSet<ContextSection> sections = EnumSet.allOf(ContextSection.class);
        tracks = dispatcher.apply(tracks, TrackType.CONTEXT, new SubmitContextVersion(1, "docs/ctx-v1.md", 30, sections, "pm"), at);
        tracks = dispatcher.apply(tracks, TrackType.CONTEXT, new SubmitContextVersion(2, "docs/ctx-v2.md", 72, sections, "pm"), at);
        tracks = dispatcher.apply(tracks, TrackType.CONTEXT, new SubmitContextVersion(3, "docs/ctx-v3.md", 90, sections, "pm"), at);

        tracks = dispatcher.apply(tracks, TrackType.DESIGN, new AttachWireframes("drive://wireframes", "designer"), at);
        tracks = dispatcher.apply(tracks, TrackType.DESIGN, new AttachDesignSpec("docs/design-spec.md", "designer"), at);
        tracks = dispatcher.apply(tracks, TrackType.DESIGN, new AttachFigma("https://www.figma.com/file/otp", "designer"), at);

        tracks = dispatcher.apply(tracks, TrackType.BUSINESS_CASE,
            new SetAssumptions("Checkout completion 71%", "+4pp completion", "ROI 3.2x", "pm"), at);
        tracks = dispatcher.apply(tracks, TrackType.BUSINESS_CASE, new SubmitForApproval("pm"), at);
        for (String approver : config.requiredBcApprovers().isEmpty()
            ? List.of("Dave Manager") : config.requiredBcApprovers()) {
            tracks = dispatcher.apply(tracks, TrackType.BUSINESS_CASE, new RecordApproval(approver, true, null), at);
        }

        tracks = dispatcher.apply(tracks, TrackType.ENGINEERING, new AddComponent("otp-service", null, "eng"), at);
        tracks = dispatcher.apply(tracks, TrackType.ENGINEERING, new CreateAdr("Use TOTP", null, null, null, "eng"), at);
        tracks = dispatcher.apply(tracks, TrackType.ENGINEERING, new DecideAdr(1, AdrStatus.ACCEPTED, "architect"), at);
        tracks = dispatcher.apply(tracks, TrackType.ENGINEERING,
            new AddRisk("SMS provider outage", RiskLevel.HIGH, RiskLevel.LOW, "Email fallback", "sre", "eng"), at);
        return record.withTracks(tracks);
    }

    /**
     * 모든 Gate를 통과하는 레코드.
     */
    static FeatureRecord ready(GateConfig config) {
        FeatureRecord record = readyExceptEstimate(config);
        Tracks tracks = new TrackDispatcher(config).apply(record.tracks(), TrackType.ENGINEERING,
            new RecordEstimate(EstimateSize.M, EstimateConfidence.HIGH, null, "eng"), T0.plusSeconds(400));
        return record.withTracks(tracks);
    }
}
