package com.ryuqq.lifecycle.testkit.fixture;

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
import com.ryuqq.lifecycle.core.track.engineering.AddDependency;
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
 * Ready-made {@link FeatureRecord}s for adapter and engine tests.
 *
 * <p>Records are built through the same state machines the engine uses, so every
 * fixture satisfies the record invariants (ordered phase history, legal track statuses).</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class FeatureRecordFixtures {

    public static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");
    public static final String PRODUCT = "meal-kit";

    private FeatureRecordFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * A freshly created record in INITIALIZATION.
     */
    public static FeatureRecord newFeature(String slug, String title, String productId) {
        return FeatureRecord.create(FeatureSlug.of(slug), title, ProductId.of(productId), "growth", T0,
            Map.of("priority", "P1", "created_by", "pm"));
    }

    public static FeatureRecord newFeature(String slug, String title) {
        return newFeature(slug, title, PRODUCT);
    }

    /**
     * A record advanced to PARALLEL_TRACKS with untouched tracks.
     */
    public static FeatureRecord inParallelTracks(String slug, String title) {
        FeatureRecord record = newFeature(slug, title);
        record = PhaseStateMachine.advance(record, Phase.SIGNAL_ANALYSIS, null, T0.plusSeconds(60));
        record = PhaseStateMachine.advance(record, Phase.CONTEXT_DOC, null, T0.plusSeconds(120));
        return PhaseStateMachine.advance(record, Phase.PARALLEL_TRACKS, null, T0.plusSeconds(180));
    }

    /**
     * A record in PARALLEL_TRACKS whose four tracks pass every gate of the given config.
     *
     * <p>Carries an accepted ADR, a mitigated high-impact risk, a resolved non-blocking
     * dependency and an M/high estimate.</p>
     */
    public static FeatureRecord readyForDecision(String slug, String title, GateConfig config) {
        FeatureRecord record = inParallelTracks(slug, title);
        return record.withTracks(readyTracks(record.tracks(), config, T0.plusSeconds(300)));
    }

    public static FeatureRecord readyForDecision(GateConfig config) {
        return readyForDecision("mea-otp-checkout-recovery", "OTP Checkout Recovery", config);
    }

    /**
     * Drives all four tracks to their passing state.
     */
    public static Tracks readyTracks(Tracks tracks, GateConfig config, Instant at) {
        TrackDispatcher dispatcher = new TrackDispatcher(config);
        EnumSet<ContextSection> sections = EnumSet.allOf(ContextSection.class);

        Tracks result = tracks;
        result = dispatcher.apply(result, TrackType.CONTEXT,
            new SubmitContextVersion(1, "docs/ctx-v1.md", 30, sections, "pm"), at);
        result = dispatcher.apply(result, TrackType.CONTEXT,
            new SubmitContextVersion(2, "docs/ctx-v2.md", 72, sections, "pm"), at);
        result = dispatcher.apply(result, TrackType.CONTEXT,
            new SubmitContextVersion(3, "docs/ctx-v3.md", 90, sections, "pm"), at);

        result = dispatcher.apply(result, TrackType.DESIGN, new AttachWireframes("drive://wireframes", "designer"), at);
        result = dispatcher.apply(result, TrackType.DESIGN, new AttachDesignSpec("docs/design-spec.md", "designer"), at);
        result = dispatcher.apply(result, TrackType.DESIGN,
            new AttachFigma("https://www.figma.com/file/otp-recovery", "designer"), at);

        result = dispatcher.apply(result, TrackType.BUSINESS_CASE,
            new SetAssumptions("Checkout completion 71%", "+4pp completion", "ROI 3.2x", "pm"), at);
        result = dispatcher.apply(result, TrackType.BUSINESS_CASE, new SubmitForApproval("pm"), at);
        List<String> approvers = config.requiredBcApprovers().isEmpty()
            ? List.of("Dave Manager") : config.requiredBcApprovers();
        for (String approver : approvers) {
            result = dispatcher.apply(result, TrackType.BUSINESS_CASE, new RecordApproval(approver, true, null), at);
        }

        result = dispatcher.apply(result, TrackType.ENGINEERING, new AddComponent("otp-service", "Issues codes", "eng"), at);
        result = dispatcher.apply(result, TrackType.ENGINEERING,
            new CreateAdr("Use TOTP", "SMS is unreliable", "TOTP via authenticator", null, "eng"), at);
        result = dispatcher.apply(result, TrackType.ENGINEERING, new DecideAdr(1, AdrStatus.ACCEPTED, "architect"), at);
        result = dispatcher.apply(result, TrackType.ENGINEERING,
            new AddRisk("SMS provider outage", RiskLevel.HIGH, RiskLevel.LOW, "Email fallback", "sre", "eng"), at);
        result = dispatcher.apply(result, TrackType.ENGINEERING,
            new AddDependency("payments-api", "Checkout hook", false, "eng"), at);
        return dispatcher.apply(result, TrackType.ENGINEERING,
            new RecordEstimate(EstimateSize.M, EstimateConfidence.HIGH, Map.of("backend", "3d", "frontend", "2d"), "eng"), at);
    }
}
