package com.ryuqq.lifecycle.application.engine;

import com.ryuqq.lifecycle.adapter.file.store.FileFeatureStore;
import com.ryuqq.lifecycle.application.config.GateConfigLoader;
import com.ryuqq.lifecycle.application.config.ProductGateConfigs;
import com.ryuqq.lifecycle.core.gate.DecisionAction;
import com.ryuqq.lifecycle.core.model.ArtifactType;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.statemachine.Phase;
import com.ryuqq.lifecycle.core.track.businesscase.BusinessCaseStatus;
import com.ryuqq.lifecycle.testkit.fixture.FeatureRecordFixtures;
import com.ryuqq.lifecycle.testkit.fixture.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 파일 저장소 기반 전체 라이프사이클 통합 테스트.
 *
 * <p>매 단계마다 새 FileFeatureStore 인스턴스로 다시 읽어, 디스크 상태만으로 흐름이 이어지는지 검증합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class FileBackedFeatureEngineTest {

    private static final String SLUG = "mea-otp-checkout-recovery";

    @TempDir
    Path root;

    private MutableClock clock;
    private ProductGateConfigs configs;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FeatureRecordFixtures.T0);
        configs = new GateConfigLoader().parse("""
            products:
              meal-kit:
                required_bc_approvers: [Dave Manager]
            """);
    }

    @Test
    void fullLifecycle_SurvivesReloadBetweenSteps() throws Exception {
        // Given
        engine().startFeature(StartFeatureRequest.of("OTP Checkout Recovery", FeatureRecordFixtures.PRODUCT, "jane"));

        // When
        step().advancePhase(SLUG, Phase.SIGNAL_ANALYSIS, Map.of("signals_found", 4));
        step().advancePhase(SLUG, Phase.CONTEXT_DOC, null);
        step().advanceTrack(SLUG, "context", "submit_version", Map.of("version", 1, "document_ref", "ctx-v1.md",
            "challenge_score", 40, "sections", List.of("problem_statement", "success_metrics", "scope")), "pm");
        step().advanceTrack(SLUG, "context", "submit_version",
            Map.of("version", 2, "document_ref", "ctx-v2.md", "challenge_score", 70), "pm");
        step().advanceTrack(SLUG, "context", "submit_version",
            Map.of("version", 3, "document_ref", "ctx-v3.md", "challenge_score", 91), "pm");
        step().advancePhase(SLUG, Phase.PARALLEL_TRACKS, null);
        step().advanceTrack(SLUG, "design", "attach_spec", Map.of("ref", "design-spec.md"), "designer");
        step().attachArtifact(SLUG, ArtifactType.FIGMA, "https://www.figma.com/file/otp", "designer");
        step().advanceTrack(SLUG, "business_case", "set_assumptions",
            Map.of("baseline_metrics", "71% completion", "impact_assumptions", "+4pp"), "pm");
        step().advanceTrack(SLUG, "business_case", "submit_for_approval", Map.of(), "pm");
        step().advanceTrack(SLUG, "business_case", "record_approval", Map.of(), "Dave Manager");
        step().advanceTrack(SLUG, "engineering", "add_component", Map.of("name", "otp-service"), "eng");
        step().advanceTrack(SLUG, "engineering", "record_estimate", Map.of("size", "M", "confidence", "high"), "eng");
        FeatureRecord approved = step().decisionGate(SLUG, DecisionAction.APPROVE, "Ship it", "vp-product", false);

        // Then
        assertEquals(Phase.OUTPUT_GENERATION, approved.currentPhase());
        FeatureRecord reloaded = new FileFeatureStore(root).load(SLUG);
        assertEquals(approved, reloaded);
        assertEquals(BusinessCaseStatus.APPROVED, reloaded.tracks().businessCase().status());
        assertThat(reloaded.decisions()).extracting(d -> d.phase()).containsExactly("business_case", "decision_gate");

        String yaml = Files.readString(root.resolve(SLUG + ".yaml"));
        assertThat(yaml).contains("current_phase: \"output_generation\"");
        assertThat(reloaded.phaseHistory()).extracting(e -> e.phase()).containsExactly(
            Phase.INITIALIZATION, Phase.SIGNAL_ANALYSIS, Phase.CONTEXT_DOC, Phase.PARALLEL_TRACKS,
            Phase.DECISION_GATE, Phase.OUTPUT_GENERATION);
    }

    @Test
    void listFeatures_ReadsRecordsWrittenByEngine() {
        engine().startFeature(StartFeatureRequest.of("Allergy Filters", FeatureRecordFixtures.PRODUCT, "jane"));
        step().startFeature(StartFeatureRequest.of("Zucchini Boxes", FeatureRecordFixtures.PRODUCT, "jane"));

        assertThat(engine().listFeatures(FeatureRecordFixtures.PRODUCT)).extracting(FeatureRecord::slug)
            .containsExactly("mea-allergy-filters", "mea-zucchini-boxes");
    }

    private FeatureEngine engine() {
        return new DefaultFeatureEngine(new FileFeatureStore(root), configs,
            record -> "[[Entities/" + record.slug() + "]]",
            (record, documents) -> List.of(), clock);
    }

    private FeatureEngine step() {
        clock.advance(Duration.ofMinutes(10));
        return engine();
    }
}
