package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.exception.InvalidPhaseTransitionException;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.model.FeatureSlug;
import com.ryuqq.lifecycle.core.model.PhaseEntry;
import com.ryuqq.lifecycle.core.model.ProductId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PhaseStateMachine 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class PhaseStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private FeatureRecord record;

    @BeforeEach
    void setUp() {
        record = FeatureRecord.create(FeatureSlug.of("mea-otp-checkout-recovery"), "OTP Checkout Recovery",
            ProductId.of("meal-kit"), null, T0, Map.of());
    }

    @Test
    void advance_ClosesCurrentEntryAndOpensNewOne() {
        // Given
        Instant at = T0.plus(Duration.ofHours(1));

        // When
        FeatureRecord advanced = PhaseStateMachine.advance(record, Phase.SIGNAL_ANALYSIS, Map.of("note", "signals"), at);

        // Then
        assertThat(advanced.currentPhase()).isEqualTo(Phase.SIGNAL_ANALYSIS);
        assertThat(advanced.phaseHistory()).hasSize(2);
        assertThat(advanced.phaseHistory().get(0).exitedAt()).isEqualTo(at);
        assertThat(advanced.currentEntry().enteredAt()).isEqualTo(at);
        assertThat(advanced.currentEntry().exitedAt()).isNull();
        assertThat(advanced.currentEntry().metadata()).containsEntry("note", "signals");
    }

    @Test
    void advance_SamePhase_ReturnsUnchangedRecord() {
        // When
        FeatureRecord same = PhaseStateMachine.advance(record, Phase.INITIALIZATION, Map.of("retry", true), T0.plusSeconds(5));

        // Then
        assertThat(same).isSameAs(record);
        assertThat(same.phaseHistory()).hasSize(1);
    }

    @Test
    void advance_InvalidTarget_ThrowsAndLeavesRecordUntouched() {
        // When & Then
        assertThatThrownBy(() -> PhaseStateMachine.advance(record, Phase.DECISION_GATE, null, T0.plusSeconds(1)))
            .isInstanceOf(InvalidPhaseTransitionException.class)
            .hasMessageContaining("initialization → decision_gate");

        assertThat(record.currentPhase()).isEqualTo(Phase.INITIALIZATION);
        assertThat(record.phaseHistory()).hasSize(1);
    }

    @Test
    void advance_ClockBehindLastEntry_ClampsToEnteredAt() {
        // Given
        Instant earlier = T0.minusSeconds(30);

        // When
        FeatureRecord advanced = PhaseStateMachine.advance(record, Phase.SIGNAL_ANALYSIS, null, earlier);

        // Then
        assertThat(advanced.phaseHistory().get(0).exitedAt()).isEqualTo(T0);
        assertThat(advanced.currentEntry().enteredAt()).isEqualTo(T0);
    }

    @Test
    void advance_FullChain_HistoryIsContiguousAndMonotonic() {
        // Given
        List<Phase> chain = List.of(Phase.SIGNAL_ANALYSIS, Phase.CONTEXT_DOC, Phase.PARALLEL_TRACKS,
            Phase.DECISION_GATE, Phase.PARALLEL_TRACKS, Phase.DECISION_GATE, Phase.OUTPUT_GENERATION, Phase.COMPLETE);
        FeatureRecord current = record;
        Instant at = T0;

        // When
        for (Phase phase : chain) {
            at = at.plus(Duration.ofMinutes(10));
            current = PhaseStateMachine.advance(current, phase, null, at);
        }

        // Then
        List<PhaseEntry> history = current.phaseHistory();
        assertThat(history).hasSize(chain.size() + 1);
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).enteredAt()).isEqualTo(history.get(i - 1).exitedAt());
            assertThat(history.get(i - 1).exitedAt()).isAfterOrEqualTo(history.get(i - 1).enteredAt());
        }
        assertThat(current.currentPhase()).isEqualTo(Phase.COMPLETE);
        assertThat(current.currentEntry().exitedAt()).isNull();
    }

    @Test
    void advance_FromTerminal_Throws() {
        // Given
        FeatureRecord archived = PhaseStateMachine.advance(record, Phase.ARCHIVED, null, T0.plusSeconds(1));

        // When & Then
        assertThatThrownBy(() -> PhaseStateMachine.advance(archived, Phase.SIGNAL_ANALYSIS, null, T0.plusSeconds(2)))
            .isInstanceOf(InvalidPhaseTransitionException.class)
            .hasMessageContaining("terminal phase");
    }
}
