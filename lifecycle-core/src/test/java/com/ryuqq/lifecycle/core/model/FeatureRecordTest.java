package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.statemachine.Phase;
import com.ryuqq.lifecycle.core.track.Tracks;
import com.ryuqq.lifecycle.core.track.TrackType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FeatureRecord 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class FeatureRecordTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private FeatureRecord record;

    @BeforeEach
    void setUp() {
        record = FeatureRecord.create(FeatureSlug.generate("meal-kit", "OTP Checkout Recovery"),
            "OTP Checkout Recovery", ProductId.of("meal-kit"), "acme", T0, Map.of("priority", "P1"));
    }

    // ========== 생성 ==========

    @Test
    void create_StartsInInitializationWithAllTracksNotStarted() {
        assertThat(record.schemaVersion()).isEqualTo(FeatureRecord.CURRENT_SCHEMA_VERSION);
        assertThat(record.slug()).isEqualTo("mea-otp-checkout-recovery");
        assertThat(record.currentPhase()).isEqualTo(Phase.INITIALIZATION);
        assertThat(record.phaseHistory()).hasSize(1);
        assertThat(record.currentEntry().metadata()).containsEntry("priority", "P1");
        assertThat(record.tracks()).isEqualTo(Tracks.initial());
        for (TrackType type : TrackType.values()) {
            assertThat(record.tracks().state(type).status().toString()).isEqualTo("not_started");
        }
        assertThat(record.artifacts()).isEmpty();
        assertThat(record.decisions()).isEmpty();
        assertThat(record.aliases()).isEmpty();
    }

    @Test
    void constructor_HistoryNotEndingInCurrentPhase_Throws() {
        List<PhaseEntry> history = List.of(PhaseEntry.open(Phase.INITIALIZATION, T0, null));

        assertThatThrownBy(() -> new FeatureRecord(2, "mea-otp", "OTP", "meal-kit", null, T0,
            Phase.SIGNAL_ANALYSIS, history, Tracks.initial(), null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not match currentPhase");
    }

    @Test
    void constructor_OverlappingHistory_Throws() {
        List<PhaseEntry> history = List.of(
            new PhaseEntry(Phase.INITIALIZATION, T0, T0.plusSeconds(60), null),
            PhaseEntry.open(Phase.SIGNAL_ANALYSIS, T0.plusSeconds(30), null));

        assertThatThrownBy(() -> new FeatureRecord(2, "mea-otp", "OTP", "meal-kit", null, T0,
            Phase.SIGNAL_ANALYSIS, history, Tracks.initial(), null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("enters before the previous entry exits");
    }

    @Test
    void constructor_OpenEntryBeforeLast_Throws() {
        List<PhaseEntry> history = List.of(
            PhaseEntry.open(Phase.INITIALIZATION, T0, null),
            PhaseEntry.open(Phase.SIGNAL_ANALYSIS, T0.plusSeconds(30), null));

        assertThatThrownBy(() -> new FeatureRecord(2, "mea-otp", "OTP", "meal-kit", null, T0,
            Phase.SIGNAL_ANALYSIS, history, Tracks.initial(), null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("is not closed");
    }

    @Test
    void constructor_InvalidSlugOrProduct_Throws() {
        List<PhaseEntry> history = List.of(PhaseEntry.open(Phase.INITIALIZATION, T0, null));

        assertThatThrownBy(() -> new FeatureRecord(2, "Bad Slug", "OTP", "meal-kit", null, T0,
            Phase.INITIALIZATION, history, Tracks.initial(), null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeatureRecord(2, "mea-otp", "OTP", "meal kit", null, T0,
            Phase.INITIALIZATION, history, Tracks.initial(), null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== 변경 (불변 복사) ==========

    @Test
    void withArtifact_AddsAndReplacesWithoutTouchingOriginal() {
        // When
        FeatureRecord first = record.withArtifact(ArtifactType.FIGMA, "https://figma.com/file/a");
        FeatureRecord second = first.withArtifact(ArtifactType.FIGMA, "https://figma.com/file/b");

        // Then
        assertThat(record.artifacts()).isEmpty();
        assertThat(first.artifacts()).containsEntry(ArtifactType.FIGMA, "https://figma.com/file/a");
        assertThat(second.artifacts()).containsEntry(ArtifactType.FIGMA, "https://figma.com/file/b").hasSize(1);
    }

    @Test
    void appendDecision_KeepsEarlierDecisions() {
        // Given
        Decision first = new Decision("decision_gate", "Not yet", null, "alice", T0, Map.of("outcome", "NO_GO"));
        Decision second = new Decision("decision_gate", "Ship it", null, "alice", T0.plusSeconds(10), Map.of());

        // When
        FeatureRecord updated = record.appendDecision(first).appendDecision(second);

        // Then
        assertThat(updated.decisions()).containsExactly(first, second);
    }

    @Test
    void withAlias_GrowsOnlyAndIgnoresDuplicatesAndTitle() {
        // When
        FeatureRecord updated = record
            .withAlias("Checkout OTP fallback")
            .withAlias("Checkout OTP fallback")
            .withAlias("OTP Checkout Recovery");

        // Then
        assertThat(updated.aliases()).containsExactly("Checkout OTP fallback");
        assertThat(record.aliases()).isEmpty();
    }

    @Test
    void collections_AreUnmodifiable() {
        assertThatThrownBy(() -> record.decisions().add(null)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> record.phaseHistory().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> record.artifacts().put(ArtifactType.GDOCS, "x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void withPhase_ShorterHistory_Throws() {
        assertThatThrownBy(() -> record.withPhase(Phase.INITIALIZATION, List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("appended");
    }
}
