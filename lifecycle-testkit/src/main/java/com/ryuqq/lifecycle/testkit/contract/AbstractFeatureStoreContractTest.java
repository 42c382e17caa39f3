package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.exception.FeatureNotFoundException;
import com.ryuqq.lifecycle.core.model.ArtifactType;
import com.ryuqq.lifecycle.core.model.Decision;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.spi.FeatureStore;
import com.ryuqq.lifecycle.core.statemachine.Phase;
import com.ryuqq.lifecycle.core.statemachine.PhaseStateMachine;
import com.ryuqq.lifecycle.testkit.fixture.FeatureRecordFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract contract test for {@link FeatureStore} implementations.
 *
 * <p>Every adapter extends this class and supplies a fresh, empty store. The contract
 * covers the behaviour the engine relies on.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>save followed by load returns an equal record</li>
 *   <li>load of an unknown slug throws {@link FeatureNotFoundException}</li>
 *   <li>save replaces the previous version (last writer wins)</li>
 *   <li>findByProduct returns only that product's records, ordered by slug</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractFeatureStoreContractTest {
 *     {@literal @}Override
 *     protected FeatureStore createStore() {
 *         return new MyStore();
 *     }
 * }
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public abstract class AbstractFeatureStoreContractTest {

    protected FeatureStore store;

    /**
     * Creates the store under test. Called before each test; must return an empty store.
     */
    protected abstract FeatureStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    // ========== Round trip ==========

    @Test
    void save_NewRecord_LoadReturnsEqualRecord() {
        // Given
        FeatureRecord record = FeatureRecordFixtures.newFeature("mea-otp-checkout-recovery", "OTP Checkout Recovery");

        // When
        store.save(record);
        FeatureRecord loaded = store.load("mea-otp-checkout-recovery");

        // Then
        assertEquals(record, loaded);
    }

    @Test
    void save_FullyPopulatedRecord_LoadPreservesTracksDecisionsAndArtifacts() {
        // Given
        FeatureRecord record = FeatureRecordFixtures.readyForDecision(GateConfig.defaults())
            .withArtifact(ArtifactType.JIRA_EPIC, "MEA-412")
            .withAlias("Checkout OTP fallback")
            .appendDecision(new Decision("context_doc", "Approved v3", "Score 90", "pm",
                FeatureRecordFixtures.T0.plusSeconds(500), Map.of("score", 90, "reviewers", List.of("a", "b"))));

        // When
        store.save(record);
        FeatureRecord loaded = store.load(record.slug());

        // Then
        assertEquals(record.tracks(), loaded.tracks());
        assertEquals(record.decisions(), loaded.decisions());
        assertEquals(record.artifacts(), loaded.artifacts());
        assertEquals(record.aliases(), loaded.aliases());
        assertEquals(record, loaded);
    }

    @Test
    void save_AdvancedPhase_LoadPreservesPhaseHistoryOrder() {
        // Given
        FeatureRecord record = FeatureRecordFixtures.inParallelTracks("mea-saved-carts", "Saved Carts");
        record = PhaseStateMachine.advance(record, Phase.DEFERRED, Map.of("reason", "Q3"),
            FeatureRecordFixtures.T0.plusSeconds(900));

        // When
        store.save(record);
        FeatureRecord loaded = store.load("mea-saved-carts");

        // Then
        assertEquals(Phase.DEFERRED, loaded.currentPhase());
        assertThat(loaded.phaseHistory()).extracting(e -> e.phase())
            .containsExactly(Phase.INITIALIZATION, Phase.SIGNAL_ANALYSIS, Phase.CONTEXT_DOC,
                Phase.PARALLEL_TRACKS, Phase.DEFERRED);
        assertEquals(record.phaseHistory(), loaded.phaseHistory());
    }

    // ========== Not found / exists ==========

    @Test
    void load_UnknownSlug_ThrowsFeatureNotFound() {
        assertThatThrownBy(() -> store.load("mea-does-not-exist"))
            .isInstanceOf(FeatureNotFoundException.class)
            .hasMessageContaining("mea-does-not-exist");
    }

    @Test
    void exists_ReflectsSavedRecords() {
        // Given
        FeatureRecord record = FeatureRecordFixtures.newFeature("mea-gift-cards", "Gift Cards");

        // When / Then
        assertFalse(store.exists("mea-gift-cards"));
        store.save(record);
        assertTrue(store.exists("mea-gift-cards"));
        assertFalse(store.exists("mea-gift"));
    }

    @Test
    void save_NullRecord_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> store.save(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Last writer wins ==========

    @Test
    void save_SameSlugTwice_LastWriteWins() {
        // Given
        FeatureRecord first = FeatureRecordFixtures.newFeature("mea-gift-cards", "Gift Cards");
        FeatureRecord second = PhaseStateMachine.advance(first, Phase.SIGNAL_ANALYSIS, null,
            FeatureRecordFixtures.T0.plusSeconds(60));

        // When
        store.save(first);
        store.save(second);

        // Then
        FeatureRecord loaded = store.load("mea-gift-cards");
        assertEquals(Phase.SIGNAL_ANALYSIS, loaded.currentPhase());
        assertEquals(second, loaded);
    }

    // ========== findByProduct ==========

    @Test
    void findByProduct_ReturnsOnlyThatProductOrderedBySlug() {
        // Given
        store.save(FeatureRecordFixtures.newFeature("mea-zucchini-boxes", "Zucchini Boxes"));
        store.save(FeatureRecordFixtures.newFeature("mea-allergy-filters", "Allergy Filters"));
        store.save(FeatureRecordFixtures.newFeature("pet-vet-chat", "Vet Chat", "pet-care"));
        store.save(FeatureRecordFixtures.newFeature("mea-meal-swaps", "Meal Swaps"));

        // When
        List<FeatureRecord> found = store.findByProduct(FeatureRecordFixtures.PRODUCT);

        // Then
        assertThat(found).extracting(FeatureRecord::slug)
            .containsExactly("mea-allergy-filters", "mea-meal-swaps", "mea-zucchini-boxes");
    }

    @Test
    void findByProduct_UnknownProduct_ReturnsEmpty() {
        store.save(FeatureRecordFixtures.newFeature("mea-meal-swaps", "Meal Swaps"));

        assertThat(store.findByProduct("no-such-product")).isEmpty();
    }
}
