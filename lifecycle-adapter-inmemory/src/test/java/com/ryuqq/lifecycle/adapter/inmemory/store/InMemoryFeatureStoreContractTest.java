package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.spi.FeatureStore;
import com.ryuqq.lifecycle.testkit.contract.AbstractFeatureStoreContractTest;
import com.ryuqq.lifecycle.testkit.fixture.FeatureRecordFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * InMemoryFeatureStore 계약 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class InMemoryFeatureStoreContractTest extends AbstractFeatureStoreContractTest {

    @Override
    protected FeatureStore createStore() {
        return new InMemoryFeatureStore();
    }

    @Test
    void clear_RemovesAllRecords() {
        InMemoryFeatureStore inMemory = (InMemoryFeatureStore) store;
        inMemory.save(FeatureRecordFixtures.newFeature("mea-meal-swaps", "Meal Swaps"));
        inMemory.save(FeatureRecordFixtures.newFeature("mea-gift-cards", "Gift Cards"));
        assertEquals(2, inMemory.size());

        inMemory.clear();

        assertEquals(0, inMemory.size());
    }

    @Test
    void load_BlankSlug_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> store.load(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("slug cannot be null or blank");
    }
}
