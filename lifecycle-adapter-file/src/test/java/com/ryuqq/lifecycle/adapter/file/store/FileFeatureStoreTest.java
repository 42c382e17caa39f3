package com.ryuqq.lifecycle.adapter.file.store;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.exception.CorruptRecordException;
import com.ryuqq.lifecycle.core.exception.UnsupportedSchemaVersionException;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.statemachine.Phase;
import com.ryuqq.lifecycle.testkit.fixture.FeatureRecordFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * FileFeatureStore 파일 포맷 및 오류 처리 테스트.
 *
 * <p>계약 테스트가 다루지 않는 파일 수준 동작을 검증합니다:</p>
 * <ul>
 *   <li>저장 포맷 (snake_case, 소문자 enum, schema_version)</li>
 *   <li>임시 파일 정리</li>
 *   <li>손상/미래 버전 레코드 보고</li>
 *   <li>레거시 레코드 로드 후 재저장 시 v2로 기록</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class FileFeatureStoreTest {

    @TempDir
    Path root;

    private FileFeatureStore store;

    @BeforeEach
    void setUp() {
        store = new FileFeatureStore(root);
    }

    // ========== 저장 포맷 ==========

    @Test
    void save_WritesSnakeCaseYamlNamedBySlug() throws IOException {
        // Given
        FeatureRecord record = FeatureRecordFixtures.readyForDecision(GateConfig.defaults());

        // When
        store.save(record);

        // Then
        Path file = root.resolve("mea-otp-checkout-recovery.yaml");
        assertTrue(Files.isRegularFile(file));
        String yaml = Files.readString(file);
        assertThat(yaml)
            .contains("schema_version: 2")
            .contains("current_phase: \"parallel_tracks\"")
            .contains("business_case:")
            .contains("entered_at: \"2026-03-02T09:00:00Z\"")
            .doesNotContain("businessCase")
            .doesNotContain("PARALLEL_TRACKS");
    }

    @Test
    void save_LeavesNoTemporaryFiles() throws IOException {
        store.save(FeatureRecordFixtures.newFeature("mea-gift-cards", "Gift Cards"));
        store.save(FeatureRecordFixtures.newFeature("mea-gift-cards", "Gift Cards"));

        try (Stream<Path> files = Files.list(root)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                .containsExactly("mea-gift-cards.yaml");
        }
    }

    @Test
    void save_CreatesMissingRootDirectory() {
        FileFeatureStore nested = new FileFeatureStore(root.resolve("a").resolve("b"));

        nested.save(FeatureRecordFixtures.newFeature("mea-gift-cards", "Gift Cards"));

        assertTrue(Files.isRegularFile(root.resolve("a/b/mea-gift-cards.yaml")));
    }

    // ========== 손상된 레코드 ==========

    @Test
    void load_UnparseableYaml_ThrowsCorruptRecord() throws IOException {
        Files.writeString(root.resolve("mea-broken.yaml"), "slug: [unclosed\n");

        assertThatThrownBy(() -> store.load("mea-broken"))
            .isInstanceOf(CorruptRecordException.class)
            .hasMessageContaining("mea-broken.yaml");
    }

    @Test
    void load_InvalidRecord_ThrowsCorruptRecordWithCause() throws IOException {
        // phase history does not end in the current phase
        Files.writeString(root.resolve("mea-broken.yaml"), String.join("\n",
            "schema_version: 2",
            "slug: mea-broken",
            "title: Broken",
            "product_id: meal-kit",
            "created_at: \"2026-03-02T09:00:00Z\"",
            "current_phase: \"context_doc\"",
            "phase_history:",
            "  - phase: \"initialization\"",
            "    entered_at: \"2026-03-02T09:00:00Z\"",
            "tracks: {}",
            ""));

        assertThatThrownBy(() -> store.load("mea-broken"))
            .isInstanceOf(CorruptRecordException.class)
            .hasCauseInstanceOf(Exception.class);
    }

    @Test
    void load_SlugDiffersFromFileName_ThrowsCorruptRecord() throws IOException {
        store.save(FeatureRecordFixtures.newFeature("mea-gift-cards", "Gift Cards"));
        Files.move(root.resolve("mea-gift-cards.yaml"), root.resolve("mea-renamed.yaml"));

        assertThatThrownBy(() -> store.load("mea-renamed"))
            .isInstanceOf(CorruptRecordException.class)
            .hasMessageContaining("does not match file name");
    }

    @Test
    void load_NewerSchema_ThrowsUnsupportedSchemaVersion() throws IOException {
        store.save(FeatureRecordFixtures.newFeature("mea-gift-cards", "Gift Cards"));
        Path file = root.resolve("mea-gift-cards.yaml");
        Files.writeString(file, Files.readString(file).replace("schema_version: 2", "schema_version: 3"));

        assertThatThrownBy(() -> store.load("mea-gift-cards"))
            .isInstanceOf(UnsupportedSchemaVersionException.class);
    }

    @Test
    void load_InvalidSlug_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> store.load("../etc/passwd"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== 레거시 레코드 ==========

    @Test
    void load_LegacyRecord_MigratesInMemoryUntilNextSave() throws IOException {
        // Given
        Path file = root.resolve("mea-otp-checkout-recovery.yaml");
        try (InputStream in = getClass().getResourceAsStream("/legacy/mea-otp-checkout-recovery.yaml")) {
            Files.write(file, in.readAllBytes());
        }
        String original = Files.readString(file, StandardCharsets.UTF_8);

        // When
        FeatureRecord loaded = store.load("mea-otp-checkout-recovery");

        // Then
        assertEquals(Phase.PARALLEL_TRACKS, loaded.currentPhase());
        assertEquals(original, Files.readString(file, StandardCharsets.UTF_8));

        store.save(loaded);
        assertThat(Files.readString(file)).contains("schema_version: 2").doesNotContain("engine:");
        assertEquals(loaded, store.load("mea-otp-checkout-recovery"));
    }

    @Test
    void findByProduct_IncludesMigratedLegacyRecords() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/legacy/mea-otp-checkout-recovery.yaml")) {
            Files.write(root.resolve("mea-otp-checkout-recovery.yaml"), in.readAllBytes());
        }
        store.save(FeatureRecordFixtures.newFeature("mea-gift-cards", "Gift Cards"));

        assertThat(store.findByProduct("meal-kit")).extracting(FeatureRecord::slug)
            .containsExactly("mea-gift-cards", "mea-otp-checkout-recovery");
    }
}
