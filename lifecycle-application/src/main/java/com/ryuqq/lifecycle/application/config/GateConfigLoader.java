package com.ryuqq.lifecycle.application.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.exception.InvalidPayloadException;
import com.ryuqq.lifecycle.core.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML 게이트 설정 로더.
 *
 * <p><strong>형식:</strong></p>
 * <pre>
 * defaults:
 *   context_review_threshold: 60
 *   figma_required: true
 * products:
 *   meal-kit:
 *     required_bc_approvers: [Dave Manager, Jack Approver]
 * </pre>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>누락된 키는 기본값 ({@link GateConfig#defaults()}), 제품 블록은 defaults 블록 위에 적용</li>
 *   <li>알 수 없는 키는 WARN 로그 후 무시</li>
 *   <li>잘못된 값(형식, 범위)은 {@link InvalidPayloadException}</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class GateConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(GateConfigLoader.class);

    static final String CONTEXT_DRAFT_THRESHOLD = "context_draft_threshold";
    static final String CONTEXT_REVIEW_THRESHOLD = "context_review_threshold";
    static final String CONTEXT_APPROVED_THRESHOLD = "context_approved_threshold";
    static final String CONTEXT_MAX_CHALLENGE_ITERATIONS = "context_max_challenge_iterations";
    static final String FIGMA_REQUIRED = "figma_required";
    static final String REQUIRED_BC_APPROVERS = "required_bc_approvers";
    static final String DUPLICATE_THRESHOLD = "duplicate_threshold";

    private static final Set<String> KNOWN_KEYS = Set.of(
        CONTEXT_DRAFT_THRESHOLD, CONTEXT_REVIEW_THRESHOLD, CONTEXT_APPROVED_THRESHOLD,
        CONTEXT_MAX_CHALLENGE_ITERATIONS, FIGMA_REQUIRED, REQUIRED_BC_APPROVERS, DUPLICATE_THRESHOLD);

    private final ObjectMapper mapper = new YAMLMapper();

    /**
     * 파일에서 설정 로드. 파일이 없으면 기본 설정.
     *
     * @param path config.yaml 경로
     * @return 제품별 설정
     * @throws PersistenceException 파일을 읽을 수 없는 경우
     * @throws InvalidPayloadException 설정 값이 잘못된 경우
     */
    public ProductGateConfigs load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (!Files.exists(path)) {
            log.info("Gate config {} not found, using defaults", path);
            return new ProductGateConfigs(GateConfig.defaults(), Map.of());
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read gate config " + path, e);
        }
    }

    /**
     * YAML 문자열에서 설정 로드.
     *
     * @param yaml 설정 YAML (빈 문서 허용)
     * @return 제품별 설정
     * @throws InvalidPayloadException 형식이나 값이 잘못된 경우
     */
    public ProductGateConfigs parse(String yaml) {
        JsonNode root;
        try {
            root = mapper.readTree(yaml == null ? "" : yaml);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Unparseable gate config: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new ProductGateConfigs(GateConfig.defaults(), Map.of());
        }
        if (!root.isObject()) {
            throw new InvalidPayloadException("Gate config must be a mapping");
        }

        warnUnknown(root, Set.of("defaults", "products"), "gate config");
        GateConfig defaults = apply(GateConfig.defaults(), root.path("defaults"), "defaults");

        Map<String, GateConfig> products = new LinkedHashMap<>();
        JsonNode productsNode = root.path("products");
        if (!productsNode.isMissingNode() && !productsNode.isNull()) {
            if (!productsNode.isObject()) {
                throw new InvalidPayloadException("'products' must be a mapping");
            }
            Iterator<Map.Entry<String, JsonNode>> entries = productsNode.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                products.put(entry.getKey(), apply(defaults, entry.getValue(), "products." + entry.getKey()));
            }
        }
        log.debug("Loaded gate config with {} product override(s)", products.size());
        return new ProductGateConfigs(defaults, products);
    }

    private GateConfig apply(GateConfig base, JsonNode block, String location) {
        if (block.isMissingNode() || block.isNull()) {
            return base;
        }
        if (!block.isObject()) {
            throw new InvalidPayloadException("'" + location + "' must be a mapping");
        }
        warnUnknown(block, KNOWN_KEYS, location);

        try {
            return new GateConfig(
                number(block, CONTEXT_DRAFT_THRESHOLD, base.contextDraftThreshold(), location),
                number(block, CONTEXT_REVIEW_THRESHOLD, base.contextReviewThreshold(), location),
                number(block, CONTEXT_APPROVED_THRESHOLD, base.contextApprovedThreshold(), location),
                integer(block, CONTEXT_MAX_CHALLENGE_ITERATIONS, base.contextMaxChallengeIterations(), location),
                bool(block, FIGMA_REQUIRED, base.figmaRequired(), location),
                names(block, REQUIRED_BC_APPROVERS, base.requiredBcApprovers(), location),
                number(block, DUPLICATE_THRESHOLD, base.duplicateThreshold(), location));
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException("Invalid gate config in '" + location + "': " + e.getMessage(), e);
        }
    }

    private static double number(JsonNode block, String key, double fallback, String location) {
        JsonNode value = block.get(key);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isNumber()) {
            throw invalid(location, key, "must be a number", value);
        }
        return value.doubleValue();
    }

    private static int integer(JsonNode block, String key, int fallback, String location) {
        JsonNode value = block.get(key);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw invalid(location, key, "must be an integer", value);
        }
        return value.intValue();
    }

    private static boolean bool(JsonNode block, String key, boolean fallback, String location) {
        JsonNode value = block.get(key);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isBoolean()) {
            throw invalid(location, key, "must be true or false", value);
        }
        return value.booleanValue();
    }

    private static List<String> names(JsonNode block, String key, List<String> fallback, String location) {
        JsonNode value = block.get(key);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isArray()) {
            throw invalid(location, key, "must be a list of names", value);
        }
        List<String> names = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw invalid(location, key, "must be a list of names", value);
            }
            names.add(item.asText().trim());
        }
        return names;
    }

    private static void warnUnknown(JsonNode block, Set<String> known, String location) {
        Iterator<String> names = block.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                log.warn("Ignoring unknown gate config key '{}' in {}", name, location);
            }
        }
    }

    private static InvalidPayloadException invalid(String location, String key, String problem, JsonNode value) {
        return new InvalidPayloadException(
            String.format("Invalid gate config '%s.%s': %s (got %s)", location, key, problem, value));
    }
}
