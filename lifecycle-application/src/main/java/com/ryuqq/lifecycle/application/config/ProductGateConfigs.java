package com.ryuqq.lifecycle.application.config;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.config.GateConfigProvider;

import java.util.Map;

/**
 * 기본 설정과 제품별 재정의를 담는 {@link GateConfigProvider}.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param defaults 재정의가 없는 제품에 적용되는 설정
 * @param products 제품 ID별 완성된 설정 (기본값 위에 재정의가 적용된 상태)
 */
public record ProductGateConfigs(GateConfig defaults, Map<String, GateConfig> products) implements GateConfigProvider {

    public ProductGateConfigs {
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }
        products = products == null ? Map.of() : Map.copyOf(products);
    }

    @Override
    public GateConfig forProduct(String productId) {
        return products.getOrDefault(productId, defaults);
    }
}
