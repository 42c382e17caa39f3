package com.ryuqq.lifecycle.core.config;

/**
 * Product-scoped gate configuration lookup.
 *
 * <p>Engines receive a provider instead of reading process-wide configuration, so each
 * evaluation uses an explicit {@link GateConfig} value.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface GateConfigProvider {

    /**
     * Resolves the configuration for a product.
     *
     * <p>Products without overrides receive the defaults.</p>
     *
     * @param productId the product identifier
     * @return the effective configuration, never null
     */
    GateConfig forProduct(String productId);

    /**
     * Provider that serves the same configuration for every product.
     *
     * @param config the configuration
     * @return a fixed provider
     * @throws IllegalArgumentException if config is null
     */
    static GateConfigProvider fixed(GateConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return productId -> config;
    }
}
