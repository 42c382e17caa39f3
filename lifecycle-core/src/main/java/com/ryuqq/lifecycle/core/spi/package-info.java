/**
 * Service Provider Interface (SPI) package.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.FeatureStore} - Feature record persistence</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.BrainEntityCreator} - Knowledge-base entity creation at start</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.OutputGenerator} - Artifact generation after approval</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (lifecycle-adapter-inmemory, lifecycle-adapter-file) implement
 * {@code FeatureStore}. The two collaborators are provided by the calling layer; the core only calls them.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.spi;
