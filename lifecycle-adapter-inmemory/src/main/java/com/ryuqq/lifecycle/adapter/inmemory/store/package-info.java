/**
 * In-memory FeatureStore adapter.
 *
 * <p>{@link com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryFeatureStore} keeps records in a
 * {@link java.util.concurrent.ConcurrentHashMap} keyed by slug. Records are immutable, so stored
 * instances are shared with callers without copying.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Intended for contract tests and engine unit tests</li>
 * </ul>
 *
 * @see com.ryuqq.lifecycle.core.spi.FeatureStore
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.adapter.inmemory.store;
