/**
 * YAML encoding of feature records.
 *
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.adapter.file.codec.FeatureRecordCodec}: Jackson YAML mapping, snake_case keys</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.file.codec.SchemaMigrator}: upgrades schema v1 documents on read</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.adapter.file.codec;
