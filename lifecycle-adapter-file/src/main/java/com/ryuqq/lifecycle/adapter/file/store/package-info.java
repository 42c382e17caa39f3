/**
 * File-backed FeatureStore adapter.
 *
 * <p>One YAML document per feature at {@code <root>/<slug>.yaml}. Writes go to a temp file in the
 * same directory and are moved into place, so readers never observe a partial document.</p>
 *
 * @see com.ryuqq.lifecycle.adapter.file.codec.FeatureRecordCodec
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.adapter.file.store;
