package com.ryuqq.lifecycle.core.exception;

/**
 * 요청한 slug의 Feature가 존재하지 않음.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class FeatureNotFoundException extends LifecycleException {

    private final String slug;

    public FeatureNotFoundException(String slug) {
        super(ErrorCategory.VALIDATION, "FEATURE_NOT_FOUND", "Feature not found: " + slug);
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
