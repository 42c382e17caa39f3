package com.ryuqq.lifecycle.core.exception;

/**
 * 동일한 slug의 Feature가 이미 존재함.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class FeatureAlreadyExistsException extends LifecycleException {

    private final String slug;

    public FeatureAlreadyExistsException(String slug) {
        super(ErrorCategory.VALIDATION, "FEATURE_ALREADY_EXISTS", "Feature already exists: " + slug);
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
