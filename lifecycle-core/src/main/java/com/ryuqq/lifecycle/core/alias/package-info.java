/**
 * 제목 정규화와 중복 Feature 탐지.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.alias;
