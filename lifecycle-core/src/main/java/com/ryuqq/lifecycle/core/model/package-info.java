/**
 * Feature 레코드와 값 객체.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.model;
