/**
 * 제품별 게이트 설정 로딩 (config.yaml).
 *
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.application.config;
