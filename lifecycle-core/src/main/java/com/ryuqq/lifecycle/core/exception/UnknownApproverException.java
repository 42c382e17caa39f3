package com.ryuqq.lifecycle.core.exception;

import java.util.List;

/**
 * 설정된 필수 승인자 목록에 없는 승인자.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class UnknownApproverException extends LifecycleException {

    private final String approver;
    private final List<String> configuredApprovers;

    public UnknownApproverException(String approver, List<String> configuredApprovers) {
        super(ErrorCategory.VALIDATION, "UNKNOWN_APPROVER",
            "Unknown approver '" + approver + "'. Configured approvers: " + configuredApprovers);
        this.approver = approver;
        this.configuredApprovers = List.copyOf(configuredApprovers);
    }

    public String getApprover() {
        return approver;
    }

    public List<String> getConfiguredApprovers() {
        return configuredApprovers;
    }
}
