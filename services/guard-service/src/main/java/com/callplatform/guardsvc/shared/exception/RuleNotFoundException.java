package com.callplatform.guardsvc.shared.exception;

public final class RuleNotFoundException extends GuardServiceException {

    public RuleNotFoundException(String ruleId) {
        super("Rule not found: " + ruleId);
    }

    @Override
    public String getErrorCode() {
        return "RULE_NOT_FOUND";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}
