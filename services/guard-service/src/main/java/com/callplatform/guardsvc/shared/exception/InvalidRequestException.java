package com.callplatform.guardsvc.shared.exception;

public final class InvalidRequestException extends GuardServiceException {

    private final String field;

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getErrorCode() {
        return "INVALID_REQUEST";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }
}
