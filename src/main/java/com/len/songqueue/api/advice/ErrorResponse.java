package com.len.songqueue.api.advice;

import com.len.songqueue.common.exception.ErrorCode;

import java.time.LocalDateTime;

public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String code,
        String message,
        boolean retryable,
        String path
) {
    public static ErrorResponse of(ErrorCode errorCode, String message, String path) {
        return new ErrorResponse(
                LocalDateTime.now(),
                errorCode.getHttpStatus().value(),
                errorCode.getCode(),
                message == null ? errorCode.getMessage() : message,
                errorCode.isRetryable(),
                path
        );
    }
}
