package com.len.songqueue.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "잘못된 요청입니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "알 수 없는 오류가 발생했습니다."),
    STORAGE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_ERROR", "저장소를 일시적으로 사용할 수 없습니다. 잠시 후 다시 시도해주세요."),

    // 카탈로그
    VENUE_NOT_FOUND(HttpStatus.NOT_FOUND, "VENUE_NOT_FOUND", "매장이 존재하지 않거나 비활성 상태입니다."),
    TRACK_NOT_FOUND(HttpStatus.NOT_FOUND, "TRACK_NOT_FOUND", "해당 매장에서 신청할 수 없는 곡입니다."),

    // 신청곡 접수
    PATRON_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "PATRON_LIMIT_EXCEEDED", "테이블당 대기 가능한 신청곡 수를 초과했습니다."),
    QUEUE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "QUEUE_LIMIT_EXCEEDED", "대기열이 가득 찼습니다. 잠시 후 다시 시도해주세요."),
    DUPLICATE_REQUEST(HttpStatus.CONFLICT, "DUPLICATE_REQUEST", "이미 신청한 곡입니다."),

    // 상태 전이
    REQUEST_NOT_FOUND(HttpStatus.NOT_FOUND, "REQUEST_NOT_FOUND", "신청곡이 존재하지 않습니다."),
    NOT_REQUEST_OWNER(HttpStatus.FORBIDDEN, "NOT_REQUEST_OWNER", "본인이 신청한 곡만 취소할 수 있습니다."),
    INVALID_TRANSITION(HttpStatus.CONFLICT, "INVALID_TRANSITION", "현재 상태에서 변경할 수 없는 상태입니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    /**
     * 같은 요청을 나중에 다시 보내면 성공할 수 있는 오류인지.
     */
    public boolean isRetryable() {
        return this == STORAGE_ERROR || this == PATRON_LIMIT_EXCEEDED || this == QUEUE_LIMIT_EXCEEDED;
    }
}
