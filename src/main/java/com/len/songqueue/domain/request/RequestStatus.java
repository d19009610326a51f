package com.len.songqueue.domain.request;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 신청곡 상태와 허용되는 전이.
 * PENDING -> PLAYING -> {COMPLETED, CANCELLED}, PENDING -> CANCELLED.
 * COMPLETED / CANCELLED 는 종료 상태라 어디로도 이동할 수 없다.
 */
public enum RequestStatus {

    PENDING,
    PLAYING,
    COMPLETED,
    CANCELLED;

    /** 중복 신청 판단에 쓰이는 "진행 중" 상태 */
    public static final Set<RequestStatus> OUTSTANDING = EnumSet.of(PENDING, PLAYING);

    public Set<RequestStatus> nextStatuses() {
        return switch (this) {
            case PENDING -> EnumSet.of(PLAYING, CANCELLED);
            case PLAYING -> EnumSet.of(COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(RequestStatus.class);
        };
    }

    public boolean canTransitionTo(RequestStatus target) {
        return target != null && nextStatuses().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * "pending", "PLAYING" 등 대소문자 무관하게 파싱. 모르는 값이면 IllegalArgumentException.
     */
    public static RequestStatus from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status is blank");
        }
        return RequestStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public String lowerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
