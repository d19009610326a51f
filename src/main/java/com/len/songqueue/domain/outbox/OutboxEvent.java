package com.len.songqueue.domain.outbox;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 신청곡 이벤트를 DB 트랜잭션과 함께 기록해두고, 커밋 이후 Kafka로 내보내기 위한 테이블.
 * 알림/통계 같은 외부 협력자는 대기열 트랜잭션을 기다리지 않는다.
 */
@Entity
@Table(
        name = "outbox_event",
        indexes = {
                @Index(name = "ix_outbox_status_retry", columnList = "status, next_retry_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    private static final int DEFAULT_MAX_RETRY = 10;

    @Id
    @Column(name = "event_id", length = 64, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "event_type", length = 60, nullable = false, updatable = false)
    private String eventType;

    @Column(name = "topic", length = 120, nullable = false)
    private String topic;

    // Kafka 파티션 키. 같은 매장 이벤트는 순서를 유지한다
    @Column(name = "event_key", length = 120, nullable = false)
    private String eventKey;

    @Column(name = "payload", columnDefinition = "json", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private OutboxStatus status;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retry", nullable = false)
    private int maxRetry;

    @Column(name = "next_retry_at", nullable = false)
    private LocalDateTime nextRetryAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static OutboxEvent pending(String eventId, String eventType, String topic, String eventKey,
                                      String payload, LocalDateTime now) {
        OutboxEvent e = new OutboxEvent();
        e.eventId = eventId;
        e.eventType = eventType;
        e.topic = topic;
        e.eventKey = eventKey;
        e.payload = payload;
        e.status = OutboxStatus.PENDING;
        e.retryCount = 0;
        e.maxRetry = DEFAULT_MAX_RETRY;
        e.nextRetryAt = now;
        e.createdAt = now;
        e.updatedAt = now;
        return e;
    }

    public void markPublished(LocalDateTime now) {
        this.status = OutboxStatus.PUBLISHED;
        this.publishedAt = now;
        this.lastError = null;
        this.updatedAt = now;
    }

    /**
     * 발행 실패. maxRetry 에 닿으면 FAILED, 아니면 지수 백오프(2,4,8..최대 60초) 후 재시도.
     */
    public void markRetryOrFail(String errorMessage, LocalDateTime now) {
        this.retryCount += 1;
        this.lastError = truncate(errorMessage);
        this.updatedAt = now;

        if (this.retryCount >= this.maxRetry) {
            this.status = OutboxStatus.FAILED;
            return;
        }

        int backoffSeconds = Math.min(60, 1 << Math.min(6, this.retryCount));
        this.status = OutboxStatus.PENDING;
        this.nextRetryAt = now.plusSeconds(backoffSeconds);
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() <= 500 ? s : s.substring(0, 500);
    }
}
