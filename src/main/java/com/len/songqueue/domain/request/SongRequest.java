package com.len.songqueue.domain.request;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "song_request",
        indexes = {
                // ListPending / renumber 용
                @Index(name = "ix_request_venue_status_position", columnList = "venue_id, status, queue_position"),
                @Index(name = "ix_request_patron", columnList = "venue_id, patron_id, status")
        }
)
public class SongRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "venue_id", nullable = false, updatable = false)
    private Long venueId;

    @Column(name = "patron_id", nullable = false, updatable = false, length = 64)
    private String patronId;

    @Column(name = "track_id", nullable = false, updatable = false)
    private Long trackId;

    @Column(name = "table_tag", length = 50)
    private String tableTag;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RequestStatus status;

    // PENDING 일 때만 의미 있음. 대기열을 벗어나면 null
    @Column(name = "queue_position")
    private Integer queuePosition;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private LocalDateTime submittedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public static SongRequest newPending(Long venueId, String patronId, Long trackId, String tableTag,
                                         int queuePosition, LocalDateTime now) {
        if (queuePosition < 1) {
            throw new IllegalArgumentException("queuePosition must be >= 1: " + queuePosition);
        }
        SongRequest r = new SongRequest();
        r.venueId = venueId;
        r.patronId = patronId;
        r.trackId = trackId;
        r.tableTag = tableTag;
        r.status = RequestStatus.PENDING;
        r.queuePosition = queuePosition;
        r.submittedAt = now;
        r.updatedAt = now;
        return r;
    }

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }

    /**
     * 상태 전이 적용. 허용되지 않는 전이면 IllegalStateException.
     * 대기열에서 빠지는 경우(PENDING -> *) 비운 순번을 돌려주고, 아니면 null.
     * 순번 당기기(renumber)는 호출자가 같은 트랜잭션 안에서 처리해야 한다.
     */
    public Integer transitionTo(RequestStatus target, LocalDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("cannot move request " + id + " from " + status + " to " + target);
        }
        Integer vacated = isPending() ? queuePosition : null;

        switch (target) {
            case PLAYING -> this.startedAt = now;
            case COMPLETED -> this.completedAt = now;
            case CANCELLED -> this.cancelledAt = now;
            default -> throw new IllegalStateException("unexpected target " + target);
        }
        this.status = target;
        this.queuePosition = null;
        this.updatedAt = now;
        return vacated;
    }
}
