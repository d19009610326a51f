package com.len.songqueue.domain.venue;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "track",
        indexes = {
                @Index(name = "ix_track_venue", columnList = "venue_id, active")
        }
)
public class Track {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 어떤 매장의 카탈로그에 속한 곡인지
    @Column(name = "venue_id", nullable = false)
    private Long venueId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 200)
    private String artist;

    @Column(name = "duration_seconds")
    private Integer durationSeconds;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "times_requested", nullable = false)
    private long timesRequested;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public static Track create(Long venueId, String title, String artist, Integer durationSeconds) {
        Track track = new Track();
        track.venueId = venueId;
        track.title = title;
        track.artist = artist;
        track.durationSeconds = durationSeconds;
        track.active = true;
        track.timesRequested = 0L;
        track.createdAt = LocalDateTime.now();
        return track;
    }

    public boolean isRequestableAt(Long venueId) {
        return active && this.venueId.equals(venueId);
    }

    public void increaseTimesRequested() {
        this.timesRequested++;
    }

    public void deactivate() {
        this.active = false;
    }
}
