package com.len.songqueue.api.request.dto;

import com.len.songqueue.application.queue.RequestView;

import java.time.LocalDateTime;

public record SongRequestResponse(
        Long id,
        Long venueId,
        TrackSummary track,
        String tableTag,
        String status,
        Integer queuePosition,
        Integer estimatedWaitMinutes,
        LocalDateTime submittedAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        LocalDateTime cancelledAt
) {
    public static SongRequestResponse from(RequestView v) {
        return new SongRequestResponse(
                v.requestId(),
                v.venueId(),
                new TrackSummary(v.trackId(), v.trackTitle(), v.trackArtist()),
                v.tableTag(),
                v.status().lowerName(),
                v.queuePosition(),
                v.estimatedWaitMinutes(),
                v.submittedAt(),
                v.startedAt(),
                v.completedAt(),
                v.cancelledAt()
        );
    }

    public record TrackSummary(Long id, String title, String artist) {}
}
