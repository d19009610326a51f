package com.len.songqueue.application.queue;

import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.SongRequest;
import com.len.songqueue.domain.venue.Track;

import java.time.LocalDateTime;

public record RequestView(
        Long requestId,
        Long venueId,
        String patronId,
        Long trackId,
        String trackTitle,
        String trackArtist,
        String tableTag,
        RequestStatus status,
        Integer queuePosition,   // PENDING 이 아니면 null
        Integer estimatedWaitMinutes,
        LocalDateTime submittedAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        LocalDateTime cancelledAt
) {
    public static RequestView of(SongRequest r, Track track, WaitTimeEstimator estimator) {
        return new RequestView(
                r.getId(),
                r.getVenueId(),
                r.getPatronId(),
                r.getTrackId(),
                track == null ? null : track.getTitle(),
                track == null ? null : track.getArtist(),
                r.getTableTag(),
                r.getStatus(),
                r.getQueuePosition(),
                r.isPending() ? estimator.estimateMinutes(r.getQueuePosition()) : null,
                r.getSubmittedAt(),
                r.getStartedAt(),
                r.getCompletedAt(),
                r.getCancelledAt()
        );
    }
}
