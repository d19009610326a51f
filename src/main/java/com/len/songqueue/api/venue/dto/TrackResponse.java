package com.len.songqueue.api.venue.dto;

import com.len.songqueue.domain.venue.Track;

public record TrackResponse(
        Long id,
        String title,
        String artist,
        Integer durationSeconds
) {
    public static TrackResponse from(Track t) {
        return new TrackResponse(t.getId(), t.getTitle(), t.getArtist(), t.getDurationSeconds());
    }
}
