package com.len.songqueue.api.venue.dto;

import com.len.songqueue.domain.venue.Venue;

public record VenueResponse(
        Long id,
        String slug,
        String name,
        int maxRequestsPerPatron,
        int queueLimit
) {
    public static VenueResponse from(Venue v) {
        return new VenueResponse(v.getId(), v.getSlug(), v.getName(), v.getMaxRequestsPerPatron(), v.getQueueLimit());
    }
}
