package com.len.songqueue.application.event;

import java.time.Instant;

public record RequestEventPayload(
        String eventId,
        String eventType,
        Long requestId,
        Long venueId,
        String patronId,
        Long trackId,
        String tableTag,
        String previousStatus,   // SUBMITTED 이면 null
        String status,
        Integer queuePosition,
        Instant occurredAt
) {}
