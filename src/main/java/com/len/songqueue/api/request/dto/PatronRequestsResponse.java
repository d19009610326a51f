package com.len.songqueue.api.request.dto;

import com.len.songqueue.application.queue.QueueQueryService;
import com.len.songqueue.application.queue.StatusCounts;

import java.util.List;

public record PatronRequestsResponse(
        List<SongRequestResponse> requests,
        StatusCounts counts
) {
    public static PatronRequestsResponse from(QueueQueryService.PatronRequests result) {
        return new PatronRequestsResponse(
                result.requests().stream().map(SongRequestResponse::from).toList(),
                result.counts()
        );
    }
}
