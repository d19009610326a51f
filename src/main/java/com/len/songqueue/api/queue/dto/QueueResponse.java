package com.len.songqueue.api.queue.dto;

import com.len.songqueue.api.request.dto.SongRequestResponse;
import com.len.songqueue.application.queue.QueueQueryService;
import com.len.songqueue.application.queue.StatusCounts;

import java.util.List;

public record QueueResponse(
        Long venueId,
        List<SongRequestResponse> requests,
        Pagination pagination,
        StatusCounts counts
) {
    public static QueueResponse from(Long venueId, QueueQueryService.QueuePage page) {
        return new QueueResponse(
                venueId,
                page.requests().stream().map(SongRequestResponse::from).toList(),
                new Pagination(page.page(), page.size(), page.totalElements(), page.totalPages()),
                page.counts()
        );
    }

    public record Pagination(int page, int size, long totalElements, int totalPages) {}
}
