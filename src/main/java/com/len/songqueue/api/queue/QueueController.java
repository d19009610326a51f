package com.len.songqueue.api.queue;

import com.len.songqueue.api.queue.dto.QueueResponse;
import com.len.songqueue.application.catalog.CatalogService;
import com.len.songqueue.application.queue.QueueQueryService;
import com.len.songqueue.domain.venue.Venue;
import com.len.songqueue.infra.sse.QueueSseHub;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/venues/{slug}/queue")
public class QueueController {

    private final QueueQueryService queueQueryService;
    private final CatalogService catalogService;
    private final QueueSseHub hub;

    /**
     * GET /api/venues/{slug}/queue?status=pending&page=1&size=50
     * status: pending(기본) | playing | completed | cancelled | all
     */
    @GetMapping
    public QueueResponse queue(
            @PathVariable String slug,
            @RequestParam(defaultValue = "pending") String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int size
    ) {
        Venue venue = catalogService.getActiveVenueBySlug(slug);
        return QueueResponse.from(venue.getId(), queueQueryService.list(venue.getId(), status, page, size));
    }

    // 대기열 변경 실시간 구독 (event: hello / queue / ping)
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String slug) {
        Venue venue = catalogService.getActiveVenueBySlug(slug);
        return hub.subscribe(venue.getId());
    }
}
