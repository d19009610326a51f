package com.len.songqueue.api.venue;

import com.len.songqueue.api.venue.dto.TrackResponse;
import com.len.songqueue.api.venue.dto.VenueResponse;
import com.len.songqueue.application.catalog.CatalogService;
import com.len.songqueue.domain.venue.Venue;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/venues")
public class VenueController {

    private final CatalogService catalogService;

    // 1) 매장 정보 (QR 진입 화면)
    @GetMapping("/{slug}")
    public VenueResponse getVenue(@PathVariable String slug) {
        return VenueResponse.from(catalogService.getActiveVenueBySlug(slug));
    }

    // 2) 신청 가능한 곡 목록
    @GetMapping("/{slug}/tracks")
    public List<TrackResponse> getTracks(@PathVariable String slug) {
        Venue venue = catalogService.getActiveVenueBySlug(slug);
        return catalogService.listActiveTracks(venue.getId())
                .stream()
                .map(TrackResponse::from)
                .toList();
    }
}
