package com.len.songqueue.application.catalog;

import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.venue.Track;
import com.len.songqueue.domain.venue.Venue;
import com.len.songqueue.infra.venue.TrackJpaRepository;
import com.len.songqueue.infra.venue.VenueJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 매장/곡 조회 전용. 대기열 코어 입장에서는 읽기만 하는 외부 데이터다.
 */
@Service
@RequiredArgsConstructor
public class CatalogService {

    private final VenueJpaRepository venueRepository;
    private final TrackJpaRepository trackRepository;

    @Transactional(readOnly = true)
    public Venue getActiveVenueBySlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new BusinessException(ErrorCode.VENUE_NOT_FOUND);
        }
        return venueRepository.findBySlugAndActiveTrue(slug.trim().toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new BusinessException(ErrorCode.VENUE_NOT_FOUND));
    }

    /**
     * 곡이 존재하고, 활성이며, 해당 매장 카탈로그에 속할 때만 반환
     */
    @Transactional(readOnly = true)
    public Track getRequestableTrack(Long venueId, Long trackId) {
        if (trackId == null) {
            throw new BusinessException(ErrorCode.TRACK_NOT_FOUND);
        }
        Track track = trackRepository.findById(trackId)
                .orElseThrow(() -> new BusinessException(ErrorCode.TRACK_NOT_FOUND));
        if (!track.isRequestableAt(venueId)) {
            throw new BusinessException(ErrorCode.TRACK_NOT_FOUND);
        }
        return track;
    }

    @Transactional(readOnly = true)
    public Optional<Track> findTrack(Long trackId) {
        return trackId == null ? Optional.empty() : trackRepository.findById(trackId);
    }

    @Transactional(readOnly = true)
    public List<Track> listActiveTracks(Long venueId) {
        return trackRepository.findByVenueIdAndActiveTrueOrderByArtistAscTitleAsc(venueId);
    }
}
