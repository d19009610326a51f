package com.len.songqueue.infra.venue;

import com.len.songqueue.domain.venue.Track;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TrackJpaRepository extends JpaRepository<Track, Long> {

    List<Track> findByVenueIdAndActiveTrueOrderByArtistAscTitleAsc(Long venueId);
}
