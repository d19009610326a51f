package com.len.songqueue.infra.request;

import com.len.songqueue.domain.request.QueueStore;
import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.SongRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

@RequiredArgsConstructor
@Component
public class JpaQueueStore implements QueueStore {

    private final SongRequestJpaRepository requestRepository;

    @Override
    public SongRequest append(Long venueId, String patronId, Long trackId, String tableTag, LocalDateTime now) {
        int position = Math.toIntExact(countPending(venueId) + 1);
        SongRequest request = SongRequest.newPending(venueId, patronId, trackId, tableTag, position, now);
        return requestRepository.save(request);
    }

    @Override
    public int renumber(Long venueId, int removedPosition) {
        return requestRepository.shiftPendingAfter(venueId, removedPosition);
    }

    @Override
    public List<SongRequest> listPending(Long venueId) {
        return requestRepository.findPendingOrderByPosition(venueId);
    }

    @Override
    public long countPending(Long venueId) {
        return requestRepository.countByVenueIdAndStatus(venueId, RequestStatus.PENDING);
    }

    @Override
    public long countPendingByPatron(Long venueId, String patronId) {
        return requestRepository.countByVenueIdAndPatronIdAndStatus(venueId, patronId, RequestStatus.PENDING);
    }

    @Override
    public boolean hasOutstanding(Long venueId, String patronId, Long trackId) {
        return requestRepository.existsByVenueIdAndPatronIdAndTrackIdAndStatusIn(
                venueId, patronId, trackId, RequestStatus.OUTSTANDING);
    }
}
