package com.len.songqueue.application.admission;

import com.len.songqueue.application.catalog.CatalogService;
import com.len.songqueue.application.event.QueueChangeNotifier;
import com.len.songqueue.application.event.RequestEventRecorder;
import com.len.songqueue.application.queue.WaitTimeEstimator;
import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.request.QueueStore;
import com.len.songqueue.domain.request.SongRequest;
import com.len.songqueue.domain.venue.Track;
import com.len.songqueue.domain.venue.Venue;
import com.len.songqueue.infra.venue.VenueJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 신청곡 접수.
 * 매장 row 락(PESSIMISTIC_WRITE)을 먼저 잡고, 그 안에서 한도 체크 + 순번 부여 + 저장까지 한 번에 처리한다.
 * 같은 매장 접수는 직렬화되고 다른 매장끼리는 서로 막지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionService {

    private static final int MAX_TAG_LENGTH = 50;

    private final VenueJpaRepository venueRepository;
    private final CatalogService catalogService;
    private final QueueStore queueStore;
    private final RequestEventRecorder eventRecorder;
    private final QueueChangeNotifier queueChangeNotifier;
    private final WaitTimeEstimator waitTimeEstimator;

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public AdmissionResult submit(Long venueId, String patronId, Long trackId, String tableTag) {
        if (venueId == null || trackId == null || patronId == null || patronId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST);
        }
        LocalDateTime now = LocalDateTime.now();

        // 1) 매장: 락을 잡으면서 존재/활성 확인
        Venue venue = venueRepository.findByIdForUpdate(venueId)
                .filter(Venue::isActive)
                .orElseThrow(() -> new BusinessException(ErrorCode.VENUE_NOT_FOUND));

        // 2) 곡: 존재 + 활성 + 이 매장 소속. 같은 트랜잭션에 참여하므로 아래 신청 수 증가가 함께 반영된다
        Track track = catalogService.getRequestableTrack(venue.getId(), trackId);

        // 3) 손님별 pending 한도
        long patronPending = queueStore.countPendingByPatron(venueId, patronId);
        if (patronPending >= venue.getMaxRequestsPerPatron()) {
            throw new BusinessException(ErrorCode.PATRON_LIMIT_EXCEEDED,
                    "테이블당 최대 " + venue.getMaxRequestsPerPatron() + "곡까지 대기할 수 있습니다.");
        }

        // 4) 매장 전체 pending 한도
        long venuePending = queueStore.countPending(venueId);
        if (venuePending >= venue.getQueueLimit()) {
            throw new BusinessException(ErrorCode.QUEUE_LIMIT_EXCEEDED);
        }

        // 5) 같은 곡이 이미 대기/재생 중
        if (queueStore.hasOutstanding(venueId, patronId, trackId)) {
            throw new BusinessException(ErrorCode.DUPLICATE_REQUEST);
        }

        SongRequest request = queueStore.append(venueId, patronId, trackId, displayTagOrDefault(tableTag), now);
        track.increaseTimesRequested();

        eventRecorder.submitted(request, now);
        queueChangeNotifier.queueChanged(venueId);

        log.info("Request admitted. venueId={}, requestId={}, patronId={}, trackId={}, position={}",
                venueId, request.getId(), patronId, trackId, request.getQueuePosition());

        return new AdmissionResult(request, track, waitTimeEstimator.estimateMinutes(request.getQueuePosition()));
    }

    // 태그 없이 들어오면 "Table #n" 을 붙여준다
    static String displayTagOrDefault(String tableTag) {
        if (tableTag == null || tableTag.isBlank()) {
            return "Table #" + ThreadLocalRandom.current().nextInt(1, 21);
        }
        String trimmed = tableTag.trim();
        return trimmed.length() <= MAX_TAG_LENGTH ? trimmed : trimmed.substring(0, MAX_TAG_LENGTH);
    }
}
