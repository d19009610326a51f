package com.len.songqueue.application.transition;

import com.len.songqueue.application.event.QueueChangeNotifier;
import com.len.songqueue.application.event.RequestEventRecorder;
import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.request.QueueStore;
import com.len.songqueue.domain.request.RequestSnapshot;
import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.SongRequest;
import com.len.songqueue.infra.request.SongRequestJpaRepository;
import com.len.songqueue.infra.venue.VenueJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 신청곡 상태 전이. 전이 규칙은 RequestStatus 한 곳에서만 판단한다.
 *
 * 락 순서는 접수와 동일하게 항상 매장 -> 신청곡. (순서가 뒤집히면 접수 트랜잭션과 데드락)
 * 락 전에 읽은 상태와 락 후 상태가 다르면 그 사이 누가 바꾼 것이므로 INVALID_TRANSITION.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestTransitionService {

    private final SongRequestJpaRepository requestRepository;
    private final VenueJpaRepository venueRepository;
    private final QueueStore queueStore;
    private final RequestEventRecorder eventRecorder;
    private final QueueChangeNotifier queueChangeNotifier;

    /**
     * 직원이 상태를 바꾸는 경우.
     * @param expectedStatus 호출자가 마지막으로 본 상태. null 이면 락 직전에 읽은 상태를 기준으로 삼는다.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public TransitionResult transition(Long requestId, RequestStatus target, RequestStatus expectedStatus) {
        if (requestId == null || target == null) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST);
        }
        RequestSnapshot snapshot = readSnapshot(requestId);
        if (expectedStatus != null && expectedStatus != snapshot.status()) {
            throw staleStatus(requestId, expectedStatus, snapshot.status());
        }
        return applyLocked(snapshot, target);
    }

    /**
     * 손님 본인 취소. 대기 중(PENDING)인 본인 신청만 취소할 수 있다.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public TransitionResult cancelByPatron(Long requestId, String patronId) {
        if (requestId == null || patronId == null) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST);
        }
        RequestSnapshot snapshot = readSnapshot(requestId);
        if (!snapshot.isOwnedBy(patronId)) {
            throw new BusinessException(ErrorCode.NOT_REQUEST_OWNER);
        }
        if (snapshot.status() != RequestStatus.PENDING) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    snapshot.status() == RequestStatus.PLAYING
                            ? "재생 중인 곡은 취소할 수 없습니다."
                            : "이미 종료된 신청입니다.");
        }
        return applyLocked(snapshot, RequestStatus.CANCELLED);
    }

    @Transactional(readOnly = true)
    public RequestSnapshot readSnapshot(Long requestId) {
        return requestRepository.findSnapshotById(requestId)
                .orElseThrow(() -> new BusinessException(ErrorCode.REQUEST_NOT_FOUND));
    }

    private TransitionResult applyLocked(RequestSnapshot snapshot, RequestStatus target) {
        Long requestId = snapshot.requestId();
        Long venueId = snapshot.venueId();

        if (!snapshot.status().canTransitionTo(target)) {
            throw invalid(requestId, snapshot.status(), target);
        }

        // 매장 범위 락 먼저. 비활성 매장이어도 남은 신청은 정리할 수 있어야 하므로 active 는 보지 않는다
        venueRepository.findByIdForUpdate(venueId)
                .orElseThrow(() -> new BusinessException(ErrorCode.VENUE_NOT_FOUND));

        SongRequest request = requestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> new BusinessException(ErrorCode.REQUEST_NOT_FOUND));

        RequestStatus current = request.getStatus();
        if (current != snapshot.status()) {
            throw staleStatus(requestId, snapshot.status(), current);
        }

        LocalDateTime now = LocalDateTime.now();
        Integer vacated = request.transitionTo(target, now);

        int renumbered = 0;
        if (vacated != null) {
            renumbered = queueStore.renumber(venueId, vacated);
        }

        eventRecorder.statusChanged(request, current, now);
        if (vacated != null) {
            queueChangeNotifier.queueChanged(venueId);
        }

        log.info("Request transitioned. venueId={}, requestId={}, from={}, to={}, vacatedPosition={}, renumbered={}",
                venueId, requestId, current, target, vacated, renumbered);

        return new TransitionResult(request, current, vacated, renumbered);
    }

    private BusinessException invalid(Long requestId, RequestStatus from, RequestStatus to) {
        return new BusinessException(ErrorCode.INVALID_TRANSITION,
                "신청곡 " + requestId + " 의 상태를 " + from.lowerName() + " 에서 " + to.lowerName() + " 로 바꿀 수 없습니다.");
    }

    private BusinessException staleStatus(Long requestId, RequestStatus seen, RequestStatus actual) {
        return new BusinessException(ErrorCode.INVALID_TRANSITION,
                "신청곡 " + requestId + " 의 상태가 변경되었습니다(" + seen.lowerName() + " -> " + actual.lowerName()
                        + "). 새로고침 후 다시 시도해주세요.");
    }
}
