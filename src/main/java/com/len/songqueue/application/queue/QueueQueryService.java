package com.len.songqueue.application.queue;

import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.request.QueueStore;
import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.SongRequest;
import com.len.songqueue.domain.venue.Track;
import com.len.songqueue.infra.request.SongRequestJpaRepository;
import com.len.songqueue.infra.venue.TrackJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 화면 표시용 조회. 상태를 바꾸지 않으며, 접수 시 한도 체크 용도로 쓰면 안 된다(락 없이 읽음).
 */
@Service
@RequiredArgsConstructor
public class QueueQueryService {

    public static final int MAX_PAGE_SIZE = 100;
    private static final String ALL = "all";

    private final QueueStore queueStore;
    private final SongRequestJpaRepository requestRepository;
    private final TrackJpaRepository trackRepository;
    private final WaitTimeEstimator waitTimeEstimator;

    @Transactional(readOnly = true)
    public List<RequestView> listPending(Long venueId) {
        return toViews(queueStore.listPending(venueId));
    }

    /**
     * afterCommit 콜백에서 호출된다. 끝난 트랜잭션의 영속성 컨텍스트를 재사용하지 않도록 새 트랜잭션으로 읽는다.
     */
    @Transactional(readOnly = true, propagation = Propagation.REQUIRES_NEW)
    public List<RequestView> listPendingAfterCommit(Long venueId) {
        return toViews(queueStore.listPending(venueId));
    }

    /**
     * status: pending(기본) / playing / completed / cancelled / all
     * pending 은 순번 오름차순, 나머지는 최근 신청 순.
     */
    @Transactional(readOnly = true)
    public QueuePage list(Long venueId, String statusFilter, int page, int size) {
        if (page < 1 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST,
                    "page 는 1 이상, size 는 1~" + MAX_PAGE_SIZE + " 사이여야 합니다.");
        }

        RequestStatus status = parseFilter(statusFilter);
        Page<SongRequest> result;
        if (status == null) {
            result = requestRepository.findByVenueId(venueId,
                    PageRequest.of(page - 1, size, Sort.by(Sort.Order.desc("submittedAt"), Sort.Order.desc("id"))));
        } else if (status == RequestStatus.PENDING) {
            result = requestRepository.findByVenueIdAndStatus(venueId, status,
                    PageRequest.of(page - 1, size, Sort.by("queuePosition", "submittedAt", "id")));
        } else {
            result = requestRepository.findByVenueIdAndStatus(venueId, status,
                    PageRequest.of(page - 1, size, Sort.by(Sort.Order.desc("submittedAt"), Sort.Order.desc("id"))));
        }

        return new QueuePage(
                toViews(result.getContent()),
                page,
                size,
                result.getTotalElements(),
                result.getTotalPages(),
                countsByStatus(venueId)
        );
    }

    /**
     * 한 손님의 신청 내역(모든 상태), 최근 순
     */
    @Transactional(readOnly = true)
    public PatronRequests listByPatron(Long venueId, String patronId) {
        List<RequestView> views = toViews(
                requestRepository.findByVenueIdAndPatronIdOrderBySubmittedAtDescIdDesc(venueId, patronId));
        return new PatronRequests(patronId, views, StatusCounts.ofViews(views));
    }

    @Transactional(readOnly = true)
    public StatusCounts countsByStatus(Long venueId) {
        return StatusCounts.of(requestRepository.countByStatus(venueId));
    }

    static RequestStatus parseFilter(String statusFilter) {
        if (statusFilter == null || statusFilter.isBlank()) {
            return RequestStatus.PENDING;
        }
        if (ALL.equalsIgnoreCase(statusFilter.trim())) {
            return null;
        }
        try {
            return RequestStatus.from(statusFilter);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "알 수 없는 상태 필터입니다: " + statusFilter);
        }
    }

    private List<RequestView> toViews(List<SongRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        Set<Long> trackIds = requests.stream().map(SongRequest::getTrackId).collect(Collectors.toSet());
        Map<Long, Track> tracks = trackRepository.findAllById(trackIds).stream()
                .collect(Collectors.toMap(Track::getId, Function.identity()));

        List<RequestView> views = new ArrayList<>(requests.size());
        for (SongRequest r : requests) {
            views.add(RequestView.of(r, tracks.get(r.getTrackId()), waitTimeEstimator));
        }
        return views;
    }

    public record QueuePage(
            List<RequestView> requests,
            int page,
            int size,
            long totalElements,
            int totalPages,
            StatusCounts counts
    ) {}

    public record PatronRequests(
            String patronId,
            List<RequestView> requests,
            StatusCounts counts
    ) {}
}
