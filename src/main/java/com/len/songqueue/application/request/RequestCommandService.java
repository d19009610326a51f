package com.len.songqueue.application.request;

import com.len.songqueue.application.admission.AdmissionResult;
import com.len.songqueue.application.admission.AdmissionService;
import com.len.songqueue.application.catalog.CatalogService;
import com.len.songqueue.application.patron.CallerContext;
import com.len.songqueue.application.patron.PatronResolver;
import com.len.songqueue.application.queue.RequestView;
import com.len.songqueue.application.queue.WaitTimeEstimator;
import com.len.songqueue.application.transition.RequestTransitionService;
import com.len.songqueue.application.transition.TransitionResult;
import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.request.RequestSnapshot;
import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.venue.Venue;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * 신청곡 명령의 진입점.
 *
 * 여기서는 트랜잭션을 잡지 않는다.
 * - 손님 식별(Redis)과 매장 slug 조회는 락 밖에서 끝낸다
 * - 락 대기 초과/데드락은 새 트랜잭션으로 짧게 재시도하고, 끝까지 실패하면 STORAGE_ERROR
 */
@Slf4j
@Service
public class RequestCommandService {

    private static final String METRIC_ADMISSION = "songqueue.admission";
    private static final String METRIC_TRANSITION = "songqueue.transition";

    private final AdmissionService admissionService;
    private final RequestTransitionService transitionService;
    private final CatalogService catalogService;
    private final PatronResolver patronResolver;
    private final WaitTimeEstimator waitTimeEstimator;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;

    public RequestCommandService(AdmissionService admissionService,
                                 RequestTransitionService transitionService,
                                 CatalogService catalogService,
                                 PatronResolver patronResolver,
                                 WaitTimeEstimator waitTimeEstimator,
                                 MeterRegistry meterRegistry,
                                 @Value("${songqueue.queue.max-attempts:5}") int maxAttempts) {
        this.admissionService = admissionService;
        this.transitionService = transitionService;
        this.catalogService = catalogService;
        this.patronResolver = patronResolver;
        this.waitTimeEstimator = waitTimeEstimator;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * HTTP 경로: 매장 slug + 요청자 정보로 접수
     */
    public RequestView submit(String venueSlug, CallerContext caller, Long trackId) {
        Venue venue = catalogService.getActiveVenueBySlug(venueSlug);
        String patronId = patronResolver.resolve(caller, venue.getId());
        return submit(venue.getId(), patronId, trackId, caller.tableTag());
    }

    public RequestView submit(Long venueId, String patronId, Long trackId, String tableTag) {
        try {
            AdmissionResult result = withLockRetry("submit",
                    () -> admissionService.submit(venueId, patronId, trackId, tableTag));
            meterRegistry.counter(METRIC_ADMISSION, "result", "accepted").increment();
            return RequestView.of(result.request(), result.track(), waitTimeEstimator);
        } catch (BusinessException e) {
            meterRegistry.counter(METRIC_ADMISSION, "result", e.getErrorCode().getCode()).increment();
            log.warn("Request rejected. venueId={}, patronId={}, trackId={}, code={}",
                    venueId, patronId, trackId, e.getErrorCode().getCode());
            throw e;
        }
    }

    public RequestView transition(Long requestId, RequestStatus target, RequestStatus expectedStatus) {
        TransitionResult result = withLockRetry("transition",
                () -> transitionService.transition(requestId, target, expectedStatus));
        meterRegistry.counter(METRIC_TRANSITION, "to", target.lowerName()).increment();
        return toView(result);
    }

    /**
     * 손님 본인 취소. 신청이 속한 매장 기준으로 요청자를 식별한 뒤 소유자인지 확인한다.
     */
    public RequestView cancelAsPatron(Long requestId, CallerContext caller) {
        RequestSnapshot snapshot = transitionService.readSnapshot(requestId);
        String patronId = patronResolver.resolve(caller, snapshot.venueId());

        TransitionResult result = withLockRetry("cancel",
                () -> transitionService.cancelByPatron(requestId, patronId));
        meterRegistry.counter(METRIC_TRANSITION, "to", RequestStatus.CANCELLED.lowerName()).increment();
        return toView(result);
    }

    private RequestView toView(TransitionResult result) {
        return RequestView.of(result.request(),
                catalogService.findTrack(result.request().getTrackId()).orElse(null),
                waitTimeEstimator);
    }

    <T> T withLockRetry(String operation, Supplier<T> action) {
        long backoffMs = 10;
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (PessimisticLockingFailureException e) {
                if (attempt >= maxAttempts) {
                    log.error("Lock retries exhausted. op={}, attempts={}", operation, attempt, e);
                    throw new BusinessException(ErrorCode.STORAGE_ERROR, e);
                }
                log.debug("Lock contention, retrying. op={}, attempt={}", operation, attempt);
                sleep(backoffMs);
                backoffMs = Math.min(backoffMs * 2, 200);
            } catch (OptimisticLockingFailureException e) {
                // 버전 충돌 = 다른 트랜잭션이 먼저 상태를 바꿨다
                throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                        "다른 요청이 먼저 처리되었습니다. 새로고침 후 다시 시도해주세요.");
            }
        }
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.STORAGE_ERROR, ie);
        }
    }
}
