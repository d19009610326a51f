package com.len.songqueue.api.request;

import com.len.songqueue.api.request.dto.PatronRequestsResponse;
import com.len.songqueue.api.request.dto.SongRequestResponse;
import com.len.songqueue.api.request.dto.StatusChangeRequest;
import com.len.songqueue.api.request.dto.SubmitRequest;
import com.len.songqueue.application.catalog.CatalogService;
import com.len.songqueue.application.patron.CallerContext;
import com.len.songqueue.application.patron.PatronResolver;
import com.len.songqueue.application.queue.QueueQueryService;
import com.len.songqueue.application.request.RequestCommandService;
import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.venue.Venue;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class RequestController {

    static final String ACCOUNT_HEADER = "X-Account-Id";
    static final String TABLE_HEADER = "X-Table-Tag";

    private final RequestCommandService commandService;
    private final QueueQueryService queueQueryService;
    private final CatalogService catalogService;
    private final PatronResolver patronResolver;

    // 손님 신청곡 접수
    @PostMapping("/venues/{slug}/requests")
    @ResponseStatus(HttpStatus.CREATED)
    public SongRequestResponse submit(
            @PathVariable String slug,
            @Valid @RequestBody SubmitRequest request,
            @RequestHeader(value = ACCOUNT_HEADER, required = false) Long accountId,
            @RequestHeader(value = TABLE_HEADER, required = false) String tableHeader,
            HttpServletRequest http
    ) {
        String tableTag = request.tableTag() != null ? request.tableTag() : tableHeader;
        CallerContext caller = new CallerContext(accountId, tableTag, http.getRemoteAddr());
        return SongRequestResponse.from(commandService.submit(slug, caller, request.trackId()));
    }

    // 내 신청 내역 (최근 순)
    @GetMapping("/venues/{slug}/requests/mine")
    public PatronRequestsResponse mine(
            @PathVariable String slug,
            @RequestParam(required = false) String tableTag,
            @RequestHeader(value = ACCOUNT_HEADER, required = false) Long accountId,
            @RequestHeader(value = TABLE_HEADER, required = false) String tableHeader,
            HttpServletRequest http
    ) {
        Venue venue = catalogService.getActiveVenueBySlug(slug);
        CallerContext caller = new CallerContext(accountId, tableTag != null ? tableTag : tableHeader, http.getRemoteAddr());
        String patronId = patronResolver.resolve(caller, venue.getId());
        return PatronRequestsResponse.from(queueQueryService.listByPatron(venue.getId(), patronId));
    }

    // 직원용 상태 변경 (인증은 게이트웨이 담당)
    @PatchMapping("/requests/{requestId}/status")
    public SongRequestResponse changeStatus(
            @PathVariable Long requestId,
            @Valid @RequestBody StatusChangeRequest request
    ) {
        RequestStatus target = parseStatus(request.status());
        RequestStatus expected = request.expectedStatus() == null ? null : parseStatus(request.expectedStatus());
        return SongRequestResponse.from(commandService.transition(requestId, target, expected));
    }

    // 손님 본인 취소
    @DeleteMapping("/requests/{requestId}")
    public SongRequestResponse cancel(
            @PathVariable Long requestId,
            @RequestParam(required = false) String tableTag,
            @RequestHeader(value = ACCOUNT_HEADER, required = false) Long accountId,
            @RequestHeader(value = TABLE_HEADER, required = false) String tableHeader,
            HttpServletRequest http
    ) {
        CallerContext caller = new CallerContext(accountId, tableTag != null ? tableTag : tableHeader, http.getRemoteAddr());
        return SongRequestResponse.from(commandService.cancelAsPatron(requestId, caller));
    }

    private RequestStatus parseStatus(String raw) {
        try {
            return RequestStatus.from(raw);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "알 수 없는 상태입니다: " + raw);
        }
    }
}
