package com.len.songqueue.application.transition;

import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.SongRequest;

/**
 * @param vacatedPosition 대기열에서 빠지며 비운 순번 (PENDING 에서 나간 경우만)
 * @param renumbered      순번이 당겨진 신청곡 수
 */
public record TransitionResult(
        SongRequest request,
        RequestStatus previousStatus,
        Integer vacatedPosition,
        int renumbered
) {}
