package com.len.songqueue.domain.request;

/**
 * 락을 잡기 전에 읽어두는 신청곡 상태. 락 획득 후 다시 읽은 값과 비교해 경합을 감지한다.
 */
public record RequestSnapshot(
        Long requestId,
        Long venueId,
        String patronId,
        RequestStatus status
) {
    public boolean isOwnedBy(String patronId) {
        return this.patronId.equals(patronId);
    }
}
