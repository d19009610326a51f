package com.len.songqueue.domain.request;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 매장별 대기열(PENDING 신청곡 집합)의 순번을 관리한다.
 * 순번 부여와 당기기는 반드시 이 저장소를 통해서만 한다.
 * 모든 변경 메서드는 호출 트랜잭션이 매장 락을 잡고 있다는 전제로 동작한다.
 */
public interface QueueStore {

    /**
     * 현재 pending 수 + 1 을 순번으로 부여해 저장
     */
    SongRequest append(Long venueId, String patronId, Long trackId, String tableTag, LocalDateTime now);

    /**
     * removedPosition 보다 뒤에 있는 pending 신청곡의 순번을 1씩 당긴다.
     * @return 당겨진 신청곡 수
     */
    int renumber(Long venueId, int removedPosition);

    /**
     * pending 신청곡을 순번 오름차순으로
     */
    List<SongRequest> listPending(Long venueId);

    long countPending(Long venueId);

    long countPendingByPatron(Long venueId, String patronId);

    boolean hasOutstanding(Long venueId, String patronId, Long trackId);
}
