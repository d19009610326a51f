package com.len.songqueue.domain.patron;

import java.time.Duration;

public interface PatronSessionStore {

    /**
     * 매장 + 세션 키에 묶인 손님 ID를 돌려준다. 없으면 새로 발급.
     * 동시에 같은 키로 들어와도 같은 ID를 받아야 한다.
     */
    String resolveOrCreate(long venueId, String sessionKey, Duration ttl);
}
