package com.len.songqueue.application.patron;

import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.patron.PatronSessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * 요청자를 매장 단위의 고정 손님 ID로 매핑한다.
 * 우선순위: 계정 > 테이블 태그 > 접속 주소
 */
@Component
@RequiredArgsConstructor
public class PatronResolver {

    private final PatronSessionStore sessionStore;

    @Value("${songqueue.patron.session-ttl-hours:6}")
    private long sessionTtlHours;

    public String resolve(CallerContext caller, long venueId) {
        return sessionStore.resolveOrCreate(venueId, sessionKeyOf(caller), Duration.ofHours(sessionTtlHours));
    }

    static String sessionKeyOf(CallerContext caller) {
        if (caller == null) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "요청자 정보가 없습니다.");
        }
        if (caller.accountId() != null) {
            return "account:" + caller.accountId();
        }
        if (caller.hasTableTag()) {
            return "table:" + normalizeTag(caller.tableTag());
        }
        if (caller.clientAddress() != null && !caller.clientAddress().isBlank()) {
            return "addr:" + caller.clientAddress().trim();
        }
        throw new BusinessException(ErrorCode.INVALID_REQUEST, "요청자를 식별할 수 없습니다.");
    }

    // "Table #3", "table  #3 " 를 같은 키로
    static String normalizeTag(String tag) {
        return tag.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
