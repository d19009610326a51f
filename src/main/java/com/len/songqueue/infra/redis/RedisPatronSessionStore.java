package com.len.songqueue.infra.redis;

import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.patron.PatronSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

@Slf4j
@RequiredArgsConstructor
@Component
public class RedisPatronSessionStore implements PatronSessionStore {

    private final StringRedisTemplate redisTemplate;

    String sessionKey(long venueId, String sessionKey) {
        return "patron:session:" + venueId + ":" + sessionKey;
    }

    @Override
    public String resolveOrCreate(long venueId, String sessionKey, Duration ttl) {
        String key = sessionKey(venueId, sessionKey);

        String existing = redisTemplate.opsForValue().get(key);
        if (existing != null) {
            // 방문 중이면 세션 연장
            redisTemplate.expire(key, ttl);
            return existing;
        }

        String candidate = UUID.randomUUID().toString();
        Boolean created = redisTemplate.opsForValue().setIfAbsent(key, candidate, ttl);
        if (Boolean.TRUE.equals(created)) {
            return candidate;
        }

        // 다른 요청이 먼저 만들었으면 그 값을 쓴다
        String winner = redisTemplate.opsForValue().get(key);
        if (winner == null) {
            // 만든 직후 만료/삭제된 경우. 다시 요청하면 새로 만들어진다
            log.warn("Patron session vanished right after creation. key={}", key);
            throw new BusinessException(ErrorCode.STORAGE_ERROR, "손님 세션을 확인하지 못했습니다. 잠시 후 다시 시도해주세요.");
        }
        return winner;
    }
}
