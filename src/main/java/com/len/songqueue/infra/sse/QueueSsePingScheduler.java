package com.len.songqueue.infra.sse;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class QueueSsePingScheduler {

    private final QueueSseHub hub;

    // 프록시/브라우저가 유휴 연결을 끊지 않도록
    @Scheduled(fixedRateString = "${songqueue.sse.ping-interval-ms:15000}")
    public void ping() {
        hub.pingAll();
    }
}
