package com.len.songqueue.infra.sse;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * venueId 별 SSE 연결을 보관하고 queue/ping 이벤트를 브로드캐스트한다.
 * 클라이언트가 끊기면 send 에서 IOException 이 나는데 정상 상황이므로 emitter 만 정리한다.
 */
@Slf4j
@Component
public class QueueSseHub {

    private final Map<Long, CopyOnWriteArrayList<SseEmitter>> rooms = new ConcurrentHashMap<>();

    public SseEmitter subscribe(Long venueId) {
        // timeout 0 = 무제한
        SseEmitter emitter = new SseEmitter(0L);
        // remove 가 빈 방을 지우는 것과 겹치지 않도록 추가도 compute 안에서
        rooms.compute(venueId, (id, list) -> {
            CopyOnWriteArrayList<SseEmitter> room = list == null ? new CopyOnWriteArrayList<>() : list;
            room.add(emitter);
            return room;
        });

        Runnable cleanup = () -> remove(venueId, emitter);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(ex -> cleanup.run());

        send(venueId, emitter, "hello", Map.of("venueId", venueId));
        return emitter;
    }

    public boolean hasSubscribers(Long venueId) {
        List<SseEmitter> emitters = rooms.get(venueId);
        return emitters != null && !emitters.isEmpty();
    }

    /**
     * 대기열 변경 이벤트 (event: queue)
     */
    public void publish(Long venueId, Object payload) {
        List<SseEmitter> emitters = rooms.get(venueId);
        if (emitters == null || emitters.isEmpty()) return;

        for (SseEmitter emitter : emitters) {
            send(venueId, emitter, "queue", payload);
        }
    }

    public void pingAll() {
        Map<String, String> payload = Map.of("at", LocalDateTime.now().toString());
        for (Map.Entry<Long, CopyOnWriteArrayList<SseEmitter>> room : rooms.entrySet()) {
            for (SseEmitter emitter : room.getValue()) {
                send(room.getKey(), emitter, "ping", payload);
            }
        }
    }

    int subscriberCount(Long venueId) {
        List<SseEmitter> emitters = rooms.get(venueId);
        return emitters == null ? 0 : emitters.size();
    }

    private void send(Long venueId, SseEmitter emitter, String name, Object payload) {
        try {
            emitter.send(SseEmitter.event().name(name).data(payload));
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE client gone. venueId={}, event={}", venueId, name);
            remove(venueId, emitter);
        }
    }

    private void remove(Long venueId, SseEmitter emitter) {
        rooms.computeIfPresent(venueId, (id, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
        try {
            emitter.complete();
        } catch (IllegalStateException alreadyCompleted) {
            log.trace("SSE emitter already completed. venueId={}", venueId);
        }
    }
}
