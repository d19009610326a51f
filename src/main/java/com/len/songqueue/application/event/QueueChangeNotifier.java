package com.len.songqueue.application.event;

import com.len.songqueue.application.queue.QueueQueryService;
import com.len.songqueue.application.queue.RequestView;
import com.len.songqueue.infra.sse.QueueSseHub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 대기열이 바뀐 매장의 구독자에게 최신 pending 목록을 보낸다.
 * 커밋 전에 보내면 롤백된 순번이 보일 수 있으므로 afterCommit 에서만 보낸다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueChangeNotifier {

    private final QueueSseHub hub;
    private final QueueQueryService queueQueryService;

    public void queueChanged(Long venueId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            broadcast(venueId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                broadcast(venueId);
            }
        });
    }

    void broadcast(Long venueId) {
        if (!hub.hasSubscribers(venueId)) {
            return;
        }
        try {
            List<RequestView> pending = queueQueryService.listPendingAfterCommit(venueId);
            hub.publish(venueId, new QueueSnapshot(venueId, pending, LocalDateTime.now()));
        } catch (RuntimeException e) {
            // 이미 커밋된 변경이므로 알림 실패가 요청 결과를 바꾸면 안 된다
            log.warn("Queue broadcast failed. venueId={}", venueId, e);
        }
    }

    public record QueueSnapshot(Long venueId, List<RequestView> pending, LocalDateTime at) {}
}
