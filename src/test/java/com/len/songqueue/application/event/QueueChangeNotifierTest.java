package com.len.songqueue.application.event;

import com.len.songqueue.application.queue.QueueQueryService;
import com.len.songqueue.infra.sse.QueueSseHub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueueChangeNotifierTest {

    @Mock QueueSseHub hub;
    @Mock QueueQueryService queueQueryService;

    @InjectMocks QueueChangeNotifier notifier;

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("트랜잭션 안에서는 커밋 이후에만 브로드캐스트한다")
    void broadcastsAfterCommit() {
        TransactionSynchronizationManager.initSynchronization();
        given(hub.hasSubscribers(1L)).willReturn(true);
        given(queueQueryService.listPendingAfterCommit(1L)).willReturn(List.of());

        notifier.queueChanged(1L);
        verifyNoInteractions(hub, queueQueryService);

        for (TransactionSynchronization sync : TransactionSynchronizationManager.getSynchronizations()) {
            sync.afterCommit();
        }
        verify(hub).publish(eq(1L), any(QueueChangeNotifier.QueueSnapshot.class));
    }

    @Test
    void noSubscribers_skipsQuery() {
        given(hub.hasSubscribers(1L)).willReturn(false);

        notifier.queueChanged(1L);

        verifyNoInteractions(queueQueryService);
        verify(hub, never()).publish(any(), any());
    }

    @Test
    @DisplayName("조회가 실패해도 예외를 밖으로 던지지 않는다")
    void queryFailure_isLogged() {
        given(hub.hasSubscribers(1L)).willReturn(true);
        given(queueQueryService.listPendingAfterCommit(1L)).willThrow(new IllegalStateException("db down"));

        notifier.queueChanged(1L);

        verify(hub, never()).publish(any(), any());
    }
}
