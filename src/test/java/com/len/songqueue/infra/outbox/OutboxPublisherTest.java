package com.len.songqueue.infra.outbox;

import com.len.songqueue.domain.outbox.OutboxEvent;
import com.len.songqueue.domain.outbox.OutboxStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    @Mock OutboxEventRepository outboxEventRepository;
    @Mock KafkaTemplate<String, String> kafkaTemplate;

    SimpleMeterRegistry meterRegistry;
    OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        publisher = new OutboxPublisher(outboxEventRepository, kafkaTemplate, meterRegistry);
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "publishTimeoutMs", 1000L);
    }

    private OutboxEvent event(String id) {
        return OutboxEvent.pending(id, "REQUEST_SUBMITTED", "song-request.events.v1", "1",
                "{\"requestId\":1}", LocalDateTime.now().minusSeconds(1));
    }

    @Test
    @DisplayName("전송 성공은 PUBLISHED, 실패는 재시도 예약")
    void publish_mixedResults() {
        OutboxEvent ok = event("e-1");
        OutboxEvent broken = event("e-2");
        given(outboxEventRepository.lockPendingBatch(10)).willReturn(List.of(ok, broken));
        given(kafkaTemplate.send("song-request.events.v1", "1", "{\"requestId\":1}"))
                .willReturn(CompletableFuture.completedFuture(mock(SendResult.class)))
                .willReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publish();

        assertThat(ok.getStatus()).isEqualTo(OutboxStatus.PUBLISHED);
        assertThat(ok.getPublishedAt()).isNotNull();
        assertThat(broken.getStatus()).isEqualTo(OutboxStatus.PENDING);
        assertThat(broken.getRetryCount()).isEqualTo(1);
        assertThat(broken.getLastError()).contains("broker down");
        verify(outboxEventRepository).saveAll(List.of(ok, broken));

        assertThat(meterRegistry.counter("songqueue.outbox.events", "result", "published").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("songqueue.outbox.events", "result", "retry").count()).isEqualTo(1.0);
    }

    @Test
    void publish_emptyBatch() {
        given(outboxEventRepository.lockPendingBatch(10)).willReturn(List.of());

        publisher.publish();

        verifyNoInteractions(kafkaTemplate);
        verify(outboxEventRepository, never()).saveAll(anyList());
        assertThat(meterRegistry.timer("songqueue.outbox.publish.loop").count()).isEqualTo(1);
    }
}
