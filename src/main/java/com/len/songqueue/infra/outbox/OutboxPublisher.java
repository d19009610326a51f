package com.len.songqueue.infra.outbox;

import com.len.songqueue.domain.outbox.OutboxEvent;
import com.len.songqueue.domain.outbox.OutboxStatus;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "songqueue.outbox.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${songqueue.outbox.batch-size:100}")
    private int batchSize;

    @Value("${songqueue.outbox.publish-timeout-ms:3000}")
    private long publishTimeoutMs;

    @Scheduled(fixedDelayString = "${songqueue.outbox.publish-interval-ms:500}")
    @Transactional
    public void publish() {
        final long startNs = System.nanoTime();

        int published = 0;
        int retry = 0;
        int failed = 0;

        try {
            List<OutboxEvent> batch = outboxEventRepository.lockPendingBatch(batchSize);
            if (batch.isEmpty()) {
                return;
            }

            for (OutboxEvent e : batch) {
                LocalDateTime now = LocalDateTime.now();
                try {
                    kafkaTemplate
                            .send(e.getTopic(), e.getEventKey(), e.getPayload())
                            .get(publishTimeoutMs, TimeUnit.MILLISECONDS);
                    e.markPublished(now);
                    published++;
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.markRetryOrFail("interrupted", now);
                    retry++;
                    break;
                } catch (Exception ex) {
                    e.markRetryOrFail(ex.getMessage(), now);

                    if (e.getStatus() == OutboxStatus.FAILED) {
                        failed++;
                        log.error("Outbox publish failed permanently. eventId={}, type={}, key={}, retryCount={}, err={}",
                                e.getEventId(), e.getEventType(), e.getEventKey(), e.getRetryCount(), e.getLastError());
                    } else {
                        retry++;
                        log.warn("Outbox publish retry scheduled. eventId={}, type={}, key={}, retryCount={}, nextRetryAt={}",
                                e.getEventId(), e.getEventType(), e.getEventKey(), e.getRetryCount(), e.getNextRetryAt());
                    }
                }
            }

            outboxEventRepository.saveAll(batch);

            count("published", published);
            count("retry", retry);
            count("failed", failed);

            log.info("Outbox batch done. total={}, published={}, retry={}, failed={}",
                    batch.size(), published, retry, failed);
        } finally {
            meterRegistry.timer("songqueue.outbox.publish.loop")
                    .record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        }
    }

    private void count(String result, int amount) {
        if (amount > 0) {
            meterRegistry.counter("songqueue.outbox.events", "result", result).increment(amount);
        }
    }
}
