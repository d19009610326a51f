package com.len.songqueue.application.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.songqueue.domain.outbox.OutboxEvent;
import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.SongRequest;
import com.len.songqueue.infra.outbox.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 신청곡 이벤트를 outbox 에 기록한다. 반드시 대기열 변경과 같은 트랜잭션에서 호출.
 */
@Component
@RequiredArgsConstructor
public class RequestEventRecorder {

    public static final String SUBMITTED = "REQUEST_SUBMITTED";
    public static final String STATUS_CHANGED = "REQUEST_STATUS_CHANGED";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Value("${songqueue.outbox.topic:song-request.events.v1}")
    private String topic;

    @Transactional(propagation = Propagation.MANDATORY)
    public void submitted(SongRequest request, LocalDateTime now) {
        record(SUBMITTED, request, null, now);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void statusChanged(SongRequest request, RequestStatus previous, LocalDateTime now) {
        record(STATUS_CHANGED, request, previous, now);
    }

    private void record(String eventType, SongRequest r, RequestStatus previous, LocalDateTime now) {
        String eventId = UUID.randomUUID().toString();
        RequestEventPayload payload = new RequestEventPayload(
                eventId,
                eventType,
                r.getId(),
                r.getVenueId(),
                r.getPatronId(),
                r.getTrackId(),
                r.getTableTag(),
                previous == null ? null : previous.lowerName(),
                r.getStatus().lowerName(),
                r.getQueuePosition(),
                Instant.now()
        );

        try {
            String json = objectMapper.writeValueAsString(payload);
            outboxEventRepository.save(
                    OutboxEvent.pending(eventId, eventType, topic, String.valueOf(r.getVenueId()), json, now));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Outbox payload serialize failed. requestId=" + r.getId(), e);
        }
    }
}
