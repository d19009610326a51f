package com.len.songqueue.application.queue;

import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.StatusCount;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public record StatusCounts(long total, long pending, long playing, long completed, long cancelled) {

    public static StatusCounts of(Collection<StatusCount> rows) {
        Map<RequestStatus, Long> byStatus = new EnumMap<>(RequestStatus.class);
        for (StatusCount row : rows) {
            byStatus.merge(row.status(), row.count(), Long::sum);
        }
        return fromMap(byStatus);
    }

    public static StatusCounts ofViews(Collection<RequestView> views) {
        Map<RequestStatus, Long> byStatus = new EnumMap<>(RequestStatus.class);
        for (RequestView v : views) {
            byStatus.merge(v.status(), 1L, Long::sum);
        }
        return fromMap(byStatus);
    }

    private static StatusCounts fromMap(Map<RequestStatus, Long> byStatus) {
        long pending = byStatus.getOrDefault(RequestStatus.PENDING, 0L);
        long playing = byStatus.getOrDefault(RequestStatus.PLAYING, 0L);
        long completed = byStatus.getOrDefault(RequestStatus.COMPLETED, 0L);
        long cancelled = byStatus.getOrDefault(RequestStatus.CANCELLED, 0L);
        return new StatusCounts(pending + playing + completed + cancelled, pending, playing, completed, cancelled);
    }
}
