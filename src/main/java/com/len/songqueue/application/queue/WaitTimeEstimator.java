package com.len.songqueue.application.queue;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 예상 대기 시간(분). 순번 x 곡당 평균 재생 시간. 표시용 값이라 정확할 필요는 없다.
 */
@Component
public class WaitTimeEstimator {

    private final int averageTrackMinutes;

    public WaitTimeEstimator(@Value("${songqueue.queue.average-track-minutes:3}") int averageTrackMinutes) {
        this.averageTrackMinutes = Math.max(1, averageTrackMinutes);
    }

    public int estimateMinutes(Integer position) {
        if (position == null || position < 1) {
            return 0;
        }
        return position * averageTrackMinutes;
    }
}
