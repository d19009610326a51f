package com.len.songqueue.infra.outbox;

import com.len.songqueue.domain.outbox.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    // 여러 인스턴스가 돌아도 같은 row를 두 번 집지 않도록 SKIP LOCKED
    @Query(value = """
        SELECT * FROM outbox_event
         WHERE status = 'PENDING'
           AND next_retry_at <= NOW()
         ORDER BY created_at
         LIMIT :limit
         FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEvent> lockPendingBatch(@Param("limit") int limit);

    List<OutboxEvent> findByEventKeyOrderByCreatedAtAsc(String eventKey);
}
