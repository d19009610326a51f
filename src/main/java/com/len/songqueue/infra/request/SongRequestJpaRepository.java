package com.len.songqueue.infra.request;

import com.len.songqueue.domain.request.RequestSnapshot;
import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.SongRequest;
import com.len.songqueue.domain.request.StatusCount;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SongRequestJpaRepository extends JpaRepository<SongRequest, Long> {

    // 락 없이 현재 상태만 (엔티티를 영속성 컨텍스트에 올리지 않는다)
    @Query("""
        select new com.len.songqueue.domain.request.RequestSnapshot(r.id, r.venueId, r.patronId, r.status)
        from SongRequest r
        where r.id = :id
    """)
    Optional<RequestSnapshot> findSnapshotById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from SongRequest r where r.id = :id")
    Optional<SongRequest> findByIdForUpdate(@Param("id") Long id);

    long countByVenueIdAndStatus(Long venueId, RequestStatus status);

    long countByVenueIdAndPatronIdAndStatus(Long venueId, String patronId, RequestStatus status);

    boolean existsByVenueIdAndPatronIdAndTrackIdAndStatusIn(Long venueId, String patronId, Long trackId,
                                                           Collection<RequestStatus> statuses);

    @Query("""
        select r from SongRequest r
        where r.venueId = :venueId
          and r.status = com.len.songqueue.domain.request.RequestStatus.PENDING
        order by r.queuePosition asc, r.submittedAt asc, r.id asc
    """)
    List<SongRequest> findPendingOrderByPosition(@Param("venueId") Long venueId);

    Page<SongRequest> findByVenueIdAndStatus(Long venueId, RequestStatus status, Pageable pageable);

    Page<SongRequest> findByVenueId(Long venueId, Pageable pageable);

    List<SongRequest> findByVenueIdAndPatronIdOrderBySubmittedAtDescIdDesc(Long venueId, String patronId);

    @Query("""
        select new com.len.songqueue.domain.request.StatusCount(r.status, count(r))
        from SongRequest r
        where r.venueId = :venueId
        group by r.status
    """)
    List<StatusCount> countByStatus(@Param("venueId") Long venueId);

    /**
     * 비워진 순번 뒤의 pending 순번을 한 칸씩 당긴다.
     * 상태 변경(flush)이 먼저 반영돼야 하므로 flushAutomatically.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
        update SongRequest r
           set r.queuePosition = r.queuePosition - 1
         where r.venueId = :venueId
           and r.status = com.len.songqueue.domain.request.RequestStatus.PENDING
           and r.queuePosition > :removedPosition
    """)
    int shiftPendingAfter(@Param("venueId") Long venueId, @Param("removedPosition") int removedPosition);
}
