package com.len.songqueue.infra.venue;

import com.len.songqueue.domain.venue.Venue;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface VenueJpaRepository extends JpaRepository<Venue, Long> {

    Optional<Venue> findBySlugAndActiveTrue(String slug);

    Optional<Venue> findByIdAndActiveTrue(Long id);

    /**
     * 매장 단위 직렬화용 락. 접수/순번 변경 트랜잭션은 항상 이 락부터 잡는다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select v from Venue v where v.id = :id")
    Optional<Venue> findByIdForUpdate(@Param("id") Long id);
}
