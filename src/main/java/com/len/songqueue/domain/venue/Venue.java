package com.len.songqueue.domain.venue;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "venue",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_venue_slug", columnNames = {"slug"})
        }
)
public class Venue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String slug;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false)
    private boolean active;

    // 테이블(손님) 한 명이 동시에 대기시킬 수 있는 신청곡 수
    @Column(name = "max_requests_per_patron", nullable = false)
    private int maxRequestsPerPatron;

    // 매장 전체 pending 상한
    @Column(name = "queue_limit", nullable = false)
    private int queueLimit;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    private Venue(String slug, String name, int maxRequestsPerPatron, int queueLimit) {
        this.slug = slug;
        this.name = name;
        this.active = true;
        this.maxRequestsPerPatron = maxRequestsPerPatron;
        this.queueLimit = queueLimit;
        this.createdAt = LocalDateTime.now();
    }

    public static Venue create(String slug, String name, int maxRequestsPerPatron, int queueLimit) {
        if (maxRequestsPerPatron < 1 || queueLimit < 1) {
            throw new IllegalArgumentException("limits must be positive");
        }
        return new Venue(slug, name, maxRequestsPerPatron, queueLimit);
    }

    public void deactivate() {
        this.active = false;
    }
}
