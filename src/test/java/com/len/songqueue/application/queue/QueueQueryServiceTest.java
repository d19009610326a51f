package com.len.songqueue.application.queue;

import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.request.QueueStore;
import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.SongRequest;
import com.len.songqueue.domain.request.StatusCount;
import com.len.songqueue.domain.venue.Track;
import com.len.songqueue.infra.request.SongRequestJpaRepository;
import com.len.songqueue.infra.venue.TrackJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueueQueryServiceTest {

    @Mock QueueStore queueStore;
    @Mock SongRequestJpaRepository requestRepository;
    @Mock TrackJpaRepository trackRepository;

    QueueQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new QueueQueryService(queueStore, requestRepository, trackRepository, new WaitTimeEstimator(3));
    }

    private SongRequest pending(long id, int position) {
        SongRequest r = SongRequest.newPending(1L, "patron-" + id, 10L, null, position, LocalDateTime.now());
        ReflectionTestUtils.setField(r, "id", id);
        return r;
    }

    @Test
    @DisplayName("상태 필터: 비어 있으면 pending, all 은 전체, 대소문자 무시")
    void parseFilter() {
        assertThat(QueueQueryService.parseFilter(null)).isEqualTo(RequestStatus.PENDING);
        assertThat(QueueQueryService.parseFilter(" ")).isEqualTo(RequestStatus.PENDING);
        assertThat(QueueQueryService.parseFilter("ALL")).isNull();
        assertThat(QueueQueryService.parseFilter("Playing")).isEqualTo(RequestStatus.PLAYING);
    }

    @Test
    void parseFilter_unknown() {
        assertThatThrownBy(() -> QueueQueryService.parseFilter("skipped"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("page < 1 이거나 size 가 범위를 벗어나면 조회하지 않고 INVALID_REQUEST")
    void list_invalidPaging() {
        assertThatThrownBy(() -> queryService.list(1L, "pending", 0, 10)).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> queryService.list(1L, "pending", 1, 0)).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> queryService.list(1L, "pending", 1, 101)).isInstanceOf(BusinessException.class);

        verifyNoInteractions(requestRepository);
    }

    @Test
    @DisplayName("pending 목록은 순번 오름차순이고 예상 대기시간이 붙는다")
    void list_pendingSortedByPosition() {
        Track track = Track.create(1L, "Creep", "Radiohead", 238);
        ReflectionTestUtils.setField(track, "id", 10L);
        List<SongRequest> rows = List.of(pending(11L, 1), pending(12L, 2));

        given(requestRepository.findByVenueIdAndStatus(eq(1L), eq(RequestStatus.PENDING), any(Pageable.class)))
                .willAnswer(inv -> new PageImpl<>(rows, inv.getArgument(2), 2));
        given(trackRepository.findAllById(anyIterable())).willReturn(List.of(track));
        given(requestRepository.countByStatus(1L)).willReturn(List.of(
                new StatusCount(RequestStatus.PENDING, 2L),
                new StatusCount(RequestStatus.COMPLETED, 5L)));

        QueueQueryService.QueuePage page = queryService.list(1L, null, 1, 20);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(requestRepository).findByVenueIdAndStatus(eq(1L), eq(RequestStatus.PENDING), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isZero();
        assertThat(pageable.getValue().getSort().getOrderFor("queuePosition").getDirection())
                .isEqualTo(Sort.Direction.ASC);

        assertThat(page.requests()).extracting(RequestView::queuePosition).containsExactly(1, 2);
        assertThat(page.requests()).extracting(RequestView::estimatedWaitMinutes).containsExactly(3, 6);
        assertThat(page.requests().get(0).trackTitle()).isEqualTo("Creep");
        assertThat(page.totalElements()).isEqualTo(2);
        assertThat(page.counts().total()).isEqualTo(7);
        assertThat(page.counts().pending()).isEqualTo(2);
        assertThat(page.counts().playing()).isZero();
    }

    @Test
    void list_allNewestFirst() {
        given(requestRepository.findByVenueId(eq(1L), any(Pageable.class)))
                .willAnswer(inv -> new PageImpl<>(List.of(), inv.getArgument(1), 0));
        given(requestRepository.countByStatus(1L)).willReturn(List.of());

        QueueQueryService.QueuePage page = queryService.list(1L, "all", 2, 10);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(requestRepository).findByVenueId(eq(1L), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
        assertThat(pageable.getValue().getSort().getOrderFor("submittedAt").getDirection())
                .isEqualTo(Sort.Direction.DESC);
        assertThat(page.requests()).isEmpty();
        assertThat(page.counts().total()).isZero();
        verifyNoInteractions(trackRepository);
    }
}
