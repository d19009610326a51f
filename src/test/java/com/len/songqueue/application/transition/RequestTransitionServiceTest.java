package com.len.songqueue.application.transition;

import com.len.songqueue.application.event.QueueChangeNotifier;
import com.len.songqueue.application.event.RequestEventRecorder;
import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import com.len.songqueue.domain.request.QueueStore;
import com.len.songqueue.domain.request.RequestSnapshot;
import com.len.songqueue.domain.request.RequestStatus;
import com.len.songqueue.domain.request.SongRequest;
import com.len.songqueue.domain.venue.Venue;
import com.len.songqueue.infra.request.SongRequestJpaRepository;
import com.len.songqueue.infra.venue.VenueJpaRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.function.Executable;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RequestTransitionServiceTest {

    private static final Long VENUE_ID = 1L;
    private static final Long REQUEST_ID = 100L;

    @Mock SongRequestJpaRepository requestRepository;
    @Mock VenueJpaRepository venueRepository;
    @Mock QueueStore queueStore;
    @Mock RequestEventRecorder eventRecorder;
    @Mock QueueChangeNotifier queueChangeNotifier;

    @InjectMocks RequestTransitionService transitionService;

    private SongRequest requestIn(RequestStatus status, int position) {
        LocalDateTime now = LocalDateTime.now();
        SongRequest r = SongRequest.newPending(VENUE_ID, "patron-a", 10L, "Table 1", position, now);
        ReflectionTestUtils.setField(r, "id", REQUEST_ID);
        if (status == RequestStatus.PLAYING || status == RequestStatus.COMPLETED) {
            r.transitionTo(RequestStatus.PLAYING, now);
        }
        if (status == RequestStatus.COMPLETED) {
            r.transitionTo(RequestStatus.COMPLETED, now);
        }
        if (status == RequestStatus.CANCELLED) {
            r.transitionTo(RequestStatus.CANCELLED, now);
        }
        return r;
    }

    private void givenSnapshot(RequestStatus status) {
        given(requestRepository.findSnapshotById(REQUEST_ID))
                .willReturn(Optional.of(new RequestSnapshot(REQUEST_ID, VENUE_ID, "patron-a", status)));
    }

    private void givenLocked(SongRequest locked) {
        given(venueRepository.findByIdForUpdate(VENUE_ID))
                .willReturn(Optional.of(Venue.create("blue-bar", "Blue Bar", 2, 50)));
        given(requestRepository.findByIdForUpdate(REQUEST_ID)).willReturn(Optional.of(locked));
    }

    private static void assertErrorCode(Executable call, ErrorCode expected) {
        assertThatThrownBy(call::execute)
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("pending -> playing: 매장 락 후 신청곡 락, 비운 순번 뒤를 당긴다")
    void startPlaying_renumbersQueue() {
        givenSnapshot(RequestStatus.PENDING);
        givenLocked(requestIn(RequestStatus.PENDING, 2));
        given(queueStore.renumber(VENUE_ID, 2)).willReturn(3);

        TransitionResult result = transitionService.transition(REQUEST_ID, RequestStatus.PLAYING, null);

        assertThat(result.request().getStatus()).isEqualTo(RequestStatus.PLAYING);
        assertThat(result.request().getStartedAt()).isNotNull();
        assertThat(result.previousStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(result.vacatedPosition()).isEqualTo(2);
        assertThat(result.renumbered()).isEqualTo(3);

        InOrder order = inOrder(venueRepository, requestRepository, queueStore);
        order.verify(venueRepository).findByIdForUpdate(VENUE_ID);
        order.verify(requestRepository).findByIdForUpdate(REQUEST_ID);
        order.verify(queueStore).renumber(VENUE_ID, 2);

        verify(eventRecorder).statusChanged(any(SongRequest.class), eq(RequestStatus.PENDING), any(LocalDateTime.class));
        verify(queueChangeNotifier).queueChanged(VENUE_ID);
    }

    @Test
    @DisplayName("pending -> cancelled 도 순번을 당긴다")
    void cancelPending_renumbersQueue() {
        givenSnapshot(RequestStatus.PENDING);
        givenLocked(requestIn(RequestStatus.PENDING, 1));

        TransitionResult result = transitionService.transition(REQUEST_ID, RequestStatus.CANCELLED, RequestStatus.PENDING);

        assertThat(result.request().getStatus()).isEqualTo(RequestStatus.CANCELLED);
        verify(queueStore).renumber(VENUE_ID, 1);
    }

    @Test
    @DisplayName("playing -> cancelled/completed 는 대기열 밖이라 renumber 없음")
    void playingToTerminal_doesNotRenumber() {
        givenSnapshot(RequestStatus.PLAYING);
        givenLocked(requestIn(RequestStatus.PLAYING, 1));

        TransitionResult result = transitionService.transition(REQUEST_ID, RequestStatus.COMPLETED, null);

        assertThat(result.request().getCompletedAt()).isNotNull();
        assertThat(result.vacatedPosition()).isNull();
        verify(queueStore, never()).renumber(any(), anyInt());
        verifyNoInteractions(queueChangeNotifier);
    }

    @Test
    @DisplayName("종료 상태에서는 락도 잡지 않고 INVALID_TRANSITION")
    void terminal_rejected() {
        givenSnapshot(RequestStatus.COMPLETED);

        assertErrorCode(() -> transitionService.transition(REQUEST_ID, RequestStatus.CANCELLED, null),
                ErrorCode.INVALID_TRANSITION);
        verifyNoInteractions(venueRepository, queueStore, eventRecorder);
    }

    @Test
    void pendingToCompleted_rejected() {
        givenSnapshot(RequestStatus.PENDING);

        assertErrorCode(() -> transitionService.transition(REQUEST_ID, RequestStatus.COMPLETED, null),
                ErrorCode.INVALID_TRANSITION);
    }

    @Test
    @DisplayName("락 대기 중에 다른 트랜잭션이 상태를 바꿨으면 INVALID_TRANSITION")
    void statusChangedWhileWaitingForLock() {
        givenSnapshot(RequestStatus.PENDING);
        givenLocked(requestIn(RequestStatus.CANCELLED, 1));

        assertErrorCode(() -> transitionService.transition(REQUEST_ID, RequestStatus.PLAYING, null),
                ErrorCode.INVALID_TRANSITION);
        verify(queueStore, never()).renumber(any(), anyInt());
        verifyNoInteractions(eventRecorder);
    }

    @Test
    @DisplayName("호출자가 본 상태와 저장된 상태가 다르면 INVALID_TRANSITION")
    void expectedStatusMismatch() {
        givenSnapshot(RequestStatus.PLAYING);

        assertErrorCode(() -> transitionService.transition(REQUEST_ID, RequestStatus.CANCELLED, RequestStatus.PENDING),
                ErrorCode.INVALID_TRANSITION);
        verifyNoInteractions(venueRepository);
    }

    @Test
    void unknownRequest() {
        given(requestRepository.findSnapshotById(REQUEST_ID)).willReturn(Optional.empty());

        assertErrorCode(() -> transitionService.transition(REQUEST_ID, RequestStatus.PLAYING, null),
                ErrorCode.REQUEST_NOT_FOUND);
    }

    @Test
    @DisplayName("손님 취소: 본인 신청이 아니면 NOT_REQUEST_OWNER")
    void cancelByPatron_notOwner() {
        givenSnapshot(RequestStatus.PENDING);

        assertErrorCode(() -> transitionService.cancelByPatron(REQUEST_ID, "patron-b"), ErrorCode.NOT_REQUEST_OWNER);
        verifyNoInteractions(venueRepository);
    }

    @Test
    @DisplayName("손님 취소: 재생 중이면 취소 불가")
    void cancelByPatron_playing() {
        givenSnapshot(RequestStatus.PLAYING);

        assertErrorCode(() -> transitionService.cancelByPatron(REQUEST_ID, "patron-a"), ErrorCode.INVALID_TRANSITION);
    }

    @Test
    void cancelByPatron_success() {
        givenSnapshot(RequestStatus.PENDING);
        givenLocked(requestIn(RequestStatus.PENDING, 4));

        TransitionResult result = transitionService.cancelByPatron(REQUEST_ID, "patron-a");

        assertThat(result.request().getStatus()).isEqualTo(RequestStatus.CANCELLED);
        verify(queueStore).renumber(VENUE_ID, 4);
    }
}
