package com.enterprise.approval.event;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.enterprise.approval.model.RequestState;
import com.enterprise.approval.model.enums.HistoryAction;
import com.enterprise.approval.model.enums.RequestStatus;

class TransitionEventListenerTest {

    private final RequestTransitionEvent event = new RequestTransitionEvent(UUID.randomUUID(), "emp-1",
            RequestState.pending(0), RequestState.terminal(RequestStatus.APPROVED), HistoryAction.APPROVE, "mgr-1",
            LocalDateTime.of(2025, 3, 3, 9, 0));

    @Test
    void failingDispatcherDoesNotStopOthers() {
        NotificationDispatcher failing = mock(NotificationDispatcher.class);
        NotificationDispatcher healthy = mock(NotificationDispatcher.class);
        doThrow(new IllegalStateException("mail server down")).when(failing).onTransition(event);
        TransitionEventListener listener = new TransitionEventListener(List.of(failing, healthy));

        assertThatCode(() -> listener.onTransition(event)).doesNotThrowAnyException();

        verify(failing).onTransition(event);
        verify(healthy).onTransition(event);
    }

    @Test
    void loggingDispatcherHandlesEveryAction() {
        LoggingNotificationDispatcher dispatcher = new LoggingNotificationDispatcher();

        for (HistoryAction action : HistoryAction.values()) {
            RequestTransitionEvent pendingEvent = new RequestTransitionEvent(UUID.randomUUID(), "emp-1",
                    RequestState.pending(0), RequestState.pending(1), action, "mgr-1", LocalDateTime.now());
            assertThatCode(() -> dispatcher.onTransition(pendingEvent)).doesNotThrowAnyException();
        }
    }
}
