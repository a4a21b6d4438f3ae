package com.enterprise.approval.event;

import java.util.List;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands committed transitions to every registered dispatcher. A failing
 * dispatcher is logged and does not stop the others.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransitionEventListener {

    private final List<NotificationDispatcher> dispatchers;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTransition(RequestTransitionEvent event) {
        for (NotificationDispatcher dispatcher : dispatchers) {
            try {
                dispatcher.onTransition(event);
            } catch (RuntimeException e) {
                log.error("Notification dispatcher {} failed for request {} ({})",
                        dispatcher.getClass().getSimpleName(), event.requestId(), event.action(), e);
            }
        }
    }
}
