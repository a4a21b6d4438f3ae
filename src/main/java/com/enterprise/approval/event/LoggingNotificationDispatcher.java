package com.enterprise.approval.event;

import org.springframework.stereotype.Component;

import com.enterprise.approval.model.enums.RequestStatus;

import lombok.extern.slf4j.Slf4j;

/**
 * Default dispatcher: writes the notification that would be sent to the log.
 */
@Component
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void onTransition(RequestTransitionEvent event) {
        log.info("===========================================");
        log.info("NOTIFICATION");
        log.info("===========================================");
        log.info("Recipient: {}", event.ownerId());
        log.info("Subject: {}", buildSubject(event));
        log.info("Request: {} ({} -> {})", event.requestId(), event.fromState(), event.toState());
        log.info("Actor: {} at {}", event.actorId(), event.occurredAt());
        log.info("===========================================");
    }

    private String buildSubject(RequestTransitionEvent event) {
        if (event.toState().status() == RequestStatus.APPROVED) {
            return "Request Approved";
        }
        return switch (event.action()) {
            case SUBMIT -> "Request Submitted";
            case APPROVE -> "Request Moved To Step " + (event.toState().stepIndex() + 1);
            case REJECT -> "Request Rejected";
            case CANCEL -> "Request Cancelled";
            case ESCALATE -> "Request Escalated";
            case DELEGATE -> "Request Delegated";
        };
    }
}
