package com.enterprise.approval.event;

/**
 * Receives transitions after they are committed. Implementations must not
 * assume they can affect the transition; it has already happened.
 */
public interface NotificationDispatcher {

    void onTransition(RequestTransitionEvent event);
}
