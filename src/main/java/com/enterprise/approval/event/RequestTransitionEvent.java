package com.enterprise.approval.event;

import java.time.LocalDateTime;
import java.util.UUID;

import com.enterprise.approval.model.RequestState;
import com.enterprise.approval.model.enums.HistoryAction;

/**
 * Published for every committed transition of a request, including submission.
 *
 * @param requestId  the request that moved
 * @param ownerId    user who submitted the request
 * @param fromState  state before the transition, {@code null} on submission
 * @param toState    state after the transition
 * @param action     what happened
 * @param actorId    who did it
 * @param occurredAt ledger timestamp of the transition
 */
public record RequestTransitionEvent(
        UUID requestId,
        String ownerId,
        RequestState fromState,
        RequestState toState,
        HistoryAction action,
        String actorId,
        LocalDateTime occurredAt) {
}
