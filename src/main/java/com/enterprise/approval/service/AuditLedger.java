package com.enterprise.approval.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.enterprise.approval.model.Actor;
import com.enterprise.approval.model.entity.RequestHistoryEntry;
import com.enterprise.approval.model.enums.HistoryAction;
import com.enterprise.approval.repository.RequestHistoryRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only history of request transitions. Entries carry a snapshot of the
 * actor as it was when the action happened.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLedger {

    private final RequestHistoryRepository historyRepository;
    private final Clock clock;

    /**
     * Appends an entry inside the caller's transaction. Sequence numbers start at 1
     * and timestamps strictly increase per request.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public RequestHistoryEntry append(UUID requestId, Actor actor, HistoryAction action, String stepId,
            String comment, Map<String, Object> metadata) {
        Optional<RequestHistoryEntry> last = historyRepository.findFirstByRequestIdOrderBySequenceDesc(requestId);
        int sequence = last.map(entry -> entry.getSequence() + 1).orElse(1);

        LocalDateTime performedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        if (last.isPresent() && !performedAt.isAfter(last.get().getPerformedAt())) {
            performedAt = last.get().getPerformedAt().plus(1, ChronoUnit.MICROS);
        }

        RequestHistoryEntry entry = RequestHistoryEntry.builder()
                .requestId(requestId)
                .sequence(sequence)
                .actorId(actor.id())
                .actorEmail(actor.email())
                .actorRole(actor.role())
                .action(action)
                .stepId(stepId)
                .comment(comment)
                .metadata(metadata == null ? Map.of() : metadata)
                .performedAt(performedAt)
                .build();

        RequestHistoryEntry saved = historyRepository.save(entry);
        log.debug("History #{} recorded for request {}: {} by {}", sequence, requestId, action, actor.id());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<RequestHistoryEntry> read(UUID requestId) {
        return historyRepository.findByRequestIdOrderBySequenceAsc(requestId);
    }

    @Transactional(readOnly = true)
    public List<RequestHistoryEntry> recentActivity(int limit) {
        return historyRepository.findAllByOrderByPerformedAtDesc(PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<RequestHistoryEntry> activityByActor(String actorId, int limit) {
        return historyRepository.findByActorIdOrderByPerformedAtDesc(actorId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public Page<RequestHistoryEntry> between(LocalDateTime from, LocalDateTime to, Pageable pageable) {
        return historyRepository.findByPerformedAtBetween(from, to, pageable);
    }
}
