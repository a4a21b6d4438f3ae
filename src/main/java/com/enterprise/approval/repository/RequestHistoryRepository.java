package com.enterprise.approval.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import com.enterprise.approval.model.entity.RequestHistoryEntry;

/**
 * Insert-and-read access to the ledger. Extends the bare {@link Repository}
 * marker so no update or delete method is ever exposed.
 */
@org.springframework.stereotype.Repository
public interface RequestHistoryRepository extends Repository<RequestHistoryEntry, UUID> {

    RequestHistoryEntry save(RequestHistoryEntry entry);

    List<RequestHistoryEntry> findByRequestIdOrderBySequenceAsc(UUID requestId);

    Optional<RequestHistoryEntry> findFirstByRequestIdOrderBySequenceDesc(UUID requestId);

    List<RequestHistoryEntry> findByActorIdOrderByPerformedAtDesc(String actorId, Pageable pageable);

    List<RequestHistoryEntry> findAllByOrderByPerformedAtDesc(Pageable pageable);

    Page<RequestHistoryEntry> findByPerformedAtBetween(LocalDateTime from, LocalDateTime to, Pageable pageable);
}
