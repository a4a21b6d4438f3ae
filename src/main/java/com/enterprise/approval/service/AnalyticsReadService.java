package com.enterprise.approval.service;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.entity.RequestHistoryEntry;
import com.enterprise.approval.repository.ApprovalRequestRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ranged, paged reads for reporting tools. Never writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsReadService {

    private final ApprovalRequestRepository requestRepository;
    private final AuditLedger auditLedger;

    @Transactional(readOnly = true)
    public Page<ApprovalRequest> requestsSubmittedBetween(LocalDateTime from, LocalDateTime to, Pageable pageable) {
        requireRange(from, to);
        log.debug("Reading requests submitted between {} and {}", from, to);
        return requestRepository.findBySubmittedAtBetween(from, to, pageable);
    }

    @Transactional(readOnly = true)
    public Page<RequestHistoryEntry> historyBetween(LocalDateTime from, LocalDateTime to, Pageable pageable) {
        requireRange(from, to);
        log.debug("Reading history between {} and {}", from, to);
        return auditLedger.between(from, to, pageable);
    }

    /**
     * Latest ledger entries, newest first, optionally restricted to one actor.
     */
    @Transactional(readOnly = true)
    public List<RequestHistoryEntry> recentActivity(String actorId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return StringUtils.hasText(actorId)
                ? auditLedger.activityByActor(actorId, limit)
                : auditLedger.recentActivity(limit);
    }

    private void requireRange(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null || to.isBefore(from)) {
            throw new IllegalArgumentException("A range with from <= to is required");
        }
    }
}
