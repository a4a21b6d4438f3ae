package com.enterprise.approval.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.entity.RequestHistoryEntry;
import com.enterprise.approval.model.enums.HistoryAction;
import com.enterprise.approval.repository.ApprovalRequestRepository;

class AnalyticsReadServiceTest {

    private static final LocalDateTime FROM = LocalDateTime.of(2025, 3, 1, 0, 0);
    private static final LocalDateTime TO = LocalDateTime.of(2025, 3, 31, 0, 0);

    @Mock
    private ApprovalRequestRepository requestRepository;

    @Mock
    private AuditLedger auditLedger;

    private AnalyticsReadService service;

    private final Pageable pageable = PageRequest.of(0, 20);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new AnalyticsReadService(requestRepository, auditLedger);
    }

    @Test
    void requestsAreReadForTheGivenRange() {
        Page<ApprovalRequest> page = new PageImpl<>(List.of(ApprovalRequest.builder().type("leave").build()));
        when(requestRepository.findBySubmittedAtBetween(FROM, TO, pageable)).thenReturn(page);

        assertThat(service.requestsSubmittedBetween(FROM, TO, pageable)).isSameAs(page);
    }

    @Test
    void singleInstantRangeIsAccepted() {
        when(auditLedger.between(FROM, FROM, pageable)).thenReturn(Page.empty());

        assertThat(service.historyBetween(FROM, FROM, pageable)).isEmpty();
    }

    @Test
    void invertedOrOpenRangeIsRejectedBeforeReading() {
        assertThatThrownBy(() -> service.requestsSubmittedBetween(TO, FROM, pageable))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("from <= to");
        assertThatThrownBy(() -> service.historyBetween(null, TO, pageable))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(requestRepository, auditLedger);
    }

    @Test
    void activityWithoutActorReadsLatestEntries() {
        List<RequestHistoryEntry> entries = List.of(entry("emp-1"), entry("mgr-1"));
        when(auditLedger.recentActivity(5)).thenReturn(entries);

        assertThat(service.recentActivity(null, 5)).isEqualTo(entries);
        verify(auditLedger, never()).activityByActor(any(), anyInt());
    }

    @Test
    void activityForActorReadsOnlyThatActor() {
        List<RequestHistoryEntry> entries = List.of(entry("mgr-1"));
        when(auditLedger.activityByActor("mgr-1", 10)).thenReturn(entries);

        assertThat(service.recentActivity("mgr-1", 10)).isEqualTo(entries);
        verify(auditLedger, never()).recentActivity(anyInt());
    }

    @Test
    void activityLimitMustBePositive() {
        assertThatThrownBy(() -> service.recentActivity(null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private RequestHistoryEntry entry(String actorId) {
        return RequestHistoryEntry.builder()
                .actorId(actorId)
                .action(HistoryAction.SUBMIT)
                .build();
    }
}
