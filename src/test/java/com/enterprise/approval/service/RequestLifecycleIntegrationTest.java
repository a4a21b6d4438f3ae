package com.enterprise.approval.service;

import static com.enterprise.approval.support.Steps.escalatingStep;
import static com.enterprise.approval.support.Steps.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import com.enterprise.approval.dto.request.CreateWorkflowRequest;
import com.enterprise.approval.dto.request.RequestActionRequest;
import com.enterprise.approval.dto.request.StepRequest;
import com.enterprise.approval.dto.request.SubmitRequest;
import com.enterprise.approval.exception.CancelNotAllowedException;
import com.enterprise.approval.exception.ConcurrentModificationException;
import com.enterprise.approval.exception.RequestNotPendingException;
import com.enterprise.approval.model.Actor;
import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.entity.RequestHistoryEntry;
import com.enterprise.approval.model.entity.WorkflowDefinition;
import com.enterprise.approval.model.enums.ApprovalAction;
import com.enterprise.approval.model.enums.HistoryAction;
import com.enterprise.approval.model.enums.RequestStatus;
import com.enterprise.approval.model.enums.Role;
import com.enterprise.approval.support.MutableClock;
import com.enterprise.approval.support.TestClockConfig;

@SpringBootTest
@Import(TestClockConfig.class)
class RequestLifecycleIntegrationTest {

    @Autowired
    private RequestLifecycleManager lifecycleManager;

    @Autowired
    private WorkflowDefinitionService workflowService;

    @Autowired
    private SlaDeadlineTracker slaTracker;

    @Autowired
    private MutableClock clock;

    private final Actor employee = new Actor("emp-1", "emp@corp.test", Role.EMPLOYEE);
    private final Actor manager = new Actor("mgr-1", "mgr@corp.test", Role.MANAGER);
    private final Actor admin = new Actor("adm-1", "adm@corp.test", Role.ADMIN);

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfig.START);
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void approvingEveryStepCompletesWithOneHistoryEntryPerTransition() {
        String flowKey = uniqueFlowKey();
        createWorkflow(flowKey, step("manager-review", Role.MANAGER, 24), step("admin-signoff", Role.ADMIN, 48));

        ApprovalRequest request = lifecycleManager.submit(submit(flowKey), employee);
        clock.advance(Duration.ofHours(2));
        ApprovalRequest afterFirst = lifecycleManager.act(request.getId(), approve(), manager);

        assertThat(afterFirst.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(afterFirst.getCurrentStepIndex()).isEqualTo(1);
        assertThat(afterFirst.getSlaDeadline()).isEqualTo(LocalDateTime.now(clock).plusHours(48));

        ApprovalRequest done = lifecycleManager.act(request.getId(), approve(), admin);

        assertThat(done.getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(done.getCompletedAt()).isNotNull();

        List<RequestHistoryEntry> history = lifecycleManager.getHistory(request.getId(), employee);
        assertThat(history).extracting(RequestHistoryEntry::getAction)
                .containsExactly(HistoryAction.SUBMIT, HistoryAction.APPROVE, HistoryAction.APPROVE);
        assertThat(history).extracting(RequestHistoryEntry::getSequence).containsExactly(1, 2, 3);
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).getPerformedAt()).isAfter(history.get(i - 1).getPerformedAt());
        }
        assertThat(history.get(1).getActorRole()).isEqualTo(Role.MANAGER);
        assertThat(history.get(1).getStepId()).isEqualTo("manager-review");
    }

    @Test
    void terminalRequestRefusesFurtherActionsWithoutWritingHistory() {
        String flowKey = uniqueFlowKey();
        createWorkflow(flowKey, step("review", Role.MANAGER, 24));
        ApprovalRequest request = lifecycleManager.submit(submit(flowKey), employee);

        lifecycleManager.cancel(request.getId(), "No longer needed", employee);

        assertThatThrownBy(() -> lifecycleManager.act(request.getId(), approve(), admin))
                .isInstanceOf(RequestNotPendingException.class);
        assertThatThrownBy(() -> lifecycleManager.cancel(request.getId(), null, employee))
                .isInstanceOf(CancelNotAllowedException.class);
        assertThat(lifecycleManager.getHistory(request.getId(), admin)).hasSize(2);
    }

    @Test
    void concurrentApprovalsOfSameStepCommitOnce() throws Exception {
        String flowKey = uniqueFlowKey();
        createWorkflow(flowKey, step("review", Role.MANAGER, 24));
        ApprovalRequest request = lifecycleManager.submit(submit(flowKey), employee);
        CountDownLatch start = new CountDownLatch(1);

        Callable<Object> approveTask = () -> {
            start.await(5, TimeUnit.SECONDS);
            try {
                return lifecycleManager.act(request.getId(), approve(), manager);
            } catch (ConcurrentModificationException | RequestNotPendingException e) {
                return e;
            }
        };
        List<Future<Object>> futures = new ArrayList<>();
        futures.add(executor.submit(approveTask));
        futures.add(executor.submit(approveTask));
        start.countDown();

        List<Object> outcomes = new ArrayList<>();
        for (Future<Object> future : futures) {
            outcomes.add(resultOf(future));
        }

        assertThat(outcomes).filteredOn(ApprovalRequest.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(RuntimeException.class::isInstance).hasSize(1);
        assertThat(lifecycleManager.getHistory(request.getId(), admin))
                .extracting(RequestHistoryEntry::getAction)
                .containsExactly(HistoryAction.SUBMIT, HistoryAction.APPROVE);
    }

    @Test
    void requestKeepsItsSnapshotWhenWorkflowChanges() {
        String flowKey = uniqueFlowKey();
        WorkflowDefinition v1 = createWorkflow(flowKey, step("review", Role.MANAGER, 24));
        ApprovalRequest request = lifecycleManager.submit(submit(flowKey), employee);

        workflowService.deactivate(v1.getId(), admin);
        WorkflowDefinition v2 = createWorkflow(flowKey, step("review", Role.MANAGER, 8), step("audit", Role.ADMIN, 8));

        ApprovalRequest reloaded = lifecycleManager.getRequest(request.getId(), employee);
        assertThat(v2.getDefinitionVersion()).isEqualTo(2);
        assertThat(reloaded.getWorkflowVersion()).isEqualTo(1);
        assertThat(reloaded.getSteps()).extracting(StepDefinition::stepId).containsExactly("review");
        assertThat(reloaded.getSlaHours()).isEqualTo(24);
    }

    @Test
    void overdueAndWarningQueriesReflectDeadlinesWithoutMutating() {
        String flowKey = uniqueFlowKey();
        createWorkflow(flowKey, step("review", Role.MANAGER, 24));
        ApprovalRequest request = lifecycleManager.submit(submit(flowKey), employee);

        clock.advance(Duration.ofHours(21));
        assertThat(slaTracker.getWarnings(4)).extracting(ApprovalRequest::getId).contains(request.getId());
        assertThat(slaTracker.getOverdue()).extracting(ApprovalRequest::getId).doesNotContain(request.getId());

        clock.advance(Duration.ofHours(4));
        assertThat(slaTracker.getOverdue()).extracting(ApprovalRequest::getId).contains(request.getId());

        ApprovalRequest unchanged = lifecycleManager.getRequest(request.getId(), admin);
        assertThat(unchanged.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(unchanged.getVersion()).isEqualTo(request.getVersion());
        assertThat(lifecycleManager.getHistory(request.getId(), admin)).hasSize(1);

        lifecycleManager.act(request.getId(), approve(), manager);

        assertThat(slaTracker.getOverdue()).extracting(ApprovalRequest::getId).doesNotContain(request.getId());
        assertThat(slaTracker.getWarnings(48)).extracting(ApprovalRequest::getId).doesNotContain(request.getId());
    }

    @Test
    void approvingManagerCanStillReadTheFinishedRequest() {
        String flowKey = uniqueFlowKey();
        createWorkflow(flowKey, step("review", Role.MANAGER, 24));
        ApprovalRequest request = lifecycleManager.submit(submit(flowKey), employee);

        lifecycleManager.act(request.getId(), approve(), manager);

        ApprovalRequest approved = lifecycleManager.getRequest(request.getId(), manager);
        assertThat(approved.getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(lifecycleManager.getHistory(request.getId(), manager))
                .extracting(RequestHistoryEntry::getAction)
                .containsExactly(HistoryAction.SUBMIT, HistoryAction.APPROVE);
    }

    @Test
    void overdueStepIsEscalatedToItsEscalationRole() {
        String flowKey = uniqueFlowKey();
        createWorkflow(flowKey, escalatingStep("review", Role.MANAGER, 4, Role.ADMIN, null));
        ApprovalRequest request = lifecycleManager.submit(submit(flowKey), employee);

        assertThat(lifecycleManager.escalateOverdue(request.getId())).isFalse();
        clock.advance(Duration.ofHours(5));
        assertThat(lifecycleManager.escalateOverdue(request.getId())).isTrue();

        ApprovalRequest escalated = lifecycleManager.getRequest(request.getId(), admin);
        assertThat(escalated.getEscalatedTo()).isEqualTo(Role.ADMIN);
        assertThat(escalated.getCurrentStepIndex()).isZero();
        assertThat(escalated.getSlaDeadline()).isEqualTo(request.getSlaDeadline());
        assertThat(lifecycleManager.getHistory(request.getId(), admin)).last()
                .satisfies(entry -> {
                    assertThat(entry.getAction()).isEqualTo(HistoryAction.ESCALATE);
                    assertThat(entry.getActorId()).isEqualTo(Actor.SYSTEM_ID);
                    assertThat(entry.getMetadata()).containsEntry("trigger", "SLA_BREACH");
                });
    }

    private Object resultOf(Future<Object> future) throws InterruptedException, TimeoutException {
        try {
            return future.get(10, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    private WorkflowDefinition createWorkflow(String flowKey, StepDefinition... steps) {
        List<StepRequest> stepRequests = new ArrayList<>();
        for (StepDefinition step : steps) {
            stepRequests.add(StepRequest.builder()
                    .stepId(step.stepId())
                    .role(step.role())
                    .actions(step.actions())
                    .slaHours(step.slaHours())
                    .required(step.required())
                    .escalationRole(step.escalationRole())
                    .escalationHours(step.escalationHours())
                    .build());
        }
        return workflowService.create(CreateWorkflowRequest.builder()
                .name("Workflow " + flowKey)
                .flowKey(flowKey)
                .steps(stepRequests)
                .build(), admin);
    }

    private SubmitRequest submit(String flowKey) {
        return SubmitRequest.builder()
                .type(flowKey)
                .payload(Map.of("amount", 120))
                .build();
    }

    private RequestActionRequest approve() {
        return RequestActionRequest.builder().action(ApprovalAction.APPROVE).build();
    }

    private String uniqueFlowKey() {
        return "flow-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
