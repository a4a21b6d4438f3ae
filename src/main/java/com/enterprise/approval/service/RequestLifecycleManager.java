package com.enterprise.approval.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import com.enterprise.approval.config.ApprovalProperties;
import com.enterprise.approval.dto.request.RequestActionRequest;
import com.enterprise.approval.dto.request.SubmitRequest;
import com.enterprise.approval.event.RequestTransitionEvent;
import com.enterprise.approval.exception.CancelNotAllowedException;
import com.enterprise.approval.exception.ConcurrentModificationException;
import com.enterprise.approval.exception.InvalidActionException;
import com.enterprise.approval.exception.MissingCommentException;
import com.enterprise.approval.exception.NoActiveStepException;
import com.enterprise.approval.exception.NoStepsConfiguredException;
import com.enterprise.approval.exception.RequestNotFoundException;
import com.enterprise.approval.exception.RequestNotPendingException;
import com.enterprise.approval.exception.WorkflowNotFoundException;
import com.enterprise.approval.model.Actor;
import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.entity.RequestHistoryEntry;
import com.enterprise.approval.model.entity.WorkflowDefinition;
import com.enterprise.approval.model.enums.ApprovalAction;
import com.enterprise.approval.model.enums.HistoryAction;
import com.enterprise.approval.model.enums.RequestStatus;
import com.enterprise.approval.model.enums.Role;
import com.enterprise.approval.repository.ApprovalRequestRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates approval requests and drives every state transition.
 *
 * <p>
 * A transition runs under the per-request lock and inside one transaction:
 * load, authorize, compute the next state, write it with a guarded update,
 * append the ledger entry and publish the post-commit event. The lock is only
 * released once the transaction has committed or rolled back.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestLifecycleManager {

    private final ApprovalRequestRepository requestRepository;
    private final WorkflowDefinitionService workflowService;
    private final ActionAuthorizer actionAuthorizer;
    private final RequestAccessPolicy accessPolicy;
    private final SlaDeadlineTracker slaTracker;
    private final AuditLedger auditLedger;
    private final RequestLockRegistry lockRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final ApprovalProperties approvalProperties;
    private final Clock clock;

    /**
     * Creates a request in {@code pending(0)} from the resolved workflow. Only the
     * steps marked as required are copied into the request.
     */
    public ApprovalRequest submit(SubmitRequest command, Actor actor) {
        return transactionTemplate.execute(status -> {
            WorkflowDefinition workflow = resolveWorkflow(command);
            List<StepDefinition> steps = workflow.getSteps().stream()
                    .filter(StepDefinition::includedInRequests)
                    .toList();
            if (steps.isEmpty()) {
                throw new NoStepsConfiguredException(
                        "Workflow " + workflow.getFlowKey() + " v" + workflow.getDefinitionVersion()
                                + " has no steps to run");
            }

            LocalDateTime now = LocalDateTime.now(clock);
            StepDefinition first = steps.get(0);
            Map<String, Object> payload = command.getPayload() == null ? Map.of() : command.getPayload();

            ApprovalRequest request = ApprovalRequest.builder()
                    .type(command.getType())
                    .workflowId(workflow.getId())
                    .flowKey(workflow.getFlowKey())
                    .workflowVersion(workflow.getDefinitionVersion())
                    .steps(steps)
                    .currentStepIndex(0)
                    .status(RequestStatus.PENDING)
                    .slaHours(first.slaHours())
                    .slaDeadline(slaTracker.deadlineFor(first, now))
                    .currentStepStartedAt(now)
                    .payload(payload)
                    .createdBy(actor.id())
                    .submittedAt(now)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            ApprovalRequest saved = requestRepository.saveAndFlush(request);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("payload", payload);
            metadata.put("workflowVersion", workflow.getDefinitionVersion());
            RequestHistoryEntry entry = auditLedger.append(saved.getId(), actor, HistoryAction.SUBMIT,
                    first.stepId(), null, metadata);

            eventPublisher.publishEvent(new RequestTransitionEvent(saved.getId(), saved.getCreatedBy(), null,
                    saved.state(), HistoryAction.SUBMIT, actor.id(), entry.getPerformedAt()));
            log.info("Request {} of type {} submitted by {} on workflow {} v{} ({} steps)", saved.getId(),
                    saved.getType(), actor.id(), workflow.getFlowKey(), workflow.getDefinitionVersion(),
                    steps.size());
            return saved;
        });
    }

    /**
     * Applies an approver action to the current step of a pending request.
     */
    public ApprovalRequest act(UUID requestId, RequestActionRequest command, Actor actor) {
        return mutate(requestId, () -> {
            ApprovalRequest request = load(requestId);
            ApprovalAction action = command.getAction();
            if (!request.isPending()) {
                log.warn("Refused {} on request {}: status is {}", action, requestId, request.getStatus());
                throw new RequestNotPendingException(
                        "Request " + requestId + " is " + request.getStatus() + " and cannot be changed");
            }
            StepDefinition step = requireCurrentStep(request);
            if (command.getExpectedStepIndex() != null
                    && !command.getExpectedStepIndex().equals(request.getCurrentStepIndex())) {
                throw new ConcurrentModificationException("Request " + requestId + " is on step "
                        + request.getCurrentStepIndex() + ", not " + command.getExpectedStepIndex());
            }
            actionAuthorizer.authorize(request, step, action, actor);

            LocalDateTime now = LocalDateTime.now(clock);
            Map<String, Object> metadata = new HashMap<>();
            PlannedTransition next = switch (action) {
                case APPROVE -> planApprove(request, now, metadata);
                case REJECT -> planReject(request, command.getComment(), now);
                case ESCALATE -> planEscalate(request, step, command.getEscalateTo(), metadata);
                case DELEGATE -> planDelegate(request, command.getDelegateTo(), metadata);
            };
            return commit(request, step, next, action.toHistoryAction(), actor, command.getComment(), metadata);
        });
    }

    /**
     * Cancels a pending request. Only its creator or an admin may do so.
     */
    public ApprovalRequest cancel(UUID requestId, String comment, Actor actor) {
        return mutate(requestId, () -> {
            ApprovalRequest request = load(requestId);
            if (!actor.isAdmin() && !actor.id().equals(request.getCreatedBy())) {
                log.warn("Refused cancel of request {} by {}: not the owner", requestId, actor.id());
                throw CancelNotAllowedException.notOwner();
            }
            if (!request.isPending()) {
                log.warn("Refused cancel of request {}: status is {}", requestId, request.getStatus());
                throw CancelNotAllowedException.notPending(request.getStatus());
            }
            StepDefinition step = requireCurrentStep(request);
            PlannedTransition next = PlannedTransition.complete(request, RequestStatus.CANCELLED,
                    LocalDateTime.now(clock));
            return commit(request, step, next, HistoryAction.CANCEL, actor, comment, Map.of());
        });
    }

    /**
     * Escalates a request whose current step is past its escalation time to the
     * step's escalation role, acting as the system. Does nothing when the request
     * is no longer pending, already escalated or not yet due.
     *
     * @return {@code true} when the request was escalated
     */
    public boolean escalateOverdue(UUID requestId) {
        ApprovalRequest result = mutate(requestId, () -> {
            ApprovalRequest request = load(requestId);
            LocalDateTime now = LocalDateTime.now(clock);
            if (!request.isPending() || !slaTracker.isEscalationDue(request, now)) {
                return null;
            }
            StepDefinition step = request.currentStep();
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("escalatedTo", step.escalationRole().name());
            metadata.put("trigger", "SLA_BREACH");
            metadata.put("slaDeadline", String.valueOf(request.getSlaDeadline()));
            PlannedTransition next = PlannedTransition.escalate(request, step.escalationRole());
            return commit(request, step, next, HistoryAction.ESCALATE, Actor.system(),
                    "Escalated automatically after SLA breach", metadata);
        });
        return result != null;
    }

    @Transactional(readOnly = true)
    public ApprovalRequest getRequest(UUID requestId, Actor actor) {
        ApprovalRequest request = load(requestId);
        accessPolicy.requireVisible(request, actor);
        log.debug("Request {} read by {}", requestId, actor.id());
        return request;
    }

    /**
     * Requests the actor may see. Employees get their own requests, managers the
     * requests currently visible to them, admins everything.
     */
    @Transactional(readOnly = true)
    public List<ApprovalRequest> listVisible(RequestFilter filter, Actor actor) {
        if (filter.mine() || actor.hasRole(Role.EMPLOYEE)) {
            return requestRepository.search(filter.status(), filter.type(), actor.id());
        }
        List<ApprovalRequest> all = requestRepository.search(filter.status(), filter.type(), null);
        if (actor.isAdmin()) {
            return all;
        }
        return all.stream()
                .filter(request -> accessPolicy.canView(request, actor))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RequestHistoryEntry> getHistory(UUID requestId, Actor actor) {
        ApprovalRequest request = load(requestId);
        accessPolicy.requireVisible(request, actor);
        return auditLedger.read(requestId);
    }

    private WorkflowDefinition resolveWorkflow(SubmitRequest command) {
        if (command.getWorkflowId() != null) {
            WorkflowDefinition workflow = workflowService.findById(command.getWorkflowId());
            if (!workflow.isActive()) {
                throw new WorkflowNotFoundException("Workflow " + command.getWorkflowId() + " is not active");
            }
            return workflow;
        }
        String flowKey = StringUtils.hasText(command.getFlowKey()) ? command.getFlowKey() : command.getType();
        return workflowService.findActive(flowKey);
    }

    private PlannedTransition planApprove(ApprovalRequest request, LocalDateTime now, Map<String, Object> metadata) {
        if (request.isOnLastStep()) {
            return PlannedTransition.complete(request, RequestStatus.APPROVED, now);
        }
        int nextIndex = request.getCurrentStepIndex() + 1;
        StepDefinition nextStep = request.getSteps().get(nextIndex);
        metadata.put("nextStepId", nextStep.stepId());
        return PlannedTransition.advance(nextIndex, nextStep.slaHours(), slaTracker.deadlineFor(nextStep, now), now);
    }

    private PlannedTransition planReject(ApprovalRequest request, String comment, LocalDateTime now) {
        int minLength = approvalProperties.getRejectCommentMinLength();
        if (comment == null || comment.trim().length() < minLength) {
            throw new MissingCommentException(
                    "A rejection comment of at least " + minLength + " characters is required");
        }
        return PlannedTransition.complete(request, RequestStatus.REJECTED, now);
    }

    private PlannedTransition planEscalate(ApprovalRequest request, StepDefinition step, Role requested,
            Map<String, Object> metadata) {
        Role target = requested != null ? requested : step.escalationRole();
        if (target == null) {
            throw new InvalidActionException("Step " + step.stepId() + " has no escalation role and none was given");
        }
        if (target == Role.EMPLOYEE) {
            throw new InvalidActionException("Requests can only be escalated to MANAGER or ADMIN");
        }
        metadata.put("escalatedTo", target.name());
        metadata.put("trigger", "MANUAL");
        return PlannedTransition.escalate(request, target);
    }

    private PlannedTransition planDelegate(ApprovalRequest request, String delegateTo, Map<String, Object> metadata) {
        if (!StringUtils.hasText(delegateTo)) {
            throw new InvalidActionException("delegateTo is required to delegate a step");
        }
        String delegate = delegateTo.trim();
        metadata.put("delegatedTo", delegate);
        return PlannedTransition.delegate(request, delegate);
    }

    private ApprovalRequest commit(ApprovalRequest request, StepDefinition step, PlannedTransition next,
            HistoryAction action, Actor actor, String comment, Map<String, Object> metadata) {
        UUID requestId = request.getId();
        int updated = requestRepository.applyTransition(
                requestId,
                RequestStatus.PENDING,
                request.getCurrentStepIndex(),
                request.getVersion(),
                next.status(),
                next.stepIndex(),
                next.slaHours(),
                next.slaDeadline(),
                next.stepStartedAt(),
                next.escalatedTo(),
                next.delegatedTo(),
                next.completedAt(),
                LocalDateTime.now(clock));
        if (updated == 0) {
            log.warn("Request {} changed while {} was being applied", requestId, action);
            throw new ConcurrentModificationException("Request " + requestId + " was modified concurrently");
        }

        RequestHistoryEntry entry = auditLedger.append(requestId, actor, action, step.stepId(), comment, metadata);
        eventPublisher.publishEvent(new RequestTransitionEvent(requestId, request.getCreatedBy(), request.state(),
                next.state(), action, actor.id(), entry.getPerformedAt()));
        log.info("Request {} {} by {}: {} -> {}", requestId, action, actor.id(), request.state(), next.state());
        return load(requestId);
    }

    private ApprovalRequest mutate(UUID requestId, Supplier<ApprovalRequest> mutation) {
        return lockRegistry.withLock(requestId, () -> {
            try {
                return transactionTemplate.execute(status -> mutation.get());
            } catch (ConcurrencyFailureException e) {
                log.warn("Lock conflict on request {}: {}", requestId, e.getMessage());
                throw new ConcurrentModificationException("Request " + requestId + " was modified concurrently", e);
            }
        });
    }

    private StepDefinition requireCurrentStep(ApprovalRequest request) {
        StepDefinition step = request.currentStep();
        if (step == null) {
            throw new NoActiveStepException("Request " + request.getId() + " has no step at index "
                    + request.getCurrentStepIndex());
        }
        return step;
    }

    private ApprovalRequest load(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new RequestNotFoundException("Request not found: " + requestId));
    }
}
