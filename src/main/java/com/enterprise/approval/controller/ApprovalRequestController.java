package com.enterprise.approval.controller;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.enterprise.approval.dto.request.CancelRequest;
import com.enterprise.approval.dto.request.RequestActionRequest;
import com.enterprise.approval.dto.request.SubmitRequest;
import com.enterprise.approval.dto.response.ApiResponse;
import com.enterprise.approval.dto.response.ApprovalRequestResponse;
import com.enterprise.approval.dto.response.HistoryEntryResponse;
import com.enterprise.approval.model.Actor;
import com.enterprise.approval.model.enums.RequestStatus;
import com.enterprise.approval.security.SecurityUtils;
import com.enterprise.approval.service.RequestFilter;
import com.enterprise.approval.service.RequestLifecycleManager;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API controller for approval requests. Who may act on a request is
 * decided per step by the lifecycle manager, not by URL rules.
 */
@RestController
@RequestMapping("/api/v1/requests")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Requests", description = "Approval request lifecycle")
@SecurityRequirement(name = "bearerAuth")
public class ApprovalRequestController {

    private final RequestLifecycleManager lifecycleManager;
    private final SecurityUtils securityUtils;

    @PostMapping
    @Operation(summary = "Submit a request", description = "Creates a request from the active workflow of its type")
    public ResponseEntity<ApiResponse<ApprovalRequestResponse>> submitRequest(
            @Valid @RequestBody SubmitRequest request) {
        log.info("Submitting request of type {}", request.getType());
        ApprovalRequestResponse response = ApprovalRequestResponse.from(
                lifecycleManager.submit(request, securityUtils.requireCurrentActor()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(response, "Request submitted successfully"));
    }

    @GetMapping
    @Operation(summary = "List visible requests", description = "Lists the requests the caller is allowed to see")
    public ResponseEntity<ApiResponse<List<ApprovalRequestResponse>>> listRequests(
            @Parameter(description = "Status filter") @RequestParam(required = false) RequestStatus status,
            @Parameter(description = "Type filter") @RequestParam(required = false) String type,
            @Parameter(description = "Only my own requests") @RequestParam(defaultValue = "false") boolean mine) {
        Actor actor = securityUtils.requireCurrentActor();
        log.debug("Listing requests for {} (status={}, type={}, mine={})", actor.id(), status, type, mine);
        List<ApprovalRequestResponse> response = lifecycleManager
                .listVisible(new RequestFilter(status, type, mine), actor).stream()
                .map(ApprovalRequestResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get request by ID")
    public ResponseEntity<ApiResponse<ApprovalRequestResponse>> getRequest(
            @Parameter(description = "Request UUID") @PathVariable UUID id) {
        log.debug("Fetching request {}", id);
        ApprovalRequestResponse response = ApprovalRequestResponse.from(
                lifecycleManager.getRequest(id, securityUtils.requireCurrentActor()));
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @PostMapping("/{id}/action")
    @Operation(summary = "Act on a request", description = "Approve, reject, escalate or delegate the current step")
    public ResponseEntity<ApiResponse<ApprovalRequestResponse>> actOnRequest(
            @Parameter(description = "Request UUID") @PathVariable UUID id,
            @Valid @RequestBody RequestActionRequest request) {
        log.info("Applying {} to request {}", request.getAction(), id);
        ApprovalRequestResponse response = ApprovalRequestResponse.from(
                lifecycleManager.act(id, request, securityUtils.requireCurrentActor()));
        return ResponseEntity.ok(ApiResponse.success(response, "Action " + request.getAction() + " applied"));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel a request", description = "Only the creator or an admin can cancel a pending request")
    public ResponseEntity<ApiResponse<ApprovalRequestResponse>> cancelRequest(
            @Parameter(description = "Request UUID") @PathVariable UUID id,
            @Valid @RequestBody(required = false) CancelRequest request) {
        log.info("Cancelling request {}", id);
        String comment = request != null ? request.getComment() : null;
        ApprovalRequestResponse response = ApprovalRequestResponse.from(
                lifecycleManager.cancel(id, comment, securityUtils.requireCurrentActor()));
        return ResponseEntity.ok(ApiResponse.success(response, "Request cancelled successfully"));
    }

    @GetMapping("/{id}/history")
    @Operation(summary = "Get request history", description = "Ledger entries of the request in order")
    public ResponseEntity<ApiResponse<List<HistoryEntryResponse>>> getHistory(
            @Parameter(description = "Request UUID") @PathVariable UUID id) {
        log.debug("Fetching history of request {}", id);
        List<HistoryEntryResponse> response = lifecycleManager
                .getHistory(id, securityUtils.requireCurrentActor()).stream()
                .map(HistoryEntryResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
